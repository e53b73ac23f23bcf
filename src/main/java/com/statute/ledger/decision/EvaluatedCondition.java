package com.statute.ledger.decision;

import java.util.Objects;

/**
 * A leaf condition the engine resolved, with its truth value.
 */
public record EvaluatedCondition(String description, boolean satisfied) {

    public EvaluatedCondition {
        Objects.requireNonNull(description, "description is required");
    }
}
