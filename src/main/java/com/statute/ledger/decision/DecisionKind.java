package com.statute.ledger.decision;

/**
 * The three shapes a {@link DecisionResult} can take.
 */
public enum DecisionKind {
    DETERMINISTIC,
    REQUIRES_DISCRETION,
    EVALUATION_ERROR
}
