package com.statute.ledger.engine;

import com.statute.ledger.decision.DecisionResult;
import com.statute.ledger.decision.EvaluatedCondition;

import java.util.List;
import java.util.Objects;

/**
 * A decision together with the leaf conditions that were resolved to reach it.
 */
public record Evaluation(String statuteId, DecisionResult result, List<EvaluatedCondition> evaluatedConditions) {

    public Evaluation {
        Objects.requireNonNull(statuteId, "statuteId is required");
        Objects.requireNonNull(result, "result is required");
        evaluatedConditions = evaluatedConditions != null ? List.copyOf(evaluatedConditions) : List.of();
    }
}
