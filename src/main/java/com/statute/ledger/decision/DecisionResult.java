package com.statute.ledger.decision;

import java.util.Objects;

/**
 * Outcome of evaluating one statute against one fact context.
 *
 * <ul>
 *   <li>{@link Deterministic}: the engine decided; {@code applies} tells whether the effect applies.</li>
 *   <li>{@link RequiresDiscretion}: preconditions hold but a human must decide the outcome.</li>
 *   <li>{@link EvaluationError}: a fact needed to decide was absent or unusable (fail closed).</li>
 * </ul>
 */
public sealed interface DecisionResult
        permits DecisionResult.Deterministic, DecisionResult.RequiresDiscretion, DecisionResult.EvaluationError {

    DecisionKind kind();

    static Deterministic deterministic(boolean applies) {
        return applies ? Deterministic.APPLIES : Deterministic.DOES_NOT_APPLY;
    }

    static RequiresDiscretion requiresDiscretion(String issue) {
        return new RequiresDiscretion(issue);
    }

    static EvaluationError missingAttribute(String attribute) {
        return new EvaluationError(attribute, "Attribute '" + attribute + "' not found");
    }

    record Deterministic(boolean applies) implements DecisionResult {
        static final Deterministic APPLIES = new Deterministic(true);
        static final Deterministic DOES_NOT_APPLY = new Deterministic(false);

        @Override
        public DecisionKind kind() {
            return DecisionKind.DETERMINISTIC;
        }
    }

    record RequiresDiscretion(String issue) implements DecisionResult {
        public RequiresDiscretion {
            Objects.requireNonNull(issue, "issue is required");
        }

        @Override
        public DecisionKind kind() {
            return DecisionKind.REQUIRES_DISCRETION;
        }
    }

    /**
     * @param missingAttribute name of the attribute that could not be resolved
     * @param detail           why it could not be resolved (absent, or not comparable with the literal)
     */
    record EvaluationError(String missingAttribute, String detail) implements DecisionResult {
        public EvaluationError {
            Objects.requireNonNull(missingAttribute, "missingAttribute is required");
            detail = detail != null ? detail : "";
        }

        @Override
        public DecisionKind kind() {
            return DecisionKind.EVALUATION_ERROR;
        }
    }
}
