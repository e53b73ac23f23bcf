package com.statute.ledger.audit;

import com.statute.ledger.core.model.FactContext;
import com.statute.ledger.decision.EvaluatedCondition;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Inputs behind an audited decision: the facts as text, free-form metadata, and the leaf
 * conditions that were resolved. Maps are kept sorted so the record hashes the same everywhere.
 * Keys and values must not be null.
 */
public record DecisionContext(
        Map<String, String> attributes,
        Map<String, String> metadata,
        List<EvaluatedCondition> evaluatedConditions
) {
    public DecisionContext {
        attributes = sortedCopy(attributes);
        metadata = sortedCopy(metadata);
        evaluatedConditions = evaluatedConditions != null ? List.copyOf(evaluatedConditions) : List.of();
    }

    public static DecisionContext empty() {
        return new DecisionContext(null, null, null);
    }

    public static DecisionContext of(FactContext facts, List<EvaluatedCondition> evaluatedConditions) {
        return new DecisionContext(facts.attributesAsText(), null, evaluatedConditions);
    }

    public DecisionContext withMetadata(String key, String value) {
        Objects.requireNonNull(key, "metadata key is required");
        Objects.requireNonNull(value, "metadata value is required");
        Map<String, String> updated = new TreeMap<>(metadata);
        updated.put(key, value);
        return new DecisionContext(attributes, updated, evaluatedConditions);
    }

    private static Map<String, String> sortedCopy(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptySortedMap();
        }
        TreeMap<String, String> copy = new TreeMap<>();
        source.forEach((key, value) -> copy.put(
                Objects.requireNonNull(key, "context key is required"),
                Objects.requireNonNull(value, () -> "context value is required for " + key)));
        return Collections.unmodifiableSortedMap(copy);
    }
}
