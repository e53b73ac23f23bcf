package com.statute.ledger.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Legal consequence of a statute whose preconditions hold.
 */
public record Effect(EffectType type, String description, Map<String, String> parameters) {

    public Effect {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(description, "description is required");
        parameters = parameters != null
                ? Collections.unmodifiableMap(new TreeMap<>(parameters))
                : Map.of();
    }

    public Effect(EffectType type, String description) {
        this(type, description, Map.of());
    }

    @Override
    public String toString() {
        return type + ": " + description;
    }
}
