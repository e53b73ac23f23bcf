package com.statute.ledger.core.model;

import java.util.Objects;

/**
 * A typed link from the subject to another entity.
 */
public record Relationship(RelationshipType type, String targetEntityId) {

    public Relationship {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(targetEntityId, "targetEntityId is required");
    }
}
