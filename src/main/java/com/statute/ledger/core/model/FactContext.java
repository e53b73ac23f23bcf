package com.statute.ledger.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Read-only view of one subject's facts: typed attributes plus relationships to other entities.
 * Instances are immutable; build them with {@link #builder()}.
 */
public final class FactContext {

    public static final String AGE = "age";
    public static final String INCOME = "income";

    private final String subjectId;
    private final SortedMap<String, AttributeValue> attributes;
    private final Set<Relationship> relationships;

    private FactContext(Builder builder) {
        this.subjectId = builder.subjectId;
        this.attributes = Collections.unmodifiableSortedMap(new TreeMap<>(builder.attributes));
        this.relationships = Collections.unmodifiableSet(new LinkedHashSet<>(builder.relationships));
    }

    public String getSubjectId() {
        return subjectId;
    }

    public Optional<AttributeValue> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public boolean hasRelationship(RelationshipType type) {
        return relationships.stream().anyMatch(r -> r.type() == type);
    }

    public boolean hasRelationship(RelationshipType type, String targetEntityId) {
        return relationships.contains(new Relationship(type, targetEntityId));
    }

    /**
     * Attribute values in their canonical text form, sorted by name.
     */
    public SortedMap<String, String> attributesAsText() {
        SortedMap<String, String> text = new TreeMap<>();
        for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
            text.put(entry.getKey(), entry.getValue().asText());
        }
        return Collections.unmodifiableSortedMap(text);
    }

    @Override
    public String toString() {
        return "FactContext{" +
                "subjectId='" + subjectId + '\'' +
                ", attributes=" + attributes.keySet() +
                ", relationships=" + relationships.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String subjectId = UUID.randomUUID().toString();
        private final Map<String, AttributeValue> attributes = new TreeMap<>();
        private final Set<Relationship> relationships = new LinkedHashSet<>();

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder attribute(String name, AttributeValue value) {
            Objects.requireNonNull(name, "attribute name is required");
            Objects.requireNonNull(value, "attribute value is required");
            attributes.put(name, value);
            return this;
        }

        public Builder attribute(String name, long value) {
            return attribute(name, AttributeValue.of(value));
        }

        public Builder attribute(String name, String value) {
            return attribute(name, AttributeValue.of(value));
        }

        public Builder attribute(String name, boolean value) {
            return attribute(name, AttributeValue.of(value));
        }

        public Builder age(long age) {
            return attribute(AGE, age);
        }

        public Builder income(long income) {
            return attribute(INCOME, income);
        }

        public Builder relationship(RelationshipType type, String targetEntityId) {
            relationships.add(new Relationship(type, targetEntityId));
            return this;
        }

        public FactContext build() {
            if (subjectId == null || subjectId.isBlank()) {
                throw new IllegalArgumentException("subjectId must not be blank");
            }
            return new FactContext(this);
        }
    }
}
