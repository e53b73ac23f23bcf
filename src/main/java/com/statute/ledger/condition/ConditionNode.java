package com.statute.ledger.condition;

import com.statute.ledger.core.model.AttributeValue;
import com.statute.ledger.core.model.ComparisonOp;
import com.statute.ledger.core.model.RelationshipType;

import java.util.Objects;
import java.util.Optional;

/**
 * A recursive boolean expression over a subject's facts.
 *
 * <p>The variant set is closed. Consumers dispatch through {@link ConditionVisitor}, so adding a
 * variant is a compile error at every consumer until it is handled. Children are held by value,
 * which makes every tree finite and acyclic.</p>
 */
public sealed interface ConditionNode permits ConditionNode.Compare, ConditionNode.AttributeEquals,
        ConditionNode.EntityRelationship, ConditionNode.And, ConditionNode.Or, ConditionNode.Not {

    <R> R accept(ConditionVisitor<R> visitor);

    /**
     * Human-readable rendering, e.g. {@code (age >= 18 AND has EMPLOYMENT)}.
     */
    default String describe() {
        return ConditionFormatter.format(this);
    }

    static Compare compare(String attribute, ComparisonOp operator, AttributeValue value) {
        return new Compare(attribute, operator, value);
    }

    static Compare compare(String attribute, ComparisonOp operator, long value) {
        return new Compare(attribute, operator, AttributeValue.of(value));
    }

    static AttributeEquals attributeEquals(String key, AttributeValue value) {
        return new AttributeEquals(key, value);
    }

    static AttributeEquals attributeEquals(String key, String value) {
        return new AttributeEquals(key, AttributeValue.of(value));
    }

    static AttributeEquals attributeEquals(String key, boolean value) {
        return new AttributeEquals(key, AttributeValue.of(value));
    }

    static EntityRelationship relationship(RelationshipType type) {
        return new EntityRelationship(type, null);
    }

    static EntityRelationship relationship(RelationshipType type, String targetEntityId) {
        return new EntityRelationship(type, targetEntityId);
    }

    static And and(ConditionNode left, ConditionNode right) {
        return new And(left, right);
    }

    static Or or(ConditionNode left, ConditionNode right) {
        return new Or(left, right);
    }

    static Not not(ConditionNode inner) {
        return new Not(inner);
    }

    /**
     * Compares a context attribute with a literal, e.g. {@code age >= 18}.
     */
    record Compare(String attribute, ComparisonOp operator, AttributeValue value) implements ConditionNode {
        public Compare {
            Objects.requireNonNull(attribute, "attribute is required");
            Objects.requireNonNull(operator, "operator is required");
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    record AttributeEquals(String key, AttributeValue value) implements ConditionNode {
        public AttributeEquals {
            Objects.requireNonNull(key, "key is required");
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitAttributeEquals(this);
        }
    }

    /**
     * Holds when the subject has a relationship of the given type, to the given target when one is set.
     */
    record EntityRelationship(RelationshipType relationshipType, String targetEntityId) implements ConditionNode {
        public EntityRelationship {
            Objects.requireNonNull(relationshipType, "relationshipType is required");
        }

        public Optional<String> target() {
            return Optional.ofNullable(targetEntityId);
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitEntityRelationship(this);
        }
    }

    record And(ConditionNode left, ConditionNode right) implements ConditionNode {
        public And {
            Objects.requireNonNull(left, "left is required");
            Objects.requireNonNull(right, "right is required");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or(ConditionNode left, ConditionNode right) implements ConditionNode {
        public Or {
            Objects.requireNonNull(left, "left is required");
            Objects.requireNonNull(right, "right is required");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(ConditionNode inner) implements ConditionNode {
        public Not {
            Objects.requireNonNull(inner, "inner is required");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }
}
