package com.statute.ledger.condition;

import com.statute.ledger.core.model.AttributeValue;

/**
 * Formats condition trees into human-readable strings.
 * Example outputs: {@code age >= 18}, {@code intent == "true"}, {@code (a OR b)}, {@code NOT x},
 * {@code has EMPLOYMENT}, {@code EMPLOYMENT with acme-corp}.
 */
public final class ConditionFormatter implements ConditionVisitor<String> {

    private static final ConditionFormatter INSTANCE = new ConditionFormatter();

    private ConditionFormatter() {
    }

    public static String format(ConditionNode condition) {
        if (condition == null) {
            return "null";
        }
        return condition.accept(INSTANCE);
    }

    @Override
    public String visitCompare(ConditionNode.Compare compare) {
        return compare.attribute() + " " + compare.operator().symbol() + " " + formatValue(compare.value());
    }

    @Override
    public String visitAttributeEquals(ConditionNode.AttributeEquals attributeEquals) {
        return attributeEquals.key() + " == \"" + attributeEquals.value().asText() + "\"";
    }

    @Override
    public String visitEntityRelationship(ConditionNode.EntityRelationship relationship) {
        return relationship.target()
                .map(target -> relationship.relationshipType() + " with " + target)
                .orElseGet(() -> "has " + relationship.relationshipType());
    }

    @Override
    public String visitAnd(ConditionNode.And and) {
        return "(" + and.left().accept(this) + " AND " + and.right().accept(this) + ")";
    }

    @Override
    public String visitOr(ConditionNode.Or or) {
        return "(" + or.left().accept(this) + " OR " + or.right().accept(this) + ")";
    }

    @Override
    public String visitNot(ConditionNode.Not not) {
        return "NOT " + not.inner().accept(this);
    }

    private static String formatValue(AttributeValue value) {
        if (value.type() == AttributeValue.Type.STRING) {
            return "'" + value.asText() + "'";
        }
        return value.asText();
    }
}
