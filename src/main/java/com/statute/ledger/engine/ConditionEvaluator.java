package com.statute.ledger.engine;

import com.statute.ledger.condition.ConditionNode;
import com.statute.ledger.condition.ConditionVisitor;
import com.statute.ledger.core.model.AttributeValue;
import com.statute.ledger.core.model.FactContext;
import com.statute.ledger.decision.DecisionResult;
import com.statute.ledger.decision.EvaluatedCondition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Resolves condition trees against one {@link FactContext}.
 *
 * <p>Missing or incomparable facts fail closed: the first one encountered becomes an
 * {@link DecisionResult.EvaluationError} and stops the traversal. AND and OR short-circuit left to
 * right, so a right operand that would error is never reached once the left operand decides.
 * Not thread-safe: create one per evaluation.</p>
 */
class ConditionEvaluator implements ConditionVisitor<ConditionEvaluator.Outcome> {

    private final FactContext context;
    private final List<EvaluatedCondition> trace = new ArrayList<>();

    ConditionEvaluator(FactContext context) {
        this.context = context;
    }

    Outcome evaluate(ConditionNode condition) {
        return condition.accept(this);
    }

    /**
     * Leaf conditions resolved so far, in evaluation order.
     */
    List<EvaluatedCondition> trace() {
        return Collections.unmodifiableList(new ArrayList<>(trace));
    }

    @Override
    public Outcome visitCompare(ConditionNode.Compare compare) {
        Optional<AttributeValue> actual = context.attribute(compare.attribute());
        if (actual.isEmpty()) {
            return Outcome.error(DecisionResult.missingAttribute(compare.attribute()));
        }
        AttributeValue expected = compare.value();
        AttributeValue value = actual.get();
        if (value.type() != expected.type()) {
            return Outcome.error(new DecisionResult.EvaluationError(compare.attribute(),
                    "Attribute '" + compare.attribute() + "' is " + value.type()
                            + ", not comparable with " + expected.type() + " literal"));
        }
        if (value.type() == AttributeValue.Type.BOOLEAN && compare.operator().isOrdering()) {
            return Outcome.error(new DecisionResult.EvaluationError(compare.attribute(),
                    "Operator " + compare.operator().symbol() + " does not apply to boolean attribute '"
                            + compare.attribute() + "'"));
        }
        return leaf(compare, compare.operator().test(compareValues(value, expected)));
    }

    @Override
    public Outcome visitAttributeEquals(ConditionNode.AttributeEquals attributeEquals) {
        Optional<AttributeValue> actual = context.attribute(attributeEquals.key());
        if (actual.isEmpty()) {
            return Outcome.error(DecisionResult.missingAttribute(attributeEquals.key()));
        }
        return leaf(attributeEquals, actual.get().asText().equals(attributeEquals.value().asText()));
    }

    @Override
    public Outcome visitEntityRelationship(ConditionNode.EntityRelationship relationship) {
        boolean satisfied = relationship.target()
                .map(target -> context.hasRelationship(relationship.relationshipType(), target))
                .orElseGet(() -> context.hasRelationship(relationship.relationshipType()));
        return leaf(relationship, satisfied);
    }

    @Override
    public Outcome visitAnd(ConditionNode.And and) {
        Outcome left = and.left().accept(this);
        if (left.isError() || !left.value()) {
            return left;
        }
        return and.right().accept(this);
    }

    @Override
    public Outcome visitOr(ConditionNode.Or or) {
        Outcome left = or.left().accept(this);
        if (left.isError() || left.value()) {
            return left;
        }
        return or.right().accept(this);
    }

    @Override
    public Outcome visitNot(ConditionNode.Not not) {
        Outcome inner = not.inner().accept(this);
        if (inner.isError()) {
            return inner;
        }
        return Outcome.of(!inner.value());
    }

    private Outcome leaf(ConditionNode condition, boolean satisfied) {
        trace.add(new EvaluatedCondition(condition.describe(), satisfied));
        return Outcome.of(satisfied);
    }

    private static int compareValues(AttributeValue actual, AttributeValue expected) {
        return switch (actual.type()) {
            case INTEGER -> Long.compare(((AttributeValue.IntValue) actual).value(),
                    ((AttributeValue.IntValue) expected).value());
            case STRING -> ((AttributeValue.StringValue) actual).value()
                    .compareTo(((AttributeValue.StringValue) expected).value());
            case BOOLEAN -> Boolean.compare(((AttributeValue.BoolValue) actual).value(),
                    ((AttributeValue.BoolValue) expected).value());
        };
    }

    /**
     * Either a truth value or the error that stopped evaluation.
     */
    record Outcome(boolean value, DecisionResult.EvaluationError error) {

        private static final Outcome TRUE = new Outcome(true, null);
        private static final Outcome FALSE = new Outcome(false, null);

        static Outcome of(boolean value) {
            return value ? TRUE : FALSE;
        }

        static Outcome error(DecisionResult.EvaluationError error) {
            return new Outcome(false, error);
        }

        boolean isError() {
            return error != null;
        }
    }
}
