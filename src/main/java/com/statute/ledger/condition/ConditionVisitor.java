package com.statute.ledger.condition;

/**
 * One method per {@link ConditionNode} variant.
 *
 * @param <R> result type of the traversal
 */
public interface ConditionVisitor<R> {

    R visitCompare(ConditionNode.Compare compare);

    R visitAttributeEquals(ConditionNode.AttributeEquals attributeEquals);

    R visitEntityRelationship(ConditionNode.EntityRelationship relationship);

    R visitAnd(ConditionNode.And and);

    R visitOr(ConditionNode.Or or);

    R visitNot(ConditionNode.Not not);
}
