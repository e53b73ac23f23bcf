package com.statute.ledger.condition;

import com.statute.ledger.core.model.AttributeValue;
import com.statute.ledger.core.model.ComparisonOp;
import com.statute.ledger.core.model.RelationshipType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.statute.ledger.condition.ConditionNode.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConditionFormatter Tests")
class ConditionFormatterTest {

    @Test
    @DisplayName("Should format leaf conditions")
    void formatsLeaves() {
        assertEquals("age >= 18", compare("age", ComparisonOp.GREATER_OR_EQUAL, 18).describe());
        assertEquals("status != 'closed'",
                compare("status", ComparisonOp.NOT_EQUAL, AttributeValue.of("closed")).describe());
        assertEquals("intent == \"true\"", attributeEquals("intent", true).describe());
        assertEquals("has EMPLOYMENT", relationship(RelationshipType.EMPLOYMENT).describe());
        assertEquals("GUARDIAN with minor-1", relationship(RelationshipType.GUARDIAN, "minor-1").describe());
    }

    @Test
    @DisplayName("Should parenthesize composite conditions")
    void formatsComposites() {
        ConditionNode tree = and(
                or(attributeEquals("intent", true), attributeEquals("negligence", true)),
                not(compare("age", ComparisonOp.LESS_THAN, 18)));

        assertEquals("((intent == \"true\" OR negligence == \"true\") AND NOT age < 18)",
                ConditionFormatter.format(tree));
    }

    @Test
    @DisplayName("Null condition formats as null")
    void formatsNull() {
        assertEquals("null", ConditionFormatter.format(null));
    }
}
