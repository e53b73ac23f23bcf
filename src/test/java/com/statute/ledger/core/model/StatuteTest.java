package com.statute.ledger.core.model;

import com.statute.ledger.condition.ConditionNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Statute Tests")
class StatuteTest {

    private static Statute.Builder adultRights() {
        return Statute.builder()
                .id("adult-rights")
                .title("Adult Rights")
                .effect(new Effect(EffectType.GRANT, "Full legal capacity"))
                .precondition(ConditionNode.compare(FactContext.AGE, ComparisonOp.GREATER_OR_EQUAL, 18));
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should build with defaults")
        void buildsWithDefaults() {
            Statute statute = adultRights().build();

            assertEquals("adult-rights", statute.getId());
            assertEquals(1, statute.getVersion());
            assertTrue(statute.getJurisdiction().isEmpty());
            assertTrue(statute.getDiscretionLogic().isEmpty());
            assertEquals(1, statute.getPreconditions().size());
            assertTrue(statute.isActive(LocalDate.of(1900, 1, 1)));
        }

        @Test
        @DisplayName("Preconditions should be immutable")
        void preconditionsImmutable() {
            Statute statute = adultRights().build();
            assertThrows(UnsupportedOperationException.class,
                    () -> statute.getPreconditions().add(ConditionNode.relationship(RelationshipType.SPOUSE)));
        }

        @Test
        @DisplayName("Should reject blank id, blank title, missing effect and version below 1")
        void rejectsIncompleteStatutes() {
            assertThrows(IllegalArgumentException.class, () -> adultRights().id(" ").build());
            assertThrows(IllegalArgumentException.class, () -> adultRights().title("").build());
            assertThrows(IllegalArgumentException.class, () -> adultRights().effect(null).build());
            assertThrows(IllegalArgumentException.class, () -> adultRights().version(0).build());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Well-formed statute has no issues")
        void wellFormed() {
            assertTrue(adultRights().build().isValid());
        }

        @ParameterizedTest
        @ValueSource(strings = {"1st-statute", "has space", "semi;colon", "-leading"})
        @DisplayName("Should flag malformed ids")
        void invalidIds(String id) {
            List<ValidationIssue> issues = adultRights().id(id).build().validate();
            assertEquals(1, issues.size());
            assertEquals(ValidationIssue.Code.INVALID_ID, issues.get(0).code());
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "minpo-709", "civil_code_1", "Art12"})
        @DisplayName("Should accept well-formed ids")
        void validIds(String id) {
            assertTrue(adultRights().id(id).build().isValid());
        }

        @Test
        @DisplayName("Should flag expiry before effective date")
        void expiryBeforeEffective() {
            Statute statute = adultRights()
                    .temporalValidity(TemporalValidity.unbounded()
                            .withEffectiveDate(LocalDate.of(2020, 1, 1))
                            .withExpiryDate(LocalDate.of(2019, 12, 31)))
                    .build();

            assertEquals(List.of(ValidationIssue.Code.EXPIRY_BEFORE_EFFECTIVE),
                    statute.validate().stream().map(ValidationIssue::code).toList());
        }

        @Test
        @DisplayName("Should flag empty effect description")
        void emptyEffectDescription() {
            Statute statute = adultRights().effect(new Effect(EffectType.GRANT, "  ")).build();
            assertEquals(ValidationIssue.Code.EMPTY_EFFECT_DESCRIPTION, statute.validate().get(0).code());
        }
    }

    @Test
    @DisplayName("Temporal validity is inclusive on both ends")
    void temporalValidityInclusive() {
        Statute statute = adultRights()
                .temporalValidity(new TemporalValidity(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31)))
                .build();

        assertFalse(statute.isActive(LocalDate.of(2019, 12, 31)));
        assertTrue(statute.isActive(LocalDate.of(2020, 1, 1)));
        assertTrue(statute.isActive(LocalDate.of(2020, 12, 31)));
        assertFalse(statute.isActive(LocalDate.of(2021, 1, 1)));
    }
}
