package com.statute.ledger.audit;

import com.statute.ledger.decision.DecisionResult;
import com.statute.ledger.decision.EvaluatedCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CanonicalPayload Tests")
class CanonicalPayloadTest {

    private static AuditRecord.Builder sample() {
        return AuditRecord.builder()
                .id(UUID.fromString("00000000-0000-0000-0000-000000000001"))
                .timestamp(Instant.parse("2026-01-15T10:00:00.123Z"))
                .eventType(EventType.AUTOMATIC_DECISION)
                .actor(Actor.system("engine"))
                .statuteId("s-1")
                .subjectId("p-1")
                .decisionContext(new DecisionContext(
                        Map.of("age", "30"), null, List.of(new EvaluatedCondition("age >= 18", true))))
                .result(DecisionResult.deterministic(true));
    }

    @Test
    @DisplayName("Canonical JSON has sorted keys, a null genesis link and no record hash")
    void canonicalJson() {
        String expected = "{\"actor\":{\"component\":\"engine\",\"kind\":\"SYSTEM\"},"
                + "\"decision_context\":{\"attributes\":{\"age\":\"30\"},"
                + "\"evaluated_conditions\":[{\"description\":\"age >= 18\",\"satisfied\":true}],"
                + "\"metadata\":{}},"
                + "\"event_type\":\"AUTOMATIC_DECISION\","
                + "\"id\":\"00000000-0000-0000-0000-000000000001\","
                + "\"previous_hash\":null,"
                + "\"result\":{\"applies\":true,\"kind\":\"DETERMINISTIC\"},"
                + "\"statute_id\":\"s-1\","
                + "\"subject_id\":\"p-1\","
                + "\"timestamp\":\"2026-01-15T10:00:00.123Z\"}";

        assertEquals(expected, CanonicalPayload.toJson(sample().recordHash("ignored").build()));
    }

    @Test
    @DisplayName("Hash is lowercase hex SHA-256 and independent of the stored hash")
    void hashFormat() {
        String first = CanonicalPayload.hash(sample().recordHash("a").build());
        String second = CanonicalPayload.hash(sample().recordHash("b").build());

        assertEquals(first, second);
        assertTrue(first.matches("[0-9a-f]{64}"), first);
    }

    @Test
    @DisplayName("Hash does not depend on map insertion order")
    void insertionOrderIndependent() {
        Map<String, String> forward = new TreeMap<>();
        forward.put("a", "1");
        forward.put("b", "2");
        Map<String, String> reverse = new LinkedHashMap<>();
        reverse.put("b", "2");
        reverse.put("a", "1");

        AuditRecord one = sample().decisionContext(new DecisionContext(forward, reverse, null)).seal();
        AuditRecord two = sample().decisionContext(new DecisionContext(reverse, forward, null)).seal();

        assertEquals(one.recordHash(), two.recordHash());
    }

    @Test
    @DisplayName("Hash covers the previous hash and every variant field")
    void hashCoversFields() {
        String base = sample().seal().recordHash();

        assertNotEquals(base, sample().previousHash("ab".repeat(32)).seal().recordHash());
        assertNotEquals(base, sample().actor(Actor.user("engine", "clerk")).seal().recordHash());
        assertNotEquals(base, sample().result(DecisionResult.deterministic(false)).seal().recordHash());
        assertNotEquals(base, sample().eventType(EventType.SIMULATION_RUN).seal().recordHash());
        assertNotEquals(base, sample().timestamp(Instant.parse("2026-01-15T10:00:00.124Z")).seal().recordHash());
    }

    @Test
    @DisplayName("Stored form reads back to an identical record")
    void storedFormReadsBack() {
        AuditRecord record = sample()
                .previousHash("cd".repeat(32))
                .actor(Actor.external("court-registry"))
                .result(new DecisionResult.EvaluationError("income", "Attribute 'income' not found"))
                .seal();

        Map<String, Object> stored = CanonicalPayload.toStoredMap(record);

        assertEquals(record.recordHash(), stored.get("record_hash"));
        assertEquals(record, CanonicalPayload.fromMap(stored));
    }

    @Test
    @DisplayName("Reading a stored form with a missing field fails")
    void missingField() {
        Map<String, Object> stored = CanonicalPayload.toStoredMap(sample().seal());
        stored.remove("statute_id");

        assertThrows(IllegalArgumentException.class, () -> CanonicalPayload.fromMap(stored));
    }
}
