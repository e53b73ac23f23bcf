package com.statute.ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.statute.ledger.decision.DecisionKind;
import com.statute.ledger.decision.DecisionResult;
import com.statute.ledger.decision.EvaluatedCondition;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Deterministic serialization of an {@link AuditRecord} and the hash computed over it.
 *
 * <p>The payload is a JSON object whose keys are sorted at every level. It holds every record
 * field except {@code record_hash}; {@code previous_hash} is always present (JSON null for the
 * genesis record). Enum constants are written by name, variants as objects with a {@code kind}
 * member, timestamps as ISO-8601 UTC. The same map form, with {@code record_hash} added, is what
 * {@link JsonlAuditRepository} stores, and {@link #fromMap} reads it back.</p>
 */
public final class CanonicalPayload {

    static final String ID = "id";
    static final String TIMESTAMP = "timestamp";
    static final String EVENT_TYPE = "event_type";
    static final String ACTOR = "actor";
    static final String STATUTE_ID = "statute_id";
    static final String SUBJECT_ID = "subject_id";
    static final String DECISION_CONTEXT = "decision_context";
    static final String RESULT = "result";
    static final String PREVIOUS_HASH = "previous_hash";
    static final String RECORD_HASH = "record_hash";

    private static final String KIND = "kind";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final HexFormat HEX = HexFormat.of();

    private CanonicalPayload() {}

    /**
     * Lowercase hex SHA-256 of the record's canonical JSON.
     */
    public static String hash(AuditRecord record) {
        byte[] payload = toJson(record).getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(md.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static String toJson(AuditRecord record) {
        try {
            return MAPPER.writeValueAsString(canonicalize(record));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize audit record " + record.id(), e);
        }
    }

    /**
     * Canonical map of every field except the record hash.
     */
    public static Map<String, Object> canonicalize(AuditRecord record) {
        Map<String, Object> result = new TreeMap<>();
        result.put(ID, record.id().toString());
        result.put(TIMESTAMP, record.timestamp().toString());
        result.put(EVENT_TYPE, record.eventType().name());
        result.put(ACTOR, actor(record.actor()));
        result.put(STATUTE_ID, record.statuteId());
        result.put(SUBJECT_ID, record.subjectId());
        result.put(DECISION_CONTEXT, decisionContext(record.decisionContext()));
        result.put(RESULT, result(record.result()));
        result.put(PREVIOUS_HASH, record.previousHash());
        return result;
    }

    /**
     * Canonical map with the stored {@code record_hash} added; the persisted form of a record.
     */
    public static Map<String, Object> toStoredMap(AuditRecord record) {
        Map<String, Object> stored = canonicalize(record);
        stored.put(RECORD_HASH, record.recordHash());
        return stored;
    }

    /**
     * Rebuilds a record from its persisted form, keeping the stored hash as-is so that
     * verification can detect any change made to the stored fields.
     *
     * @throws IllegalArgumentException if a field is missing or has an unknown value
     */
    public static AuditRecord fromMap(Map<String, Object> stored) {
        return AuditRecord.builder()
                .id(UUID.fromString(text(stored, ID)))
                .timestamp(Instant.parse(text(stored, TIMESTAMP)))
                .eventType(EventType.valueOf(text(stored, EVENT_TYPE)))
                .actor(readActor(object(stored, ACTOR)))
                .statuteId(text(stored, STATUTE_ID))
                .subjectId(text(stored, SUBJECT_ID))
                .decisionContext(readDecisionContext(object(stored, DECISION_CONTEXT)))
                .result(readResult(object(stored, RESULT)))
                .previousHash((String) stored.get(PREVIOUS_HASH))
                .recordHash(text(stored, RECORD_HASH))
                .build();
    }

    private static Map<String, Object> actor(Actor actor) {
        Map<String, Object> data = new TreeMap<>();
        data.put(KIND, actor.kind().name());
        if (actor instanceof Actor.System system) {
            data.put("component", system.component());
        } else if (actor instanceof Actor.User user) {
            data.put("user_id", user.userId());
            data.put("role", user.role());
        } else if (actor instanceof Actor.External external) {
            data.put("system_id", external.systemId());
        }
        return data;
    }

    private static Actor readActor(Map<String, Object> data) {
        Actor.Kind kind = Actor.Kind.valueOf(text(data, KIND));
        return switch (kind) {
            case SYSTEM -> Actor.system(text(data, "component"));
            case USER -> Actor.user(text(data, "user_id"), text(data, "role"));
            case EXTERNAL -> Actor.external(text(data, "system_id"));
        };
    }

    private static Map<String, Object> decisionContext(DecisionContext context) {
        Map<String, Object> data = new TreeMap<>();
        data.put("attributes", new TreeMap<>(context.attributes()));
        data.put("metadata", new TreeMap<>(context.metadata()));
        List<Map<String, Object>> conditions = new ArrayList<>();
        for (EvaluatedCondition condition : context.evaluatedConditions()) {
            Map<String, Object> c = new TreeMap<>();
            c.put("description", condition.description());
            c.put("satisfied", condition.satisfied());
            conditions.add(c);
        }
        data.put("evaluated_conditions", conditions);
        return data;
    }

    @SuppressWarnings("unchecked")
    private static DecisionContext readDecisionContext(Map<String, Object> data) {
        List<EvaluatedCondition> conditions = new ArrayList<>();
        Object rawConditions = data.get("evaluated_conditions");
        if (rawConditions instanceof List<?> list) {
            for (Object item : list) {
                Map<String, Object> c = (Map<String, Object>) item;
                conditions.add(new EvaluatedCondition(text(c, "description"), bool(c, "satisfied")));
            }
        }
        return new DecisionContext(stringMap(data, "attributes"), stringMap(data, "metadata"), conditions);
    }

    private static Map<String, String> stringMap(Map<String, Object> data, String key) {
        Map<String, String> result = new TreeMap<>();
        Object value = data.get(key);
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (!(v instanceof String text)) {
                    throw new IllegalArgumentException("Invalid " + key + " value for " + k + ": " + v);
                }
                result.put(String.valueOf(k), text);
            });
        }
        return result;
    }

    private static Map<String, Object> result(DecisionResult result) {
        Map<String, Object> data = new TreeMap<>();
        data.put(KIND, result.kind().name());
        if (result instanceof DecisionResult.Deterministic deterministic) {
            data.put("applies", deterministic.applies());
        } else if (result instanceof DecisionResult.RequiresDiscretion discretion) {
            data.put("issue", discretion.issue());
        } else if (result instanceof DecisionResult.EvaluationError error) {
            data.put("missing_attribute", error.missingAttribute());
            data.put("detail", error.detail());
        }
        return data;
    }

    private static DecisionResult readResult(Map<String, Object> data) {
        return switch (DecisionKind.valueOf(text(data, KIND))) {
            case DETERMINISTIC -> DecisionResult.deterministic(bool(data, "applies"));
            case REQUIRES_DISCRETION -> DecisionResult.requiresDiscretion(text(data, "issue"));
            case EVALUATION_ERROR -> new DecisionResult.EvaluationError(
                    text(data, "missing_attribute"), (String) data.get("detail"));
        };
    }

    private static String text(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException("Expected text field '" + key + "' but found: " + value);
        }
        return s;
    }

    private static boolean bool(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof Boolean b)) {
            throw new IllegalArgumentException("Expected boolean field '" + key + "' but found: " + value);
        }
        return b;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Expected object field '" + key + "' but found: " + value);
        }
        return (Map<String, Object>) value;
    }
}
