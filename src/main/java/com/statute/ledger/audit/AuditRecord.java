package com.statute.ledger.audit;

import com.statute.ledger.decision.DecisionResult;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, hash-linked snapshot of one evaluation.
 *
 * <p>{@code recordHash} is the SHA-256 of the record's canonical payload (every field except the
 * hash itself, see {@link CanonicalPayload}). {@code previousHash} is the hash of the record
 * appended just before this one, or {@code null} for the first record of a ledger.</p>
 */
public record AuditRecord(
        UUID id,
        Instant timestamp,
        EventType eventType,
        Actor actor,
        String statuteId,
        String subjectId,
        DecisionContext decisionContext,
        DecisionResult result,
        String recordHash,
        String previousHash
) {
    public AuditRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(eventType, "eventType is required");
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(statuteId, "statuteId is required");
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(result, "result is required");
        Objects.requireNonNull(recordHash, "recordHash is required");
        decisionContext = decisionContext != null ? decisionContext : DecisionContext.empty();
    }

    public boolean isGenesis() {
        return previousHash == null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .timestamp(timestamp)
                .eventType(eventType)
                .actor(actor)
                .statuteId(statuteId)
                .subjectId(subjectId)
                .decisionContext(decisionContext)
                .result(result)
                .recordHash(recordHash)
                .previousHash(previousHash);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private Instant timestamp = Instant.now();
        private EventType eventType;
        private Actor actor;
        private String statuteId;
        private String subjectId;
        private DecisionContext decisionContext;
        private DecisionResult result;
        private String recordHash;
        private String previousHash;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder eventType(EventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder actor(Actor actor) {
            this.actor = actor;
            return this;
        }

        public Builder statuteId(String statuteId) {
            this.statuteId = statuteId;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder decisionContext(DecisionContext decisionContext) {
            this.decisionContext = decisionContext;
            return this;
        }

        public Builder result(DecisionResult result) {
            this.result = result;
            return this;
        }

        public Builder recordHash(String recordHash) {
            this.recordHash = recordHash;
            return this;
        }

        public Builder previousHash(String previousHash) {
            this.previousHash = previousHash;
            return this;
        }

        /**
         * Builds the record with the hash exactly as set on this builder.
         */
        public AuditRecord build() {
            return new AuditRecord(id, timestamp, eventType, actor, statuteId, subjectId,
                    decisionContext, result, recordHash, previousHash);
        }

        /**
         * Builds the record with {@code recordHash} computed from the other fields.
         */
        public AuditRecord seal() {
            AuditRecord draft = new AuditRecord(id, timestamp, eventType, actor, statuteId, subjectId,
                    decisionContext, result, "", previousHash);
            this.recordHash = CanonicalPayload.hash(draft);
            return build();
        }
    }
}
