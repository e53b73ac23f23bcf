package com.statute.ledger.api;

import com.statute.ledger.audit.AuditRecord;
import com.statute.ledger.decision.DecisionResult;

import java.util.Objects;

/**
 * A decision and the ledger record that captured it.
 */
public record AuditedDecision(DecisionResult result, AuditRecord record) {

    public AuditedDecision {
        Objects.requireNonNull(result, "result is required");
        Objects.requireNonNull(record, "record is required");
    }

    public String statuteId() {
        return record.statuteId();
    }

    public String recordHash() {
        return record.recordHash();
    }
}
