package com.statute.ledger.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * Summary of the decisions held by a ledger.
 *
 * @param totalDecisions         number of records
 * @param automaticDecisions     records of type {@link EventType#AUTOMATIC_DECISION}
 * @param discretionaryDecisions records of type {@link EventType#DISCRETIONARY_REVIEW}
 * @param humanOverrides         records of type {@link EventType#HUMAN_OVERRIDE}
 * @param applied                deterministic results where the effect applies
 * @param notApplied             deterministic results where it does not
 * @param evaluationErrors       results that failed closed on a missing or unusable fact
 * @param integrityVerified      whether the chain verified when the report was generated
 * @param generatedAt            generation time
 */
public record ComplianceReport(
        int totalDecisions,
        int automaticDecisions,
        int discretionaryDecisions,
        int humanOverrides,
        int applied,
        int notApplied,
        int evaluationErrors,
        boolean integrityVerified,
        Instant generatedAt
) {
    public ComplianceReport {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
    }
}
