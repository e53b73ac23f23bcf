package com.statute.ledger.health;

import com.statute.ledger.audit.AuditLedger;
import com.statute.ledger.audit.VerificationResult;

/**
 * Verifies the ledger's hash chain. DOWN when it is broken, with the index and kind of the
 * first failure.
 */
public class LedgerIntegrityHealthCheck implements HealthCheck {

    private final AuditLedger ledger;

    public LedgerIntegrityHealthCheck(AuditLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public String getName() {
        return "ledgerIntegrity";
    }

    @Override
    public HealthStatus check() {
        VerificationResult result = ledger.verify();
        if (result.valid()) {
            return HealthStatus.up()
                    .withDetail("records", result.checkedRecords())
                    .withDetail("tipHash", ledger.tipHash().orElse("none"));
        }
        return HealthStatus.down(result.describe())
                .withDetail("records", result.checkedRecords())
                .withDetail("firstBrokenIndex", result.firstBrokenIndex())
                .withDetail("failure", result.failure().name())
                .withDetail("recordId", String.valueOf(result.brokenRecordId()));
    }
}
