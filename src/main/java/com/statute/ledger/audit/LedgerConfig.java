package com.statute.ledger.audit;

/**
 * Configuration for an {@link AuditLedger}.
 *
 * @param appendTimeoutMs maximum time an append waits for the write lock (milliseconds)
 */
public record LedgerConfig(long appendTimeoutMs) {

    public static final long DEFAULT_APPEND_TIMEOUT_MS = 5000;

    public LedgerConfig {
        if (appendTimeoutMs <= 0) {
            throw new IllegalArgumentException("appendTimeoutMs must be positive");
        }
    }

    public static LedgerConfig defaults() {
        return new LedgerConfig(DEFAULT_APPEND_TIMEOUT_MS);
    }
}
