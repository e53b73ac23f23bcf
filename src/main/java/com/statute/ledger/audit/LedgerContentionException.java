package com.statute.ledger.audit;

/**
 * Thrown when an append cannot take the ledger's write lock within the configured timeout.
 * Nothing was appended; the caller may retry.
 */
public class LedgerContentionException extends RuntimeException {

    public LedgerContentionException(String message) {
        super(message);
    }

    public LedgerContentionException(String message, Throwable cause) {
        super(message, cause);
    }
}
