package com.statute.ledger.audit;

/**
 * Raised by an {@link AuditRepository} that cannot write or read its backing store.
 */
public class AuditStorageException extends RuntimeException {

    public AuditStorageException(String message) {
        super(message);
    }

    public AuditStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
