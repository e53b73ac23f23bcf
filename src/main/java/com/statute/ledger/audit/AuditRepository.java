package com.statute.ledger.audit;

import java.util.List;

/**
 * Durable storage behind an {@link AuditLedger}.
 * Implementations must keep records in save order and reproduce every field exactly on load.
 */
public interface AuditRepository {

    /**
     * Persists a sealed record after all previously saved ones.
     *
     * @throws AuditStorageException if the record could not be stored
     */
    void save(AuditRecord record);

    /**
     * Loads every stored record in save order.
     *
     * @throws AuditStorageException if the store cannot be read
     */
    List<AuditRecord> loadAll();

    /**
     * Number of stored records.
     */
    int count();
}
