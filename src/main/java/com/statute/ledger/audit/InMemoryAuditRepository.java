package com.statute.ledger.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link AuditRepository}. Contents are lost on shutdown.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final CopyOnWriteArrayList<AuditRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void save(AuditRecord record) {
        records.add(record);
    }

    @Override
    public List<AuditRecord> loadAll() {
        return List.copyOf(records);
    }

    @Override
    public int count() {
        return records.size();
    }
}
