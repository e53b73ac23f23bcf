package com.statute.ledger.audit;

import com.statute.ledger.decision.DecisionKind;
import com.statute.ledger.decision.DecisionResult;
import com.statute.ledger.metrics.MetricsService;
import com.statute.ledger.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Append-only, hash-chained sequence of {@link AuditRecord}s.
 *
 * <p>Appends are serialized by a write lock taken with a timeout, so at most one append is in
 * flight and no two records ever share a {@code previous_hash}. The lock covers sealing the record,
 * storing it and advancing the tip; evaluation happens before and outside it. Readers copy the
 * record list under the read lock and work on that snapshot.</p>
 *
 * <p>A record is added to the ledger only after the {@link AuditRepository} accepted it.</p>
 */
public class AuditLedger {
    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    private final List<AuditRecord> records = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final LedgerConfig config;
    private final AuditRepository repository;
    private final MetricsService metrics;
    private final Clock clock;
    private String tipHash;

    public AuditLedger() {
        this(LedgerConfig.defaults(), new InMemoryAuditRepository(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public AuditLedger(LedgerConfig config, AuditRepository repository) {
        this(config, repository, new NoOpMetricsService(), Clock.systemUTC());
    }

    /**
     * Opens a ledger over whatever the repository already holds.
     *
     * @throws ChainIntegrityException if the stored records do not form an intact chain
     */
    public AuditLedger(LedgerConfig config, AuditRepository repository, MetricsService metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");

        List<AuditRecord> stored = repository.loadAll();
        if (!stored.isEmpty()) {
            VerificationResult result = HashChainVerifier.verify(stored);
            metrics.recordVerification(result.valid());
            if (!result.valid()) {
                log.error("Refusing to open audit ledger: {}", result.describe());
                throw new ChainIntegrityException(result);
            }
            records.addAll(stored);
            tipHash = stored.get(stored.size() - 1).recordHash();
            log.info("Audit ledger restored with {} records, tip {}", stored.size(), tipHash);
        }
    }

    /**
     * Seals a new record linked to the current tip and appends it.
     *
     * @return the stored record, carrying its {@code record_hash}
     * @throws LedgerContentionException if the write lock is not acquired within the configured timeout
     * @throws AuditStorageException     if the repository rejects the record; nothing is appended
     */
    public AuditRecord append(EventType eventType, Actor actor, String statuteId, String subjectId,
                              DecisionContext decisionContext, DecisionResult result) {
        AuditRecord.Builder builder = AuditRecord.builder()
                .id(UUID.randomUUID())
                .eventType(Objects.requireNonNull(eventType, "eventType is required"))
                .actor(Objects.requireNonNull(actor, "actor is required"))
                .statuteId(Objects.requireNonNull(statuteId, "statuteId is required"))
                .subjectId(Objects.requireNonNull(subjectId, "subjectId is required"))
                .decisionContext(decisionContext)
                .result(Objects.requireNonNull(result, "result is required"));

        acquireWriteLock(statuteId);
        long start = System.nanoTime();
        AuditRecord sealed;
        try {
            sealed = builder
                    .timestamp(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                    .previousHash(tipHash)
                    .seal();
            repository.save(sealed);
            records.add(sealed);
            tipHash = sealed.recordHash();
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordAppendDuration(Duration.ofNanos(System.nanoTime() - start));
        log.info("Audit record appended: {} {} statute={} subject={} result={} hash={}",
                sealed.id(), eventType, statuteId, subjectId, result.kind(), sealed.recordHash());
        return sealed;
    }

    private void acquireWriteLock(String statuteId) {
        try {
            boolean acquired = lock.writeLock().tryLock(config.appendTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                metrics.incrementAppendContention();
                log.warn("Append for statute {} timed out waiting {}ms for the ledger lock",
                        statuteId, config.appendTimeoutMs());
                throw new LedgerContentionException(
                        "Failed to acquire ledger write lock within " + config.appendTimeoutMs() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerContentionException("Interrupted while acquiring ledger write lock", e);
        }
    }

    /**
     * Recomputes every hash and link of a snapshot of the chain. Does not modify the ledger.
     */
    public VerificationResult verify() {
        List<AuditRecord> snapshot = records();
        VerificationResult result = HashChainVerifier.verify(snapshot);
        metrics.recordVerification(result.valid());
        if (result.valid()) {
            log.debug("Audit ledger verified: {} records", result.checkedRecords());
        } else {
            log.error("Audit ledger integrity violation: {}", result.describe());
        }
        return result;
    }

    /**
     * @throws ChainIntegrityException if the chain is broken
     */
    public VerificationResult verifyOrThrow() {
        VerificationResult result = verify();
        if (!result.valid()) {
            throw new ChainIntegrityException(result);
        }
        return result;
    }

    /**
     * Immutable snapshot of all records in append order.
     */
    public List<AuditRecord> records() {
        lock.readLock().lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AuditRecord> get(UUID id) {
        return records().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public List<AuditRecord> byStatute(String statuteId) {
        return filter(r -> r.statuteId().equals(statuteId));
    }

    public List<AuditRecord> bySubject(String subjectId) {
        return filter(r -> r.subjectId().equals(subjectId));
    }

    public List<AuditRecord> byEventType(EventType eventType) {
        return filter(r -> r.eventType() == eventType);
    }

    /**
     * Records whose timestamp lies within {@code [start, end]}.
     */
    public List<AuditRecord> between(Instant start, Instant end) {
        return filter(r -> !r.timestamp().isBefore(start) && !r.timestamp().isAfter(end));
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Hash of the last appended record; empty for an empty ledger.
     */
    public Optional<String> tipHash() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tipHash);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ComplianceReport report() {
        List<AuditRecord> snapshot = records();
        int automatic = 0;
        int discretionary = 0;
        int overrides = 0;
        int applied = 0;
        int notApplied = 0;
        int errors = 0;
        for (AuditRecord record : snapshot) {
            switch (record.eventType()) {
                case AUTOMATIC_DECISION -> automatic++;
                case DISCRETIONARY_REVIEW -> discretionary++;
                case HUMAN_OVERRIDE -> overrides++;
                default -> { }
            }
            DecisionResult result = record.result();
            if (result.kind() == DecisionKind.DETERMINISTIC) {
                if (((DecisionResult.Deterministic) result).applies()) {
                    applied++;
                } else {
                    notApplied++;
                }
            } else if (result.kind() == DecisionKind.EVALUATION_ERROR) {
                errors++;
            }
        }
        boolean intact = HashChainVerifier.verify(snapshot).valid();
        return new ComplianceReport(snapshot.size(), automatic, discretionary, overrides,
                applied, notApplied, errors, intact, Instant.now(clock));
    }

    public LedgerConfig getConfig() {
        return config;
    }

    private List<AuditRecord> filter(Predicate<AuditRecord> predicate) {
        return records().stream().filter(predicate).toList();
    }
}
