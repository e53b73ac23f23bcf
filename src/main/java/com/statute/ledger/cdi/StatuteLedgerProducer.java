package com.statute.ledger.cdi;

import com.statute.ledger.api.StatuteLedger;
import com.statute.ledger.audit.AuditLedger;
import com.statute.ledger.audit.AuditRepository;
import com.statute.ledger.audit.InMemoryAuditRepository;
import com.statute.ledger.audit.JsonlAuditRepository;
import com.statute.ledger.audit.LedgerConfig;
import com.statute.ledger.metrics.MetricsService;
import com.statute.ledger.metrics.MicrometerMetricsService;
import com.statute.ledger.metrics.NoOpMetricsService;
import com.statute.ledger.registry.DuplicatePolicy;
import com.statute.ledger.registry.StatuteRegistry;
import io.micrometer.core.instrument.Metrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

/**
 * CDI producer that wires the statute ledger from MicroProfile Config properties.
 *
 * <pre>
 * statute-ledger.ledger.append-timeout-ms=5000
 * statute-ledger.ledger.storage=jsonl
 * statute-ledger.ledger.jsonl-path=/var/lib/statute-ledger/audit.jsonl
 * statute-ledger.registry.duplicate-policy=REJECT
 * statute-ledger.metrics.enabled=true
 * </pre>
 *
 * <p>The produced {@link StatuteRegistry} starts empty; the application registers its statutes
 * and freezes it at startup.</p>
 */
@ApplicationScoped
public class StatuteLedgerProducer {

    private static final Logger log = LoggerFactory.getLogger(StatuteLedgerProducer.class);

    static final String STORAGE_MEMORY = "memory";
    static final String STORAGE_JSONL = "jsonl";

    // ── Ledger ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "statute-ledger.ledger.append-timeout-ms", defaultValue = "5000")
    long appendTimeoutMs;

    @Inject
    @ConfigProperty(name = "statute-ledger.ledger.storage", defaultValue = STORAGE_MEMORY)
    String storage;

    @Inject
    @ConfigProperty(name = "statute-ledger.ledger.jsonl-path", defaultValue = "statute-ledger-audit.jsonl")
    String jsonlPath;

    // ── Registry ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "statute-ledger.registry.duplicate-policy", defaultValue = "REJECT")
    String duplicatePolicy;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "statute-ledger.metrics.enabled", defaultValue = "false")
    boolean metricsEnabled;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public LedgerConfig ledgerConfig() {
        return new LedgerConfig(appendTimeoutMs);
    }

    @Produces
    @ApplicationScoped
    public AuditRepository auditRepository() {
        String kind = storage.trim().toLowerCase(Locale.ROOT);
        if (STORAGE_JSONL.equals(kind)) {
            log.info("Audit storage: JSONL at {}", jsonlPath);
            return new JsonlAuditRepository(Path.of(jsonlPath));
        }
        if (!STORAGE_MEMORY.equals(kind)) {
            throw new IllegalArgumentException("Unknown audit storage '" + storage
                    + "', expected " + STORAGE_MEMORY + " or " + STORAGE_JSONL);
        }
        log.info("Audit storage: in-memory");
        return new InMemoryAuditRepository();
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled) {
            log.info("Metrics enabled on the global Micrometer registry");
            return new MicrometerMetricsService(Metrics.globalRegistry);
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public StatuteRegistry statuteRegistry() {
        DuplicatePolicy policy = DuplicatePolicy.valueOf(duplicatePolicy.trim().toUpperCase(Locale.ROOT));
        log.info("Statute registry duplicate policy: {}", policy);
        return new StatuteRegistry(policy);
    }

    @Produces
    @ApplicationScoped
    public AuditLedger auditLedger(LedgerConfig config, AuditRepository repository, MetricsService metrics) {
        return new AuditLedger(config, repository, metrics, Clock.systemUTC());
    }

    @Produces
    @ApplicationScoped
    public StatuteLedger statuteLedger(StatuteRegistry registry, AuditLedger ledger, MetricsService metrics) {
        return StatuteLedger.builder()
                .registry(registry)
                .ledger(ledger)
                .metricsService(metrics)
                .build();
    }
}
