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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatuteLedgerProducer Tests")
class StatuteLedgerProducerTest {

    @TempDir
    Path tempDir;

    private StatuteLedgerProducer producer;

    @BeforeEach
    void setUp() {
        producer = new StatuteLedgerProducer();
        producer.appendTimeoutMs = 5000;
        producer.storage = "memory";
        producer.jsonlPath = tempDir.resolve("audit.jsonl").toString();
        producer.duplicatePolicy = "REJECT";
        producer.metricsEnabled = false;
    }

    @Test
    @DisplayName("Defaults produce an in-memory ledger without metrics")
    void defaults() {
        assertEquals(LedgerConfig.defaults(), producer.ledgerConfig());
        assertInstanceOf(InMemoryAuditRepository.class, producer.auditRepository());
        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
        assertEquals(DuplicatePolicy.REJECT, producer.statuteRegistry().getDuplicatePolicy());
    }

    @Test
    @DisplayName("JSONL storage writes to the configured path")
    void jsonlStorage() {
        producer.storage = " JSONL ";

        AuditRepository repository = producer.auditRepository();

        JsonlAuditRepository jsonl = assertInstanceOf(JsonlAuditRepository.class, repository);
        assertEquals(tempDir.resolve("audit.jsonl"), jsonl.getPath());
    }

    @Test
    @DisplayName("Unknown storage kind is rejected")
    void unknownStorage() {
        producer.storage = "postgres";
        assertThrows(IllegalArgumentException.class, () -> producer.auditRepository());
    }

    @Test
    @DisplayName("Duplicate policy and metrics follow configuration")
    void policyAndMetrics() {
        producer.duplicatePolicy = "replace_newer_version";
        producer.metricsEnabled = true;

        assertEquals(DuplicatePolicy.REPLACE_NEWER_VERSION, producer.statuteRegistry().getDuplicatePolicy());
        assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
    }

    @Test
    @DisplayName("Produced facade is wired to the produced registry and ledger")
    void facade() {
        producer.appendTimeoutMs = 250;
        StatuteRegistry registry = producer.statuteRegistry();
        MetricsService metrics = producer.metricsService();
        AuditLedger ledger = producer.auditLedger(producer.ledgerConfig(), producer.auditRepository(), metrics);

        StatuteLedger statutes = producer.statuteLedger(registry, ledger, metrics);

        assertSame(registry, statutes.getRegistry());
        assertSame(ledger, statutes.getLedger());
        assertEquals(250, ledger.getConfig().appendTimeoutMs());
    }
}
