package com.statute.ledger.api;

import com.statute.ledger.audit.Actor;
import com.statute.ledger.audit.AuditLedger;
import com.statute.ledger.audit.AuditRecord;
import com.statute.ledger.audit.ComplianceReport;
import com.statute.ledger.audit.DecisionContext;
import com.statute.ledger.audit.EventType;
import com.statute.ledger.audit.InMemoryAuditRepository;
import com.statute.ledger.audit.LedgerConfig;
import com.statute.ledger.audit.VerificationResult;
import com.statute.ledger.core.model.FactContext;
import com.statute.ledger.core.model.Statute;
import com.statute.ledger.decision.DecisionKind;
import com.statute.ledger.decision.DecisionResult;
import com.statute.ledger.engine.Evaluation;
import com.statute.ledger.engine.EvaluationEngine;
import com.statute.ledger.health.HealthCheckRegistry;
import com.statute.ledger.health.HealthStatus;
import com.statute.ledger.health.LedgerIntegrityHealthCheck;
import com.statute.ledger.health.StatuteRegistryHealthCheck;
import com.statute.ledger.logging.LogContext;
import com.statute.ledger.metrics.MetricsService;
import com.statute.ledger.metrics.NoOpMetricsService;
import com.statute.ledger.registry.StatuteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point: evaluates registered statutes and records every decision in the audit ledger.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * StatuteRegistry registry = new StatuteRegistry()
 *     .add(adultRights)
 *     .freeze();
 *
 * StatuteLedger statutes = StatuteLedger.builder()
 *     .registry(registry)
 *     .build();
 *
 * FactContext facts = FactContext.builder().subjectId("citizen-7").age(25).build();
 * AuditedDecision decision = statutes.decide("adult-rights", facts, Actor.system("intake"));
 * decision.result();       // Deterministic[applies=true]
 * decision.recordHash();   // sha-256 of the stored record
 *
 * statutes.verify().valid();
 * </pre>
 *
 * <p>Evaluation runs on the caller's thread, outside the ledger lock; only the append is serialized.</p>
 */
public class StatuteLedger {
    private static final Logger log = LoggerFactory.getLogger(StatuteLedger.class);

    static final String OVERRIDES_METADATA = "overrides";
    static final String REASON_METADATA = "reason";

    private final StatuteRegistry registry;
    private final AuditLedger ledger;
    private final EvaluationEngine engine;
    private final MetricsService metricsService;
    private final HealthCheckRegistry healthCheckRegistry;

    private StatuteLedger(Builder builder) {
        this.registry = builder.registry;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.ledger = builder.ledger != null ? builder.ledger
                : new AuditLedger(LedgerConfig.defaults(), new InMemoryAuditRepository(), metricsService, Clock.systemUTC());
        this.engine = builder.engine != null ? builder.engine : new EvaluationEngine();

        this.healthCheckRegistry = new HealthCheckRegistry()
                .register(new LedgerIntegrityHealthCheck(ledger))
                .register(new StatuteRegistryHealthCheck(registry));

        log.info("StatuteLedger initialized with {} statutes and {} audit records",
                registry.size(), ledger.size());
    }

    /**
     * Evaluates one statute and appends the decision to the ledger.
     *
     * @throws IllegalArgumentException if no statute with that id is registered
     * @throws com.statute.ledger.engine.MalformedStatuteException if the statute has neither
     *         preconditions nor discretion text
     * @throws com.statute.ledger.audit.LedgerContentionException if the append timed out; retry
     */
    public AuditedDecision decide(String statuteId, FactContext facts, Actor actor) {
        Statute statute = registry.get(statuteId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown statute: " + statuteId));
        try (LogContext ignored = LogContext.forDecision(
                LogContext.generateCorrelationId(), statuteId, facts.getSubjectId())) {
            return decide(statute, facts, actor);
        }
    }

    /**
     * Evaluates every statute of a jurisdiction in registry order, recording each decision.
     */
    public List<AuditedDecision> decideAll(String jurisdiction, FactContext facts, Actor actor) {
        List<AuditedDecision> decisions = new ArrayList<>();
        try (LogContext ignored = LogContext.forJurisdiction(
                LogContext.generateCorrelationId(), jurisdiction, facts.getSubjectId())) {
            for (Statute statute : registry.byJurisdiction(jurisdiction)) {
                decisions.add(decide(statute, facts, actor));
            }
            log.info("Evaluated {} statutes of {} for subject {}",
                    decisions.size(), jurisdiction, facts.getSubjectId());
        }
        return decisions;
    }

    private AuditedDecision decide(Statute statute, FactContext facts, Actor actor) {
        Objects.requireNonNull(actor, "actor is required");
        long start = System.nanoTime();
        Evaluation evaluation = engine.evaluateWithTrace(statute, facts);
        DecisionResult result = evaluation.result();
        metricsService.recordEvaluationDuration(result.kind(), Duration.ofNanos(System.nanoTime() - start));

        EventType eventType = result.kind() == DecisionKind.REQUIRES_DISCRETION
                ? EventType.DISCRETIONARY_REVIEW : EventType.AUTOMATIC_DECISION;
        DecisionContext context = DecisionContext.of(facts, evaluation.evaluatedConditions())
                .withMetadata("statute_version", String.valueOf(statute.getVersion()));
        AuditRecord record = ledger.append(eventType, actor, statute.getId(), facts.getSubjectId(), context, result);
        return new AuditedDecision(result, record);
    }

    /**
     * Records a reviewer's decision that replaces an earlier one. The earlier record stays in the
     * ledger; the new one references it by id.
     *
     * @throws IllegalArgumentException if the reason is blank
     */
    public AuditedDecision override(AuditRecord original, DecisionResult decision, Actor.User reviewer, String reason) {
        Objects.requireNonNull(original, "original is required");
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(reviewer, "reviewer is required");
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("An override requires a reason");
        }
        DecisionContext context = new DecisionContext(original.decisionContext().attributes(), null, null)
                .withMetadata(OVERRIDES_METADATA, original.id().toString())
                .withMetadata(REASON_METADATA, reason);
        AuditRecord record = ledger.append(EventType.HUMAN_OVERRIDE, reviewer,
                original.statuteId(), original.subjectId(), context, decision);
        log.info("Decision {} overridden by {} ({})", original.id(), reviewer.userId(), reviewer.role());
        return new AuditedDecision(decision, record);
    }

    public VerificationResult verify() {
        try (LogContext ignored = LogContext.forVerification(LogContext.generateCorrelationId())) {
            return ledger.verify();
        }
    }

    public ComplianceReport report() {
        return ledger.report();
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public StatuteRegistry getRegistry() {
        return registry;
    }

    public AuditLedger getLedger() {
        return ledger;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StatuteRegistry registry;
        private AuditLedger ledger;
        private EvaluationEngine engine;
        private MetricsService metricsService;

        public Builder registry(StatuteRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Defaults to an in-memory ledger reporting to this facade's metrics service if not set.
         */
        public Builder ledger(AuditLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder engine(EvaluationEngine engine) {
            this.engine = engine;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public StatuteLedger build() {
            if (registry == null) {
                throw new IllegalStateException("StatuteRegistry is required");
            }
            return new StatuteLedger(this);
        }
    }
}
