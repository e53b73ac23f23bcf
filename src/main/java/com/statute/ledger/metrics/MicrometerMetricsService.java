package com.statute.ledger.metrics;

import com.statute.ledger.decision.DecisionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code statute.evaluation.duration} Timer (tag: result)</li>
 *   <li>{@code ledger.append.duration} Timer</li>
 *   <li>{@code ledger.append.contention} Counter</li>
 *   <li>{@code ledger.verification} Counter (tag: outcome = valid|broken)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<DecisionKind, Timer> evaluationTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> verificationCounters = new ConcurrentHashMap<>();
    private final Timer appendTimer;
    private final Counter contentionCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.appendTimer = Timer.builder("ledger.append.duration")
                .description("Time spent holding the ledger write lock to seal and store a record")
                .register(registry);
        this.contentionCounter = Counter.builder("ledger.append.contention")
                .description("Appends rejected because the write lock was not acquired in time")
                .register(registry);
    }

    @Override
    public void recordEvaluationDuration(DecisionKind result, Duration duration) {
        Timer timer = evaluationTimers.computeIfAbsent(result, kind ->
                Timer.builder("statute.evaluation.duration")
                        .description("Duration of statute evaluations")
                        .tag("result", kind.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordAppendDuration(Duration duration) {
        appendTimer.record(duration);
    }

    @Override
    public void incrementAppendContention() {
        contentionCounter.increment();
    }

    @Override
    public void recordVerification(boolean valid) {
        String outcome = valid ? "valid" : "broken";
        Counter counter = verificationCounters.computeIfAbsent(outcome, o ->
                Counter.builder("ledger.verification")
                        .description("Hash chain verifications by outcome")
                        .tag("outcome", o)
                        .register(registry));
        counter.increment();
    }
}
