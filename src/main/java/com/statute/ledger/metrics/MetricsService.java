package com.statute.ledger.metrics;

import com.statute.ledger.decision.DecisionKind;

import java.time.Duration;

/**
 * Records evaluation and ledger metrics.
 * The default {@link NoOpMetricsService} keeps the library usable without a metrics backend;
 * {@link MicrometerMetricsService} publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordEvaluationDuration(DecisionKind result, Duration duration);

    void recordAppendDuration(Duration duration);

    void incrementAppendContention();

    void recordVerification(boolean valid);
}
