package com.statute.ledger.metrics;

import com.statute.ledger.decision.DecisionKind;

import java.time.Duration;

/**
 * {@link MetricsService} that records nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordEvaluationDuration(DecisionKind result, Duration duration) {
    }

    @Override
    public void recordAppendDuration(Duration duration) {
    }

    @Override
    public void incrementAppendContention() {
    }

    @Override
    public void recordVerification(boolean valid) {
    }
}
