package com.statute.ledger.metrics;

import com.statute.ledger.decision.DecisionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Test
    @DisplayName("NoOpMetricsService accepts every call")
    void noOp() {
        NoOpMetricsService noOp = new NoOpMetricsService();

        assertDoesNotThrow(() -> {
            noOp.recordEvaluationDuration(DecisionKind.DETERMINISTIC, Duration.ofMillis(3));
            noOp.recordAppendDuration(Duration.ofMillis(1));
            noOp.incrementAppendContention();
            noOp.recordVerification(false);
        });
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should time evaluations per result kind")
        void evaluationDuration() {
            metrics.recordEvaluationDuration(DecisionKind.DETERMINISTIC, Duration.ofMillis(2));
            metrics.recordEvaluationDuration(DecisionKind.DETERMINISTIC, Duration.ofMillis(4));
            metrics.recordEvaluationDuration(DecisionKind.EVALUATION_ERROR, Duration.ofMillis(1));

            Timer deterministic = registry.find("statute.evaluation.duration").tag("result", "DETERMINISTIC").timer();
            Timer errors = registry.find("statute.evaluation.duration").tag("result", "EVALUATION_ERROR").timer();

            assertNotNull(deterministic);
            assertEquals(2, deterministic.count());
            assertNotNull(errors);
            assertEquals(1, errors.count());
        }

        @Test
        @DisplayName("Should record append duration and contention")
        void appendMetrics() {
            metrics.recordAppendDuration(Duration.ofMillis(5));
            metrics.incrementAppendContention();
            metrics.incrementAppendContention();

            assertEquals(1, registry.find("ledger.append.duration").timer().count());
            assertEquals(2.0, registry.find("ledger.append.contention").counter().count());
        }

        @Test
        @DisplayName("Should count verifications by outcome")
        void verification() {
            metrics.recordVerification(true);
            metrics.recordVerification(true);
            metrics.recordVerification(false);

            Counter valid = registry.find("ledger.verification").tag("outcome", "valid").counter();
            Counter broken = registry.find("ledger.verification").tag("outcome", "broken").counter();

            assertEquals(2.0, valid.count());
            assertEquals(1.0, broken.count());
        }
    }
}
