package com.z254.arbiter.drift;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.observability.ArbiterMetrics;
import com.z254.arbiter.observability.ArbiterStructuredLogger;
import com.z254.arbiter.registry.ModelRegistry;
import com.z254.arbiter.store.BestEffortWriter;
import com.z254.arbiter.store.DriftAlertPublisher;
import com.z254.arbiter.store.DriftHistoryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link DriftMonitor}.
 */
class DriftMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private ArbiterMetrics metrics;
    private ModelRegistry registry;
    private DriftHistoryStore historyStore;
    private DriftAlertPublisher alertPublisher;
    private ArbiterProperties properties;

    @BeforeEach
    void setUp() {
        metrics = new ArbiterMetrics(new SimpleMeterRegistry());
        registry = new ModelRegistry(Clock.fixed(NOW, ZoneOffset.UTC), metrics, new ArbiterStructuredLogger());
        historyStore = mock(DriftHistoryStore.class);
        alertPublisher = mock(DriftAlertPublisher.class);
        when(historyStore.append(any())).thenReturn(Mono.empty());
        when(alertPublisher.publish(any())).thenReturn(Mono.empty());
        properties = new ArbiterProperties();
        properties.getDrift().setThreshold(0.1);
        properties.getDrift().setMinSamples(2);
    }

    private DriftMonitor monitor(DriftDataSource source, DriftScoreCalculator calculator) {
        return new DriftMonitor(source, calculator, registry, historyStore, alertPublisher,
                new BestEffortWriter(metrics), metrics, new ArbiterStructuredLogger(),
                Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    private static DriftWindows windows(int reference, int current) {
        return new DriftWindows(new double[reference][18], new double[current][18]);
    }

    private static DriftDataSource source(DriftWindows windows) {
        return (version, now) -> Mono.just(windows);
    }

    private static DriftScoreCalculator fixedScore(double score) {
        return windows -> new DriftScore(score, Map.of("content_toxicity_score", score, "time_of_day", 0.01));
    }

    @Nested
    @DisplayName("with enough data")
    class WithData {

        @Test
        @DisplayName("should detect drift above the threshold and raise an alert")
        void detects() {
            DriftMonitor monitor = monitor(source(windows(5, 5)), fixedScore(0.15));

            StepVerifier.create(monitor.check("rf-1"))
                    .assertNext(result -> {
                        assertThat(result.isDriftDetected()).isTrue();
                        assertThat(result.getDriftScore()).isEqualTo(0.15);
                        assertThat(result.getThreshold()).isEqualTo(0.1);
                        assertThat(result.getModelVersion()).isEqualTo("rf-1");
                        assertThat(result.getAffectedFeatures()).containsExactly("content_toxicity_score");
                        assertThat(result.getTimestamp()).isEqualTo(NOW);
                        assertThat(result.getDetails()).containsEntry("referenceSamples", 5);
                    })
                    .verifyComplete();

            verify(alertPublisher, timeout(2000)).publish(any());
            verify(historyStore, timeout(2000)).append(any());
            assertThat(metrics.getDriftDetected().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should not report drift at exactly the threshold")
        void thresholdIsExclusive() {
            DriftMonitor monitor = monitor(source(windows(5, 5)), fixedScore(0.1));

            StepVerifier.create(monitor.check("rf-1"))
                    .assertNext(result -> assertThat(result.isDriftDetected()).isFalse())
                    .verifyComplete();

            verify(historyStore, timeout(2000)).append(any());
            verify(alertPublisher, never()).publish(any());
            assertThat(metrics.getDriftChecks().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should check the active random forest when no version is given")
        void defaultsToActiveVersion() {
            DriftMonitor monitor = monitor(source(windows(3, 3)), fixedScore(0.0));

            StepVerifier.create(monitor.check(null))
                    .assertNext(result -> assertThat(result.getModelVersion()).isNull())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("without enough data")
    class NoData {

        @Test
        @DisplayName("should complete empty when the source has nothing")
        void emptySource() {
            DriftMonitor monitor = monitor((version, now) -> Mono.empty(), fixedScore(0.5));

            StepVerifier.create(monitor.check("rf-1")).verifyComplete();

            assertThat(metrics.getDriftNoData().count()).isEqualTo(1.0);
            verify(historyStore, never()).append(any());
        }

        @Test
        @DisplayName("should complete empty when a window is below the minimum size")
        void smallWindow() {
            DriftMonitor monitor = monitor(source(windows(10, 1)), fixedScore(0.5));

            StepVerifier.create(monitor.check("rf-1")).verifyComplete();

            assertThat(metrics.getDriftNoData().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should complete empty when the computation fails")
        void calculatorFailure() {
            DriftMonitor monitor = monitor(source(windows(5, 5)), windows -> {
                throw new IllegalArgumentException("degenerate sample");
            });

            StepVerifier.create(monitor.check("rf-1")).verifyComplete();

            assertThat(metrics.getDriftNoData().count()).isEqualTo(1.0);
            assertThat(metrics.getDriftChecks().count()).isZero();
        }

        @Test
        @DisplayName("should treat a non-finite score as no data")
        void nonFiniteScore() {
            DriftMonitor monitor = monitor(source(windows(5, 5)), fixedScore(Double.NaN));

            StepVerifier.create(monitor.check("rf-1")).verifyComplete();

            verify(historyStore, never()).append(any());
        }
    }

    @Test
    @DisplayName("should read history back from the store")
    void history() {
        DriftDetectionResult stored = DriftDetectionResult.builder()
                .checkId("c-1")
                .modelVersion("rf-1")
                .timestamp(NOW)
                .build();
        when(historyStore.history("rf-1", 5)).thenReturn(Flux.just(stored));

        StepVerifier.create(monitor(source(windows(5, 5)), fixedScore(0.0)).history("rf-1", 5))
                .expectNext(stored)
                .verifyComplete();
    }
}
