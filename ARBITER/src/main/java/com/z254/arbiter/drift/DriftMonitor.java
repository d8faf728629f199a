package com.z254.arbiter.drift;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.observability.ArbiterMetrics;
import com.z254.arbiter.observability.ArbiterStructuredLogger;
import com.z254.arbiter.observability.ArbiterStructuredLogger.DriftEventType;
import com.z254.arbiter.registry.ModelRegistry;
import com.z254.arbiter.store.BestEffortWriter;
import com.z254.arbiter.store.DriftAlertPublisher;
import com.z254.arbiter.store.DriftHistoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Compares recent feature distributions against a reference window.
 * <p>
 * An empty result means "no data": the source had nothing, a window was
 * below the minimum size, or the computation failed. That is distinct from
 * a result with {@code driftDetected=false}.
 */
@Slf4j
@Component
public class DriftMonitor {

    private static final int MIN_WINDOW_ROWS = 2;

    private final DriftDataSource dataSource;
    private final DriftScoreCalculator calculator;
    private final ModelRegistry registry;
    private final DriftHistoryStore historyStore;
    private final DriftAlertPublisher alertPublisher;
    private final BestEffortWriter writer;
    private final ArbiterMetrics metrics;
    private final ArbiterStructuredLogger structuredLogger;
    private final Clock clock;
    private final double threshold;
    private final int minSamples;
    private final boolean scheduledCheckEnabled;

    @Autowired
    public DriftMonitor(DriftDataSource dataSource,
                        DriftScoreCalculator calculator,
                        ModelRegistry registry,
                        DriftHistoryStore historyStore,
                        DriftAlertPublisher alertPublisher,
                        BestEffortWriter writer,
                        ArbiterMetrics metrics,
                        ArbiterStructuredLogger structuredLogger,
                        Clock clock,
                        ArbiterProperties properties) {
        this.dataSource = dataSource;
        this.calculator = calculator;
        this.registry = registry;
        this.historyStore = historyStore;
        this.alertPublisher = alertPublisher;
        this.writer = writer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        ArbiterProperties.Drift drift = properties.getDrift();
        this.threshold = drift.getThreshold();
        this.minSamples = Math.max(MIN_WINDOW_ROWS, drift.getMinSamples());
        this.scheduledCheckEnabled = drift.isScheduledCheckEnabled();
    }

    /**
     * Run a drift check for {@code modelVersion}, or for the active random
     * forest when null.
     */
    public Mono<DriftDetectionResult> check(String modelVersion) {
        String version = modelVersion != null
                ? modelVersion
                : registry.getActive(ModelType.RANDOM_FOREST).orElse(null);
        Instant now = clock.instant();

        return dataSource.windows(version, now)
                .filter(windows -> windows.referenceSize() >= minSamples && windows.currentSize() >= minSamples)
                .flatMap(windows -> Mono.fromCallable(() -> evaluate(version, windows, now))
                        .subscribeOn(Schedulers.boundedElastic()))
                .onErrorResume(error -> {
                    structuredLogger.logDriftEvent(version, DriftEventType.CHECK_FAILED,
                            "Drift computation failed, reporting no data",
                            Map.of("error", String.valueOf(error.getMessage())));
                    return Mono.empty();
                })
                .doOnNext(this::record)
                .switchIfEmpty(Mono.defer(() -> {
                    metrics.recordDriftNoData();
                    structuredLogger.logDriftEvent(version, DriftEventType.NO_DATA,
                            "Not enough data for drift check", Map.of("minSamples", minSamples));
                    return Mono.empty();
                }));
    }

    public Flux<DriftDetectionResult> history(String modelVersion, int limit) {
        return historyStore.history(modelVersion, limit);
    }

    @Scheduled(initialDelayString = "${arbiter.drift.check-interval:PT1H}",
            fixedDelayString = "${arbiter.drift.check-interval:PT1H}")
    public void scheduledCheck() {
        if (!scheduledCheckEnabled) {
            return;
        }
        check(null).subscribe(
                result -> log.debug("Scheduled drift check finished: detected={}", result.isDriftDetected()),
                error -> log.warn("Scheduled drift check failed: {}", error.getMessage()));
    }

    /**
     * Score a pair of windows. Exposed for callers that already hold the data.
     */
    DriftDetectionResult evaluate(String version, DriftWindows windows, Instant now) {
        DriftScore score = calculator.score(windows);
        if (!Double.isFinite(score.score())) {
            throw new IllegalStateException("Non-finite drift score " + score.score());
        }
        List<String> affected = score.featureScores().entrySet().stream()
                .filter(e -> e.getValue() > threshold)
                .map(Map.Entry::getKey)
                .toList();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("referenceSamples", windows.referenceSize());
        details.put("currentSamples", windows.currentSize());
        details.put("statistic", "kolmogorov-smirnov");
        details.put("featureScores", score.featureScores());

        return DriftDetectionResult.builder()
                .checkId(UUID.randomUUID().toString())
                .modelVersion(version)
                .driftDetected(score.score() > threshold)
                .driftScore(score.score())
                .threshold(threshold)
                .affectedFeatures(affected)
                .timestamp(now)
                .details(details)
                .build();
    }

    private void record(DriftDetectionResult result) {
        metrics.recordDriftCheck(result.getDriftScore(), result.isDriftDetected());
        Map<String, Object> details = Map.of(
                "driftScore", result.getDriftScore(),
                "threshold", result.getThreshold(),
                "affectedFeatures", result.getAffectedFeatures());
        if (result.isDriftDetected()) {
            structuredLogger.logDriftEvent(result.getModelVersion(), DriftEventType.DRIFT_DETECTED,
                    "Feature drift detected", details);
            writer.submit(BestEffortWriter.DRIFT_ALERTS, result.getCheckId(), () -> alertPublisher.publish(result));
        } else {
            structuredLogger.logDriftEvent(result.getModelVersion(), DriftEventType.NO_DRIFT,
                    "No feature drift", details);
        }
        writer.submit(BestEffortWriter.DRIFT_HISTORY, result.getCheckId(), () -> historyStore.append(result));
    }
}
