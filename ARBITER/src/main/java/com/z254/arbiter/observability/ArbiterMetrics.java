package com.z254.arbiter.observability;

import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeedbackType;
import com.z254.arbiter.domain.model.ModelType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for ARBITER service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Predictions (latency, decisions, fallbacks)</li>
 *     <li>Feedback and online learner updates</li>
 *     <li>Best-effort store writes</li>
 *     <li>Drift checks</li>
 * </ul>
 * Per-version counters are also kept as plain atomics so the engine can
 * report them without querying the meter registry.
 */
@Component
public class ArbiterMetrics {

    private final MeterRegistry meterRegistry;

    // Prediction metrics
    @Getter
    private final Counter predictionsTotal;
    @Getter
    private final Counter abRoutedPredictions;
    private final Timer predictionLatency;
    private final DistributionSummary predictionConfidence;
    private final Map<Decision, Counter> predictionsByDecision = new EnumMap<>(Decision.class);
    private final Map<String, Counter> fallbacksByReason = new ConcurrentHashMap<>();
    private final AtomicLong fallbacks = new AtomicLong();

    // Feedback metrics
    private final Map<FeedbackType, Counter> feedbackByType = new EnumMap<>(FeedbackType.class);
    @Getter
    private final Counter feedbackUnknownTarget;
    @Getter
    private final Counter onlineUpdates;
    @Getter
    private final Counter onlineUpdateFailures;
    @Getter
    private final Counter correctionsRecorded;

    // Store metrics
    private final Map<String, Counter> storeWriteFailures = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> storeWriteFailureCounts = new ConcurrentHashMap<>();

    // Drift metrics
    @Getter
    private final Counter driftChecks;
    @Getter
    private final Counter driftDetected;
    @Getter
    private final Counter driftNoData;
    private final DistributionSummary driftScore;

    // Registry metrics
    private final Map<ModelType, Counter> promotionsByType = new EnumMap<>(ModelType.class);

    // Per-version tallies for reporting
    private final Map<String, VersionStats> versionStats = new ConcurrentHashMap<>();

    public ArbiterMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.predictionsTotal = Counter.builder("arbiter.predictions.total")
                .description("Total governance predictions served")
                .register(meterRegistry);
        this.abRoutedPredictions = Counter.builder("arbiter.predictions.ab_routed")
                .description("Predictions routed through an A/B test")
                .register(meterRegistry);
        this.predictionLatency = Timer.builder("arbiter.prediction.latency")
                .description("End-to-end prediction latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.predictionConfidence = DistributionSummary.builder("arbiter.prediction.confidence")
                .description("Confidence of returned decisions")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        for (Decision decision : Decision.values()) {
            predictionsByDecision.put(decision, Counter.builder("arbiter.predictions.decision")
                    .description("Predictions by decision")
                    .tag("decision", decision.name())
                    .register(meterRegistry));
        }

        for (FeedbackType type : FeedbackType.values()) {
            feedbackByType.put(type, Counter.builder("arbiter.feedback.received")
                    .description("Feedback submissions by type")
                    .tag("type", type.name())
                    .register(meterRegistry));
        }
        this.feedbackUnknownTarget = Counter.builder("arbiter.feedback.unknown_target")
                .description("Feedback referencing a request id that is not logged")
                .register(meterRegistry);
        this.onlineUpdates = Counter.builder("arbiter.online.updates")
                .description("Online learner updates applied")
                .register(meterRegistry);
        this.onlineUpdateFailures = Counter.builder("arbiter.online.update_failures")
                .description("Online learner updates that failed")
                .register(meterRegistry);
        this.correctionsRecorded = Counter.builder("arbiter.feedback.corrections")
                .description("Correction records written to the long-term store")
                .register(meterRegistry);

        this.driftChecks = Counter.builder("arbiter.drift.checks")
                .description("Drift checks with enough data to run")
                .register(meterRegistry);
        this.driftDetected = Counter.builder("arbiter.drift.detected")
                .description("Drift checks that detected drift")
                .register(meterRegistry);
        this.driftNoData = Counter.builder("arbiter.drift.no_data")
                .description("Drift checks skipped for lack of data")
                .register(meterRegistry);
        this.driftScore = DistributionSummary.builder("arbiter.drift.score")
                .description("Computed drift scores")
                .register(meterRegistry);

        for (ModelType type : ModelType.values()) {
            promotionsByType.put(type, Counter.builder("arbiter.registry.promotions")
                    .description("Model versions promoted to ACTIVE")
                    .tag("type", type.name())
                    .register(meterRegistry));
        }
    }

    // ========== Prediction Methods ==========

    public Timer.Sample startPredictionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordPrediction(Timer.Sample sample, Decision decision, double confidence,
                                 String modelVersion, boolean abRouted) {
        sample.stop(predictionLatency);
        predictionsTotal.increment();
        predictionsByDecision.get(decision).increment();
        predictionConfidence.record(confidence);
        if (abRouted) {
            abRoutedPredictions.increment();
        }
        if (modelVersion != null) {
            stats(modelVersion).predictions.incrementAndGet();
        }
    }

    public void recordFallback(String reason) {
        fallbacks.incrementAndGet();
        fallbacksByReason.computeIfAbsent(reason, r -> Counter.builder("arbiter.prediction.fallbacks")
                        .description("Conservative fallback decisions by reason")
                        .tag("reason", r)
                        .register(meterRegistry))
                .increment();
    }

    public long fallbackCount() {
        return fallbacks.get();
    }

    // ========== Feedback Methods ==========

    public void recordFeedback(FeedbackType type, String modelVersion) {
        feedbackByType.get(type).increment();
        if (modelVersion == null) {
            return;
        }
        VersionStats stats = stats(modelVersion);
        stats.feedback.incrementAndGet();
        switch (type) {
            case CORRECT -> stats.feedbackCorrect.incrementAndGet();
            case INCORRECT -> stats.feedbackIncorrect.incrementAndGet();
            case ESCALATED, OVERRIDDEN -> {
                // not counted toward feedback accuracy
            }
        }
    }

    public double feedbackTypeCount(FeedbackType type) {
        return feedbackByType.get(type).count();
    }

    public void recordOnlineUpdate(boolean success) {
        if (success) {
            onlineUpdates.increment();
        } else {
            onlineUpdateFailures.increment();
        }
    }

    // ========== Store Methods ==========

    public void recordStoreWriteFailure(String store) {
        storeWriteFailureCounts.computeIfAbsent(store, s -> new AtomicLong()).incrementAndGet();
        storeWriteFailures.computeIfAbsent(store, s -> Counter.builder("arbiter.store.write.failures")
                        .description("Best-effort store writes that failed")
                        .tag("store", s)
                        .register(meterRegistry))
                .increment();
    }

    public long storeWriteFailures(String store) {
        AtomicLong count = storeWriteFailureCounts.get(store);
        return count != null ? count.get() : 0L;
    }

    // ========== Drift Methods ==========

    public void recordDriftCheck(double score, boolean detected) {
        driftChecks.increment();
        driftScore.record(score);
        if (detected) {
            driftDetected.increment();
        }
    }

    public void recordDriftNoData() {
        driftNoData.increment();
    }

    // ========== Registry Methods ==========

    public void recordPromotion(ModelType type) {
        promotionsByType.get(type).increment();
    }

    // ========== Reporting ==========

    public long predictionCount(String modelVersion) {
        VersionStats stats = versionStats.get(modelVersion);
        return stats != null ? stats.predictions.get() : 0L;
    }

    public long feedbackCount(String modelVersion) {
        VersionStats stats = versionStats.get(modelVersion);
        return stats != null ? stats.feedback.get() : 0L;
    }

    /**
     * Share of CORRECT among CORRECT + INCORRECT feedback for a version.
     */
    public OptionalDouble feedbackAccuracy(String modelVersion) {
        VersionStats stats = versionStats.get(modelVersion);
        if (stats == null) {
            return OptionalDouble.empty();
        }
        long correct = stats.feedbackCorrect.get();
        long judged = correct + stats.feedbackIncorrect.get();
        return judged == 0 ? OptionalDouble.empty() : OptionalDouble.of(correct / (double) judged);
    }

    public long totalPredictions() {
        return (long) predictionsTotal.count();
    }

    public Duration meanPredictionLatency() {
        return Duration.ofNanos((long) predictionLatency.mean(TimeUnit.NANOSECONDS));
    }

    private VersionStats stats(String modelVersion) {
        return versionStats.computeIfAbsent(modelVersion, v -> new VersionStats());
    }

    private static final class VersionStats {
        private final AtomicLong predictions = new AtomicLong();
        private final AtomicLong feedback = new AtomicLong();
        private final AtomicLong feedbackCorrect = new AtomicLong();
        private final AtomicLong feedbackIncorrect = new AtomicLong();
    }
}
