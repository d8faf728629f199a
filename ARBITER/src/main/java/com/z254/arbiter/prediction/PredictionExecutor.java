package com.z254.arbiter.prediction;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.model.GovernanceModel;
import com.z254.arbiter.observability.ArbiterMetrics;
import com.z254.arbiter.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a model version against a feature vector under a bounded timeout.
 * <p>
 * Never throws: a missing handle, an exception, a timeout or a malformed
 * distribution all yield {@link PredictionOutcome#fallback}, and each is
 * counted by reason.
 */
@Slf4j
@Component
public class PredictionExecutor {

    static final String REASON_NO_VERSION = "no_version";
    static final String REASON_UNAVAILABLE = "unavailable";
    static final String REASON_ERROR = "error";
    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_REJECTED = "rejected";
    static final String REASON_INTERRUPTED = "interrupted";
    static final String REASON_MALFORMED = "malformed";

    private final ModelRegistry registry;
    private final ExecutorService inferencePool;
    private final Duration timeout;
    private final ArbiterMetrics metrics;

    @Autowired
    public PredictionExecutor(ModelRegistry registry,
                              @Qualifier("inferenceExecutor") ExecutorService inferencePool,
                              ArbiterProperties properties,
                              ArbiterMetrics metrics) {
        this(registry, inferencePool, properties.getPrediction().getInferenceTimeout(), metrics);
    }

    PredictionExecutor(ModelRegistry registry, ExecutorService inferencePool, Duration timeout, ArbiterMetrics metrics) {
        this.registry = registry;
        this.inferencePool = inferencePool;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    public PredictionOutcome predict(FeatureVector features, String versionId) {
        if (versionId == null) {
            return fallback(REASON_NO_VERSION, null, null);
        }
        Optional<GovernanceModel> model = registry.findArtifact(versionId);
        if (model.isEmpty()) {
            return fallback(REASON_UNAVAILABLE, versionId, null);
        }

        double[] input = features.toArray();
        Future<double[]> pending;
        try {
            pending = inferencePool.submit(() -> model.get().predictProba(input));
        } catch (RejectedExecutionException e) {
            return fallback(REASON_REJECTED, versionId, e);
        }

        double[] distribution;
        try {
            distribution = pending.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return fallback(REASON_TIMEOUT, versionId, null);
        } catch (ExecutionException e) {
            return fallback(REASON_ERROR, versionId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            return fallback(REASON_INTERRUPTED, versionId, null);
        }

        PredictionOutcome outcome = interpret(distribution);
        return outcome != null ? outcome : fallback(REASON_MALFORMED, versionId, null);
    }

    /**
     * Arg-max over a normalized distribution, or null when it is not a usable
     * probability vector.
     */
    static PredictionOutcome interpret(double[] distribution) {
        int classes = Decision.values().length;
        if (distribution == null || distribution.length != classes) {
            return null;
        }
        double sum = 0.0;
        for (double p : distribution) {
            if (!Double.isFinite(p) || p < 0.0) {
                return null;
            }
            sum += p;
        }
        if (sum <= 0.0) {
            return null;
        }

        Map<Decision, Double> probabilities = new EnumMap<>(Decision.class);
        int best = 0;
        for (int i = 0; i < classes; i++) {
            probabilities.put(Decision.fromIndex(i), distribution[i] / sum);
            if (distribution[i] > distribution[best]) {
                best = i;
            }
        }
        double confidence = Math.min(1.0, distribution[best] / sum);
        return new PredictionOutcome(Decision.fromIndex(best), confidence,
                Collections.unmodifiableMap(probabilities), null);
    }

    private PredictionOutcome fallback(String reason, String versionId, Throwable cause) {
        metrics.recordFallback(reason);
        if (cause != null) {
            log.warn("Falling back to MONITOR for {} ({}): {}", versionId, reason, cause.getMessage());
        } else {
            log.warn("Falling back to MONITOR for {} ({})", versionId, reason);
        }
        return PredictionOutcome.fallback(reason);
    }
}
