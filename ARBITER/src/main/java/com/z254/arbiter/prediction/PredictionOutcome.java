package com.z254.arbiter.prediction;

import com.z254.arbiter.domain.model.Decision;

import java.util.Map;

/**
 * Result of one model invocation. A fallback outcome is always
 * {@code (MONITOR, 0.5, {})}.
 */
public record PredictionOutcome(Decision decision,
                                double confidence,
                                Map<Decision, Double> probabilities,
                                String fallbackReason) {

    public static final double FALLBACK_CONFIDENCE = 0.5;

    public static PredictionOutcome fallback(String reason) {
        return new PredictionOutcome(Decision.MONITOR, FALLBACK_CONFIDENCE, Map.of(), reason);
    }

    public boolean isFallback() {
        return fallbackReason != null;
    }
}
