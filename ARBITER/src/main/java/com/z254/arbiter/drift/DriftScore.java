package com.z254.arbiter.drift;

import java.util.Map;

/**
 * Aggregate drift score plus the per-feature distances it was built from.
 */
public record DriftScore(double score, Map<String, Double> featureScores) {
}
