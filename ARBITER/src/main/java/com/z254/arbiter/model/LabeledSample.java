package com.z254.arbiter.model;

import com.z254.arbiter.domain.model.Decision;

/**
 * One training row: model-ready features plus the target decision.
 */
public record LabeledSample(double[] features, Decision label) {
}
