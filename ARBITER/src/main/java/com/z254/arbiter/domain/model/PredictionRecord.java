package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Prediction log entry keyed by request id. Appended once, never mutated.
 */
@Value
@Builder
@Jacksonized
public class PredictionRecord {

    String requestId;

    Decision decision;

    double confidence;

    String modelVersion;

    FeatureVector features;

    boolean abTest;

    String abTestId;

    String userId;

    Instant timestamp;

    public static PredictionRecord from(GovernanceResponse response, String userId) {
        return PredictionRecord.builder()
                .requestId(response.getRequestId())
                .decision(response.getDecision())
                .confidence(response.getConfidence())
                .modelVersion(response.getModelVersion())
                .features(response.getFeatures())
                .abTest(response.usedAbTest())
                .abTestId(response.getAbTestId())
                .userId(userId)
                .timestamp(response.getTimestamp())
                .build();
    }
}
