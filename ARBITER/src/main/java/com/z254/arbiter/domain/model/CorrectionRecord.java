package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Long-term record of a corrected label, kept for batch retraining.
 */
@Value
@Builder
public class CorrectionRecord {

    String correctionId;

    String requestId;

    String modelVersion;

    String learnerVersion;

    Decision originalDecision;

    Decision correctedDecision;

    FeatureVector features;

    FeedbackType feedbackType;

    String userId;

    boolean learnerUpdated;

    Instant createdAt;
}
