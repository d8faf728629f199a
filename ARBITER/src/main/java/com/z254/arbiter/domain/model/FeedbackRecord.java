package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Stored form of a feedback submission, joined with the decision it refers to.
 */
@Value
@Builder
@Jacksonized
public class FeedbackRecord {

    String requestId;

    String userId;

    FeedbackType feedbackType;

    Decision originalDecision;

    Decision correctDecision;

    String modelVersion;

    String rationale;

    String severity;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    Instant receivedAt;

    public static FeedbackRecord of(FeedbackSubmission feedback, PredictionRecord prediction, Instant receivedAt) {
        return FeedbackRecord.builder()
                .requestId(feedback.getRequestId())
                .userId(feedback.getUserId())
                .feedbackType(feedback.getFeedbackType())
                .originalDecision(prediction.getDecision())
                .correctDecision(feedback.getCorrectDecision())
                .modelVersion(prediction.getModelVersion())
                .rationale(feedback.getRationale())
                .severity(feedback.getSeverity())
                .metadata(feedback.getMetadata() != null ? feedback.getMetadata() : Map.of())
                .receivedAt(receivedAt)
                .build();
    }
}
