package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Reviewer feedback on a previously issued decision.
 */
@Value
@Builder
public class FeedbackSubmission {

    String requestId;

    String userId;

    FeedbackType feedbackType;

    /** Decision the reviewer says should have been made, if any */
    Decision correctDecision;

    String rationale;

    String severity;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    public Optional<Decision> correctDecisionOpt() {
        return Optional.ofNullable(correctDecision);
    }
}
