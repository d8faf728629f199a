package com.z254.arbiter.api.mapper;

import com.z254.arbiter.api.dto.FeedbackRequest;
import com.z254.arbiter.api.dto.PredictRequest;
import com.z254.arbiter.domain.model.FeedbackSubmission;
import com.z254.arbiter.domain.model.GovernanceRequest;

import java.util.Map;

/**
 * Maps API request DTOs to engine inputs.
 */
public final class GovernanceMapper {

    private GovernanceMapper() {
    }

    public static GovernanceRequest toGovernanceRequest(PredictRequest request) {
        return GovernanceRequest.builder()
                .requestId(request.getRequestId())
                .content(request.getContent())
                .context(request.getContext() != null ? request.getContext() : Map.of())
                .userId(request.getUserId())
                .sessionId(request.getSessionId())
                .build();
    }

    public static FeedbackSubmission toSubmission(FeedbackRequest request) {
        return FeedbackSubmission.builder()
                .requestId(request.getRequestId())
                .userId(request.getUserId())
                .feedbackType(request.getFeedbackType())
                .correctDecision(request.getCorrectDecision())
                .rationale(request.getRationale())
                .severity(request.getSeverity())
                .metadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
                .build();
    }
}
