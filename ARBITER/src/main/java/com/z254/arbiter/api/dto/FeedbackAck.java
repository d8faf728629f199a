package com.z254.arbiter.api.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Response DTO for a feedback submission.
 */
@Data
@Builder
public class FeedbackAck {
    private String requestId;
    private boolean accepted;
    private String message;
}
