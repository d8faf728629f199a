package com.z254.arbiter.api.dto;

import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeedbackType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for reviewer feedback on an issued decision.
 */
@Data
public class FeedbackRequest {

    @NotBlank
    private String requestId;

    private String userId;

    @NotNull
    private FeedbackType feedbackType;

    private Decision correctDecision;

    @Size(max = 4000)
    private String rationale;

    private String severity;

    private Map<String, String> metadata = new HashMap<>();
}
