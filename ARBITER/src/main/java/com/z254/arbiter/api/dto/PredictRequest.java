package com.z254.arbiter.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for a governance decision.
 */
@Data
public class PredictRequest {

    /** Optional caller-supplied id; generated when absent */
    @Size(max = 128)
    private String requestId;

    @NotNull
    @Size(max = 100_000)
    private String content;

    private Map<String, Object> context = new HashMap<>();

    @Size(max = 128)
    private String userId;

    @Size(max = 128)
    private String sessionId;

    private boolean useAbTest;
}
