package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Content submitted for a governance decision. Read-only inside the engine.
 */
@Value
@Builder
public class GovernanceRequest {

    String requestId;

    String content;

    /** Free-form caller context; parsed through {@code GovernanceContext} */
    @Builder.Default
    Map<String, Object> context = Map.of();

    String userId;

    String sessionId;

    Instant timestamp;
}
