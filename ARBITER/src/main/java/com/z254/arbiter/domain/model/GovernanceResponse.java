package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Decision produced once per request. Logged for feedback lookup.
 */
@Value
@Builder
@Jacksonized
public class GovernanceResponse {

    String requestId;

    Decision decision;

    /** Probability of the chosen class, in [0,1] */
    double confidence;

    String reasoning;

    String modelVersion;

    FeatureVector features;

    double processingTimeMs;

    Instant timestamp;

    /** Set when the request was routed through an A/B test */
    String abTestId;

    /** "champion" or "candidate" when {@link #abTestId} is set */
    String abArm;

    /** True when the conservative fallback decision was returned */
    boolean fallback;

    public boolean usedAbTest() {
        return abTestId != null;
    }
}
