package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A/B test configuration with its observed routing counts.
 */
@Value
@Builder
public class ABTestReport {

    ABTest test;

    long requests;

    long championRequests;

    long candidateRequests;

    double observedCandidateShare;
}
