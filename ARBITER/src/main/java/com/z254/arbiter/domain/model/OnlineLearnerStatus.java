package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Activity of one registered online learner.
 */
@Value
@Builder
public class OnlineLearnerStatus {

    String versionId;

    ModelStatus status;

    /** True when the learner is the active ONLINE_LEARNER version */
    boolean active;

    /** False when the artifact is not loaded */
    boolean loaded;

    long samplesSeen;

    long updateCount;
}
