package com.z254.arbiter.model;

import com.z254.arbiter.domain.model.Decision;

/**
 * Model that can be updated one labeled example at a time.
 */
public interface OnlineGovernanceModel extends GovernanceModel {

    /**
     * Incorporate one labeled example. Updates to the same learner are
     * applied one at a time; readers keep seeing the previous state until
     * the update is published.
     */
    void learnOne(double[] features, Decision label);

    /** Examples seen since creation, including warm-start samples */
    long samplesSeen();

    /** Updates applied through {@link #learnOne} */
    long updateCount();
}
