package com.z254.arbiter.domain.model;

/**
 * Model version lifecycle: TRAINING → {ACTIVE | CANDIDATE | FAILED} → RETIRED.
 */
public enum ModelStatus {
    TRAINING,
    ACTIVE,
    CANDIDATE,
    FAILED,
    RETIRED;

    public boolean canTransitionTo(ModelStatus target) {
        return switch (this) {
            case TRAINING -> target == ACTIVE || target == CANDIDATE || target == FAILED;
            case CANDIDATE -> target == ACTIVE || target == RETIRED || target == FAILED;
            case ACTIVE -> target == RETIRED;
            case RETIRED -> target == ACTIVE;
            case FAILED -> false;
        };
    }
}
