package com.z254.arbiter.domain.model;

public enum ABTestStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED,
    /** Replaced by a new test after a traffic split change */
    SUPERSEDED
}
