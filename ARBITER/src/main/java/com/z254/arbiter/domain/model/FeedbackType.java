package com.z254.arbiter.domain.model;

public enum FeedbackType {
    CORRECT,
    INCORRECT,
    ESCALATED,
    OVERRIDDEN
}
