package com.z254.arbiter.features;

/**
 * Context keys recognized by feature extraction. Anything else in the
 * request context is ignored.
 */
public enum ContextKey {
    INTENT_CLASS("intent_class"),
    INTENT_CONFIDENCE("intent_confidence"),
    TOXICITY_SCORE("toxicity_score"),
    USER_HISTORY_SCORE("user_history_score"),
    POLICY_MATCHES("policy_matches"),
    POLICY_DENIES("policy_denies"),
    POLICY_ALLOWS("policy_allows"),
    RISK_LEVEL("risk_level"),
    COMPLIANCE_FLAGS("compliance_flags"),
    SENSITIVITY_SCORE("sensitivity_score");

    private final String key;

    ContextKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
