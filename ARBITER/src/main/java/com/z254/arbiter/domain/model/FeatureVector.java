package com.z254.arbiter.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Fixed-width, normalized feature record extracted from a governance request.
 * <p>
 * Every numeric field is already normalized into [0,1]. The categorical
 * {@link #intentClass} is carried for explanation only; models see it through
 * the one-hot pair {@link #intentIsHelpful}/{@link #intentIsHarmful}
 * (NEUTRAL = both zero), so {@link #toArray()} always has
 * {@value #DIMENSIONS} entries.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FeatureVector {

    public static final int DIMENSIONS = 18;

    /** Model column names, in {@link #toArray()} order. */
    public static final List<String> FEATURE_NAMES = List.of(
            "intent_confidence",
            "intent_is_helpful",
            "intent_is_harmful",
            "content_length",
            "content_has_urls",
            "content_has_email",
            "content_has_code",
            "content_toxicity_score",
            "user_history_score",
            "time_of_day",
            "day_of_week",
            "is_business_hours",
            "policy_match_count",
            "policy_deny_count",
            "policy_allow_count",
            "risk_level",
            "compliance_flags",
            "sensitivity_score");

    // Intent
    double intentConfidence;
    @Builder.Default
    IntentClass intentClass = IntentClass.NEUTRAL;
    boolean intentIsHelpful;
    boolean intentIsHarmful;

    // Content
    double contentLength;
    boolean contentHasUrls;
    boolean contentHasEmail;
    boolean contentHasCode;
    double contentToxicityScore;

    // Context
    double userHistoryScore;
    double timeOfDay;
    double dayOfWeek;
    boolean businessHours;

    // Policy
    double policyMatchCount;
    double policyDenyCount;
    double policyAllowCount;

    // Risk
    @Builder.Default
    RiskLevel riskLevel = RiskLevel.MEDIUM;
    double complianceFlags;
    double sensitivityScore;

    /**
     * Model-ready representation in {@link #FEATURE_NAMES} order.
     */
    public double[] toArray() {
        return new double[]{
                intentConfidence,
                flag(intentIsHelpful),
                flag(intentIsHarmful),
                contentLength,
                flag(contentHasUrls),
                flag(contentHasEmail),
                flag(contentHasCode),
                contentToxicityScore,
                userHistoryScore,
                timeOfDay,
                dayOfWeek,
                flag(businessHours),
                policyMatchCount,
                policyDenyCount,
                policyAllowCount,
                riskLevel.normalized(),
                complianceFlags,
                sensitivityScore
        };
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
