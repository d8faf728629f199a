package com.z254.arbiter.features;

import com.z254.arbiter.domain.model.IntentClass;
import com.z254.arbiter.domain.model.RiskLevel;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Typed view over the free-form request context.
 * <p>
 * Values are coerced leniently: numbers may arrive as numbers or numeric
 * strings, counts as integers, lists or comma-separated strings. A value that
 * cannot be coerced is treated as absent so the caller's default applies.
 */
public final class GovernanceContext {

    private final Map<String, Object> raw;

    private GovernanceContext(Map<String, Object> raw) {
        this.raw = raw;
    }

    public static GovernanceContext of(Map<String, Object> context) {
        return new GovernanceContext(context != null ? context : Map.of());
    }

    public Optional<IntentClass> intentClass() {
        return string(ContextKey.INTENT_CLASS).flatMap(IntentClass::parse);
    }

    public OptionalDouble intentConfidence() {
        return unitScore(ContextKey.INTENT_CONFIDENCE);
    }

    public OptionalDouble toxicityScore() {
        return unitScore(ContextKey.TOXICITY_SCORE);
    }

    public double userHistoryScore() {
        return unitScore(ContextKey.USER_HISTORY_SCORE).orElse(0.5);
    }

    public int policyMatches() {
        return count(ContextKey.POLICY_MATCHES);
    }

    public int policyDenies() {
        return count(ContextKey.POLICY_DENIES);
    }

    public int policyAllows() {
        return count(ContextKey.POLICY_ALLOWS);
    }

    /**
     * Risk level from a level name, or from a numeric score in [0,1].
     */
    public RiskLevel riskLevel() {
        Object value = raw.get(ContextKey.RISK_LEVEL.key());
        if (value instanceof Number) {
            return RiskLevel.fromScore(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            String text = (String) value;
            Optional<RiskLevel> parsed = RiskLevel.parse(text);
            if (parsed.isPresent()) {
                return parsed.get();
            }
            OptionalDouble score = parseDouble(text);
            if (score.isPresent()) {
                return RiskLevel.fromScore(score.getAsDouble());
            }
        }
        return RiskLevel.MEDIUM;
    }

    public int complianceFlags() {
        return count(ContextKey.COMPLIANCE_FLAGS);
    }

    public double sensitivityScore() {
        return unitScore(ContextKey.SENSITIVITY_SCORE).orElse(0.0);
    }

    private Optional<String> string(ContextKey key) {
        Object value = raw.get(key.key());
        return value instanceof String ? Optional.of((String) value) : Optional.empty();
    }

    private OptionalDouble unitScore(ContextKey key) {
        Object value = raw.get(key.key());
        OptionalDouble parsed;
        if (value instanceof Number) {
            parsed = OptionalDouble.of(((Number) value).doubleValue());
        } else if (value instanceof String) {
            parsed = parseDouble((String) value);
        } else {
            parsed = OptionalDouble.empty();
        }
        if (parsed.isEmpty() || Double.isNaN(parsed.getAsDouble())) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(clip(parsed.getAsDouble()));
    }

    /**
     * Counts accept an integer, a collection (its size) or a comma-separated string.
     */
    private int count(ContextKey key) {
        Object value = raw.get(key.key());
        if (value instanceof Number) {
            return Math.max(0, ((Number) value).intValue());
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Object[]) {
            return ((Object[]) value).length;
        }
        if (value instanceof String) {
            String text = (String) value;
            if (text.isBlank()) {
                return 0;
            }
            OptionalDouble numeric = parseDouble(text);
            if (numeric.isPresent()) {
                return Math.max(0, (int) numeric.getAsDouble());
            }
            return (int) Arrays.stream(text.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .count();
        }
        return 0;
    }

    private static OptionalDouble parseDouble(String text) {
        try {
            return OptionalDouble.of(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
