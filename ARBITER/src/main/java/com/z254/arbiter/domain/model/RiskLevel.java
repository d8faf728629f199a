package com.z254.arbiter.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordinal risk assessment supplied by the caller's context.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Ordinal encoding in [0,1]: LOW 0, MEDIUM 1/3, HIGH 2/3, CRITICAL 1.
     */
    public double normalized() {
        return ordinal() / (double) (values().length - 1);
    }

    public boolean isHighOrAbove() {
        return switch (this) {
            case HIGH, CRITICAL -> true;
            case LOW, MEDIUM -> false;
        };
    }

    public static Optional<RiskLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Map a numeric risk score in [0,1] onto the nearest level.
     */
    public static RiskLevel fromScore(double score) {
        double clipped = Math.max(0.0, Math.min(1.0, score));
        int index = (int) Math.round(clipped * (values().length - 1));
        return values()[index];
    }
}
