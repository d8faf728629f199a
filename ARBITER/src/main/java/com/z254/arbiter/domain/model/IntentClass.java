package com.z254.arbiter.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum IntentClass {
    HELPFUL,
    HARMFUL,
    NEUTRAL;

    public static Optional<IntentClass> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
