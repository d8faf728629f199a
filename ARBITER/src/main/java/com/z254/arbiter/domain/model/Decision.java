package com.z254.arbiter.domain.model;

import java.util.List;

/**
 * Governance outcome for a piece of content.
 * <p>
 * The declaration order is the class index used by every model handle, so it
 * must not be reordered once models have been persisted.
 */
public enum Decision {
    ALLOW,
    DENY,
    ESCALATE,
    MONITOR;

    /** Class labels in model index order. */
    public static final List<String> LABELS = List.of("ALLOW", "DENY", "ESCALATE", "MONITOR");

    public int index() {
        return ordinal();
    }

    public static Decision fromIndex(int index) {
        Decision[] values = values();
        if (index < 0 || index >= values.length) {
            throw new IllegalArgumentException("No decision for class index " + index);
        }
        return values[index];
    }

    /**
     * Title-cased label used in reasoning text, e.g. {@code "Deny"}.
     */
    public String displayName() {
        return switch (this) {
            case ALLOW -> "Allow";
            case DENY -> "Deny";
            case ESCALATE -> "Escalate";
            case MONITOR -> "Monitor";
        };
    }
}
