package com.partsbin.core.model;

import java.util.Locale;

public enum Priority {
    ESSENTIAL,
    OPTIONAL;

    public static Priority fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPTIONAL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "essential", "high", "core" -> ESSENTIAL;
            default -> OPTIONAL;
        };
    }

    /**
     * Higher rank sorts first when priority breaks ties.
     */
    public int rank() {
        return this == ESSENTIAL ? 1 : 0;
    }
}
