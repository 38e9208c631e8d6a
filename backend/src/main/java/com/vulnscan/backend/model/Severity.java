package com.vulnscan.backend.model;

import java.util.Locale;

public enum Severity {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    INFO(0);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAlertWorthy() {
        return this == CRITICAL || this == HIGH;
    }

    /**
     * Lenient parse for engine input; null when the value is not a known severity.
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("INFORMATIONAL".equals(normalized)) {
            return INFO;
        }
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return null;
    }
}
