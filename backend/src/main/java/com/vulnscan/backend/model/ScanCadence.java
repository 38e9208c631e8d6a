package com.vulnscan.backend.model;

import java.time.Duration;
import java.util.Locale;

public enum ScanCadence {
    DAILY(Duration.ofHours(24)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration interval;

    ScanCadence(Duration interval) {
        this.interval = interval;
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Parses a stored cadence. Blank and "none" mean no schedule and return null.
     */
    public static ScanCadence fromValue(String value) {
        if (value == null || value.isBlank() || "none".equalsIgnoreCase(value.trim())) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
