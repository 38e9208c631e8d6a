package com.vulnscan.backend.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class SchedulerTickSummary {

    public enum Outcome {
        CREATED,
        QUOTA_EXHAUSTED,
        SCAN_IN_FLIGHT,
        NO_OWNER,
        NOT_DUE,
        FAILED
    }

    private final Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
    private final boolean skipped;

    private SchedulerTickSummary(boolean skipped) {
        this.skipped = skipped;
    }

    public static SchedulerTickSummary started() {
        return new SchedulerTickSummary(false);
    }

    public static SchedulerTickSummary overlapping() {
        return new SchedulerTickSummary(true);
    }

    public void record(Outcome outcome) {
        counts.merge(outcome, 1, Integer::sum);
    }

    public int count(Outcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isSkipped() {
        return skipped;
    }

    public Map<Outcome, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        return skipped ? "skipped (tick in progress)" : counts.toString();
    }
}
