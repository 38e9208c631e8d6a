package com.vulnscan.backend.event;

import com.vulnscan.backend.model.Severity;
import com.vulnscan.backend.model.VulnCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a committed COMPLETED reconciliation, handed to the downstream fan-out.
 */
public record ScanCompletedEvent(
        Long scanId,
        Long targetId,
        Long organizationId,
        String targetValue,
        Long createdById,
        Map<Severity, Integer> severityCounts,
        int totalVulns,
        int totalAssets,
        int newAssets,
        List<FindingSnapshot> notableFindings,
        Instant completedAt
) {

    public int count(Severity severity) {
        Integer value = severityCounts == null ? null : severityCounts.get(severity);
        return value == null ? 0 : value;
    }

    public boolean hasCriticalOrHigh() {
        return count(Severity.CRITICAL) > 0 || count(Severity.HIGH) > 0;
    }

    public Severity highestSeverity() {
        for (Severity severity : Severity.values()) {
            if (count(severity) > 0) {
                return severity;
            }
        }
        return null;
    }

    public record FindingSnapshot(String title, Severity severity, VulnCategory category, String affectedUrl) {
    }
}
