package com.vulnscan.backend.event;

import com.vulnscan.backend.model.Scan;

import java.time.Instant;

public record ScanStatusChangedEvent(
        Long scanId,
        Long targetId,
        Long organizationId,
        Scan.Status previousStatus,
        Scan.Status status,
        int progress,
        String errorMessage,
        Instant occurredAt
) {
}
