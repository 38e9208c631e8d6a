package com.vulnscan.backend.event;

import java.time.Instant;

public record ScanFailedEvent(
        Long scanId,
        Long targetId,
        Long organizationId,
        String targetValue,
        Long createdById,
        String errorMessage,
        Instant failedAt
) {
}
