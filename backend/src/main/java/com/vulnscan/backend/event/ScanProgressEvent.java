package com.vulnscan.backend.event;

import java.time.Instant;

public record ScanProgressEvent(
        Long scanId,
        Long organizationId,
        int progress,
        String currentModule,
        String message,
        Instant occurredAt
) {
}
