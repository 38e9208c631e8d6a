package com.vulnscan.backend.event;

public record ScanJobEnqueuedEvent(Long jobId, Long scanId) {
}
