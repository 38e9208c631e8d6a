package com.vulnscan.backend.model;

public enum FindingStatus {
    OPEN,
    IN_PROGRESS,
    FIXED,
    ACCEPTED,
    FALSE_POSITIVE
}
