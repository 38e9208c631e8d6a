package com.vulnscan.backend.model;

public enum AlertEventType {
    NEW_VULNERABILITY,
    SCAN_COMPLETED,
    SCAN_FAILED,
    CERT_EXPIRING,
    NEW_ASSET_DISCOVERED,
    SEVERITY_THRESHOLD
}
