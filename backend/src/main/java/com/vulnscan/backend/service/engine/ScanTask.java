package com.vulnscan.backend.service.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Task description published to the scanning engine, one per dispatch attempt.
 */
public record ScanTask(
        Long scanId,
        Long targetId,
        String targetValue,
        String targetType,
        String profile,
        List<String> modules,
        Long orgId
) {

    // The engine worker reads the target under this key.
    @JsonProperty("target")
    public String target() {
        return targetValue;
    }
}
