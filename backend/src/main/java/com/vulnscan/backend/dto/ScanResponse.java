package com.vulnscan.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResponse {

    private Long id;
    private Long targetId;
    private String type;
    private String profile;
    private List<String> modules;
    private String status;
    private int progress;
    private String currentModule;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationSeconds;
    private String errorMessage;
    private int totalAssets;
    private int newAssets;
    private int totalVulns;
    private int criticalCount;
    private int highCount;
    private int mediumCount;
    private int lowCount;
    private int infoCount;
}
