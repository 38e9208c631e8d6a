package com.vulnscan.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanDiff {

    private Long currentScanId;
    private Long previousScanId;
    private Long targetId;
    private String targetValue;
    private boolean hasPrevious;
    private String message;
    private Summary summary;
    private List<DiffFinding> newFindings;
    private List<DiffFinding> fixedFindings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int currentTotal;
        private int previousTotal;
        private int newCount;
        private int fixedCount;
        private int unchanged;
    }
}
