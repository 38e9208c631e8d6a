package com.vulnscan.backend.dto;

import com.vulnscan.backend.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event attributes matched against alert rule filters. Absent values never exclude a rule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertContext {

    private Severity severity;
    private Long targetId;
    private String category;
    private Integer count;

    public int effectiveCount() {
        return count == null ? 1 : count;
    }

    public static AlertContext forTarget(Long targetId) {
        return AlertContext.builder().targetId(targetId).build();
    }
}
