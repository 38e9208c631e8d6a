package com.vulnscan.backend.service.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineFinding {
    private String title;
    private String severity;
    private String category;
    private String description;
    private String solution;
    private String cveId;
    private Double cvssScore;
    private String affectedComponent;
    private String affectedUrl;
    private String evidence;
    private List<String> references;

    /**
     * The URL or component the finding applies to; newer engines send {@code affectedUrl}.
     */
    public String resolveAffectedUrl() {
        if (affectedUrl != null && !affectedUrl.isBlank()) {
            return affectedUrl;
        }
        return affectedComponent == null || affectedComponent.isBlank() ? null : affectedComponent;
    }
}
