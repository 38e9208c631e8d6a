package com.vulnscan.backend.service.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One message from the engine results channel. The {@code status} field decides which of the other
 * fields are meaningful.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineResultMessage {

    public static final String STATUS_PROGRESS = "PROGRESS";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";

    private Long scanId;
    private String status;
    private Integer progress;
    private String currentModule;
    private String message;
    private List<EngineAsset> assets;
    private List<EngineFinding> findings;
    private Map<String, Object> summary;
    private String error;
}
