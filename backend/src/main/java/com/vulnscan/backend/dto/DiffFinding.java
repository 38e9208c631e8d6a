package com.vulnscan.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffFinding {
    private Long id;
    private String title;
    private String severity;
    private String category;
    private String affectedUrl;
    private String fingerprint;
}
