package com.vulnscan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "vuln_findings", indexes = {
        @Index(name = "idx_vuln_findings_scan", columnList = "scan_id"),
        @Index(name = "idx_vuln_findings_target", columnList = "target_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VulnFinding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scan_id", nullable = false)
    private Long scanId;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @Column(name = "asset_id")
    private Long assetId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(name = "cvss_score")
    private Double cvssScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private VulnCategory category;

    @Column(name = "cve_id", columnDefinition = "TEXT")
    private String cveId;

    @Column(name = "affected_url", length = 2000)
    private String affectedUrl;

    @Column(columnDefinition = "TEXT")
    private String evidence;

    @Column(columnDefinition = "TEXT")
    private String remediation;

    @Convert(converter = StringListConverter.class)
    @Column(name = "reference_links", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> references = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private FindingStatus status = FindingStatus.OPEN;

    @Column(name = "first_found_at", nullable = false)
    private Instant firstFoundAt;

    @Column(name = "last_found_at", nullable = false)
    private Instant lastFoundAt;
}
