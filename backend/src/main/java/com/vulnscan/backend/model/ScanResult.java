package com.vulnscan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "scan_results")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scan_id", nullable = false, unique = true, updatable = false)
    private Long scanId;

    @Column(name = "result_data", columnDefinition = "TEXT", updatable = false)
    private String resultData;

    @Column(name = "assets_found", nullable = false, updatable = false)
    private int assetsFound;

    @Column(name = "vulns_found", nullable = false, updatable = false)
    private int vulnsFound;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
