package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.ScanResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ScanResultRepository extends JpaRepository<ScanResult, Long> {

    Optional<ScanResult> findByScanId(Long scanId);

    boolean existsByScanId(Long scanId);
}
