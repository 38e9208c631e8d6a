package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.VulnFinding;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface VulnFindingRepository extends JpaRepository<VulnFinding, Long> {

    List<VulnFinding> findByScanId(Long scanId);

    long countByScanId(Long scanId);
}
