package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.ScanJob;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface ScanJobRepository extends JpaRepository<ScanJob, Long> {

    List<ScanJob> findTop50ByResolvedFalseAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(Instant now);

    List<ScanJob> findByScanId(Long scanId);

    boolean existsByScanIdAndResolvedFalse(Long scanId);
}
