package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.Target;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TargetRepository extends JpaRepository<Target, Long> {

    @Query("SELECT t FROM Target t WHERE t.active = true AND t.verificationStatus = :status " +
            "AND t.scanSchedule IS NOT NULL AND t.nextScanAt <= :now ORDER BY t.nextScanAt ASC")
    List<Target> findDueForScan(@Param("status") Target.VerificationStatus status, @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Target t WHERE t.id = :id")
    Optional<Target> findByIdForUpdate(@Param("id") Long id);

    Optional<Target> findByIdAndOrganizationId(Long id, Long organizationId);
}
