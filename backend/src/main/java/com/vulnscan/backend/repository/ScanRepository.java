package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.Scan;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ScanRepository extends JpaRepository<Scan, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Scan s WHERE s.id = :id")
    Optional<Scan> findByIdForUpdate(@Param("id") Long id);

    Optional<Scan> findFirstByTargetIdAndStatusIn(Long targetId, Collection<Scan.Status> statuses);

    long countByTargetIdAndStatusIn(Long targetId, Collection<Scan.Status> statuses);

    Optional<Scan> findFirstByTargetIdAndStatusAndCompletedAtBeforeAndIdNotOrderByCompletedAtDesc(
            Long targetId, Scan.Status status, Instant completedAt, Long excludedId);

    List<Scan> findByStatusAndCreatedAtBefore(Scan.Status status, Instant createdAt);

    List<Scan> findByStatusAndStartedAtBefore(Scan.Status status, Instant startedAt);
}
