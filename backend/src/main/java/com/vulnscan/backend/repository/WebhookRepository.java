package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.Webhook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface WebhookRepository extends JpaRepository<Webhook, Long> {

    List<Webhook> findByOrganizationIdAndActiveTrue(Long organizationId);

    long countByOrganizationId(Long organizationId);

    @Transactional
    @Modifying
    @Query("UPDATE Webhook w SET w.lastTriggeredAt = :triggeredAt, w.lastError = :lastError WHERE w.id = :id")
    int recordDelivery(@Param("id") Long id,
                       @Param("triggeredAt") Instant triggeredAt,
                       @Param("lastError") String lastError);
}
