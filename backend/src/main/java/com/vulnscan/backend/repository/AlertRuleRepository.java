package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.AlertEventType;
import com.vulnscan.backend.model.AlertRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface AlertRuleRepository extends JpaRepository<AlertRule, Long> {

    List<AlertRule> findByOrganizationIdAndEventTypeAndActiveTrue(Long organizationId, AlertEventType eventType);

    @Transactional
    @Modifying
    @Query("UPDATE AlertRule r SET r.lastTriggeredAt = :now, r.triggerCount = r.triggerCount + 1 WHERE r.id = :id")
    int recordTrigger(@Param("id") Long id, @Param("now") Instant now);
}
