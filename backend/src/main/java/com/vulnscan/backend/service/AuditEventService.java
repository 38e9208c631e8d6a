package com.vulnscan.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.model.AuditEvent;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    public static final String ENTITY_SCAN = "scan";
    public static final String ENTITY_SCHEDULED_TASK = "scheduled_task";

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    public void recordScanTransition(Scan scan, Scan.Status from, Scan.Status to) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", from == null ? null : from.name());
        metadata.put("to", to.name());
        metadata.put("targetId", scan.getTargetId());
        if (scan.getErrorMessage() != null && to == Scan.Status.FAILED) {
            metadata.put("error", scan.getErrorMessage());
        }
        recordEvent(scan.getOrganizationId(), ENTITY_SCAN, scan.getId(), "SCAN_" + to.name(),
                "Scan " + scan.getId() + " " + (from == null ? "created" : from + " -> " + to), metadata);
    }

    public void recordEvent(Long organizationId, String entityType, Long entityId, String action,
                            String description, Object metadata) {
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            AuditEvent event = AuditEvent.builder()
                    .organizationId(organizationId)
                    .entityType(entityType)
                    .entityId(entityId)
                    .action(action)
                    .description(description)
                    .metadata(payload)
                    .correlationId(MDC.get("correlationId"))
                    .createdAt(Instant.now())
                    .build();
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event {}:{} - {}", entityType, action, e.getMessage());
        }
    }
}
