package com.vulnscan.backend.service.notification;

import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.event.ScanProgressEvent;
import com.vulnscan.backend.event.ScanStatusChangedEvent;
import com.vulnscan.backend.model.Scan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes committed scan changes to the organization's live topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanEventBroadcaster {

    private final SimpMessagingTemplate messagingTemplate;
    private final VulnScanProperties properties;

    static String topic(Long organizationId) {
        return "/topic/orgs/" + organizationId + "/scans";
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onProgress(ScanProgressEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "scan:progress");
        payload.put("scanId", event.scanId());
        payload.put("progress", event.progress());
        payload.put("currentModule", event.currentModule());
        payload.put("message", event.message());
        payload.put("timestamp", event.occurredAt().toString());
        send(event.organizationId(), payload);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onStatusChanged(ScanStatusChangedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventName(event.status()));
        payload.put("scanId", event.scanId());
        payload.put("targetId", event.targetId());
        payload.put("status", event.status());
        payload.put("previousStatus", event.previousStatus());
        payload.put("progress", event.progress());
        if (event.errorMessage() != null) {
            payload.put("error", event.errorMessage());
        }
        payload.put("timestamp", event.occurredAt().toString());
        send(event.organizationId(), payload);
    }

    private String eventName(Scan.Status status) {
        return switch (status) {
            case COMPLETED -> "scan:completed";
            case FAILED -> "scan:failed";
            default -> "scan:status";
        };
    }

    private void send(Long organizationId, Map<String, Object> payload) {
        if (!properties.getNotifications().isRealtimeEnabled() || organizationId == null) {
            return;
        }
        try {
            messagingTemplate.convertAndSend(topic(organizationId), payload);
        } catch (Exception e) {
            log.warn("Realtime scan update failed org={} event={} error={}", organizationId, payload.get("event"), e.getMessage());
        }
    }
}
