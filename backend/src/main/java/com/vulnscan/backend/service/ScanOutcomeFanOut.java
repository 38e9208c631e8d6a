package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.AlertContext;
import com.vulnscan.backend.event.ScanCompletedEvent;
import com.vulnscan.backend.event.ScanFailedEvent;
import com.vulnscan.backend.model.AlertEventType;
import com.vulnscan.backend.model.Notification;
import com.vulnscan.backend.model.Severity;
import com.vulnscan.backend.service.notification.NotificationDispatcher;
import com.vulnscan.backend.service.notification.NotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Consequences of a committed terminal result: member notifications, alert rules and webhooks.
 * Every step is isolated; a failure in one never suppresses the next.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanOutcomeFanOut {

    private final NotificationDispatcher notificationDispatcher;
    private final AlertRuleEvaluator alertRuleEvaluator;
    private final WebhookDispatcher webhookDispatcher;

    public void onScanCompleted(ScanCompletedEvent event) {
        if (event.hasCriticalOrHigh()) {
            guard("vulnerability notification", event.scanId(), () -> notifyMembers(event));
        }

        if (event.totalVulns() > 0) {
            guard("NEW_VULNERABILITY alerts", event.scanId(), () -> alertRuleEvaluator.evaluate(
                    event.organizationId(), AlertEventType.NEW_VULNERABILITY, AlertContext.builder()
                            .severity(event.highestSeverity())
                            .targetId(event.targetId())
                            .count(event.totalVulns())
                            .build()));
        }
        guard("SCAN_COMPLETED alerts", event.scanId(), () -> alertRuleEvaluator.evaluate(
                event.organizationId(), AlertEventType.SCAN_COMPLETED, AlertContext.forTarget(event.targetId())));
        if (event.newAssets() > 0) {
            guard("NEW_ASSET_DISCOVERED alerts", event.scanId(), () -> alertRuleEvaluator.evaluate(
                    event.organizationId(), AlertEventType.NEW_ASSET_DISCOVERED, AlertContext.builder()
                            .targetId(event.targetId())
                            .count(event.newAssets())
                            .build()));
        }

        Map<String, Object> summary = summary(event);
        guard("scan.completed webhooks", event.scanId(), () ->
                webhookDispatcher.dispatch(event.organizationId(), WebhookDispatcher.EVENT_SCAN_COMPLETED, summary));
        if (event.count(Severity.CRITICAL) > 0) {
            guard("vulnerability.critical webhooks", event.scanId(), () -> webhookDispatcher.dispatch(
                    event.organizationId(), WebhookDispatcher.EVENT_VULN_CRITICAL, findings(event, Severity.CRITICAL)));
        }
        if (event.count(Severity.HIGH) > 0) {
            guard("vulnerability.high webhooks", event.scanId(), () -> webhookDispatcher.dispatch(
                    event.organizationId(), WebhookDispatcher.EVENT_VULN_HIGH, findings(event, Severity.HIGH)));
        }
        if (event.newAssets() > 0) {
            Map<String, Object> assets = new LinkedHashMap<>();
            assets.put("scanId", event.scanId());
            assets.put("targetId", event.targetId());
            assets.put("target", event.targetValue());
            assets.put("newAssets", event.newAssets());
            assets.put("totalAssets", event.totalAssets());
            guard("asset.discovered webhooks", event.scanId(), () ->
                    webhookDispatcher.dispatch(event.organizationId(), WebhookDispatcher.EVENT_ASSET_DISCOVERED, assets));
        }
    }

    public void onScanFailed(ScanFailedEvent event) {
        guard("SCAN_FAILED alerts", event.scanId(), () -> alertRuleEvaluator.evaluate(
                event.organizationId(), AlertEventType.SCAN_FAILED, AlertContext.forTarget(event.targetId())));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scanId", event.scanId());
        data.put("targetId", event.targetId());
        data.put("target", event.targetValue());
        data.put("error", event.errorMessage());
        data.put("failedAt", event.failedAt().toString());
        guard("scan.failed webhooks", event.scanId(), () ->
                webhookDispatcher.dispatch(event.organizationId(), WebhookDispatcher.EVENT_SCAN_FAILED, data));
    }

    private void notifyMembers(ScanCompletedEvent event) {
        int critical = event.count(Severity.CRITICAL);
        int high = event.count(Severity.HIGH);
        Notification.Type type = critical > 0 ? Notification.Type.CRITICAL_VULN_FOUND : Notification.Type.HIGH_VULN_FOUND;
        String title = critical > 0
                ? critical + " critical vulnerabilit" + (critical == 1 ? "y" : "ies") + " found"
                : high + " high severity vulnerabilit" + (high == 1 ? "y" : "ies") + " found";
        String message = String.format("Scan of %s completed with %d critical and %d high severity findings.",
                event.targetValue(), critical, high);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scanId", event.scanId());
        data.put("targetId", event.targetId());
        data.put("critical", critical);
        data.put("high", high);
        notificationDispatcher.notifyOrganization(event.organizationId(), new NotificationMessage(type, title, message, data));
    }

    private Map<String, Object> summary(ScanCompletedEvent event) {
        Map<String, Object> counts = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            counts.put(severity.name().toLowerCase(Locale.ROOT), event.count(severity));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scanId", event.scanId());
        data.put("targetId", event.targetId());
        data.put("target", event.targetValue());
        data.put("totalVulns", event.totalVulns());
        data.put("totalAssets", event.totalAssets());
        data.put("newAssets", event.newAssets());
        data.put("severityCounts", counts);
        data.put("completedAt", event.completedAt().toString());
        return data;
    }

    private Map<String, Object> findings(ScanCompletedEvent event, Severity severity) {
        List<Map<String, Object>> findings = event.notableFindings().stream()
                .filter(f -> f.severity() == severity)
                .map(f -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("title", f.title());
                    item.put("category", f.category());
                    item.put("affectedUrl", f.affectedUrl());
                    return item;
                })
                .toList();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scanId", event.scanId());
        data.put("targetId", event.targetId());
        data.put("target", event.targetValue());
        data.put("severity", severity);
        data.put("count", event.count(severity));
        data.put("findings", findings);
        return data;
    }

    private void guard(String step, Long scanId, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            log.warn("Post-scan step '{}' failed for scan {}: {}", step, scanId, e.getMessage());
        }
    }
}
