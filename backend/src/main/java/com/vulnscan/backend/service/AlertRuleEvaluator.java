package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.AlertContext;
import com.vulnscan.backend.dto.DeliveryResult;
import com.vulnscan.backend.model.AlertEventType;
import com.vulnscan.backend.model.AlertRule;
import com.vulnscan.backend.model.Notification;
import com.vulnscan.backend.repository.AlertRuleRepository;
import com.vulnscan.backend.service.notification.EmailNotifier;
import com.vulnscan.backend.service.notification.InAppNotifier;
import com.vulnscan.backend.service.notification.NotificationDispatcher;
import com.vulnscan.backend.service.notification.NotificationMessage;
import com.vulnscan.backend.service.notification.RealtimeNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlertRuleEvaluator {

    public static final String EVENT_ALERT_TRIGGERED = "alert.triggered";

    private final AlertRuleRepository alertRuleRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final WebhookDispatcher webhookDispatcher;

    /**
     * Fires every active rule of the organization that matches the event. Returns the ids of the
     * rules that fired. A failing rule is logged and does not stop the others.
     */
    public List<Long> evaluate(Long organizationId, AlertEventType eventType, AlertContext context) {
        AlertContext ctx = context == null ? new AlertContext() : context;
        List<Long> triggered = new ArrayList<>();
        for (AlertRule rule : alertRuleRepository.findByOrganizationIdAndEventTypeAndActiveTrue(organizationId, eventType)) {
            try {
                if (!matches(rule, ctx)) {
                    continue;
                }
                fire(rule, eventType, ctx);
                alertRuleRepository.recordTrigger(rule.getId(), Instant.now());
                triggered.add(rule.getId());
            } catch (Exception e) {
                log.warn("Alert rule {} evaluation failed: {}", rule.getId(), e.getMessage());
            }
        }
        if (!triggered.isEmpty()) {
            log.info("🔔 {} alert rule(s) triggered for {} in org {}", triggered.size(), eventType, organizationId);
        }
        return triggered;
    }

    /**
     * A filter only excludes when the rule sets it and the event carries the attribute.
     */
    public static boolean matches(AlertRule rule, AlertContext ctx) {
        if (ctx.getSeverity() != null && !accepts(rule.getSeverityFilter(), ctx.getSeverity().name())) {
            return false;
        }
        if (ctx.getTargetId() != null && !accepts(rule.getTargetFilter(), ctx.getTargetId().toString())) {
            return false;
        }
        if (ctx.getCategory() != null && !accepts(rule.getCategoryFilter(), ctx.getCategory())) {
            return false;
        }
        return ctx.effectiveCount() >= rule.getThreshold();
    }

    private static boolean accepts(List<String> filter, String value) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        return filter.stream().anyMatch(entry -> entry != null && entry.trim().equalsIgnoreCase(value));
    }

    private void fire(AlertRule rule, AlertEventType eventType, AlertContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("ruleId", rule.getId());
        data.put("ruleName", rule.getName());
        data.put("eventType", eventType);
        data.put("severity", ctx.getSeverity());
        data.put("targetId", ctx.getTargetId());
        data.put("category", ctx.getCategory());
        data.put("count", ctx.effectiveCount());

        NotificationMessage message = new NotificationMessage(Notification.Type.SYSTEM,
                "Alert: " + rule.getName(),
                "Alert rule \"" + rule.getName() + "\" triggered for event " + eventType,
                data);

        for (String channel : rule.getChannels()) {
            try {
                deliver(rule, channel, message, data);
            } catch (Exception e) {
                log.warn("Alert rule {} channel {} failed: {}", rule.getId(), channel, e.getMessage());
            }
        }
    }

    private void deliver(AlertRule rule, String channel, NotificationMessage message, Map<String, Object> data) {
        switch (channel) {
            case AlertRule.CHANNEL_IN_APP -> notificationDispatcher.notifyUser(rule.getCreatedById(),
                    rule.getOrganizationId(), message, List.of(InAppNotifier.CHANNEL, RealtimeNotifier.CHANNEL));
            case AlertRule.CHANNEL_EMAIL -> {
                if (rule.getEmailRecipients() != null && !rule.getEmailRecipients().isEmpty()) {
                    notificationDispatcher.notifyAddresses(rule.getEmailRecipients(), rule.getOrganizationId(), message);
                } else {
                    notificationDispatcher.notifyUser(rule.getCreatedById(), rule.getOrganizationId(), message,
                            List.of(EmailNotifier.CHANNEL));
                }
            }
            case AlertRule.CHANNEL_WEBHOOK -> {
                if (rule.getWebhookUrl() == null || rule.getWebhookUrl().isBlank()) {
                    log.warn("Alert rule {} has a webhook channel but no webhook URL", rule.getId());
                    return;
                }
                DeliveryResult result = webhookDispatcher.deliverToUrl(rule.getWebhookUrl(), EVENT_ALERT_TRIGGERED, data);
                if (!result.isDelivered()) {
                    log.warn("Alert rule {} webhook delivery failed: {}", rule.getId(), result.error());
                }
            }
            default -> log.warn("Alert rule {} has unsupported channel '{}'", rule.getId(), channel);
        }
    }
}
