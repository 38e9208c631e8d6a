package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.AlertContext;
import com.vulnscan.backend.dto.DeliveryResult;
import com.vulnscan.backend.model.AlertEventType;
import com.vulnscan.backend.model.AlertRule;
import com.vulnscan.backend.model.Severity;
import com.vulnscan.backend.repository.AlertRuleRepository;
import com.vulnscan.backend.service.notification.NotificationDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlertRuleEvaluatorTest {

    private static final Long ORG_ID = 5L;

    private AlertRuleRepository alertRuleRepository;
    private NotificationDispatcher notificationDispatcher;
    private WebhookDispatcher webhookDispatcher;
    private AlertRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        alertRuleRepository = mock(AlertRuleRepository.class);
        notificationDispatcher = mock(NotificationDispatcher.class);
        webhookDispatcher = mock(WebhookDispatcher.class);
        evaluator = new AlertRuleEvaluator(alertRuleRepository, notificationDispatcher, webhookDispatcher);
    }

    @Test
    void defaultSeverityFilterExcludesLow() {
        AlertRule rule = rule(1L, AlertEventType.NEW_VULNERABILITY);

        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.builder().severity(Severity.LOW).build())).isFalse();
        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.builder().severity(Severity.HIGH).build())).isTrue();
        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.builder().severity(Severity.CRITICAL).build())).isTrue();
    }

    @Test
    void thresholdIsInclusive() {
        AlertRule rule = rule(1L, AlertEventType.NEW_VULNERABILITY);
        rule.setThreshold(5);

        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.builder().severity(Severity.HIGH).count(4).build())).isFalse();
        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.builder().severity(Severity.HIGH).count(5).build())).isTrue();
    }

    @Test
    void filtersApplyOnlyWhenEventCarriesTheAttribute() {
        AlertRule rule = rule(1L, AlertEventType.SCAN_COMPLETED);
        rule.setTargetFilter(new ArrayList<>(List.of("42")));
        rule.setCategoryFilter(new ArrayList<>(List.of("sql_injection")));

        assertThat(AlertRuleEvaluator.matches(rule, new AlertContext())).isTrue();
        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.forTarget(42L))).isTrue();
        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.forTarget(7L))).isFalse();
        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.builder().category("SQL_INJECTION").build())).isTrue();
        assertThat(AlertRuleEvaluator.matches(rule, AlertContext.builder().category("XSS_REFLECTED").build())).isFalse();
    }

    @Test
    void firedRulesAreRecordedAndOthersIgnored() {
        AlertRule high = rule(1L, AlertEventType.NEW_VULNERABILITY);
        AlertRule strict = rule(2L, AlertEventType.NEW_VULNERABILITY);
        strict.setThreshold(10);
        when(alertRuleRepository.findByOrganizationIdAndEventTypeAndActiveTrue(ORG_ID, AlertEventType.NEW_VULNERABILITY))
                .thenReturn(List.of(high, strict));

        List<Long> fired = evaluator.evaluate(ORG_ID, AlertEventType.NEW_VULNERABILITY,
                AlertContext.builder().severity(Severity.CRITICAL).count(3).targetId(9L).build());

        assertThat(fired).containsExactly(1L);
        verify(alertRuleRepository).recordTrigger(eq(1L), any());
        verify(alertRuleRepository, never()).recordTrigger(eq(2L), any());
        verify(notificationDispatcher).notifyUser(eq(100L), eq(ORG_ID), any(), anyCollection());
    }

    @Test
    void failingRuleDoesNotStopTheOthers() {
        AlertRule broken = rule(1L, AlertEventType.SCAN_FAILED);
        AlertRule healthy = rule(2L, AlertEventType.SCAN_FAILED);
        when(alertRuleRepository.findByOrganizationIdAndEventTypeAndActiveTrue(ORG_ID, AlertEventType.SCAN_FAILED))
                .thenReturn(List.of(broken, healthy));
        doThrow(new RuntimeException("db down")).when(alertRuleRepository).recordTrigger(eq(1L), any());

        List<Long> fired = evaluator.evaluate(ORG_ID, AlertEventType.SCAN_FAILED, AlertContext.forTarget(3L));

        assertThat(fired).containsExactly(2L);
    }

    @Test
    void webhookChannelPostsAlertEnvelopeToRuleUrl() {
        AlertRule rule = rule(1L, AlertEventType.SCAN_COMPLETED);
        rule.setChannels(new ArrayList<>(List.of(AlertRule.CHANNEL_WEBHOOK)));
        rule.setWebhookUrl("https://hooks.example.com/alerts");
        when(alertRuleRepository.findByOrganizationIdAndEventTypeAndActiveTrue(ORG_ID, AlertEventType.SCAN_COMPLETED))
                .thenReturn(List.of(rule));
        when(webhookDispatcher.deliverToUrl(eq("https://hooks.example.com/alerts"), eq(AlertRuleEvaluator.EVENT_ALERT_TRIGGERED), any()))
                .thenReturn(DeliveryResult.delivered(null, 200));

        evaluator.evaluate(ORG_ID, AlertEventType.SCAN_COMPLETED, AlertContext.forTarget(3L));

        verify(webhookDispatcher).deliverToUrl(eq("https://hooks.example.com/alerts"),
                eq(AlertRuleEvaluator.EVENT_ALERT_TRIGGERED), any());
        verify(notificationDispatcher, never()).notifyUser(anyLong(), anyLong(), any(), anyCollection());
    }

    @Test
    void emailChannelPrefersExplicitRecipients() {
        AlertRule rule = rule(1L, AlertEventType.SCAN_COMPLETED);
        rule.setChannels(new ArrayList<>(List.of(AlertRule.CHANNEL_EMAIL)));
        rule.setEmailRecipients(new ArrayList<>(List.of("secops@example.com")));
        when(alertRuleRepository.findByOrganizationIdAndEventTypeAndActiveTrue(ORG_ID, AlertEventType.SCAN_COMPLETED))
                .thenReturn(List.of(rule));

        evaluator.evaluate(ORG_ID, AlertEventType.SCAN_COMPLETED, null);

        verify(notificationDispatcher).notifyAddresses(eq(List.of("secops@example.com")), eq(ORG_ID), any());
    }

    private static AlertRule rule(Long id, AlertEventType eventType) {
        return AlertRule.builder()
                .id(id)
                .organizationId(ORG_ID)
                .name("rule-" + id)
                .eventType(eventType)
                .createdById(100L)
                .build();
    }
}
