package com.vulnscan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "alert_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    public static final String CHANNEL_IN_APP = "in_app";
    public static final String CHANNEL_EMAIL = "email";
    public static final String CHANNEL_WEBHOOK = "webhook";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    private AlertEventType eventType;

    @Convert(converter = StringListConverter.class)
    @Column(name = "severity_filter", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> severityFilter = new ArrayList<>(List.of("CRITICAL", "HIGH"));

    @Convert(converter = StringListConverter.class)
    @Column(name = "target_filter", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> targetFilter = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "category_filter", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> categoryFilter = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private int threshold = 1;

    // Stored for the rule editor; evaluation is per event.
    @Column(name = "time_window_mins", nullable = false)
    @Builder.Default
    private int timeWindowMins = 60;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> channels = new ArrayList<>(List.of(CHANNEL_IN_APP));

    @Column(name = "webhook_url", length = 2000)
    private String webhookUrl;

    @Convert(converter = StringListConverter.class)
    @Column(name = "email_recipients", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> emailRecipients = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;

    @Column(name = "trigger_count", nullable = false)
    private int triggerCount;

    @Column(name = "created_by_id", nullable = false)
    private Long createdById;
}
