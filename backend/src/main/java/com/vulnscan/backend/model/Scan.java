package com.vulnscan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "scans", indexes = {
        @Index(name = "idx_scans_target_status", columnList = "target_id,status"),
        @Index(name = "idx_scans_target_completed", columnList = "target_id,completed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Scan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "created_by_id", nullable = false)
    private Long createdById;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Type type = Type.ON_DEMAND;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ScanProfile profile;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<String> modules = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(nullable = false)
    private int progress;

    @Column(name = "current_module")
    private String currentModule;

    @Column(name = "status_message", length = 1000)
    private String statusMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "total_assets", nullable = false)
    private int totalAssets;

    @Column(name = "new_assets", nullable = false)
    private int newAssets;

    @Column(name = "total_vulns", nullable = false)
    private int totalVulns;

    @Column(name = "critical_count", nullable = false)
    private int criticalCount;

    @Column(name = "high_count", nullable = false)
    private int highCount;

    @Column(name = "medium_count", nullable = false)
    private int mediumCount;

    @Column(name = "low_count", nullable = false)
    private int lowCount;

    @Column(name = "info_count", nullable = false)
    private int infoCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum Type {
        ON_DEMAND,
        SCHEDULED,
        CONTINUOUS
    }

    /**
     * QUEUED -> RUNNING -> COMPLETED | FAILED, and QUEUED | RUNNING -> CANCELLED.
     */
    public enum Status {
        QUEUED,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }

        public boolean isInFlight() {
            return this == QUEUED || this == RUNNING;
        }

        public boolean canTransitionTo(Status target) {
            if (target == null) return false;
            return switch (this) {
                case QUEUED -> target == RUNNING || target == FAILED || target == CANCELLED;
                case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
                default -> false;
            };
        }

        public static List<Status> inFlight() {
            return List.of(QUEUED, RUNNING);
        }
    }
}
