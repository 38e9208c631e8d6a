package com.vulnscan.backend.model;

import jakarta.persistence.Column;
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

@Entity
@Table(name = "organizations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Organization {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private Plan plan = Plan.STARTER;

    /**
     * Overrides the plan limit when set. -1 means unlimited.
     */
    @Column(name = "max_scans_per_month")
    private Integer maxScansPerMonth;

    @Column(name = "scans_used", nullable = false)
    private int scansUsed;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    public int effectiveScanLimit() {
        if (maxScansPerMonth != null) {
            return maxScansPerMonth;
        }
        return plan != null ? plan.getMaxScansPerMonth() : Plan.STARTER.getMaxScansPerMonth();
    }

    public enum Plan {
        STARTER(10),
        PROFESSIONAL(50),
        BUSINESS(200),
        ENTERPRISE(-1);

        public static final int UNLIMITED = -1;

        private final int maxScansPerMonth;

        Plan(int maxScansPerMonth) {
            this.maxScansPerMonth = maxScansPerMonth;
        }

        public int getMaxScansPerMonth() {
            return maxScansPerMonth;
        }
    }
}
