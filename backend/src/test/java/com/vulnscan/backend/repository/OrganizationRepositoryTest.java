package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.Organization;
import com.vulnscan.backend.model.ScanCadence;
import com.vulnscan.backend.model.Target;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class OrganizationRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private OrganizationRepository organizationRepository;

    @Autowired
    private TargetRepository targetRepository;

    @Test
    void incrementUsageBelowLimitStopsAtTheLimit() {
        Organization org = entityManager.persist(Organization.builder()
                .name("Acme")
                .scansUsed(9)
                .build());
        entityManager.flush();

        assertThat(organizationRepository.incrementUsageBelowLimit(org.getId(), 10)).isEqualTo(1);
        assertThat(organizationRepository.incrementUsageBelowLimit(org.getId(), 10)).isZero();

        entityManager.clear();
        assertThat(organizationRepository.findById(org.getId()).orElseThrow().getScansUsed()).isEqualTo(10);
    }

    @Test
    void resetAllUsageClearsEveryOrganization() {
        Organization first = entityManager.persist(Organization.builder().name("One").scansUsed(4).build());
        Organization second = entityManager.persist(Organization.builder().name("Two").scansUsed(0).build());
        entityManager.flush();

        assertThat(organizationRepository.resetAllUsage()).isEqualTo(1);

        entityManager.clear();
        assertThat(organizationRepository.findById(first.getId()).orElseThrow().getScansUsed()).isZero();
        assertThat(organizationRepository.findById(second.getId()).orElseThrow().getScansUsed()).isZero();
    }

    @Test
    void findDueForScanOnlyReturnsActiveVerifiedScheduledTargets() {
        Instant now = Instant.now();
        Organization org = entityManager.persist(Organization.builder().name("Acme").build());
        Target due = entityManager.persist(target(org, "due.example.com", Target.VerificationStatus.VERIFIED,
                ScanCadence.DAILY, true, now.minus(1, ChronoUnit.MINUTES)));
        entityManager.persist(target(org, "later.example.com", Target.VerificationStatus.VERIFIED,
                ScanCadence.DAILY, true, now.plus(1, ChronoUnit.HOURS)));
        entityManager.persist(target(org, "pending.example.com", Target.VerificationStatus.PENDING,
                ScanCadence.WEEKLY, true, now.minus(1, ChronoUnit.HOURS)));
        entityManager.persist(target(org, "inactive.example.com", Target.VerificationStatus.VERIFIED,
                ScanCadence.MONTHLY, false, now.minus(1, ChronoUnit.HOURS)));
        entityManager.persist(target(org, "manual.example.com", Target.VerificationStatus.VERIFIED,
                null, true, now.minus(1, ChronoUnit.HOURS)));
        entityManager.flush();

        assertThat(targetRepository.findDueForScan(Target.VerificationStatus.VERIFIED, now))
                .extracting(Target::getId)
                .containsExactly(due.getId());
    }

    private Target target(Organization org, String value, Target.VerificationStatus status,
                          ScanCadence cadence, boolean active, Instant nextScanAt) {
        return Target.builder()
                .organizationId(org.getId())
                .value(value)
                .verificationStatus(status)
                .scanSchedule(cadence)
                .active(active)
                .nextScanAt(nextScanAt)
                .build();
    }
}
