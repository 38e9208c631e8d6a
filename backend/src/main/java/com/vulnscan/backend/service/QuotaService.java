package com.vulnscan.backend.service;

import com.vulnscan.backend.exception.NotFoundException;
import com.vulnscan.backend.exception.QuotaExceededException;
import com.vulnscan.backend.model.Organization;
import com.vulnscan.backend.repository.OrganizationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Monthly scan usage per organization against its plan limit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuotaService {

    private final OrganizationRepository organizationRepository;
    private final ScheduledTaskGuard scheduledTaskGuard;

    /**
     * Reserves one scan for the organization. Must run inside the transaction that creates the scan,
     * so a rollback of either write undoes both.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void checkAndReserve(Long organizationId) {
        Organization organization = organizationRepository.findById(organizationId)
                .orElseThrow(() -> new NotFoundException("Organization not found"));
        int limit = organization.effectiveScanLimit();
        if (limit == Organization.Plan.UNLIMITED) {
            organizationRepository.incrementUsage(organizationId);
            return;
        }
        int updated = organizationRepository.incrementUsageBelowLimit(organizationId, limit);
        if (updated == 0) {
            log.info("Scan quota exhausted orgId={} limit={}", organizationId, limit);
            throw new QuotaExceededException(organizationId, limit);
        }
    }

    public boolean hasRemaining(Organization organization) {
        int limit = organization.effectiveScanLimit();
        return limit == Organization.Plan.UNLIMITED || organization.getScansUsed() < limit;
    }

    @Scheduled(cron = "${vulnscan.quota.reset-cron:0 0 0 1 * *}")
    public void scheduledMonthlyReset() {
        scheduledTaskGuard.run(ScheduledTaskGuard.Task.QUOTA_RESET, this::resetMonthlyUsage,
                reset -> Map.of("organizationsReset", reset));
    }

    @Transactional
    public int resetMonthlyUsage() {
        int reset = organizationRepository.resetAllUsage();
        log.info("Monthly scan usage reset for {} organizations", reset);
        return reset;
    }
}
