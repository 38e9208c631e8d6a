package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.SchedulerTickSummary.Outcome;
import com.vulnscan.backend.model.Organization;
import com.vulnscan.backend.model.OrganizationMember;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.repository.OrganizationMemberRepository;
import com.vulnscan.backend.repository.OrganizationRepository;
import com.vulnscan.backend.repository.TargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-target unit of work for the scheduler. Each call runs in its own transaction so one target's
 * failure is rolled back alone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledScanService {

    private final TargetRepository targetRepository;
    private final OrganizationRepository organizationRepository;
    private final OrganizationMemberRepository memberRepository;
    private final QuotaService quotaService;
    private final ScanRecordService scanRecordService;

    @Transactional(readOnly = true)
    public List<Long> findDueTargetIds(Instant now) {
        return targetRepository.findDueForScan(Target.VerificationStatus.VERIFIED, now).stream()
                .map(Target::getId)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Outcome processTarget(Long targetId, Instant now) {
        Target target = targetRepository.findByIdForUpdate(targetId).orElse(null);
        if (target == null || !isDue(target, now)) {
            return Outcome.NOT_DUE;
        }

        Organization organization = organizationRepository.findById(target.getOrganizationId()).orElse(null);
        if (organization == null) {
            log.warn("Target {} references missing organization {}", targetId, target.getOrganizationId());
            return Outcome.NO_OWNER;
        }
        if (!quotaService.hasRemaining(organization)) {
            advance(target, now, false);
            log.info("Scan quota exhausted for org {}, skipping target {} until {}",
                    target.getOrganizationId(), targetId, target.getNextScanAt());
            return Outcome.QUOTA_EXHAUSTED;
        }

        if (scanRecordService.findRunningOrQueued(targetId).isPresent()) {
            log.debug("Target {} already has a scan in flight", targetId);
            return Outcome.SCAN_IN_FLIGHT;
        }

        List<String> modules = target.getScanProfile().resolveModules(null);

        Optional<OrganizationMember> owner = memberRepository.findFirstByOrganizationIdAndRoleOrderByIdAsc(
                target.getOrganizationId(), OrganizationMember.Role.OWNER);
        if (owner.isEmpty()) {
            log.warn("Organization {} has no owner, cannot attribute scheduled scan for target {}",
                    target.getOrganizationId(), targetId);
            return Outcome.NO_OWNER;
        }

        Scan scan = scanRecordService.create(target, target.getScanProfile(), modules,
                owner.get().getUserId(), Scan.Type.SCHEDULED);
        advance(target, now, true);
        log.info("⏰ Scheduled scan {} created for target {} ({}), next run {}",
                scan.getId(), targetId, target.getValue(), target.getNextScanAt());
        return Outcome.CREATED;
    }

    /**
     * Pushes the next run out by one cadence interval without creating a scan.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void advanceSchedule(Long targetId, Instant now) {
        targetRepository.findByIdForUpdate(targetId)
                .filter(target -> target.getScanSchedule() != null)
                .ifPresent(target -> advance(target, now, false));
    }

    private void advance(Target target, Instant now, boolean scanned) {
        if (scanned) {
            target.setLastScanAt(now);
        }
        target.setNextScanAt(now.plus(target.getScanSchedule().getInterval()));
        targetRepository.save(target);
    }

    private boolean isDue(Target target, Instant now) {
        return target.isActive()
                && target.getVerificationStatus() == Target.VerificationStatus.VERIFIED
                && target.getScanSchedule() != null
                && target.getNextScanAt() != null
                && !target.getNextScanAt().isAfter(now);
    }
}
