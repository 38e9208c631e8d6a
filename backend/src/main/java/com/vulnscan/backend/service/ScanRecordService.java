package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.ScanUpdate;
import com.vulnscan.backend.event.ScanFailedEvent;
import com.vulnscan.backend.event.ScanProgressEvent;
import com.vulnscan.backend.event.ScanStatusChangedEvent;
import com.vulnscan.backend.exception.DuplicateScanException;
import com.vulnscan.backend.exception.InvalidTransitionException;
import com.vulnscan.backend.exception.NotFoundException;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.ScanProfile;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.repository.ScanRepository;
import com.vulnscan.backend.repository.TargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the scan lifecycle. Every status change goes through {@link #transition} or
 * {@link #applyTransition}, which enforce {@link Scan.Status#canTransitionTo}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanRecordService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ScanRepository scanRepository;
    private final TargetRepository targetRepository;
    private final QuotaService quotaService;
    private final ScanJobQueue scanJobQueue;
    private final AuditEventService auditEventService;
    private final MetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a QUEUED scan, reserves quota and enqueues its dispatch job as one unit. The target row
     * is locked first so concurrent creators serialize on the duplicate check.
     */
    @Transactional
    public Scan create(Target target, ScanProfile profile, List<String> modules, Long creatorId, Scan.Type type) {
        Target locked = targetRepository.findByIdForUpdate(target.getId())
                .orElseThrow(() -> new NotFoundException("Target not found"));

        if (findRunningOrQueued(locked.getId()).isPresent()) {
            throw new DuplicateScanException(locked.getId());
        }

        quotaService.checkAndReserve(locked.getOrganizationId());

        Instant now = Instant.now();
        Scan scan = Scan.builder()
                .targetId(locked.getId())
                .organizationId(locked.getOrganizationId())
                .createdById(creatorId)
                .type(type)
                .profile(profile)
                .modules(new ArrayList<>(modules == null ? List.of() : modules))
                .status(Scan.Status.QUEUED)
                .progress(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            scanRepository.saveAndFlush(scan);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateScanException(locked.getId(), ex);
        }

        scanJobQueue.enqueue(scan.getId());
        auditEventService.recordScanTransition(scan, null, Scan.Status.QUEUED);
        metricsService.incrementScansCreated();
        publishStatusChange(scan, null);
        log.info("Scan created scanId={} targetId={} type={} profile={} modules={}",
                scan.getId(), locked.getId(), type, profile, scan.getModules().size());
        return scan;
    }

    @Transactional(readOnly = true)
    public Optional<Scan> findRunningOrQueued(Long targetId) {
        return scanRepository.findFirstByTargetIdAndStatusIn(targetId, Scan.Status.inFlight());
    }

    @Transactional
    public Scan transition(Long scanId, Scan.Status newStatus, ScanUpdate update) {
        Scan scan = scanRepository.findByIdForUpdate(scanId)
                .orElseThrow(() -> new NotFoundException("Scan not found"));
        return applyTransition(scan, newStatus, update);
    }

    /**
     * Applies a transition to a scan the caller has already locked in the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Scan applyTransition(Scan scan, Scan.Status newStatus, ScanUpdate update) {
        Scan.Status current = scan.getStatus();
        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidTransitionException(scan.getId(), current, newStatus);
        }
        ScanUpdate fields = update == null ? ScanUpdate.none() : update;

        scan.setStatus(newStatus);
        if (fields.getStartedAt() != null) {
            scan.setStartedAt(fields.getStartedAt());
        }
        if (fields.getCompletedAt() != null) {
            scan.setCompletedAt(fields.getCompletedAt());
            if (scan.getStartedAt() != null) {
                scan.setDurationSeconds(Duration.between(scan.getStartedAt(), fields.getCompletedAt()).getSeconds());
            }
        }
        if (fields.getProgress() != null) {
            scan.setProgress(clampProgress(fields.getProgress()));
        }
        if (fields.getErrorMessage() != null) {
            scan.setErrorMessage(truncate(fields.getErrorMessage()));
        }
        scan.setUpdatedAt(Instant.now());
        scanRepository.save(scan);

        auditEventService.recordScanTransition(scan, current, newStatus);
        if (newStatus == Scan.Status.COMPLETED) {
            metricsService.incrementScansCompleted();
        } else if (newStatus == Scan.Status.FAILED) {
            metricsService.incrementScansFailed();
        }
        publishStatusChange(scan, current);
        log.info("Scan {} {} -> {}", scan.getId(), current, newStatus);
        return scan;
    }

    /**
     * QUEUED -> RUNNING for a dispatch attempt. A scan that is already RUNNING (redelivered job) or
     * terminal is returned unchanged so the caller can decide.
     */
    @Transactional
    public Scan markRunning(Long scanId) {
        Scan scan = scanRepository.findByIdForUpdate(scanId)
                .orElseThrow(() -> new NotFoundException("Scan not found"));
        if (scan.getStatus() != Scan.Status.QUEUED) {
            return scan;
        }
        return applyTransition(scan, Scan.Status.RUNNING, ScanUpdate.started(Instant.now()));
    }

    /**
     * Fails an in-flight scan in its own transaction. Returns the failure details, or empty when the
     * scan is missing or already terminal.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ScanFailedEvent> markFailed(Long scanId, String errorMessage) {
        Scan scan = scanRepository.findByIdForUpdate(scanId).orElse(null);
        if (scan == null) {
            log.warn("Cannot fail unknown scan {}", scanId);
            return Optional.empty();
        }
        if (!scan.getStatus().isInFlight()) {
            log.info("Scan {} already {}, not marking FAILED", scanId, scan.getStatus());
            return Optional.empty();
        }
        Instant now = Instant.now();
        applyTransition(scan, Scan.Status.FAILED, ScanUpdate.failed(now, errorMessage));
        String targetValue = targetRepository.findById(scan.getTargetId()).map(Target::getValue).orElse(null);
        return Optional.of(new ScanFailedEvent(scan.getId(), scan.getTargetId(), scan.getOrganizationId(),
                targetValue, scan.getCreatedById(), scan.getErrorMessage(), now));
    }

    /**
     * Moves progress forward for a RUNNING scan. Stale or out-of-order values are ignored.
     */
    @Transactional
    public boolean updateProgress(Long scanId, int progress, String currentModule, String message) {
        Scan scan = scanRepository.findByIdForUpdate(scanId).orElse(null);
        if (scan == null || scan.getStatus() != Scan.Status.RUNNING) {
            return false;
        }
        int clamped = clampProgress(progress);
        if (clamped < scan.getProgress()) {
            log.debug("Ignoring stale progress {} < {} for scan {}", clamped, scan.getProgress(), scanId);
            return false;
        }
        scan.setProgress(clamped);
        if (currentModule != null) {
            scan.setCurrentModule(currentModule.length() > 255 ? currentModule.substring(0, 255) : currentModule);
        }
        if (message != null) {
            scan.setStatusMessage(message.length() > 1000 ? message.substring(0, 1000) : message);
        }
        scan.setUpdatedAt(Instant.now());
        scanRepository.save(scan);
        eventPublisher.publishEvent(new ScanProgressEvent(scan.getId(), scan.getOrganizationId(), clamped,
                scan.getCurrentModule(), scan.getStatusMessage(), Instant.now()));
        return true;
    }

    /**
     * Operator cancel. Only QUEUED or RUNNING scans can be cancelled; the engine is not stopped.
     */
    @Transactional
    public Scan cancel(Long scanId) {
        Scan scan = transition(scanId, Scan.Status.CANCELLED, ScanUpdate.cancelled(Instant.now()));
        scanJobQueue.resolveForScan(scanId, "Scan cancelled");
        return scan;
    }

    private void publishStatusChange(Scan scan, Scan.Status previous) {
        eventPublisher.publishEvent(new ScanStatusChangedEvent(scan.getId(), scan.getTargetId(),
                scan.getOrganizationId(), previous, scan.getStatus(), scan.getProgress(),
                scan.getErrorMessage(), Instant.now()));
    }

    private int clampProgress(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    private String truncate(String value) {
        return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
    }
}
