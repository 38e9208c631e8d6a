package com.vulnscan.backend.service;

import com.vulnscan.backend.exception.NotFoundException;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.ScanJob;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.repository.TargetRepository;
import com.vulnscan.backend.service.engine.ScanTask;
import com.vulnscan.backend.service.engine.ScanTaskPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Executes one dispatch attempt: QUEUED -> RUNNING, then publish the task. Fire-and-forget; engine
 * completion arrives later on the results channel.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanJobWorker {

    public enum Outcome {
        PUBLISHED,
        SKIPPED
    }

    private final ScanRecordService scanRecordService;
    private final TargetRepository targetRepository;
    private final ScanTaskPublisher scanTaskPublisher;
    private final ScanOutcomeFanOut scanOutcomeFanOut;

    /**
     * Runs the attempt. On failure the scan is marked FAILED and the exception is rethrown so the
     * queue records the attempt.
     */
    public Outcome process(ScanJob job) {
        Long scanId = job.getScanId();
        MDC.put("scanId", String.valueOf(scanId));
        try {
            Scan scan = scanRecordService.markRunning(scanId);
            if (scan.getStatus().isTerminal()) {
                log.info("Scan {} is already {}, nothing to dispatch", scanId, scan.getStatus());
                return Outcome.SKIPPED;
            }
            Target target = targetRepository.findById(scan.getTargetId())
                    .orElseThrow(() -> new IllegalStateException("Target " + scan.getTargetId() + " no longer exists"));
            scanTaskPublisher.publish(new ScanTask(
                    scan.getId(),
                    target.getId(),
                    target.getValue(),
                    target.getType().name(),
                    scan.getProfile().name(),
                    scan.getModules(),
                    scan.getOrganizationId()));
            log.info("🚀 Scan {} dispatched to engine (attempt {})", scanId, job.getAttempts() + 1);
            return Outcome.PUBLISHED;
        } catch (NotFoundException e) {
            log.warn("Dispatch job {} references missing scan {}", job.getId(), scanId);
            return Outcome.SKIPPED;
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Dispatch failed for scan {}: {}", scanId, message);
            try {
                scanRecordService.markFailed(scanId, message).ifPresent(scanOutcomeFanOut::onScanFailed);
            } catch (RuntimeException markFailure) {
                log.error("Could not mark scan {} FAILED: {}", scanId, markFailure.getMessage());
                e.addSuppressed(markFailure);
            }
            throw e;
        } finally {
            MDC.remove("scanId");
        }
    }
}
