package com.vulnscan.backend.service;

import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.repository.ScanJobRepository;
import com.vulnscan.backend.repository.ScanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fails scans the engine never finished, so a target is not blocked forever by a lost message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanSweeper {

    static final String REASON = "stuck scan cleanup";

    private final ScanRepository scanRepository;
    private final ScanJobRepository scanJobRepository;
    private final ScanRecordService scanRecordService;
    private final ScanJobQueue scanJobQueue;
    private final ScanOutcomeFanOut scanOutcomeFanOut;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final VulnScanProperties properties;

    @Scheduled(fixedDelayString = "${vulnscan.sweeper.interval-ms:300000}")
    public void scheduledSweep() {
        if (!properties.getSweeper().isEnabled()) {
            return;
        }
        scheduledTaskGuard.run(ScheduledTaskGuard.Task.SCAN_SWEEPER, () -> sweep(Instant.now()),
                swept -> swept == 0 ? Map.of() : Map.of("failedScans", swept));
    }

    public int sweep(Instant now) {
        VulnScanProperties.Sweeper config = properties.getSweeper();
        List<Scan> queued = scanRepository.findByStatusAndCreatedAtBefore(Scan.Status.QUEUED,
                now.minus(Duration.ofMinutes(config.getQueuedTimeoutMinutes())));
        List<Scan> running = scanRepository.findByStatusAndStartedAtBefore(Scan.Status.RUNNING,
                now.minus(Duration.ofMinutes(config.getRunningTimeoutMinutes())));

        int swept = 0;
        for (Scan scan : queued) {
            // A pending job means the dispatcher is still retrying it.
            if (scanJobRepository.existsByScanIdAndResolvedFalse(scan.getId())) {
                continue;
            }
            swept += markFailed(scan) ? 1 : 0;
        }
        for (Scan scan : running) {
            swept += markFailed(scan) ? 1 : 0;
        }
        return swept;
    }

    private boolean markFailed(Scan scan) {
        MDC.put("scanId", String.valueOf(scan.getId()));
        try {
            return scanRecordService.markFailed(scan.getId(), REASON)
                    .map(event -> {
                        scanJobQueue.resolveForScan(scan.getId(), REASON);
                        log.warn("Sweeper marked scan as FAILED: scanId={}, status was {}", scan.getId(), scan.getStatus());
                        scanOutcomeFanOut.onScanFailed(event);
                        return true;
                    })
                    .orElse(false);
        } catch (Exception e) {
            log.error("Sweeper failed to clean up scan {}", scan.getId(), e);
            return false;
        } finally {
            MDC.remove("scanId");
        }
    }
}
