package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.SchedulerTickSummary;
import com.vulnscan.backend.exception.DuplicateScanException;
import com.vulnscan.backend.exception.QuotaExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Finds targets whose cadence has elapsed and creates their scans. Ticks never overlap: a tick that
 * starts while another is running is skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanScheduler {

    private final ScheduledScanService scheduledScanService;

    private final AtomicBoolean ticking = new AtomicBoolean(false);

    public SchedulerTickSummary tick() {
        return tick(Instant.now());
    }

    public SchedulerTickSummary tick(Instant now) {
        if (!ticking.compareAndSet(false, true)) {
            log.warn("Scheduler tick skipped: previous tick still running");
            return SchedulerTickSummary.overlapping();
        }
        try {
            SchedulerTickSummary summary = SchedulerTickSummary.started();
            List<Long> due = scheduledScanService.findDueTargetIds(now);
            for (Long targetId : due) {
                summary.record(processTarget(targetId, now));
            }
            if (!due.isEmpty()) {
                log.info("Scheduler tick processed {} due targets: {}", due.size(), summary);
            }
            return summary;
        } finally {
            ticking.set(false);
        }
    }

    private SchedulerTickSummary.Outcome processTarget(Long targetId, Instant now) {
        MDC.put("targetId", String.valueOf(targetId));
        try {
            return scheduledScanService.processTarget(targetId, now);
        } catch (QuotaExceededException e) {
            // Lost a race for the last unit of quota; reschedule like any exhausted org.
            advanceQuietly(targetId, now);
            return SchedulerTickSummary.Outcome.QUOTA_EXHAUSTED;
        } catch (DuplicateScanException e) {
            return SchedulerTickSummary.Outcome.SCAN_IN_FLIGHT;
        } catch (Exception e) {
            log.error("Scheduler failed to process target {}", targetId, e);
            return SchedulerTickSummary.Outcome.FAILED;
        } finally {
            MDC.remove("targetId");
        }
    }

    private void advanceQuietly(Long targetId, Instant now) {
        try {
            scheduledScanService.advanceSchedule(targetId, now);
        } catch (Exception e) {
            log.error("Failed to advance schedule for target {}", targetId, e);
        }
    }

    boolean isTicking() {
        return ticking.get();
    }
}
