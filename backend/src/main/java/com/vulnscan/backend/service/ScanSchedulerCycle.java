package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.SchedulerTickSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "vulnscan.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ScanSchedulerCycle {

    private final ScanScheduler scanScheduler;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${vulnscan.scheduler.tick-interval-ms:60000}")
    public void runCycle() {
        scheduledTaskGuard.run(ScheduledTaskGuard.Task.SCAN_SCHEDULER, scanScheduler::tick, ScanSchedulerCycle::summarize);
    }

    static Map<String, Object> summarize(SchedulerTickSummary summary) {
        if (summary.isSkipped() || summary.total() == 0) {
            return Map.of();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        summary.getCounts().forEach((outcome, count) -> metadata.put(outcome.name(), count));
        metadata.put("dueTargets", summary.total());
        return metadata;
    }
}
