package com.vulnscan.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the orchestrator's background jobs. A job never escapes with an exception: failures are logged
 * and audited as {@code <TASK>_FAILED}. Runs whose summary is non-empty are audited as
 * {@code <TASK>_COMPLETED} with the summary as metadata; idle runs leave no row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    public enum Task {
        SCAN_SCHEDULER,
        SCAN_SWEEPER,
        QUOTA_RESET;

        String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final AuditEventService auditEventService;

    public <T> Optional<T> run(Task task, Supplier<T> body, Function<? super T, Map<String, Object>> summarizer) {
        String runId = task.key() + "-" + UUID.randomUUID().toString().substring(0, 8);
        boolean ownsCorrelation = MDC.get("correlationId") == null;
        if (ownsCorrelation) {
            MDC.put("correlationId", runId);
        }
        long started = System.currentTimeMillis();
        try {
            T result = body.get();
            Map<String, Object> summary = summarizer.apply(result);
            if (summary != null && !summary.isEmpty()) {
                Map<String, Object> metadata = metadata(task, runId, started);
                metadata.putAll(summary);
                auditEventService.recordEvent(null, AuditEventService.ENTITY_SCHEDULED_TASK, null,
                        task.name() + "_COMPLETED", "Scheduled task " + task.key() + " completed", metadata);
            }
            return Optional.ofNullable(result);
        } catch (Throwable t) {
            log.error("❌ Scheduled task {} failed run={}", task.key(), runId, t);
            Map<String, Object> metadata = metadata(task, runId, started);
            metadata.put("errorType", t.getClass().getSimpleName());
            metadata.put("error", t.getMessage());
            auditEventService.recordEvent(null, AuditEventService.ENTITY_SCHEDULED_TASK, null,
                    task.name() + "_FAILED", "Scheduled task " + task.key() + " failed", metadata);
            return Optional.empty();
        } finally {
            if (ownsCorrelation) {
                MDC.remove("correlationId");
            }
        }
    }

    private Map<String, Object> metadata(Task task, String runId, long started) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("task", task.key());
        metadata.put("runId", runId);
        metadata.put("durationMs", System.currentTimeMillis() - started);
        return metadata;
    }
}
