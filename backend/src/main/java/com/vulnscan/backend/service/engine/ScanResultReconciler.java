package com.vulnscan.backend.service.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.exception.MalformedEventException;
import com.vulnscan.backend.service.MetricsService;
import com.vulnscan.backend.service.ScanOutcomeFanOut;
import com.vulnscan.backend.service.ScanRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Consumes engine result messages one at a time. Never throws: every failure is logged per message so
 * the subscription keeps running.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanResultReconciler {

    public enum Outcome {
        PROGRESS_APPLIED,
        COMPLETED,
        FAILED,
        IGNORED,
        DROPPED,
        ERROR
    }

    private final ObjectMapper objectMapper;
    private final ScanRecordService scanRecordService;
    private final ScanCompletionService scanCompletionService;
    private final ScanOutcomeFanOut scanOutcomeFanOut;
    private final MetricsService metricsService;

    public Outcome handle(String payload) {
        try {
            EngineResultMessage message = parse(payload);
            MDC.put("scanId", String.valueOf(message.getScanId()));
            return dispatch(message, payload);
        } catch (MalformedEventException e) {
            metricsService.incrementDroppedResultMessages();
            log.warn("Dropping malformed engine result: {}", e.getMessage());
            return Outcome.DROPPED;
        } catch (Exception e) {
            log.error("Error processing engine result", e);
            return Outcome.ERROR;
        } finally {
            MDC.remove("scanId");
        }
    }

    private Outcome dispatch(EngineResultMessage message, String payload) {
        String status = message.getStatus().trim().toUpperCase(Locale.ROOT);
        switch (status) {
            case EngineResultMessage.STATUS_PROGRESS -> {
                if (message.getProgress() == null) {
                    throw new MalformedEventException("PROGRESS without progress for scan " + message.getScanId());
                }
                boolean applied = scanRecordService.updateProgress(message.getScanId(), message.getProgress(),
                        message.getCurrentModule(), message.getMessage());
                return applied ? Outcome.PROGRESS_APPLIED : Outcome.IGNORED;
            }
            case EngineResultMessage.STATUS_COMPLETED -> {
                return scanCompletionService.complete(message, payload)
                        .map(event -> {
                            scanOutcomeFanOut.onScanCompleted(event);
                            return Outcome.COMPLETED;
                        })
                        .orElse(Outcome.IGNORED);
            }
            case EngineResultMessage.STATUS_FAILED -> {
                return scanCompletionService.fail(message.getScanId(), message.getError())
                        .map(event -> {
                            scanOutcomeFanOut.onScanFailed(event);
                            return Outcome.FAILED;
                        })
                        .orElse(Outcome.IGNORED);
            }
            default -> throw new MalformedEventException("Unknown result status '" + message.getStatus() + "'");
        }
    }

    private EngineResultMessage parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedEventException("Empty result message");
        }
        EngineResultMessage message;
        try {
            message = objectMapper.readValue(payload, EngineResultMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Unparseable result message: " + e.getOriginalMessage(), e);
        }
        if (message == null || message.getScanId() == null) {
            throw new MalformedEventException("Result message without scanId");
        }
        if (message.getStatus() == null || message.getStatus().isBlank()) {
            throw new MalformedEventException("Result message without status for scan " + message.getScanId());
        }
        return message;
    }
}
