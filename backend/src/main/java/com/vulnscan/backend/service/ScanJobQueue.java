package com.vulnscan.backend.service;

import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.event.ScanJobEnqueuedEvent;
import com.vulnscan.backend.model.ScanJob;
import com.vulnscan.backend.repository.ScanJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable, at-least-once dispatch queue backed by the scan_jobs table.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanJobQueue {

    public static final String DLQ_TYPE = "SCAN_DISPATCH";

    private final ScanJobRepository scanJobRepository;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ApplicationEventPublisher eventPublisher;
    private final VulnScanProperties properties;

    /**
     * Adds a job in the caller's transaction. Dispatch is woken after that transaction commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ScanJob enqueue(Long scanId) {
        Instant now = Instant.now();
        ScanJob job = ScanJob.builder()
                .scanId(scanId)
                .attempts(0)
                .resolved(false)
                .dlqLogged(false)
                .nextAttemptAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        scanJobRepository.save(job);
        eventPublisher.publishEvent(new ScanJobEnqueuedEvent(job.getId(), scanId));
        return job;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<ScanJob> findDue(Instant now) {
        return scanJobRepository.findTop50ByResolvedFalseAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(now);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public boolean isPending(Long jobId) {
        return scanJobRepository.findById(jobId).map(job -> !job.isResolved()).orElse(false);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markResolved(Long jobId, String note) {
        scanJobRepository.findById(jobId).ifPresent(job -> {
            Instant now = Instant.now();
            job.setAttempts(job.getAttempts() + 1);
            job.setLastAttemptAt(now);
            job.setResolved(true);
            job.setLastError(note);
            job.setUpdatedAt(now);
            scanJobRepository.save(job);
        });
    }

    @Transactional
    public void resolveForScan(Long scanId, String note) {
        scanJobRepository.findByScanId(scanId).stream()
                .filter(job -> !job.isResolved())
                .forEach(job -> {
                    job.setResolved(true);
                    job.setLastError(note);
                    job.setUpdatedAt(Instant.now());
                    scanJobRepository.save(job);
                });
    }

    /**
     * Records a failed attempt and schedules the next one with exponential backoff, or dead-letters
     * the job once the attempt budget is spent.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(Long jobId, String error) {
        ScanJob job = scanJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Dispatch job {} vanished before failure could be recorded", jobId);
            return;
        }
        Instant now = Instant.now();
        int attempts = job.getAttempts() + 1;
        job.setAttempts(attempts);
        job.setLastAttemptAt(now);
        job.setLastError(error);
        job.setUpdatedAt(now);

        int maxAttempts = properties.getDispatcher().getMaxAttempts();
        if (attempts >= maxAttempts) {
            job.setResolved(true);
            if (!job.isDlqLogged()) {
                deadLetterQueueService.logFailure(DLQ_TYPE, "scanId=" + job.getScanId(), error, attempts);
                job.setDlqLogged(true);
            }
        } else {
            job.setNextAttemptAt(now.plus(backoff(attempts)));
            log.warn("Dispatch retry scheduled scanId={} attempts={} nextAttemptAt={} error={}",
                    job.getScanId(), attempts, job.getNextAttemptAt(), error);
        }
        scanJobRepository.save(job);
    }

    Duration backoff(int attempts) {
        VulnScanProperties.Dispatcher dispatcher = properties.getDispatcher();
        long base = Math.max(1, dispatcher.getRetryBaseDelaySeconds());
        long delay = base << Math.min(attempts - 1, 20);
        return Duration.ofSeconds(Math.min(delay, dispatcher.getRetryMaxDelaySeconds()));
    }
}
