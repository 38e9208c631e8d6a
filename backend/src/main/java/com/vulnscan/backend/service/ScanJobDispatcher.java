package com.vulnscan.backend.service;

import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.event.ScanJobEnqueuedEvent;
import com.vulnscan.backend.model.ScanJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Pulls due jobs from {@link ScanJobQueue} and runs them on the dispatch pool, never more than
 * {@code vulnscan.dispatcher.concurrency} at a time.
 */
@Service
@Slf4j
public class ScanJobDispatcher {

    private final ScanJobQueue scanJobQueue;
    private final ScanJobWorker scanJobWorker;
    private final Executor scanDispatchExecutor;
    private final VulnScanProperties properties;
    private final MetricsService metricsService;

    private final Semaphore permits;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public ScanJobDispatcher(ScanJobQueue scanJobQueue,
                             ScanJobWorker scanJobWorker,
                             @Qualifier("scanDispatchExecutor") Executor scanDispatchExecutor,
                             VulnScanProperties properties,
                             MetricsService metricsService) {
        this.scanJobQueue = scanJobQueue;
        this.scanJobWorker = scanJobWorker;
        this.scanDispatchExecutor = scanDispatchExecutor;
        this.properties = properties;
        this.metricsService = metricsService;
        this.permits = new Semaphore(properties.getDispatcher().getConcurrency());
    }

    @Scheduled(fixedDelayString = "${vulnscan.dispatcher.poll-interval-ms:1000}")
    public void poll() {
        if (!properties.getDispatcher().isPollingEnabled()) {
            return;
        }
        try {
            drain();
        } catch (Exception e) {
            log.error("Dispatch poll failed", e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onJobEnqueued(ScanJobEnqueuedEvent event) {
        try {
            drain();
        } catch (Exception e) {
            log.warn("Immediate dispatch of scan {} failed, poller will retry: {}", event.scanId(), e.getMessage());
        }
    }

    /**
     * Submits due jobs until the pool is saturated. Returns the number submitted.
     */
    public int drain() {
        List<ScanJob> due = scanJobQueue.findDue(Instant.now());
        int submitted = 0;
        for (ScanJob job : due) {
            if (!inFlight.add(job.getId())) {
                continue;
            }
            if (!permits.tryAcquire()) {
                inFlight.remove(job.getId());
                break;
            }
            try {
                scanDispatchExecutor.execute(() -> run(job));
                submitted++;
            } catch (RejectedExecutionException e) {
                inFlight.remove(job.getId());
                permits.release();
                log.warn("Dispatch pool rejected job {}", job.getId());
                break;
            }
        }
        return submitted;
    }

    void run(ScanJob job) {
        metricsService.dispatchStarted();
        try {
            if (!scanJobQueue.isPending(job.getId())) {
                return;
            }
            ScanJobWorker.Outcome outcome = scanJobWorker.process(job);
            scanJobQueue.markResolved(job.getId(), outcome.name());
        } catch (Exception e) {
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            try {
                scanJobQueue.recordFailure(job.getId(), error);
            } catch (Exception recordError) {
                log.error("Failed to record dispatch failure for job {}", job.getId(), recordError);
            }
        } finally {
            metricsService.dispatchFinished();
            inFlight.remove(job.getId());
            permits.release();
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
