package com.vulnscan.backend.service;

import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.model.ScanJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScanJobDispatcherTest {

    private ScanJobQueue scanJobQueue;
    private ScanJobWorker scanJobWorker;
    private List<Runnable> submitted;
    private ScanJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        scanJobQueue = mock(ScanJobQueue.class);
        scanJobWorker = mock(ScanJobWorker.class);
        submitted = new ArrayList<>();
        VulnScanProperties properties = new VulnScanProperties();
        properties.getDispatcher().setConcurrency(5);
        dispatcher = new ScanJobDispatcher(scanJobQueue, scanJobWorker, submitted::add, properties,
                mock(MetricsService.class));
        when(scanJobQueue.isPending(anyLong())).thenReturn(true);
    }

    @Test
    void neverRunsMoreThanConfiguredConcurrency() {
        List<ScanJob> due = jobs(7);
        when(scanJobQueue.findDue(any(Instant.class))).thenReturn(due, due, due.subList(2, 7));

        assertThat(dispatcher.drain()).isEqualTo(5);
        assertThat(dispatcher.drain()).isZero();
        assertThat(dispatcher.inFlightCount()).isEqualTo(5);

        submitted.get(0).run();
        submitted.get(1).run();

        assertThat(dispatcher.inFlightCount()).isEqualTo(3);
        assertThat(dispatcher.drain()).isEqualTo(2);
        assertThat(dispatcher.inFlightCount()).isEqualTo(5);
    }

    @Test
    void successfulAttemptResolvesTheJob() {
        ScanJob job = jobs(1).get(0);
        when(scanJobWorker.process(job)).thenReturn(ScanJobWorker.Outcome.PUBLISHED);

        dispatcher.run(job);

        verify(scanJobQueue).markResolved(job.getId(), "PUBLISHED");
        verify(scanJobQueue, never()).recordFailure(anyLong(), anyString());
    }

    @Test
    void failedAttemptIsRecordedForRetry() {
        ScanJob job = jobs(1).get(0);
        when(scanJobWorker.process(job)).thenThrow(new IllegalStateException("engine channel down"));

        dispatcher.run(job);

        verify(scanJobQueue).recordFailure(eq(job.getId()), eq("engine channel down"));
        verify(scanJobQueue, never()).markResolved(anyLong(), anyString());
        assertThat(dispatcher.inFlightCount()).isZero();
    }

    @Test
    void resolvedJobIsNotProcessedAgain() {
        ScanJob job = jobs(1).get(0);
        when(scanJobQueue.isPending(job.getId())).thenReturn(false);

        dispatcher.run(job);

        verify(scanJobWorker, never()).process(any());
    }

    private static List<ScanJob> jobs(int count) {
        Instant now = Instant.now();
        return LongStream.rangeClosed(1, count)
                .mapToObj(id -> ScanJob.builder()
                        .id(id)
                        .scanId(100 + id)
                        .nextAttemptAt(now)
                        .createdAt(now)
                        .updatedAt(now)
                        .build())
                .toList();
    }
}
