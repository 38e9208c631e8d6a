package com.vulnscan.backend.service;

import com.vulnscan.backend.event.ScanFailedEvent;
import com.vulnscan.backend.exception.NotFoundException;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.ScanJob;
import com.vulnscan.backend.model.ScanProfile;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.repository.TargetRepository;
import com.vulnscan.backend.service.engine.ScanTask;
import com.vulnscan.backend.service.engine.ScanTaskPublisher;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScanJobWorkerTest {

    private final ScanRecordService scanRecordService = mock(ScanRecordService.class);
    private final TargetRepository targetRepository = mock(TargetRepository.class);
    private final ScanTaskPublisher publisher = mock(ScanTaskPublisher.class);
    private final ScanOutcomeFanOut fanOut = mock(ScanOutcomeFanOut.class);
    private final ScanJobWorker worker = new ScanJobWorker(scanRecordService, targetRepository, publisher, fanOut);

    @Test
    void queuedScanIsStartedAndPublished() {
        when(scanRecordService.markRunning(11L)).thenReturn(scan(Scan.Status.RUNNING));
        when(targetRepository.findById(5L)).thenReturn(Optional.of(target()));

        assertThat(worker.process(job())).isEqualTo(ScanJobWorker.Outcome.PUBLISHED);

        ArgumentCaptor<ScanTask> task = ArgumentCaptor.forClass(ScanTask.class);
        verify(publisher).publish(task.capture());
        assertThat(task.getValue().scanId()).isEqualTo(11L);
        assertThat(task.getValue().targetValue()).isEqualTo("acme.example.com");
        assertThat(task.getValue().profile()).isEqualTo("QUICK");
        assertThat(task.getValue().modules()).containsExactly("dns", "ssl");
        assertThat(task.getValue().orgId()).isEqualTo(3L);
    }

    @Test
    void databaseErrorWhileStartingFailsTheScanAndRethrows() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");
        when(scanRecordService.markRunning(11L)).thenThrow(failure);
        ScanFailedEvent failed = new ScanFailedEvent(11L, 5L, 3L, "acme.example.com", 9L,
                "connection refused", Instant.now());
        when(scanRecordService.markFailed(11L, "connection refused")).thenReturn(Optional.of(failed));

        assertThatThrownBy(() -> worker.process(job())).isSameAs(failure);

        verify(scanRecordService).markFailed(11L, "connection refused");
        verify(fanOut).onScanFailed(failed);
        verify(publisher, never()).publish(any());
    }

    @Test
    void publishFailureFailsTheScanAndRethrows() {
        when(scanRecordService.markRunning(11L)).thenReturn(scan(Scan.Status.RUNNING));
        when(targetRepository.findById(5L)).thenReturn(Optional.of(target()));
        doThrow(new IllegalStateException("redis unavailable")).when(publisher).publish(any());
        when(scanRecordService.markFailed(anyLong(), anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> worker.process(job()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("redis unavailable");

        verify(scanRecordService).markFailed(11L, "redis unavailable");
    }

    @Test
    void failureToMarkFailedKeepsTheOriginalError() {
        IllegalStateException original = new IllegalStateException("redis unavailable");
        when(scanRecordService.markRunning(11L)).thenReturn(scan(Scan.Status.RUNNING));
        when(targetRepository.findById(5L)).thenReturn(Optional.of(target()));
        doThrow(original).when(publisher).publish(any());
        when(scanRecordService.markFailed(anyLong(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("pool exhausted"));

        assertThatThrownBy(() -> worker.process(job())).isSameAs(original);
        assertThat(original.getSuppressed()).hasSize(1);
    }

    @Test
    void terminalOrMissingScansAreSkipped() {
        when(scanRecordService.markRunning(11L)).thenReturn(scan(Scan.Status.CANCELLED));
        assertThat(worker.process(job())).isEqualTo(ScanJobWorker.Outcome.SKIPPED);

        when(scanRecordService.markRunning(11L)).thenThrow(new NotFoundException("Scan 11 not found"));
        assertThat(worker.process(job())).isEqualTo(ScanJobWorker.Outcome.SKIPPED);

        verify(publisher, never()).publish(any());
        verify(scanRecordService, never()).markFailed(anyLong(), anyString());
    }

    private ScanJob job() {
        return ScanJob.builder().id(1L).scanId(11L).attempts(0).build();
    }

    private Scan scan(Scan.Status status) {
        return Scan.builder()
                .id(11L)
                .targetId(5L)
                .organizationId(3L)
                .createdById(9L)
                .profile(ScanProfile.QUICK)
                .modules(List.of("dns", "ssl"))
                .status(status)
                .build();
    }

    private Target target() {
        return Target.builder()
                .id(5L)
                .organizationId(3L)
                .value("acme.example.com")
                .build();
    }
}
