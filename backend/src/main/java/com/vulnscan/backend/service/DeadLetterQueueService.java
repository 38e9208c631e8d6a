package com.vulnscan.backend.service;

import com.vulnscan.backend.model.FailedOperation;
import com.vulnscan.backend.repository.FailedOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterQueueService {

    private final FailedOperationRepository repo;

    public void logFailure(String type, String reference, String error, int attempts) {
        log.error("💀 DLQ Entry: [{}] {} after {} attempts -> {}", type, reference, attempts, error);

        FailedOperation op = FailedOperation.builder()
                .operationType(type)
                .reference(reference)
                .errorMessage(error)
                .attempts(attempts)
                .resolved(false)
                .createdAt(Instant.now())
                .build();

        repo.save(op);
    }

    public void resolve(Long id) {
        repo.findById(id).ifPresent(op -> {
            op.setResolved(true);
            repo.save(op);
            log.info("✅ DLQ Operation {} marked as resolved.", id);
        });
    }
}
