package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.FailedOperation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FailedOperationRepository extends JpaRepository<FailedOperation, Long> {

    List<FailedOperation> findByOperationTypeAndResolvedFalse(String operationType);
}
