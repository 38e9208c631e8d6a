package com.vulnscan.backend.exception;

public class DuplicateScanException extends RuntimeException {

    private final Long targetId;

    public DuplicateScanException(Long targetId) {
        super("A scan is already running for this target");
        this.targetId = targetId;
    }

    public DuplicateScanException(Long targetId, Throwable cause) {
        super("A scan is already running for this target", cause);
        this.targetId = targetId;
    }

    public Long getTargetId() {
        return targetId;
    }
}
