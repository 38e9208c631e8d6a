package com.vulnscan.backend.exception;

import com.vulnscan.backend.model.Scan;

/**
 * A scan state change that the lifecycle does not allow. Never retried.
 */
public class InvalidTransitionException extends RuntimeException {

    private final Long scanId;
    private final Scan.Status from;
    private final Scan.Status to;

    public InvalidTransitionException(Long scanId, Scan.Status from, Scan.Status to) {
        super("Scan " + scanId + " cannot move from " + from + " to " + to);
        this.scanId = scanId;
        this.from = from;
        this.to = to;
    }

    public Long getScanId() {
        return scanId;
    }

    public Scan.Status getFrom() {
        return from;
    }

    public Scan.Status getTo() {
        return to;
    }
}
