package com.vulnscan.backend.service.engine;

/**
 * Outbound channel to the scanning engine. Implementations throw on delivery failure.
 */
public interface ScanTaskPublisher {

    void publish(ScanTask task);
}
