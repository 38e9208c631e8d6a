package com.vulnscan.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicInteger dispatchInFlight = new AtomicInteger();

    private Counter scansCreatedCounter;
    private Counter scansCompletedCounter;
    private Counter scansFailedCounter;
    private Counter resultMessagesDroppedCounter;
    private Counter webhookDeliveredCounter;
    private Counter webhookFailedCounter;
    private Counter unknownCategoryCounter;

    @PostConstruct
    void init() {
        scansCreatedCounter = Counter.builder("scans_created_total").register(meterRegistry);
        scansCompletedCounter = Counter.builder("scans_completed_total").register(meterRegistry);
        scansFailedCounter = Counter.builder("scans_failed_total").register(meterRegistry);
        resultMessagesDroppedCounter = Counter.builder("engine_result_messages_dropped_total").register(meterRegistry);
        webhookDeliveredCounter = Counter.builder("webhook_deliveries_total").tag("outcome", "delivered").register(meterRegistry);
        webhookFailedCounter = Counter.builder("webhook_deliveries_total").tag("outcome", "failed").register(meterRegistry);
        unknownCategoryCounter = Counter.builder("engine_unknown_category_total").register(meterRegistry);
        Gauge.builder("scan_dispatch_in_flight", dispatchInFlight, AtomicInteger::get).register(meterRegistry);
    }

    public void incrementScansCreated() {
        increment(scansCreatedCounter);
    }

    public void incrementScansCompleted() {
        increment(scansCompletedCounter);
    }

    public void incrementScansFailed() {
        increment(scansFailedCounter);
    }

    public void incrementDroppedResultMessages() {
        increment(resultMessagesDroppedCounter);
    }

    public void incrementUnknownCategory() {
        increment(unknownCategoryCounter);
    }

    public void recordWebhookDelivery(boolean delivered) {
        increment(delivered ? webhookDeliveredCounter : webhookFailedCounter);
    }

    public void dispatchStarted() {
        dispatchInFlight.incrementAndGet();
    }

    public void dispatchFinished() {
        dispatchInFlight.decrementAndGet();
    }

    private void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
