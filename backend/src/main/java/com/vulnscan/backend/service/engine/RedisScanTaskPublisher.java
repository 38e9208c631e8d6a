package com.vulnscan.backend.service.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.exception.TransientDeliveryException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "vulnscan.engine.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisScanTaskPublisher implements ScanTaskPublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final VulnScanProperties properties;
    private final CircuitBreaker engineCircuitBreaker;
    private final Retry engineRetry;

    @Override
    public void publish(ScanTask task) {
        String channel = properties.getEngine().getTaskChannel();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize scan task " + task.scanId(), e);
        }

        Supplier<Long> send = () -> redisTemplate.convertAndSend(channel, payload);
        Supplier<Long> decorated = CircuitBreaker.decorateSupplier(engineCircuitBreaker,
                Retry.decorateSupplier(engineRetry, send));
        try {
            Long receivers = decorated.get();
            if (receivers == null || receivers == 0) {
                log.warn("Scan task {} published to {} but no engine worker is subscribed", task.scanId(), channel);
            } else {
                log.info("Scan task {} published to {} receivers={}", task.scanId(), channel, receivers);
            }
        } catch (CallNotPermittedException e) {
            throw new TransientDeliveryException("Scan engine circuit open", e);
        } catch (TransientDeliveryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientDeliveryException("Failed to publish scan task: " + e.getMessage(), e);
        }
    }
}
