package com.vulnscan.backend.config;

import com.vulnscan.backend.exception.TransientDeliveryException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;

@Configuration
public class EngineResilienceConfig {

    @Bean
    public CircuitBreaker engineCircuitBreaker(
            @Value("${vulnscan.engine.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${vulnscan.engine.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${vulnscan.engine.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("scan-engine", config);
    }

    @Bean
    public Retry engineRetry(
            @Value("${vulnscan.engine.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${vulnscan.engine.resilience.retry.base-delay-ms:200}") long baseDelayMs,
            @Value("${vulnscan.engine.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(RedisConnectionFailureException.class,
                        DataAccessResourceFailureException.class,
                        TransientDeliveryException.class)
                .build();
        return Retry.of("scan-engine", config);
    }
}
