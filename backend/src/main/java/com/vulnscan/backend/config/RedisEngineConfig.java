package com.vulnscan.backend.config;

import com.vulnscan.backend.service.engine.ScanResultSubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.concurrent.Executor;

/**
 * Wires the inbound results channel. Disabled with {@code vulnscan.engine.redis.enabled=false}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "vulnscan.engine.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisEngineConfig {

    @Bean
    public RedisMessageListenerContainer engineResultListenerContainer(
            RedisConnectionFactory connectionFactory,
            ScanResultSubscriber scanResultSubscriber,
            VulnScanProperties properties,
            @Qualifier("engineResultExecutor") Executor engineResultExecutor
    ) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(engineResultExecutor);
        container.addMessageListener(scanResultSubscriber, new ChannelTopic(properties.getEngine().getResultChannel()));
        container.setErrorHandler(t -> log.error("Engine result listener error", t));
        log.info("Subscribed to engine results channel {}", properties.getEngine().getResultChannel());
        return container;
    }
}
