package com.vulnscan.backend.service.engine;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "vulnscan.engine.redis.enabled", havingValue = "true", matchIfMissing = true)
public class ScanResultSubscriber implements MessageListener {

    private final ScanResultReconciler reconciler;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        reconciler.handle(new String(message.getBody(), StandardCharsets.UTF_8));
    }
}
