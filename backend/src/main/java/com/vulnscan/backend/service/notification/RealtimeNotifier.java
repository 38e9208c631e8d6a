package com.vulnscan.backend.service.notification;

import com.vulnscan.backend.config.VulnScanProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes a notification to the user's STOMP queue. Best effort; nothing is stored.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class RealtimeNotifier implements Notifier {

    public static final String CHANNEL = "realtime";
    static final String DESTINATION = "/queue/notifications";

    private final SimpMessagingTemplate messagingTemplate;
    private final VulnScanProperties properties;

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public void send(NotificationRecipient recipient, NotificationMessage message) {
        if (recipient.userId() == null || !properties.getNotifications().isRealtimeEnabled()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "notification:new");
        payload.put("type", message.type());
        payload.put("title", message.title());
        payload.put("message", message.message());
        payload.put("data", message.data());
        payload.put("timestamp", Instant.now().toString());
        messagingTemplate.convertAndSendToUser(recipient.userId().toString(), DESTINATION, payload);
    }
}
