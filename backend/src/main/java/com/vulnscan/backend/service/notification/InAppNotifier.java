package com.vulnscan.backend.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.model.Notification;
import com.vulnscan.backend.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class InAppNotifier implements Notifier {

    public static final String CHANNEL = "in_app";

    private final NotificationRepository notificationRepository;
    private final ObjectMapper objectMapper;

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public void send(NotificationRecipient recipient, NotificationMessage message) {
        if (recipient.userId() == null) {
            return;
        }
        notificationRepository.save(Notification.builder()
                .userId(recipient.userId())
                .organizationId(recipient.organizationId())
                .type(message.type())
                .title(message.title())
                .message(message.message().length() > 2000 ? message.message().substring(0, 2000) : message.message())
                .data(writeData(message))
                .channel(CHANNEL)
                .read(false)
                .createdAt(Instant.now())
                .build());
    }

    private String writeData(NotificationMessage message) {
        if (message.data() == null || message.data().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(message.data());
        } catch (JsonProcessingException e) {
            log.warn("Notification data not serializable: {}", e.getMessage());
            return null;
        }
    }
}
