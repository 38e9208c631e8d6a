package com.vulnscan.backend.service.notification;

import com.vulnscan.backend.model.Notification;

import java.util.Map;

public record NotificationMessage(
        Notification.Type type,
        String title,
        String message,
        Map<String, Object> data
) {
}
