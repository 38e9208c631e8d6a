package com.vulnscan.backend.service.notification;

import com.vulnscan.backend.model.User;

public record NotificationRecipient(
        Long userId,
        Long organizationId,
        String email,
        String name,
        boolean emailNotifications
) {

    public static NotificationRecipient of(User user, Long organizationId) {
        return new NotificationRecipient(user.getId(), organizationId, user.getEmail(), user.getName(),
                user.isEmailNotifications());
    }

    /**
     * An address-only recipient, e.g. an alert rule's extra email list.
     */
    public static NotificationRecipient address(String email, Long organizationId) {
        return new NotificationRecipient(null, organizationId, email, null, true);
    }
}
