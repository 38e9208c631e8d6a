package com.vulnscan.backend.service.notification;

/**
 * One delivery channel for user notifications. Implementations throw on failure; the dispatcher
 * isolates failures per recipient and channel.
 */
public interface Notifier {

    String channel();

    void send(NotificationRecipient recipient, NotificationMessage message);
}
