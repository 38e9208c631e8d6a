package com.vulnscan.backend.service.notification;

import com.vulnscan.backend.config.VulnScanProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.annotation.Order;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class EmailNotifier implements Notifier {

    public static final String CHANNEL = "email";

    private final ObjectProvider<JavaMailSender> mailSender;
    private final VulnScanProperties properties;

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public void send(NotificationRecipient recipient, NotificationMessage message) {
        VulnScanProperties.Email config = properties.getNotifications().getEmail();
        if (!config.isEnabled() || recipient.email() == null || !recipient.emailNotifications()) {
            return;
        }
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.debug("Email enabled but no mail sender configured, skipping {}", recipient.email());
            return;
        }
        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(config.getFrom());
        mail.setTo(recipient.email());
        mail.setSubject("[VulnScan] " + message.title());
        mail.setText(message.message() + "\n\n" + config.getAppBaseUrl() + "/dashboard/notifications");
        sender.send(mail);
        log.info("Email notification sent to {} type={}", recipient.email(), message.type());
    }
}
