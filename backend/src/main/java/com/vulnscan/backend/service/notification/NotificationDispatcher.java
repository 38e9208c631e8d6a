package com.vulnscan.backend.service.notification;

import com.vulnscan.backend.model.OrganizationMember;
import com.vulnscan.backend.model.User;
import com.vulnscan.backend.repository.OrganizationMemberRepository;
import com.vulnscan.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Fans a notification out over every {@link Notifier}. A failing channel or recipient is logged and
 * skipped; it never stops the remaining deliveries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final List<Notifier> notifiers;
    private final OrganizationMemberRepository memberRepository;
    private final UserRepository userRepository;

    /**
     * Notifies every member of the organization on all channels. Returns the number of recipients.
     */
    public int notifyOrganization(Long organizationId, NotificationMessage message) {
        List<Long> userIds = memberRepository.findByOrganizationId(organizationId).stream()
                .map(OrganizationMember::getUserId)
                .distinct()
                .toList();
        List<User> users = userRepository.findAllById(userIds);
        for (User user : users) {
            deliver(NotificationRecipient.of(user, organizationId), message, null);
        }
        log.info("Notification {} sent to {} members of org {}", message.type(), users.size(), organizationId);
        return users.size();
    }

    /**
     * Notifies one user on the given channels only; null means all channels.
     */
    public void notifyUser(Long userId, Long organizationId, NotificationMessage message, Collection<String> channels) {
        userRepository.findById(userId).ifPresentOrElse(
                user -> deliver(NotificationRecipient.of(user, organizationId), message, channels),
                () -> log.warn("Notification {} for unknown user {}", message.type(), userId));
    }

    public void notifyAddresses(Collection<String> emails, Long organizationId, NotificationMessage message) {
        if (emails == null) {
            return;
        }
        for (String email : emails) {
            if (email != null && !email.isBlank()) {
                deliver(NotificationRecipient.address(email.trim(), organizationId), message, List.of(EmailNotifier.CHANNEL));
            }
        }
    }

    private void deliver(NotificationRecipient recipient, NotificationMessage message, Collection<String> channels) {
        for (Notifier notifier : notifiers) {
            if (channels != null && !channels.contains(notifier.channel())) {
                continue;
            }
            try {
                notifier.send(recipient, message);
            } catch (Exception e) {
                log.warn("Notification delivery failed channel={} user={} email={} error={}",
                        notifier.channel(), recipient.userId(), recipient.email(), e.getMessage());
            }
        }
    }
}
