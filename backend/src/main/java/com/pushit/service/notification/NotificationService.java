package com.pushit.service.notification;

import com.pushit.entity.Notification;
import com.pushit.entity.NotificationType;
import com.pushit.entity.User;
import com.pushit.exception.ResourceNotFoundException;
import com.pushit.repository.NotificationRepository;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** In-app notifications. Creation joins the caller's transaction. */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;

    @Transactional
    public Notification notify(
            User user,
            NotificationType type,
            String title,
            String message,
            Long submissionId,
            Long payoutId) {
        Notification notification =
                Notification.builder()
                        .user(user)
                        .type(type)
                        .title(title)
                        .message(message)
                        .submissionId(submissionId)
                        .payoutId(payoutId)
                        .build();
        Notification saved = notificationRepository.save(notification);
        log.debug("Notification {} created for user {}", type, user.getId());
        return saved;
    }

    @Transactional
    public Notification notify(User user, NotificationType type, String title, String message) {
        return notify(user, type, title, message, null, null);
    }

    @Transactional(readOnly = true)
    public List<Notification> listForUser(Long userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long userId) {
        return notificationRepository.countByUserIdAndReadFalse(userId);
    }

    @Transactional
    public Notification markRead(Long userId, Long notificationId) {
        Notification notification =
                notificationRepository
                        .findById(notificationId)
                        .filter(n -> n.getUser().getId().equals(userId))
                        .orElseThrow(
                                () ->
                                        new ResourceNotFoundException(
                                                "Notification", notificationId));
        if (!notification.isRead()) {
            notification.setRead(true);
            notification.setReadAt(LocalDateTime.now());
        }
        return notificationRepository.save(notification);
    }
}
