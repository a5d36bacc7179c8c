package dev.jobboard.service;

import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Notification;
import dev.jobboard.entity.NotificationType;
import dev.jobboard.entity.User;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.NotificationResponse;
import dev.jobboard.model.PageResponse;
import dev.jobboard.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Service for in-app notifications. Every read or write is scoped to the acting user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final AccountService accountService;
    private final PaginationConfig paginationConfig;

    /**
     * Store a notification for a user.
     *
     * @param recipient Who receives it
     * @param relatedId Id of the job or application concerned, may be null
     */
    @Transactional
    public Notification notify(User recipient, NotificationType type, String title, String message,
            Long relatedId) {
        Notification notification = Notification.builder()
                .user(recipient)
                .type(type)
                .title(title)
                .message(message)
                .relatedId(relatedId)
                .readFlag(false)
                .createdAt(LocalDateTime.now())
                .build();
        Notification saved = notificationRepository.save(notification);
        log.debug("Notification {} ({}) stored for user {}", saved.getId(), type.value(), recipient.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public PageResponse<NotificationResponse> list(Long actorId, boolean unreadOnly, Integer page, Integer size) {
        User actor = accountService.requireActiveUser(actorId);
        Pageable pageable = paginationConfig.pageable(page, size);
        return PageResponse.of(unreadOnly
                        ? notificationRepository.findByUserIdAndReadFlagFalseOrderByCreatedAtDesc(actor.getId(), pageable)
                        : notificationRepository.findByUserIdOrderByCreatedAtDesc(actor.getId(), pageable),
                NotificationResponse::from);
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        return notificationRepository.countByUserIdAndReadFlagFalse(actor.getId());
    }

    /**
     * Mark one notification as read. Reading it again keeps the first read time.
     */
    @Transactional
    public NotificationResponse markRead(Long actorId, Long notificationId) {
        Notification notification = requireOwn(actorId, notificationId);
        if (!notification.isReadFlag()) {
            notification.setReadFlag(true);
            notification.setReadAt(LocalDateTime.now());
            notification = notificationRepository.save(notification);
        }
        return NotificationResponse.from(notification);
    }

    /**
     * @return Number of notifications that changed to read
     */
    @Transactional
    public int markAllRead(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        int updated = notificationRepository.markAllRead(actor.getId(), LocalDateTime.now());
        log.debug("Marked {} notifications read for user {}", updated, actor.getId());
        return updated;
    }

    @Transactional
    public void delete(Long actorId, Long notificationId) {
        notificationRepository.delete(requireOwn(actorId, notificationId));
    }

    private Notification requireOwn(Long actorId, Long notificationId) {
        User actor = accountService.requireActiveUser(actorId);
        return notificationRepository.findByIdAndUserId(notificationId, actor.getId())
                .orElseThrow(() -> NotFoundException.of("Notification", notificationId));
    }
}
