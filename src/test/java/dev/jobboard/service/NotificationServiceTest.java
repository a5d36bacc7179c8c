package dev.jobboard.service;

import dev.jobboard.TestData;
import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Notification;
import dev.jobboard.entity.NotificationType;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.NotificationResponse;
import dev.jobboard.repository.NotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private AccountService accountService;

    @Captor
    private ArgumentCaptor<Notification> notificationCaptor;

    private NotificationService notificationService;
    private User user;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notificationRepository, accountService, new PaginationConfig());
        user = TestData.user(2L, Role.JOB_SEEKER);
    }

    private Notification unread(long id) {
        return Notification.builder()
                .id(id)
                .user(user)
                .type(NotificationType.APPLICATION_STATUS)
                .title("Application reviewed")
                .message("Your application was reviewed")
                .readFlag(false)
                .createdAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("Should store an unread notification")
    void shouldNotify() {
        when(notificationRepository.save(any(Notification.class))).thenAnswer(inv -> inv.getArgument(0));

        notificationService.notify(user, NotificationType.JOB_ALERT, "New jobs", "3 new jobs", 4L);

        verify(notificationRepository).save(notificationCaptor.capture());
        Notification saved = notificationCaptor.getValue();
        assertThat(saved.isReadFlag()).isFalse();
        assertThat(saved.getRelatedId()).isEqualTo(4L);
        assertThat(saved.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Should stamp readAt once")
    void shouldMarkReadOnce() {
        Notification notification = unread(5L);
        when(accountService.requireActiveUser(2L)).thenReturn(user);
        when(notificationRepository.findByIdAndUserId(5L, 2L)).thenReturn(Optional.of(notification));
        when(notificationRepository.save(notification)).thenReturn(notification);

        NotificationResponse first = notificationService.markRead(2L, 5L);
        NotificationResponse second = notificationService.markRead(2L, 5L);

        assertThat(first.isRead()).isTrue();
        assertThat(second.getReadAt()).isEqualTo(first.getReadAt());
        verify(notificationRepository, times(1)).save(notification);
    }

    @Test
    @DisplayName("Should hide notifications of other users")
    void shouldHideOthers() {
        when(accountService.requireActiveUser(2L)).thenReturn(user);
        when(notificationRepository.findByIdAndUserId(9L, 2L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> notificationService.delete(2L, 9L)).isInstanceOf(NotFoundException.class);
        verify(notificationRepository, never()).delete(any());
    }

    @Test
    @DisplayName("Should mark everything read and count unread")
    void shouldMarkAllRead() {
        when(accountService.requireActiveUser(2L)).thenReturn(user);
        when(notificationRepository.markAllRead(eq(2L), any(LocalDateTime.class))).thenReturn(3);
        when(notificationRepository.countByUserIdAndReadFlagFalse(2L)).thenReturn(0L);

        assertThat(notificationService.markAllRead(2L)).isEqualTo(3);
        assertThat(notificationService.unreadCount(2L)).isZero();
    }
}
