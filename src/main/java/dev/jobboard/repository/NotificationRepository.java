package dev.jobboard.repository;

import dev.jobboard.entity.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    Page<Notification> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);

    Page<Notification> findByUserIdAndReadFlagFalseOrderByCreatedAtDesc(Long userId, Pageable pageable);

    Optional<Notification> findByIdAndUserId(Long id, Long userId);

    long countByUserIdAndReadFlagFalse(Long userId);

    @Modifying
    @Query("UPDATE Notification n SET n.readFlag = true, n.readAt = :readAt WHERE n.user.id = :userId AND n.readFlag = false")
    int markAllRead(@Param("userId") Long userId, @Param("readAt") LocalDateTime readAt);

    void deleteByUserId(Long userId);
}
