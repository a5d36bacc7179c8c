package dev.jobboard.repository;

import dev.jobboard.entity.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for job postings.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    Optional<Job> findByIdAndActiveTrue(Long id);

    /**
     * All active postings, newest first. Text and skill filters are applied by {@code JobMatcher}.
     */
    List<Job> findByActiveTrueOrderByPostedAtDesc();

    /**
     * Active postings published after the given instant, newest first.
     */
    List<Job> findByActiveTrueAndPostedAtAfterOrderByPostedAtDesc(LocalDateTime since);

    List<Job> findByPostedByIdOrderByPostedAtDesc(Long userId);

    /**
     * Increment the view counter in a single statement.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.viewCount = j.viewCount + 1 WHERE j.id = :id")
    int incrementViewCount(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.applicationCount = j.applicationCount + 1 WHERE j.id = :id")
    int incrementApplicationCount(@Param("id") Long id);

    /**
     * Decrement the application counter, never below zero.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Job j SET j.applicationCount = j.applicationCount - 1 WHERE j.id = :id AND j.applicationCount > 0")
    int decrementApplicationCount(@Param("id") Long id);
}
