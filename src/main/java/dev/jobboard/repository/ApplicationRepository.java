package dev.jobboard.repository;

import dev.jobboard.entity.Application;
import dev.jobboard.entity.ApplicationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for job applications.
 */
@Repository
public interface ApplicationRepository extends JpaRepository<Application, Long> {

    boolean existsByApplicantIdAndJobId(Long applicantId, Long jobId);

    Page<Application> findByApplicantIdOrderByCreatedAtDesc(Long applicantId, Pageable pageable);

    List<Application> findByApplicantId(Long applicantId);

    List<Application> findByJobIdOrderByCreatedAtDesc(Long jobId);

    List<Application> findByJobIdAndStatusOrderByCreatedAtDesc(Long jobId, ApplicationStatus status);

    /**
     * Count applications of a job grouped by status.
     * Each row is {@code [ApplicationStatus, Long]}.
     */
    @Query("SELECT a.status, COUNT(a) FROM Application a WHERE a.job.id = :jobId GROUP BY a.status")
    List<Object[]> countByStatusForJob(@Param("jobId") Long jobId);

    /**
     * Same as {@link #countByStatusForJob} across every job of one employer.
     */
    @Query("SELECT a.status, COUNT(a) FROM Application a WHERE a.job.postedBy.id = :employerId GROUP BY a.status")
    List<Object[]> countByStatusForEmployer(@Param("employerId") Long employerId);

    /**
     * Stamp the first time the job owner looked at the applications of a job.
     */
    @Modifying
    @Query("UPDATE Application a SET a.viewedAt = :viewedAt WHERE a.job.id = :jobId AND a.viewedAt IS NULL")
    int markViewed(@Param("jobId") Long jobId, @Param("viewedAt") LocalDateTime viewedAt);

    void deleteByJobId(Long jobId);

}
