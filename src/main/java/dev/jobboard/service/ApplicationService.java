package dev.jobboard.service;

import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Application;
import dev.jobboard.entity.ApplicationStatus;
import dev.jobboard.entity.Job;
import dev.jobboard.entity.JobSeekerProfile;
import dev.jobboard.entity.NotificationType;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.ForbiddenException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.metrics.JobBoardMetrics;
import dev.jobboard.model.ApplicationRequest;
import dev.jobboard.model.ApplicationResponse;
import dev.jobboard.model.PageResponse;
import dev.jobboard.model.StatusUpdateRequest;
import dev.jobboard.repository.ApplicationRepository;
import dev.jobboard.repository.JobRepository;
import dev.jobboard.repository.JobSeekerProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for submitting applications and moving them through their status lifecycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationService {

    private final ApplicationRepository applicationRepository;
    private final JobRepository jobRepository;
    private final JobSeekerProfileRepository profileRepository;
    private final AccountService accountService;
    private final NotificationService notificationService;
    private final PaginationConfig paginationConfig;
    private final JobBoardMetrics metrics;

    /**
     * Apply to a job as the acting job seeker.
     *
     * @param request Job id, optional cover letter and resume URL
     * @return The new application, in status APPLIED
     */
    @Transactional
    public ApplicationResponse apply(Long actorId, ApplicationRequest request) {
        User applicant = accountService.requireActiveUser(actorId);
        AccessRules.requireExactRole(applicant, "apply to jobs", Role.JOB_SEEKER);

        Job job = jobRepository.findById(request.getJobId())
                .orElseThrow(() -> NotFoundException.of("Job", request.getJobId()));
        if (!job.isActive()) {
            throw new ConflictException("Job is no longer accepting applications");
        }
        if (applicationRepository.existsByApplicantIdAndJobId(applicant.getId(), job.getId())) {
            throw new ConflictException("Application already submitted for this job");
        }

        LocalDateTime now = LocalDateTime.now();
        Application application = Application.builder()
                .job(job)
                .applicant(applicant)
                .status(ApplicationStatus.APPLIED)
                .coverLetter(request.getCoverLetter())
                .resumeUrl(resolveResumeUrl(applicant, request.getResumeUrl()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        Application saved = applicationRepository.save(application);
        ApplicationResponse response = ApplicationResponse.from(saved);

        notificationService.notify(job.getPostedBy(), NotificationType.NEW_APPLICATION,
                "New application",
                applicant.getFullName() + " applied to " + job.getTitle(),
                saved.getId());
        jobRepository.incrementApplicationCount(job.getId());
        metrics.recordApplicationSubmitted();

        log.info("User {} applied to job {} (application {})", applicant.getId(), job.getId(), saved.getId());
        return response;
    }

    /**
     * Applications of the acting user, newest first.
     */
    @Transactional(readOnly = true)
    public PageResponse<ApplicationResponse> mine(Long actorId, Integer page, Integer size) {
        User applicant = accountService.requireActiveUser(actorId);
        return PageResponse.of(
                applicationRepository.findByApplicantIdOrderByCreatedAtDesc(applicant.getId(),
                        paginationConfig.pageable(page, size)),
                ApplicationResponse::from);
    }

    /**
     * Applications received for a job. The first listing by the job owner stamps viewedAt.
     *
     * @param status Optional status filter
     */
    @Transactional
    public List<ApplicationResponse> forJob(Long actorId, Long jobId, ApplicationStatus status) {
        User actor = accountService.requireActiveUser(actorId);
        Job job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));
        AccessRules.requireOwnerOrAdmin(job, actor, "view applications for this job");

        if (job.isOwnedBy(actor)) {
            applicationRepository.markViewed(jobId, LocalDateTime.now());
        }

        List<Application> applications = status == null
                ? applicationRepository.findByJobIdOrderByCreatedAtDesc(jobId)
                : applicationRepository.findByJobIdAndStatusOrderByCreatedAtDesc(jobId, status);
        return applications.stream().map(ApplicationResponse::from).toList();
    }

    /**
     * Visible to the applicant, the job owner and admins. Anyone else gets a not-found.
     */
    @Transactional(readOnly = true)
    public ApplicationResponse get(Long actorId, Long applicationId) {
        User actor = accountService.requireActiveUser(actorId);
        Application application = requireApplication(applicationId);
        if (!actor.isAdmin() && !isApplicant(application, actor) && !application.getJob().isOwnedBy(actor)) {
            throw new NotFoundException("Application not found or not authorized to view");
        }
        return ApplicationResponse.from(application);
    }

    /**
     * Move an application to a new status.
     *
     * <p>The job owner (or an admin) drives the pipeline; only the applicant can accept an offer.
     */
    @Transactional
    public ApplicationResponse updateStatus(Long actorId, Long applicationId, StatusUpdateRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        Application application = requireApplication(applicationId);
        ApplicationStatus target = request.getStatus();

        if (target == ApplicationStatus.ACCEPTED) {
            if (!isApplicant(application, actor)) {
                throw new ForbiddenException("Only the applicant can accept an offer");
            }
        } else {
            AccessRules.requireOwnerOrAdmin(application.getJob(), actor, "update this application");
        }

        ApplicationStatus current = application.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new ConflictException(
                    "Cannot move application from " + current.value() + " to " + target.value());
        }

        application.setStatus(target);
        if (request.getNotes() != null) {
            application.setNotes(request.getNotes());
        }
        application.setUpdatedAt(LocalDateTime.now());
        Application saved = applicationRepository.save(application);

        Job job = saved.getJob();
        User recipient = target == ApplicationStatus.ACCEPTED ? job.getPostedBy() : saved.getApplicant();
        notificationService.notify(recipient, NotificationType.APPLICATION_STATUS,
                "Application " + target.value(),
                "Application for " + job.getTitle() + " at " + job.getCompany() + " is now " + target.value(),
                saved.getId());
        metrics.recordStatusChange(target);

        log.info("Application {} moved {} -> {} by user {}", applicationId, current.value(), target.value(),
                actor.getId());
        return ApplicationResponse.from(saved);
    }

    /**
     * Withdraw (delete) an application. Allowed for the applicant and admins.
     */
    @Transactional
    public void withdraw(Long actorId, Long applicationId) {
        User actor = accountService.requireActiveUser(actorId);
        Application application = requireApplication(applicationId);
        if (!actor.isAdmin() && !isApplicant(application, actor)) {
            throw new ForbiddenException("Not authorized to delete this application");
        }

        Long jobId = application.getJob().getId();
        applicationRepository.delete(application);
        jobRepository.decrementApplicationCount(jobId);
        metrics.recordApplicationWithdrawn();
        log.info("Application {} withdrawn by user {}", applicationId, actor.getId());
    }

    /**
     * Number of applications of a job per status; every status is present, zero when unused.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> statusCounts(Long actorId, Long jobId) {
        User actor = accountService.requireActiveUser(actorId);
        Job job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));
        AccessRules.requireOwnerOrAdmin(job, actor, "view applications for this job");
        return toStatusMap(applicationRepository.countByStatusForJob(jobId));
    }

    static Map<String, Long> toStatusMap(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ApplicationStatus status : ApplicationStatus.values()) {
            counts.put(status.value(), 0L);
        }
        for (Object[] row : rows) {
            counts.put(((ApplicationStatus) row[0]).value(), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private String resolveResumeUrl(User applicant, String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return profileRepository.findByUserId(applicant.getId())
                .map(JobSeekerProfile::getResumeUrl)
                .orElse(null);
    }

    private boolean isApplicant(Application application, User actor) {
        return application.getApplicant().getId().equals(actor.getId());
    }

    private Application requireApplication(Long applicationId) {
        return applicationRepository.findById(applicationId)
                .orElseThrow(() -> NotFoundException.of("Application", applicationId));
    }
}
