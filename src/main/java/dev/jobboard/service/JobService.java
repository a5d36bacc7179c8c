package dev.jobboard.service;

import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Job;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.exception.ValidationException;
import dev.jobboard.metrics.JobBoardMetrics;
import dev.jobboard.model.JobRequest;
import dev.jobboard.model.JobResponse;
import dev.jobboard.model.JobSearchCriteria;
import dev.jobboard.model.PageResponse;
import dev.jobboard.repository.ApplicationRepository;
import dev.jobboard.repository.JobRepository;
import dev.jobboard.repository.SavedJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Service for posting, searching and maintaining jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    private final JobRepository jobRepository;
    private final ApplicationRepository applicationRepository;
    private final SavedJobRepository savedJobRepository;
    private final AccountService accountService;
    private final JobMatcher jobMatcher;
    private final PaginationConfig paginationConfig;
    private final JobBoardMetrics metrics;

    /**
     * Post a new job on behalf of an employer.
     */
    @Transactional
    public JobResponse create(Long actorId, JobRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireRole(actor, "post jobs", Role.EMPLOYER);
        validateSalaryRange(request);

        LocalDateTime now = LocalDateTime.now();
        Job job = Job.builder()
                .postedBy(actor)
                .postedAt(now)
                .active(true)
                .applicationCount(0)
                .viewCount(0)
                .build();
        applyRequest(job, request, now);

        Job saved = jobRepository.save(job);
        metrics.recordJobPosted();
        log.info("User {} posted job {} '{}' at {}", actor.getId(), saved.getId(), saved.getTitle(),
                saved.getCompany());
        return JobResponse.from(saved);
    }

    /**
     * Search active jobs, newest first.
     *
     * @param criteria Optional filters
     * @param page     Zero-based page number
     * @param size     Page size, capped by configuration
     */
    @Transactional(readOnly = true)
    public PageResponse<JobResponse> search(JobSearchCriteria criteria, Integer page, Integer size) {
        Pageable pageable = paginationConfig.pageable(page, size);

        List<Job> matching = jobRepository.findByActiveTrueOrderByPostedAtDesc().stream()
                .filter(job -> jobMatcher.matches(job, criteria))
                .toList();

        int from = (int) Math.min(pageable.getOffset(), matching.size());
        int to = Math.min(from + pageable.getPageSize(), matching.size());
        List<JobResponse> items = matching.subList(from, to).stream()
                .map(JobResponse::from)
                .toList();

        log.debug("Job search {} matched {} jobs", criteria, matching.size());
        return new PageResponse<>(items, pageable.getPageNumber(), pageable.getPageSize(), matching.size());
    }

    /**
     * Fetch an active job and count the view.
     */
    @Transactional
    public JobResponse view(Long jobId) {
        Job job = jobRepository.findByIdAndActiveTrue(jobId)
                .orElseThrow(() -> NotFoundException.of("Job", jobId));
        JobResponse response = JobResponse.from(job);

        jobRepository.incrementViewCount(jobId);
        response.setViewCount(response.getViewCount() + 1);
        metrics.recordJobView();
        return response;
    }

    /**
     * Jobs posted by the acting employer, active or not.
     */
    @Transactional(readOnly = true)
    public List<JobResponse> mine(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireRole(actor, "list their jobs", Role.EMPLOYER);
        return jobRepository.findByPostedByIdOrderByPostedAtDesc(actor.getId()).stream()
                .map(JobResponse::from)
                .toList();
    }

    @Transactional
    public JobResponse update(Long actorId, Long jobId, JobRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        Job job = requireJob(jobId);
        AccessRules.requireOwnerOrAdmin(job, actor, "update this job");
        validateSalaryRange(request);

        applyRequest(job, request, LocalDateTime.now());
        log.info("Job {} updated by user {}", jobId, actor.getId());
        return JobResponse.from(jobRepository.save(job));
    }

    /**
     * Open or close a job for applications and search.
     */
    @Transactional
    public JobResponse setActive(Long actorId, Long jobId, boolean active) {
        User actor = accountService.requireActiveUser(actorId);
        Job job = requireJob(jobId);
        AccessRules.requireOwnerOrAdmin(job, actor, "change this job");

        job.setActive(active);
        job.setUpdatedAt(LocalDateTime.now());
        log.info("Job {} {} by user {}", jobId, active ? "activated" : "deactivated", actor.getId());
        return JobResponse.from(jobRepository.save(job));
    }

    @Transactional
    public void delete(Long actorId, Long jobId) {
        User actor = accountService.requireActiveUser(actorId);
        Job job = requireJob(jobId);
        AccessRules.requireOwnerOrAdmin(job, actor, "delete this job");
        removeWithDependents(job);
        log.info("Job {} deleted by user {}", jobId, actor.getId());
    }

    /**
     * Delete a job together with its applications and bookmarks.
     */
    @Transactional
    public void removeWithDependents(Job job) {
        applicationRepository.deleteByJobId(job.getId());
        savedJobRepository.deleteByJobId(job.getId());
        jobRepository.delete(job);
    }

    Job requireJob(Long jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));
    }

    private void applyRequest(Job job, JobRequest request, LocalDateTime now) {
        job.setTitle(request.getTitle().trim());
        job.setDescription(request.getDescription());
        job.setCompany(request.getCompany().trim());
        job.setSalaryMin(request.getSalaryMin());
        job.setSalaryMax(request.getSalaryMax());
        job.setLocation(request.getLocation().trim());
        job.setSkills(new ArrayList<>(cleanSkills(request.getSkills())));
        job.setExperienceRequired(request.getExperienceRequired());
        job.setJobType(request.getJobType());
        job.setWorkMode(request.getWorkMode());
        job.setCompanyLogoUrl(request.getCompanyLogoUrl());
        job.setUpdatedAt(now);
    }

    private List<String> cleanSkills(List<String> skills) {
        if (skills == null) {
            return List.of();
        }
        return skills.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    private void validateSalaryRange(JobRequest request) {
        if (request.getSalaryMin() != null && request.getSalaryMax() != null
                && request.getSalaryMin() > request.getSalaryMax()) {
            throw new ValidationException("salaryMin cannot be greater than salaryMax");
        }
    }
}
