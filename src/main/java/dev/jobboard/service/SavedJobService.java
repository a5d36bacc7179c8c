package dev.jobboard.service;

import dev.jobboard.entity.Job;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.SavedJob;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.SavedJobResponse;
import dev.jobboard.repository.JobRepository;
import dev.jobboard.repository.SavedJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for job bookmarks of job seekers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SavedJobService {

    private final SavedJobRepository savedJobRepository;
    private final JobRepository jobRepository;
    private final AccountService accountService;

    @Transactional
    public SavedJobResponse save(Long actorId, Long jobId) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireExactRole(actor, "save jobs", Role.JOB_SEEKER);

        Job job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));
        if (savedJobRepository.existsByUserIdAndJobId(actor.getId(), jobId)) {
            throw new ConflictException("Job already saved");
        }

        SavedJob saved = savedJobRepository.save(SavedJob.builder()
                .user(actor)
                .job(job)
                .createdAt(LocalDateTime.now())
                .build());
        log.debug("User {} saved job {}", actor.getId(), jobId);
        return SavedJobResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<SavedJobResponse> list(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        return savedJobRepository.findByUserIdOrderByCreatedAtDesc(actor.getId()).stream()
                .map(SavedJobResponse::from)
                .toList();
    }

    /**
     * Remove a bookmark by its own id. Bookmarks of other users are reported as missing.
     */
    @Transactional
    public void unsave(Long actorId, Long savedJobId) {
        User actor = accountService.requireActiveUser(actorId);
        SavedJob savedJob = savedJobRepository.findByIdAndUserId(savedJobId, actor.getId())
                .orElseThrow(() -> NotFoundException.of("Saved job", savedJobId));
        savedJobRepository.delete(savedJob);
        log.debug("User {} removed saved job {}", actor.getId(), savedJobId);
    }

    @Transactional
    public void unsaveByJob(Long actorId, Long jobId) {
        User actor = accountService.requireActiveUser(actorId);
        SavedJob savedJob = savedJobRepository.findByUserIdAndJobId(actor.getId(), jobId)
                .orElseThrow(() -> new NotFoundException("Job is not saved: " + jobId));
        savedJobRepository.delete(savedJob);
    }

    @Transactional(readOnly = true)
    public boolean isSaved(Long actorId, Long jobId) {
        User actor = accountService.requireActiveUser(actorId);
        return savedJobRepository.existsByUserIdAndJobId(actor.getId(), jobId);
    }
}
