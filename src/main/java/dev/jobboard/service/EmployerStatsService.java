package dev.jobboard.service;

import dev.jobboard.entity.Job;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.model.EmployerStats;
import dev.jobboard.repository.ApplicationRepository;
import dev.jobboard.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Dashboard totals for an employer.
 */
@Service
@RequiredArgsConstructor
public class EmployerStatsService {

    private final JobRepository jobRepository;
    private final ApplicationRepository applicationRepository;
    private final AccountService accountService;

    @Transactional(readOnly = true)
    public EmployerStats stats(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireRole(actor, "view employer statistics", Role.EMPLOYER);

        List<Job> jobs = jobRepository.findByPostedByIdOrderByPostedAtDesc(actor.getId());
        Map<String, Long> byStatus = ApplicationService.toStatusMap(
                applicationRepository.countByStatusForEmployer(actor.getId()));

        return EmployerStats.builder()
                .totalJobs(jobs.size())
                .activeJobs((int) jobs.stream().filter(Job::isActive).count())
                .totalApplications(byStatus.values().stream().mapToLong(Long::longValue).sum())
                .totalViews(jobs.stream().mapToLong(Job::getViewCount).sum())
                .applicationsByStatus(byStatus)
                .build();
    }
}
