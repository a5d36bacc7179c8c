package dev.jobboard.service;

import dev.jobboard.config.AlertsConfig;
import dev.jobboard.entity.AlertFrequency;
import dev.jobboard.entity.Job;
import dev.jobboard.entity.JobAlert;
import dev.jobboard.entity.NotificationType;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.metrics.JobBoardMetrics;
import dev.jobboard.model.JobAlertRequest;
import dev.jobboard.model.JobAlertResponse;
import dev.jobboard.model.JobResponse;
import dev.jobboard.model.JobSearchCriteria;
import dev.jobboard.repository.JobAlertRepository;
import dev.jobboard.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.hibernate.Hibernate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for saved searches and the periodic digest of newly matching jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobAlertService {

    private final JobAlertRepository alertRepository;
    private final JobRepository jobRepository;
    private final AccountService accountService;
    private final JobMatcher jobMatcher;
    private final NotificationService notificationService;
    private final EmailService emailService;
    private final AlertsConfig alertsConfig;
    private final JobBoardMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    /**
     * Outcome of one evaluation of all active alerts.
     */
    public record AlertRunSummary(int evaluated, int triggered, int matchedJobs, int emailsSent,
            int emailFailures, int alertFailures) {
    }

    private record AlertDigest(JobAlert alert, User owner, List<JobResponse> jobs, int matchCount) {
    }

    @Transactional
    public JobAlertResponse create(Long actorId, JobAlertRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        JobAlert candidate = JobAlert.builder().user(actor).build();
        applyRequest(candidate, request);
        rejectDuplicate(actor, candidate, null);

        LocalDateTime now = LocalDateTime.now();
        candidate.setMatchedJobsCount(0);
        candidate.setCreatedAt(now);
        candidate.setUpdatedAt(now);

        JobAlert saved = alertRepository.save(candidate);
        log.info("User {} created job alert {} '{}' ({})", actor.getId(), saved.getId(), saved.getTitle(),
                saved.getFrequency().value());
        return JobAlertResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<JobAlertResponse> list(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        return alertRepository.findByUserIdOrderByCreatedAtDesc(actor.getId()).stream()
                .map(JobAlertResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public JobAlertResponse get(Long actorId, Long alertId) {
        return JobAlertResponse.from(requireOwn(actorId, alertId));
    }

    @Transactional
    public JobAlertResponse update(Long actorId, Long alertId, JobAlertRequest request) {
        JobAlert alert = requireOwn(actorId, alertId);
        applyRequest(alert, request);
        rejectDuplicate(alert.getUser(), alert, alert.getId());
        alert.setUpdatedAt(LocalDateTime.now());
        log.info("Job alert {} updated", alertId);
        return JobAlertResponse.from(alertRepository.save(alert));
    }

    @Transactional
    public void delete(Long actorId, Long alertId) {
        JobAlert alert = requireOwn(actorId, alertId);
        alertRepository.delete(alert);
        log.info("Job alert {} deleted", alertId);
    }

    /**
     * Active jobs matching the alert, posted since it last fired (all of them when it never fired).
     */
    @Transactional(readOnly = true)
    public List<JobResponse> matches(Long actorId, Long alertId) {
        JobAlert alert = requireOwn(actorId, alertId);
        return findMatches(alert).stream().map(JobResponse::from).toList();
    }

    /**
     * Evaluate every active alert whose frequency window has elapsed and deliver the digests.
     * Each alert is matched and marked in its own transaction and its email goes out after that
     * commits, so a failing alert or a slow mail server never holds back or rolls back the others.
     *
     * @return Counts of the run
     */
    public AlertRunSummary evaluateDueAlerts() {
        return evaluateDueAlerts(LocalDateTime.now());
    }

    AlertRunSummary evaluateDueAlerts(LocalDateTime now) {
        List<Long> due = transactionTemplate.execute(status -> alertRepository.findByActiveTrue().stream()
                .filter(alert -> isDue(alert, now))
                .map(JobAlert::getId)
                .toList());
        if (due == null) {
            due = List.of();
        }

        int triggered = 0;
        int matchedJobs = 0;
        int sent = 0;
        int emailFailures = 0;
        int alertFailures = 0;

        for (Long alertId : due) {
            AlertDigest digest;
            try {
                digest = transactionTemplate.execute(status -> trigger(alertId, now));
            } catch (RuntimeException e) {
                alertFailures++;
                log.error("Alert {} could not be evaluated: {}", alertId, e.getMessage(), e);
                continue;
            }
            if (digest == null) {
                continue;
            }

            triggered++;
            matchedJobs += digest.matchCount();

            if (digest.alert().isEmailNotifications()) {
                if (deliver(digest)) {
                    sent++;
                    metrics.recordDigestSent();
                } else {
                    emailFailures++;
                    metrics.recordDigestFailure();
                }
            }
        }

        metrics.recordAlertsEvaluated(due.size());
        return new AlertRunSummary(due.size(), triggered, matchedJobs, sent, emailFailures, alertFailures);
    }

    /**
     * Match one alert, notify its owner in-app and mark it fired. Runs inside a transaction.
     *
     * @return The digest to mail once committed, or null when nothing new matched
     */
    private AlertDigest trigger(Long alertId, LocalDateTime now) {
        JobAlert alert = alertRepository.findById(alertId).orElse(null);
        if (alert == null || !alert.isActive()) {
            return null;
        }
        List<Job> matches = findMatches(alert);
        if (matches.isEmpty()) {
            log.debug("Alert {} matched no new jobs", alertId);
            return null;
        }

        User owner = alert.getUser();
        notificationService.notify(owner, NotificationType.JOB_ALERT,
                "New jobs for " + alert.getTitle(),
                matches.size() + " new job" + (matches.size() == 1 ? "" : "s") + " match your alert",
                alertId);

        alert.setLastTriggeredAt(now);
        alert.setMatchedJobsCount(matches.size());
        alertRepository.save(alert);

        List<JobResponse> jobs = matches.stream()
                .limit(Math.max(1, alertsConfig.getMaxJobsPerDigest()))
                .map(JobResponse::from)
                .toList();
        // Load the owner now; the mail is rendered after the session closes
        Hibernate.initialize(owner);
        return new AlertDigest(alert, owner, jobs, matches.size());
    }

    /**
     * An alert is due when it never fired or at least its frequency window in calendar days has
     * passed since the day it last did. Comparing dates keeps a daily run from skipping a day when
     * it starts a few milliseconds earlier than the previous one.
     */
    static boolean isDue(JobAlert alert, LocalDateTime now) {
        LocalDateTime last = alert.getLastTriggeredAt();
        if (last == null) {
            return true;
        }
        LocalDate nextDue = last.toLocalDate().plusDays(alert.getFrequency().window().toDays());
        return !nextDue.isAfter(now.toLocalDate());
    }

    static JobSearchCriteria toCriteria(JobAlert alert) {
        return JobSearchCriteria.builder()
                .keyword(alert.getKeyword())
                .location(alert.getLocation())
                .workMode(alert.getWorkMode())
                .minSalary(alert.getMinSalary())
                .skills(alert.getSkills())
                .build();
    }

    private boolean deliver(AlertDigest digest) {
        try {
            return Boolean.TRUE.equals(
                    emailService.sendJobAlertDigest(digest.owner(), digest.alert(), digest.jobs()).block());
        } catch (RuntimeException e) {
            log.warn("Alert digest {} could not be rendered or sent: {}", digest.alert().getId(), e.getMessage(), e);
            return false;
        }
    }

    private List<Job> findMatches(JobAlert alert) {
        List<Job> candidates = alert.getLastTriggeredAt() == null
                ? jobRepository.findByActiveTrueOrderByPostedAtDesc()
                : jobRepository.findByActiveTrueAndPostedAtAfterOrderByPostedAtDesc(alert.getLastTriggeredAt());
        JobSearchCriteria criteria = toCriteria(alert);
        return candidates.stream().filter(job -> jobMatcher.matches(job, criteria)).toList();
    }

    private void applyRequest(JobAlert alert, JobAlertRequest request) {
        alert.setTitle(request.getTitle().trim());
        alert.setKeyword(trimToNull(request.getKeyword()));
        alert.setLocation(trimToNull(request.getLocation()));
        alert.setWorkMode(request.getWorkMode());
        alert.setMinSalary(request.getMinSalary());
        alert.setSkills(new ArrayList<>(request.getSkills() == null ? List.of() : request.getSkills().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList()));
        alert.setFrequency(request.getFrequency() != null ? request.getFrequency() : AlertFrequency.DAILY);
        alert.setActive(request.isActive());
        alert.setEmailNotifications(request.isEmailNotifications());
    }

    private void rejectDuplicate(User owner, JobAlert candidate, Long ignoreId) {
        boolean duplicate = alertRepository.findByUserIdOrderByCreatedAtDesc(owner.getId()).stream()
                .filter(existing -> !existing.getId().equals(ignoreId))
                .anyMatch(existing -> sameCriteria(existing, candidate));
        if (duplicate) {
            throw new ConflictException("An alert with the same criteria already exists");
        }
    }

    static boolean sameCriteria(JobAlert a, JobAlert b) {
        return equalsIgnoreCase(a.getKeyword(), b.getKeyword())
                && equalsIgnoreCase(a.getLocation(), b.getLocation())
                && a.getWorkMode() == b.getWorkMode()
                && Objects.equals(a.getMinSalary(), b.getMinSalary())
                && skillSet(a).equals(skillSet(b));
    }

    private static boolean equalsIgnoreCase(String a, String b) {
        return a == null ? b == null : a.equalsIgnoreCase(b);
    }

    private static Set<String> skillSet(JobAlert alert) {
        return alert.getSkills().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private JobAlert requireOwn(Long actorId, Long alertId) {
        User actor = accountService.requireActiveUser(actorId);
        return alertRepository.findByIdAndUserId(alertId, actor.getId())
                .orElseThrow(() -> NotFoundException.of("Job alert", alertId));
    }

    private String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
