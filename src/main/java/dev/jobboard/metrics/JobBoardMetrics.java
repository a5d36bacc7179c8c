package dev.jobboard.metrics;

import dev.jobboard.entity.ApplicationStatus;
import dev.jobboard.entity.Role;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for job board activity.
 */
@Component
public class JobBoardMetrics {

    private static final String TAG_ROLE = "role";
    private static final String TAG_STATUS = "status";
    private final MeterRegistry registry;

    // Counters
    private final Counter loginFailuresCounter;
    private final Counter jobsPostedCounter;
    private final Counter jobViewsCounter;
    private final Counter applicationsSubmittedCounter;
    private final Counter applicationsWithdrawnCounter;
    private final Counter alertsEvaluatedCounter;
    private final Counter alertDigestsSentCounter;
    private final Counter alertDigestFailuresCounter;

    private final Timer alertRunTimer;

    // Gauges
    private final AtomicInteger lastAlertRunMatches = new AtomicInteger(0);

    public JobBoardMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.loginFailuresCounter = Counter.builder("job_board_login_failures_total")
                .description("Rejected login attempts")
                .register(registry);

        this.jobsPostedCounter = Counter.builder("job_board_jobs_posted_total")
                .description("Job postings created")
                .register(registry);

        this.jobViewsCounter = Counter.builder("job_board_job_views_total")
                .description("Job detail views")
                .register(registry);

        this.applicationsSubmittedCounter = Counter.builder("job_board_applications_submitted_total")
                .description("Applications submitted by job seekers")
                .register(registry);

        this.applicationsWithdrawnCounter = Counter.builder("job_board_applications_withdrawn_total")
                .description("Applications withdrawn")
                .register(registry);

        // Alerts
        this.alertsEvaluatedCounter = Counter.builder("job_board_alerts_evaluated_total")
                .description("Job alerts evaluated by the scheduler")
                .register(registry);

        this.alertDigestsSentCounter = Counter.builder("job_board_alert_digests_sent_total")
                .description("Job alert digest emails sent")
                .register(registry);

        this.alertDigestFailuresCounter = Counter.builder("job_board_alert_digest_failures_total")
                .description("Job alert digest emails that failed to send")
                .register(registry);

        this.alertRunTimer = Timer.builder("job_board_alert_run_duration")
                .description("Time to evaluate all active job alerts")
                .register(registry);

        Gauge.builder("job_board_last_alert_run_matches", lastAlertRunMatches, AtomicInteger::get)
                .description("Jobs matched across all alerts in the last run")
                .register(registry);
    }

    /**
     * Record a new account, tagged by role.
     */
    public void recordRegistration(Role role) {
        Counter.builder("job_board_users_registered_total")
                .description("Accounts registered")
                .tag(TAG_ROLE, role.value())
                .register(registry)
                .increment();
    }

    public void recordLoginFailure() {
        loginFailuresCounter.increment();
    }

    public void recordJobPosted() {
        jobsPostedCounter.increment();
    }

    public void recordJobView() {
        jobViewsCounter.increment();
    }

    public void recordApplicationSubmitted() {
        applicationsSubmittedCounter.increment();
    }

    public void recordApplicationWithdrawn() {
        applicationsWithdrawnCounter.increment();
    }

    /**
     * Record an application moving to a new status.
     */
    public void recordStatusChange(ApplicationStatus status) {
        Counter.builder("job_board_application_status_changes_total")
                .description("Application status transitions")
                .tag(TAG_STATUS, status.value())
                .register(registry)
                .increment();
    }

    public void recordAlertsEvaluated(int count) {
        alertsEvaluatedCounter.increment(count);
    }

    public void recordDigestSent() {
        alertDigestsSentCounter.increment();
    }

    public void recordDigestFailure() {
        alertDigestFailuresCounter.increment();
    }

    /**
     * Update statistics of the last alert run.
     */
    public void updateLastAlertRun(int matchedJobs, long durationMs) {
        lastAlertRunMatches.set(matchedJobs);
        alertRunTimer.record(Duration.ofMillis(durationMs));
    }
}
