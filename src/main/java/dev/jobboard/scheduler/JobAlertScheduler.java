package dev.jobboard.scheduler;

import dev.jobboard.metrics.JobBoardMetrics;
import dev.jobboard.service.JobAlertService;
import dev.jobboard.service.JobAlertService.AlertRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the job-alert digest on the configured cron.
 * Disabled with {@code alerts.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "alerts", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobAlertScheduler {

    private static final String SEPARATOR = "========================================";

    private final JobAlertService jobAlertService;
    private final JobBoardMetrics metrics;

    /**
     * Evaluate all due alerts once.
     *
     * @return Summary of the run, or null when it failed
     */
    @Scheduled(cron = "${alerts.cron:0 0 7 * * *}")
    public AlertRunSummary run() {
        log.info(SEPARATOR);
        log.info("Job alert digest starting");
        log.info(SEPARATOR);

        long start = System.currentTimeMillis();
        try {
            AlertRunSummary summary = jobAlertService.evaluateDueAlerts();
            long duration = System.currentTimeMillis() - start;
            metrics.updateLastAlertRun(summary.matchedJobs(), duration);

            log.info(SEPARATOR);
            log.info("Job alert digest completed in {} ms", duration);
            log.info("Alerts evaluated: {}, triggered: {}", summary.evaluated(), summary.triggered());
            log.info("Jobs matched: {}, emails sent: {}, email failures: {}", summary.matchedJobs(),
                    summary.emailsSent(), summary.emailFailures());
            if (summary.alertFailures() > 0) {
                log.warn("Alerts that failed to evaluate: {}", summary.alertFailures());
            }
            log.info(SEPARATOR);
            return summary;
        } catch (RuntimeException e) {
            // the next scheduled run retries
            log.error("Job alert digest failed: {}", e.getMessage(), e);
            return null;
        }
    }
}
