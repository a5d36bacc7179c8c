package dev.jobboard.metrics;

import dev.jobboard.entity.ApplicationStatus;
import dev.jobboard.entity.Role;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JobBoardMetricsTest {

    private MeterRegistry meterRegistry;
    private JobBoardMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new JobBoardMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Activity counters")
    class ActivityCounterTests {

        @Test
        @DisplayName("Should record registrations by role")
        void shouldRecordRegistrationsByRole() {
            metrics.recordRegistration(Role.EMPLOYER);
            metrics.recordRegistration(Role.EMPLOYER);
            metrics.recordRegistration(Role.JOB_SEEKER);

            assertThat(meterRegistry.counter("job_board_users_registered_total", "role", "employer").count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_board_users_registered_total", "role", "job_seeker").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record job and application activity")
        void shouldRecordActivity() {
            metrics.recordJobPosted();
            metrics.recordJobView();
            metrics.recordJobView();
            metrics.recordApplicationSubmitted();
            metrics.recordApplicationWithdrawn();
            metrics.recordLoginFailure();

            assertThat(meterRegistry.counter("job_board_jobs_posted_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_board_job_views_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_board_applications_submitted_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_board_applications_withdrawn_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_board_login_failures_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record status changes by status")
        void shouldRecordStatusChanges() {
            metrics.recordStatusChange(ApplicationStatus.INTERVIEW);

            assertThat(meterRegistry.counter("job_board_application_status_changes_total", "status", "interview")
                    .count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Alert run")
    class AlertRunTests {

        @Test
        @DisplayName("Should record digests and evaluated alerts")
        void shouldRecordDigests() {
            metrics.recordAlertsEvaluated(4);
            metrics.recordDigestSent();
            metrics.recordDigestFailure();

            assertThat(meterRegistry.counter("job_board_alerts_evaluated_total").count()).isEqualTo(4.0);
            assertThat(meterRegistry.counter("job_board_alert_digests_sent_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_board_alert_digest_failures_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should update the last run gauge and timer")
        void shouldUpdateLastRun() {
            metrics.updateLastAlertRun(7, 1500);

            assertThat(meterRegistry.get("job_board_last_alert_run_matches").gauge().value()).isEqualTo(7.0);
            assertThat(meterRegistry.timer("job_board_alert_run_duration").totalTime(TimeUnit.MILLISECONDS))
                    .isEqualTo(1500.0);
        }
    }
}
