package dev.jobboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the scheduled job-alert digest.
 * Loaded from application.yml under 'alerts' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "alerts")
public class AlertsConfig {

    private boolean enabled = true;
    private String cron = "0 0 7 * * *";
    private int maxJobsPerDigest = 20;
}
