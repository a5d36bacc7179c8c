package dev.jobboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Weights used to compute a job seeker's profile completion percentage.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "profile.completion")
public class ProfileCompletionConfig {

    /** Weight of the account fields every profile must have (name, email). */
    private int requiredWeight = 2;
    private int optionalWeight = 1;
}
