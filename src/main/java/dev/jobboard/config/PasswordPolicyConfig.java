package dev.jobboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Password rules applied at registration.
 * Loaded from application.yml under 'security.password' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "security.password")
public class PasswordPolicyConfig {

    private int minLength = 8;
    // BCrypt ignores everything past 72 bytes
    private int maxBytes = 72;
    private boolean requireUppercase = true;
    private boolean requireDigit = true;
    private boolean requireSpecial = true;
    private int bcryptStrength = 10;
}
