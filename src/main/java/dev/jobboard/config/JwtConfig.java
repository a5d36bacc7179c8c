package dev.jobboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the signed access tokens handed out at login.
 * Loaded from application.yml under 'security.jwt' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "security.jwt")
public class JwtConfig {

    /** HMAC secret, at least 32 bytes. A random key is generated when blank. */
    private String secret;
    private String issuer = "job-board";
    private Duration accessTokenTtl = Duration.ofMinutes(30);
}
