package dev.jobboard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Slf4j
@Configuration
public class PasswordEncoderConfig {

    @Bean
    public PasswordEncoder passwordEncoder(PasswordPolicyConfig policy) {
        log.info("Using BCrypt password hashing with strength {}", policy.getBcryptStrength());
        return new BCryptPasswordEncoder(policy.getBcryptStrength());
    }
}
