package dev.jobboard.config;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.security.oauth2.jwt.NimbusReactiveJwtDecoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * HS256 signing and verification of access tokens.
 */
@Slf4j
@Configuration
public class TokenConfig {

    static final int MIN_SECRET_BYTES = 32;

    @Bean
    public SecretKey jwtSigningKey(JwtConfig config) {
        byte[] secret;
        if (config.getSecret() == null || config.getSecret().isBlank()) {
            log.warn("security.jwt.secret is not set, using a random key: tokens will not survive a restart");
            secret = new byte[MIN_SECRET_BYTES];
            new SecureRandom().nextBytes(secret);
        } else {
            secret = config.getSecret().getBytes(StandardCharsets.UTF_8);
            if (secret.length < MIN_SECRET_BYTES) {
                throw new IllegalStateException(
                        "security.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
        }
        return new SecretKeySpec(secret, "HmacSHA256");
    }

    @Bean
    public JwtEncoder jwtEncoder(SecretKey jwtSigningKey) {
        return new NimbusJwtEncoder(new ImmutableSecret<>(jwtSigningKey));
    }

    @Bean
    public ReactiveJwtDecoder jwtDecoder(SecretKey jwtSigningKey, JwtConfig config) {
        NimbusReactiveJwtDecoder decoder = NimbusReactiveJwtDecoder.withSecretKey(jwtSigningKey)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(config.getIssuer()));
        return decoder;
    }
}
