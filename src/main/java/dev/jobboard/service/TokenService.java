package dev.jobboard.service;

import dev.jobboard.config.JwtConfig;
import dev.jobboard.entity.User;
import dev.jobboard.model.LoginResponse;
import dev.jobboard.model.UserResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Issues signed access tokens. The subject is the user id; role and email ride along as claims.
 */
@Service
@RequiredArgsConstructor
public class TokenService {

    static final String TOKEN_TYPE = "Bearer";

    private final JwtEncoder jwtEncoder;
    private final JwtConfig jwtConfig;

    public LoginResponse issue(User user) {
        return issue(user, Instant.now());
    }

    public LoginResponse issue(User user, Instant issuedAt) {
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(jwtConfig.getIssuer())
                .subject(String.valueOf(user.getId()))
                .issuedAt(issuedAt)
                .expiresAt(issuedAt.plus(jwtConfig.getAccessTokenTtl()))
                .claim("email", user.getEmail())
                .claim("role", user.getRole().value())
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();

        return LoginResponse.builder()
                .accessToken(token)
                .tokenType(TOKEN_TYPE)
                .expiresIn(jwtConfig.getAccessTokenTtl().toSeconds())
                .user(UserResponse.from(user))
                .build();
    }
}
