package dev.jobboard.model;

import lombok.Builder;
import lombok.Data;

/**
 * Access token returned by a successful login.
 */
@Data
@Builder
public class LoginResponse {
    private String accessToken;
    private String tokenType;
    /** Seconds until the token expires. */
    private long expiresIn;
    private UserResponse user;
}
