package dev.jobboard.model;

import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Public view of an account. Never carries the password hash.
 */
@Data
@Builder
public class UserResponse {
    private Long id;
    private String email;
    private String fullName;
    private String mobile;
    private Role role;
    private boolean verified;
    private boolean active;
    private LocalDateTime createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .mobile(user.getMobile())
                .role(user.getRole())
                .verified(user.isVerified())
                .active(user.isActive())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
