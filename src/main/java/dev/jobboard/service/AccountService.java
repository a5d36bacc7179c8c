package dev.jobboard.service;

import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.ForbiddenException;
import dev.jobboard.exception.UnauthorizedException;
import dev.jobboard.metrics.JobBoardMetrics;
import dev.jobboard.model.LoginRequest;
import dev.jobboard.model.LoginResponse;
import dev.jobboard.model.RegisterRequest;
import dev.jobboard.model.UserResponse;
import dev.jobboard.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Service for registration, login and resolving the acting user of a request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final RegistrationValidator validator;
    private final TokenService tokenService;
    private final JobBoardMetrics metrics;

    /**
     * Register a new account.
     *
     * @param request Registration data
     * @return The created account
     */
    @Transactional
    public UserResponse register(RegisterRequest request) {
        String email = RegistrationValidator.normalizeEmail(request.getEmail());
        validator.validateEmail(email);
        validator.validatePassword(request.getPassword());
        validator.validateMobile(request.getMobile());

        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("Email already exists");
        }

        LocalDateTime now = LocalDateTime.now();
        User user = User.builder()
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .fullName(request.getFullName().trim())
                .mobile(request.getMobile() != null && !request.getMobile().isBlank()
                        ? request.getMobile().trim() : null)
                .role(request.getRole())
                .verified(false)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();

        User saved = userRepository.save(user);
        metrics.recordRegistration(saved.getRole());
        log.info("Registered {} account {}", saved.getRole().value(), saved.getId());
        return UserResponse.from(saved);
    }

    /**
     * Check credentials and issue an access token.
     *
     * @return Bearer token and account summary when email and password match
     */
    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        String email = RegistrationValidator.normalizeEmail(request.getEmail());
        User user = userRepository.findByEmail(email).orElse(null);

        if (user == null || !passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            metrics.recordLoginFailure();
            log.debug("Rejected login for {}", email);
            throw new UnauthorizedException("Invalid credentials");
        }
        if (!user.isActive()) {
            metrics.recordLoginFailure();
            throw new ForbiddenException("Account is deactivated");
        }

        log.info("User {} logged in", user.getId());
        return tokenService.issue(user);
    }

    /**
     * Resolve the acting user of a request.
     *
     * @param userId Subject of the request's verified access token, null when none was sent
     * @return The active account
     */
    @Transactional(readOnly = true)
    public User requireActiveUser(Long userId) {
        if (userId == null) {
            throw new UnauthorizedException("Authentication required");
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UnauthorizedException("Unknown user: " + userId));
        if (!user.isActive()) {
            throw new ForbiddenException("Account is deactivated");
        }
        return user;
    }

    @Transactional(readOnly = true)
    public UserResponse me(Long actorId) {
        return UserResponse.from(requireActiveUser(actorId));
    }
}
