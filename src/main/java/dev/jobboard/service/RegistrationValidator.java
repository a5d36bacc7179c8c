package dev.jobboard.service;

import dev.jobboard.config.PasswordPolicyConfig;
import dev.jobboard.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates the email, password and mobile number given at registration.
 */
@Component
@RequiredArgsConstructor
public class RegistrationValidator {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Pattern MOBILE_PATTERN = Pattern.compile("^\\d{10}$");
    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern SPECIAL = Pattern.compile("[^A-Za-z0-9]");

    private final PasswordPolicyConfig policy;

    /**
     * Trim and lower-case an email so uniqueness is case-insensitive.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public void validateEmail(String email) {
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            throw new ValidationException("Invalid email format");
        }
    }

    public void validatePassword(String password) {
        if (password == null) {
            throw new ValidationException("Password is required");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > policy.getMaxBytes()) {
            throw new ValidationException(
                    "Password cannot be longer than " + policy.getMaxBytes() + " bytes");
        }
        boolean strong = password.length() >= policy.getMinLength()
                && (!policy.isRequireUppercase() || UPPERCASE.matcher(password).find())
                && (!policy.isRequireDigit() || DIGIT.matcher(password).find())
                && (!policy.isRequireSpecial() || SPECIAL.matcher(password).find());
        if (!strong) {
            throw new ValidationException(describePolicy());
        }
    }

    /**
     * Mobile numbers are optional; when present they must be exactly 10 digits.
     */
    public void validateMobile(String mobile) {
        if (mobile != null && !mobile.isBlank() && !MOBILE_PATTERN.matcher(mobile.trim()).matches()) {
            throw new ValidationException("Mobile number must be 10 digits");
        }
    }

    private String describePolicy() {
        StringBuilder message = new StringBuilder("Password must be at least ")
                .append(policy.getMinLength()).append(" characters");
        if (policy.isRequireUppercase()) {
            message.append(", with 1 uppercase letter");
        }
        if (policy.isRequireDigit()) {
            message.append(", 1 number");
        }
        if (policy.isRequireSpecial()) {
            message.append(", 1 special character");
        }
        return message.toString();
    }
}
