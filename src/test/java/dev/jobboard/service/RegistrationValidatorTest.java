package dev.jobboard.service;

import dev.jobboard.config.PasswordPolicyConfig;
import dev.jobboard.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistrationValidatorTest {

    private PasswordPolicyConfig policy;
    private RegistrationValidator validator;

    @BeforeEach
    void setUp() {
        policy = new PasswordPolicyConfig();
        validator = new RegistrationValidator(policy);
    }

    @Test
    @DisplayName("Should trim and lower-case emails")
    void shouldNormalizeEmail() {
        assertThat(RegistrationValidator.normalizeEmail("  Jane.Doe@Example.COM ")).isEqualTo("jane.doe@example.com");
        assertThat(RegistrationValidator.normalizeEmail(null)).isNull();
    }

    @Test
    @DisplayName("Should reject malformed emails")
    void shouldRejectMalformedEmail() {
        assertThatThrownBy(() -> validator.validateEmail("not-an-email"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid email format");
        assertThatCode(() -> validator.validateEmail("jane@example.com")).doesNotThrowAnyException();
    }

    @Nested
    @DisplayName("Password policy")
    class PasswordTests {

        @Test
        @DisplayName("Should accept a strong password")
        void shouldAcceptStrongPassword() {
            assertThatCode(() -> validator.validatePassword("Secret#123")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should describe the policy when a rule is missed")
        void shouldDescribePolicy() {
            assertThatThrownBy(() -> validator.validatePassword("secret#123"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Password must be at least 8 characters, with 1 uppercase letter, 1 number, "
                            + "1 special character");
            assertThatThrownBy(() -> validator.validatePassword("Sec#1")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> validator.validatePassword("Secret1234")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should reject passwords longer than the byte limit")
        void shouldRejectTooManyBytes() {
            String longPassword = "Aa1#" + "x".repeat(69);

            assertThatThrownBy(() -> validator.validatePassword(longPassword))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("72 bytes");
        }

        @Test
        @DisplayName("Should follow a relaxed configuration")
        void shouldFollowConfiguration() {
            policy.setRequireSpecial(false);
            policy.setRequireUppercase(false);
            policy.setMinLength(6);

            assertThatCode(() -> validator.validatePassword("abc123")).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("Should accept a missing mobile and reject a malformed one")
    void shouldValidateMobile() {
        assertThatCode(() -> validator.validateMobile(null)).doesNotThrowAnyException();
        assertThatCode(() -> validator.validateMobile("9876543210")).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateMobile("12345"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Mobile number must be 10 digits");
    }
}
