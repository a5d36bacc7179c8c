package dev.jobboard.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private JavaMailSender mailSender;

  @Autowired
  private PasswordPolicyConfig passwordPolicyConfig;

  @Autowired
  private PaginationConfig paginationConfig;

  @Autowired
  private AlertsConfig alertsConfig;

  @Autowired
  private ProfileCompletionConfig profileCompletionConfig;

  @Autowired
  private JwtConfig jwtConfig;

  @Test
  void shouldLoadJwtConfig() {
    assertThat(jwtConfig.getSecret()).isEqualTo("job-board-test-secret-0123456789abcdef");
    assertThat(jwtConfig.getIssuer()).isEqualTo("job-board");
    assertThat(jwtConfig.getAccessTokenTtl()).isEqualTo(Duration.ofMinutes(30));
  }

  @Test
  void shouldLoadPasswordPolicyConfig() {
    assertThat(passwordPolicyConfig.getBcryptStrength()).isEqualTo(4);
    assertThat(passwordPolicyConfig.getMinLength()).isEqualTo(8);
    assertThat(passwordPolicyConfig.getMaxBytes()).isEqualTo(72);
  }

  @Test
  void shouldLoadPaginationConfig() {
    assertThat(paginationConfig.getDefaultSize()).isEqualTo(10);
    assertThat(paginationConfig.getMaxSize()).isEqualTo(50);
  }

  @Test
  void shouldLoadAlertsConfig() {
    assertThat(alertsConfig.isEnabled()).isFalse();
    assertThat(alertsConfig.getCron()).isEqualTo("0 0 6 * * *");
    assertThat(alertsConfig.getMaxJobsPerDigest()).isEqualTo(5);
  }

  @Test
  void shouldLoadProfileCompletionConfig() {
    assertThat(profileCompletionConfig.getRequiredWeight()).isGreaterThan(0);
    assertThat(profileCompletionConfig.getOptionalWeight()).isGreaterThan(0);
  }
}
