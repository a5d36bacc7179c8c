package dev.jobboard.service;

import dev.jobboard.TestData;
import dev.jobboard.entity.JobAlert;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.entity.WorkMode;
import dev.jobboard.model.JobResponse;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.util.ReflectionTestUtils;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.IContext;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailServiceTest {

    @Mock
    private JavaMailSender mailSender;

    @Mock
    private TemplateEngine templateEngine;

    private EmailService emailService;
    private MimeMessage mimeMessage;
    private User recipient;
    private JobAlert alert;
    private List<JobResponse> jobs;

    @BeforeEach
    void setUp() {
        emailService = new EmailService(mailSender, templateEngine);
        ReflectionTestUtils.setField(emailService, "fromEmail", "alerts@jobboard.local");
        mimeMessage = new MimeMessage(Session.getInstance(new Properties()));

        recipient = TestData.user(2L, Role.JOB_SEEKER);
        alert = TestData.alert(3L, recipient, "java");
        alert.setTitle("Java jobs");
        User employer = TestData.user(1L, Role.EMPLOYER);
        JobResponse remote = JobResponse.from(TestData.job(10L, employer, "Java Developer"));
        remote.setWorkMode(WorkMode.REMOTE);
        jobs = List.of(remote, JobResponse.from(TestData.job(11L, employer, "Java Engineer")));
    }

    @Nested
    @DisplayName("Send alert digest")
    class SendDigestTests {

        @Test
        @DisplayName("Should send the digest to the alert owner")
        void shouldSendDigest() throws Exception {
            when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
            when(templateEngine.process(eq(EmailService.DIGEST_TEMPLATE), any(IContext.class)))
                    .thenReturn("<html>digest</html>");

            StepVerifier.create(emailService.sendJobAlertDigest(recipient, alert, jobs))
                    .expectNext(true)
                    .verifyComplete();

            verify(mailSender).send(mimeMessage);
            assertThat(mimeMessage.getSubject()).isEqualTo("2 new jobs for \"Java jobs\"");
            assertThat(mimeMessage.getRecipients(Message.RecipientType.TO)[0].toString())
                    .isEqualTo("user2@example.com");
        }

        @Test
        @DisplayName("Should pass the digest data to the template")
        void shouldFillTemplate() {
            when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
            ArgumentCaptor<IContext> contextCaptor = ArgumentCaptor.forClass(IContext.class);
            when(templateEngine.process(eq(EmailService.DIGEST_TEMPLATE), contextCaptor.capture()))
                    .thenReturn("<html>digest</html>");

            emailService.sendJobAlertDigest(recipient, alert, jobs).block();

            IContext context = contextCaptor.getValue();
            assertThat(context.getVariable("alertTitle")).isEqualTo("Java jobs");
            assertThat(context.getVariable("jobCount")).isEqualTo(2);
            assertThat(context.getVariable("remoteCount")).isEqualTo(1L);
            assertThat(context.getVariable("recipientName")).isEqualTo("User 2");
        }

        @Test
        @DisplayName("Should return false when sending fails")
        void shouldReturnFalseOnMailException() {
            when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
            when(templateEngine.process(eq(EmailService.DIGEST_TEMPLATE), any(IContext.class)))
                    .thenReturn("<html>digest</html>");
            doThrow(new MailSendException("SMTP error")).when(mailSender).send(any(MimeMessage.class));

            StepVerifier.create(emailService.sendJobAlertDigest(recipient, alert, jobs))
                    .expectNext(false)
                    .verifyComplete();
        }
    }
}
