package dev.jobboard.service;

import dev.jobboard.entity.JobAlert;
import dev.jobboard.entity.User;
import dev.jobboard.entity.WorkMode;
import dev.jobboard.model.JobResponse;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Service for sending job-alert digest emails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailService {

    static final String DIGEST_TEMPLATE = "email/job-alert-digest";

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;

    @Value("${spring.mail.username}")
    private String fromEmail;

    /**
     * Send the jobs matched by an alert to the alert's owner.
     *
     * @param recipient Owner of the alert
     * @param alert     The alert that matched
     * @param jobs      Matched jobs, newest first
     * @return Mono<Boolean> indicating success or failure
     */
    @SuppressWarnings("null")
    public Mono<Boolean> sendJobAlertDigest(User recipient, JobAlert alert, List<JobResponse> jobs) {
        return Mono.fromCallable(() -> {
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

                String subject = String.format("%d new job%s for \"%s\"",
                        jobs.size(), jobs.size() == 1 ? "" : "s", alert.getTitle());

                helper.setFrom(fromEmail);
                helper.setTo(recipient.getEmail());
                helper.setSubject(subject);
                helper.setText(generateEmailContent(recipient, alert, jobs), true);

                mailSender.send(message);
                log.info("Alert digest {} sent to user {}", alert.getId(), recipient.getId());
                return true;

            } catch (MessagingException | MailException e) {
                log.error("Failed to send alert digest {}: {}", alert.getId(), e.getMessage(), e);
                return false;
            }
        });
    }

    private String generateEmailContent(User recipient, JobAlert alert, List<JobResponse> jobs) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("recipientName", recipient.getFullName());
        context.setVariable("alertTitle", alert.getTitle());
        context.setVariable("jobs", jobs);
        context.setVariable("jobCount", jobs.size());
        context.setVariable("date", LocalDate.now().format(DateTimeFormatter.ofPattern("MMMM d, yyyy")));
        context.setVariable("remoteCount", jobs.stream().filter(j -> j.getWorkMode() == WorkMode.REMOTE).count());

        return templateEngine.process(DIGEST_TEMPLATE, context);
    }
}
