package dev.marketbloom.service;

import dev.marketbloom.config.LeadCaptureProperties;
import dev.marketbloom.config.ResilienceConfig;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * SMTP delivery. {@link JavaMailSender} blocks, so every send is moved to the
 * bounded elastic scheduler and capped by the external call timeout.
 */
@Service
@Slf4j
public class EmailService {

    private final JavaMailSender mailSender;
    private final ResilienceConfig resilience;
    private final String fromEmail;
    private final String fromName;

    public EmailService(JavaMailSender mailSender,
                        ResilienceConfig resilience,
                        LeadCaptureProperties properties,
                        @Value("${spring.mail.username:}") String fromEmail) {
        this.mailSender = mailSender;
        this.resilience = resilience;
        this.fromEmail = fromEmail;
        this.fromName = properties.notification().brandName();
    }

    /**
     * Send an HTML email from the configured SMTP account.
     */
    public Mono<Void> sendHtmlEmail(String to, String subject, String htmlContent) {
        return Mono.<Void>fromRunnable(() -> {
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

                helper.setFrom(fromEmail, fromName);
                helper.setTo(to);
                helper.setSubject(subject);
                helper.setText(htmlContent, true);

                mailSender.send(message);
                log.debug("HTML email sent to: {}", to);
            } catch (Exception e) {
                log.warn("Failed to send HTML email to {}: {}", to, e.getMessage());
                throw new IllegalStateException("Failed to send email", e);
            }
        }).subscribeOn(Schedulers.boundedElastic())
                .timeout(resilience.getExternalTimeout());
    }
}
