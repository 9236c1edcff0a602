package dev.marketbloom.service;

import dev.marketbloom.config.LeadCaptureProperties;
import dev.marketbloom.entity.Submission;
import dev.marketbloom.metrics.LeadMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Emails the lead inbox about each new submission. Disabled when SMTP credentials are
 * not configured. Sends are detached from the request and their failures only logged.
 */
@Service
@Slf4j
public class EmailSubmissionNotifier implements SubmissionNotifier {

    static final String TEMPLATE = "submission-notification";
    static final String NO_MESSAGE = "No additional message";

    private final EmailService emailService;
    private final EmailTemplateService templateService;
    private final LeadMetrics metrics;
    private final Clock clock;
    private final Scheduler scheduler;
    private final boolean enabled;
    private final String recipient;
    private final String brandName;
    private final ZoneId zoneId;
    private final DateTimeFormatter timeFormatter;

    @Autowired
    public EmailSubmissionNotifier(EmailService emailService,
                                   EmailTemplateService templateService,
                                   LeadMetrics metrics,
                                   LeadCaptureProperties properties,
                                   @Value("${spring.mail.username:}") String mailUsername,
                                   @Value("${spring.mail.password:}") String mailPassword) {
        this(emailService, templateService, metrics, properties, mailUsername, mailPassword,
                Clock.systemUTC(), Schedulers.boundedElastic());
    }

    EmailSubmissionNotifier(EmailService emailService,
                            EmailTemplateService templateService,
                            LeadMetrics metrics,
                            LeadCaptureProperties properties,
                            String mailUsername,
                            String mailPassword,
                            Clock clock,
                            Scheduler scheduler) {
        this.emailService = emailService;
        this.templateService = templateService;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = scheduler;
        LeadCaptureProperties.Notification notification = properties.notification();
        this.enabled = StringUtils.hasText(mailUsername) && StringUtils.hasText(mailPassword);
        this.recipient = StringUtils.hasText(notification.recipient()) ? notification.recipient() : mailUsername;
        this.brandName = notification.brandName();
        this.zoneId = ZoneId.of(notification.timeZone());
        this.timeFormatter = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM)
                .withLocale(Locale.forLanguageTag(notification.locale()));
        if (enabled) {
            log.info("Lead notifications enabled, sending to {}", recipient);
        } else {
            log.info("Lead notifications disabled: SMTP username or password not configured");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void notifyNewSubmission(Submission submission) {
        if (!enabled) {
            metrics.recordNotificationSkipped();
            log.debug("Skipping notification for submission {}", submission.getId());
            return;
        }
        Long id = submission.getId();
        // rendering and sending both happen off the request thread
        Mono.fromCallable(() -> render(submission))
                .subscribeOn(scheduler)
                .flatMap(html -> emailService.sendHtmlEmail(recipient, subjectFor(submission), html))
                .doOnSuccess(v -> {
                    metrics.recordNotificationSent();
                    log.info("Lead notification sent for submission {}", id);
                })
                .doOnError(e -> {
                    metrics.recordNotificationFailed();
                    log.error("Lead notification failed for submission {}: {}", id, e.getMessage());
                })
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    String subjectFor(Submission submission) {
        return "New Lead: " + submission.getBusiness() + " - " + brandName;
    }

    String render(Submission submission) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("brandName", brandName);
        variables.put("name", submission.getName());
        variables.put("business", submission.getBusiness());
        variables.put("service", submission.getService());
        variables.put("phone", submission.getPhone());
        variables.put("message", StringUtils.hasLength(submission.getMessage()) ? submission.getMessage() : NO_MESSAGE);
        variables.put("submissionId", submission.getId());
        variables.put("time", ZonedDateTime.now(clock).withZoneSameInstant(zoneId).format(timeFormatter));
        return templateService.render(TEMPLATE, variables);
    }
}
