package dev.marketbloom.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LeadMetrics {

    public static final String GATE_API_KEY = "api-key";
    public static final String GATE_ADMIN = "admin";
    public static final String REASON_MISSING = "missing";
    public static final String REASON_INVALID = "invalid";

    private final MeterRegistry meterRegistry;

    private Counter submissionCreatedCounter;
    private Counter submissionDeletedCounter;
    private Counter notificationSentCounter;
    private Counter notificationFailedCounter;
    private Counter notificationSkippedCounter;

    @PostConstruct
    public void init() {
        submissionCreatedCounter = Counter.builder("leads.submissions.created")
                .description("Contact form submissions stored")
                .register(meterRegistry);
        submissionDeletedCounter = Counter.builder("leads.submissions.deleted")
                .description("Submissions deleted by an admin")
                .register(meterRegistry);
        notificationSentCounter = notificationCounter("sent");
        notificationFailedCounter = notificationCounter("failed");
        notificationSkippedCounter = notificationCounter("skipped");
    }

    private Counter notificationCounter(String result) {
        return Counter.builder("leads.notifications")
                .description("Lead notification emails by outcome")
                .tag("result", result)
                .register(meterRegistry);
    }

    public void recordSubmissionCreated() {
        submissionCreatedCounter.increment();
    }

    public void recordSubmissionDeleted() {
        submissionDeletedCounter.increment();
    }

    public void recordNotificationSent() {
        notificationSentCounter.increment();
    }

    public void recordNotificationFailed() {
        notificationFailedCounter.increment();
    }

    public void recordNotificationSkipped() {
        notificationSkippedCounter.increment();
    }

    public void recordAuthRejected(String gate, String reason) {
        meterRegistry.counter("leads.auth.rejected", "gate", gate, "reason", reason).increment();
    }
}
