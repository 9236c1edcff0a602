package dev.marketbloom.service;

import dev.marketbloom.config.ResilienceConfig;
import dev.marketbloom.dto.ContactRequest;
import dev.marketbloom.dto.SubmissionResponse;
import dev.marketbloom.entity.Submission;
import dev.marketbloom.exception.ResourceNotFoundException;
import dev.marketbloom.exception.SubmissionStoreException;
import dev.marketbloom.metrics.LeadMetrics;
import dev.marketbloom.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionService {

    static final String NOT_FOUND_MESSAGE = "Submission not found";

    private final SubmissionRepository submissionRepository;
    private final SubmissionNotifier notifier;
    private final ResilienceConfig resilience;
    private final LeadMetrics metrics;

    /**
     * Stores a validated contact request and fires the new-lead notification without
     * waiting for it.
     *
     * @return the id assigned by the store
     */
    public Mono<Long> createSubmission(ContactRequest request) {
        Submission submission = Submission.builder()
                .name(request.getName())
                .business(request.getBusiness())
                .service(request.getService())
                .phone(request.getPhone())
                .message(request.getMessage() != null ? request.getMessage() : "")
                .build();

        return submissionRepository.insertSubmission(submission)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Insert returned no generated id")))
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.error("Failed to store submission", e))
                .onErrorMap(SubmissionStoreException::new)
                .doOnNext(id -> {
                    submission.setId(id);
                    metrics.recordSubmissionCreated();
                    log.info("Submission saved with ID: {}", id);
                    log.debug("Submission {} from {} ({}) for {}", id, submission.getName(),
                            submission.getBusiness(), submission.getService());
                    dispatchNotification(submission);
                });
    }

    public Mono<List<SubmissionResponse>> listSubmissions() {
        return submissionRepository.findAllByOrderByTimestampDescIdDesc()
                .map(SubmissionResponse::from)
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.error("Failed to list submissions", e))
                .onErrorMap(SubmissionStoreException::new);
    }

    /**
     * Deletes a submission by its path id. Ids that are not numbers cannot match a row
     * and are reported as not found without a store round trip.
     */
    public Mono<Void> deleteSubmission(String rawId) {
        Long id = parseId(rawId);
        if (id == null) {
            log.debug("Delete requested for non-numeric submission id");
            return Mono.error(new ResourceNotFoundException(NOT_FOUND_MESSAGE));
        }
        return submissionRepository.deleteSubmissionById(id)
                .timeout(resilience.getDatabaseTimeout())
                .doOnError(e -> log.error("Failed to delete submission {}", id, e))
                .onErrorMap(SubmissionStoreException::new)
                .defaultIfEmpty(0L)
                .flatMap(deleted -> {
                    if (deleted == 0) {
                        return Mono.error(new ResourceNotFoundException(NOT_FOUND_MESSAGE));
                    }
                    metrics.recordSubmissionDeleted();
                    log.info("Submission {} deleted", id);
                    return Mono.<Void>empty();
                });
    }

    private void dispatchNotification(Submission submission) {
        try {
            notifier.notifyNewSubmission(submission);
        } catch (RuntimeException e) {
            log.error("Notification dispatch failed for submission {}", submission.getId(), e);
        }
    }

    private static Long parseId(String rawId) {
        if (rawId == null || rawId.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(rawId);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
