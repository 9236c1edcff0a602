package dev.marketbloom.repository;

import dev.marketbloom.entity.Submission;
import reactor.core.publisher.Mono;

/**
 * Insert path that leaves {@code timestamp} and {@code status} to the column defaults,
 * so the store clock stamps every row.
 */
public interface SubmissionInsertOperations {

    /**
     * Inserts the caller-supplied fields of a submission.
     *
     * @return the generated id
     */
    Mono<Long> insertSubmission(Submission submission);
}
