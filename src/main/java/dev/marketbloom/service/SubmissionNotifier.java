package dev.marketbloom.service;

import dev.marketbloom.entity.Submission;

/**
 * Announces a newly stored submission. Implementations must return immediately and
 * must never throw; delivery problems are theirs to log.
 */
public interface SubmissionNotifier {

    void notifyNewSubmission(Submission submission);
}
