package dev.marketbloom.exception;

/**
 * A submission store call failed or timed out. The message is safe to return to
 * clients; driver detail stays in the cause.
 */
public class SubmissionStoreException extends RuntimeException {

    public static final String CLIENT_MESSAGE = "Database error";

    public SubmissionStoreException(Throwable cause) {
        super(CLIENT_MESSAGE, cause);
    }
}
