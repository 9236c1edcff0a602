package dev.marketbloom.exception;

/**
 * Raised when the admin login password does not match.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
