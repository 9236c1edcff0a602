package dev.marketbloom.exception;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error envelope shared by the exception handler and the authentication gates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    @Builder.Default
    private boolean success = false;

    private String message;

    public static ErrorResponse of(String message) {
        return ErrorResponse.builder().message(message).build();
    }
}
