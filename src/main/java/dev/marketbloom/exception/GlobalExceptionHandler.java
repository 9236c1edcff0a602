package dev.marketbloom.exception;

import dev.marketbloom.config.FrontendResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.MethodNotAllowedException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    static final String INVALID_BODY_MESSAGE = "Invalid request body";
    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final FrontendResources frontendResources;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found on {}: {}", path(exchange), ex.getMessage());
        return Mono.just(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Mono<ErrorResponse> handleInvalidCredentials(InvalidCredentialsException ex, ServerWebExchange exchange) {
        log.warn("Authentication failed on {}", path(exchange));
        return Mono.just(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        // Every constraint on a request carries the same client message, so the first one wins.
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .filter(m -> m != null && !m.isBlank())
                .findFirst()
                .orElse(INVALID_BODY_MESSAGE);
        log.warn("Validation failed on {}: {}", path(exchange),
                ex.getBindingResult().getFieldErrors().stream().map(FieldError::getField).toList());
        return Mono.just(ErrorResponse.of(message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Unreadable request on {}: {}", path(exchange), ex.getReason());
        return Mono.just(ErrorResponse.of(INVALID_BODY_MESSAGE));
    }

    @ExceptionHandler(SubmissionStoreException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleStoreFailure(SubmissionStoreException ex, ServerWebExchange exchange) {
        // cause already logged where the store call failed
        return Mono.just(ErrorResponse.of(SubmissionStoreException.CLIENT_MESSAGE));
    }

    /**
     * A known API path called with a method it does not support is an unmatched request
     * like any other, so it gets the front-end entry document.
     */
    @ExceptionHandler(MethodNotAllowedException.class)
    public Mono<ResponseEntity<Resource>> handleMethodNotAllowed(MethodNotAllowedException ex, ServerWebExchange exchange) {
        log.debug("No {} route for {}, serving the front-end entry document",
                exchange.getRequest().getMethod(), path(exchange));
        Resource entryDocument = frontendResources.entryDocument();
        if (!entryDocument.exists()) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        MediaType mediaType = FrontendResources.mediaTypeOf(entryDocument);
        return Mono.just(ResponseEntity.ok()
                .contentType(mediaType)
                .cacheControl(FrontendResources.cacheControlFor(mediaType))
                .body(entryDocument));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        log.debug("{} on {}", status, path(exchange));
        HttpStatus known = HttpStatus.resolve(status.value());
        String reason = ex.getReason() != null ? ex.getReason()
                : known != null ? known.getReasonPhrase() : "Request failed";
        return Mono.just(ResponseEntity.status(status).body(ErrorResponse.of(reason)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}", path(exchange), ex);
        return Mono.just(ErrorResponse.of(INTERNAL_ERROR_MESSAGE));
    }

    private static String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }
}
