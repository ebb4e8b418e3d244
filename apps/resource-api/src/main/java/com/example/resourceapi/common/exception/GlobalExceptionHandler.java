package com.example.resourceapi.common.exception;

import com.example.resourceapi.exception.ErrorResponse;
import com.example.resourceapi.security.exception.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Maps the resource error taxonomy to HTTP statuses and keeps internal detail out of responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 200;

    /**
     * Handles validation, forbidden, not-found and internal resource errors.
     *
     * @param ex       the exception
     * @param exchange the current exchange
     * @return error response with the status of the error kind
     */
    @ExceptionHandler(ResourceException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleResource(@NonNull ResourceException ex,
                                                        @NonNull ServerWebExchange exchange) {
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.INTERNAL) {
            // cause was logged where it was wrapped
            LOG.error("Internal error: {}", sanitizeForLog(ex.getMessage()));
        } else {
            LOG.warn("{}: {}", kind.getCode(), sanitizeForLog(ex.getMessage()));
        }
        return respond(kind.getStatus(), kind.getCode(), ex.getMessage(), exchange);
    }

    /**
     * Handles authentication failures that reach a controller.
     */
    @ExceptionHandler(AuthenticationException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleAuthentication(@NonNull AuthenticationException ex,
                                                              @NonNull ServerWebExchange exchange) {
        LOG.warn("Authentication failed: {}", sanitizeForLog(ex.getMessage()));
        return respond(HttpStatus.UNAUTHORIZED, "authentication_error", "Authentication required", exchange);
    }

    /**
     * Handles bean validation failures on request bodies.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleBind(@NonNull WebExchangeBindException ex,
                                                    @NonNull ServerWebExchange exchange) {
        String fieldErrors = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOG.warn("Validation failed: {}", sanitizeForLog(fieldErrors));
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION.getCode(),
                "Validation failed: " + fieldErrors, exchange);
    }

    /**
     * Handles malformed request bodies or type conversion errors.
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleInput(@NonNull ServerWebInputException ex,
                                                     @NonNull ServerWebExchange exchange) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format", exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleResponseStatus(@NonNull ResponseStatusException ex,
                                                              @NonNull ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        LOG.warn("Response status exception: status={}, reason={}", status, sanitizeForLog(ex.getReason()));
        return respond(status, "request_error",
                ex.getReason() != null ? ex.getReason() : status.getReasonPhrase(), exchange);
    }

    /**
     * Handles all unhandled exceptions.
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleGeneral(@NonNull Exception ex,
                                                       @NonNull ServerWebExchange exchange) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL.getCode(),
                "An unexpected error occurred", exchange);
    }

    @NonNull
    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, @Nullable String message,
                                                  ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, sanitizeResponseMessage(message),
                exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }

    @NonNull
    private String sanitizeForLog(@Nullable String value) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");

        if (sanitized.length() > MAX_LOG_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_LOG_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Request failed";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
