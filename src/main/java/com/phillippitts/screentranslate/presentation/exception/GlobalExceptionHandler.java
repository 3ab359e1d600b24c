package com.phillippitts.screentranslate.presentation.exception;

import com.phillippitts.screentranslate.exception.FlowException;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * <p>Converts domain exceptions to HTTP responses. Provider diagnostics are passed through as
 * details together with a recovery suggestion; request text and credentials never are.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Translation engine failure: 400 for configuration or input problems, 429 when rate
     * limited, 502 otherwise.
     */
    @ExceptionHandler(TranslationProviderException.class)
    ResponseEntity<ApiError> handleProviderFailure(TranslationProviderException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case EMPTY_INPUT, INVALID_CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case NOT_AVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_GATEWAY;
        };
        LOG.warn("Translation failed: engine={}, kind={}", ex.getEngineId(), ex.getKind());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        ex.getRetryAfter().ifPresent(d -> builder.header(HttpHeaders.RETRY_AFTER, Long.toString(d.toSeconds())));
        return builder.body(new ApiError(
                ex.getKind().name(),
                ex.getMessage(),
                ex.getRecoverySuggestion(),
                Instant.now()
        ));
    }

    /**
     * Flow failure surfaced synchronously: 409 when cancelled, 422 when there is no text,
     * 502 otherwise.
     */
    @ExceptionHandler(FlowException.class)
    ResponseEntity<ApiError> handleFlowFailure(FlowException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case CANCELLED -> HttpStatus.CONFLICT;
            case NO_TEXT_FOUND -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.BAD_GATEWAY;
        };
        LOG.warn("Flow failed: kind={}", ex.getKind());
        return ResponseEntity
            .status(status)
            .body(new ApiError(
                ex.getKind().name(),
                ex.getError().message(),
                ex.getError().recoverySuggestion(),
                Instant.now()
            ));
    }

    /**
     * Client error - unknown engine, unreadable image, bad overlay mode (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationFailed",
                "Invalid request",
                details,
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
