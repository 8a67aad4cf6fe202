package com.phillippitts.estatesearch.presentation.exception;

import com.phillippitts.estatesearch.exception.InvalidWorkerReplyException;
import com.phillippitts.estatesearch.exception.UnknownSessionException;
import com.phillippitts.estatesearch.exception.WorkerUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Session not held by this instance (never created, or evicted after idling) (HTTP 404).
     * For worker replies this is a correlation bug and was already logged at ERROR.
     */
    @ExceptionHandler(UnknownSessionException.class)
    ResponseEntity<ApiError> handleUnknownSession(UnknownSessionException ex) {
        LOG.warn("Unknown session: {}", ex.getSessionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Malformed worker reply (HTTP 400).
     */
    @ExceptionHandler(InvalidWorkerReplyException.class)
    ResponseEntity<ApiError> handleInvalidReply(InvalidWorkerReplyException ex) {
        LOG.warn("Rejected worker reply: correlationId={}, reason={}", ex.getCorrelationId(), ex.getReason());
        return badRequest(ex.getClass().getSimpleName(), "Invalid worker reply", ex.getReason());
    }

    /**
     * Client error - blank message or similar argument problem (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return badRequest("ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("MalformedBody", "Request body could not be parsed",
            ex.getMostSpecificCause().getClass().getSimpleName());
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(WorkerUnavailableException.class)
    ResponseEntity<ApiError> handleWorkerUnavailable(WorkerUnavailableException ex) {
        LOG.error("Worker unavailable: worker={}", ex.getWorkerKind(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Search service temporarily unavailable",
                "Please retry in a few seconds",
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

    private static ResponseEntity<ApiError> badRequest(String errorCode, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, message, details, Instant.now()));
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
