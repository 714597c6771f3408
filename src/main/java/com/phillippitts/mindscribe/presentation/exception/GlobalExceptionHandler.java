package com.phillippitts.mindscribe.presentation.exception;

import com.phillippitts.mindscribe.exception.SessionAlreadyActiveException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;

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
     * A start while another session is still live (HTTP 409).
     */
    @ExceptionHandler(SessionAlreadyActiveException.class)
    ResponseEntity<ApiError> handleSessionActive(SessionAlreadyActiveException ex) {
        LOG.info("Start rejected: session={}, state={}", ex.getActiveSessionId(), ex.getActiveState());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getErrorCode().name(),
                "A session is already active",
                "Stop, cancel or acknowledge session " + ex.getActiveSessionId() + " first",
                Instant.now()
            ));
    }

    /**
     * Client error - unknown command or malformed argument (HTTP 400).
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

    /**
     * Command queue saturated - retry possible (HTTP 503).
     */
    @ExceptionHandler(RejectedExecutionException.class)
    ResponseEntity<ApiError> handleSaturated(RejectedExecutionException ex) {
        LOG.warn("Session command queue saturated");
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                "CommandQueueFull",
                "Session controller is busy",
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

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
