package com.phillippitts.vinylscrobbler.presentation.exception;

import com.phillippitts.vinylscrobbler.exception.AudioDeviceException;
import com.phillippitts.vinylscrobbler.exception.SessionStartException;
import com.phillippitts.vinylscrobbler.exception.VinylScrobblerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed request body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Request body could not be read",
                "Expected JSON such as {\"deviceIndex\": 1}",
                Instant.now()
            ));
    }

    /**
     * Audio hardware problem - retry after fixing the device (HTTP 503).
     */
    @ExceptionHandler(AudioDeviceException.class)
    ResponseEntity<ApiError> handleAudioDevice(AudioDeviceException ex) {
        LOG.warn("Audio device error: reason={}, device={}", ex.getReason(), ex.getDeviceIndex());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Audio device unavailable",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Session could not be started right now; a retry may succeed (HTTP 503).
     */
    @ExceptionHandler(SessionStartException.class)
    ResponseEntity<ApiError> handleSessionStart(SessionStartException ex) {
        LOG.warn("Session start refused: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session could not be started",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Other domain failures (HTTP 500).
     */
    @ExceptionHandler(VinylScrobblerException.class)
    ResponseEntity<ApiError> handleDomain(VinylScrobblerException ex) {
        LOG.error("Request failed", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Request failed",
                ex.getMessage(),
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
                "Check the server log for the request ID",
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
