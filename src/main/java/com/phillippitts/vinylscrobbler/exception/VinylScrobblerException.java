package com.phillippitts.vinylscrobbler.exception;

/**
 * Base exception for all vinyl-scrobbler application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VinylScrobblerException extends RuntimeException {

    public VinylScrobblerException(String message) {
        super(message);
    }

    public VinylScrobblerException(String message, Throwable cause) {
        super(message, cause);
    }

    public VinylScrobblerException(Throwable cause) {
        super(cause);
    }
}
