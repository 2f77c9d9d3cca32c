package com.phillippitts.vinylscrobbler.exception;

/**
 * Thrown when a now-playing update or scrobble submission fails.
 * Logged by the deduplicator; the last reported track is kept so the report can be retried.
 */
public class ScrobbleException extends VinylScrobblerException {

    private final String operation;
    private final Integer errorCode;

    public ScrobbleException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
        this.errorCode = null;
    }

    public ScrobbleException(String operation, int errorCode, String message) {
        super(operation + " failed with error " + errorCode + ": " + message);
        this.operation = operation;
        this.errorCode = errorCode;
    }

    public ScrobbleException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
        this.errorCode = null;
    }

    public String getOperation() {
        return operation;
    }

    /** Service-specific error code, or null when the failure happened below the API layer. */
    public Integer getErrorCode() {
        return errorCode;
    }
}
