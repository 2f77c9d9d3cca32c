package com.phillippitts.vinylscrobbler.exception;

/**
 * Thrown when a recognition call fails (service error, timeout, unparseable response).
 * The consistency checker treats it as a sample with no result.
 */
public class RecognitionException extends VinylScrobblerException {

    private final String service;

    public RecognitionException(String message) {
        super(message);
        this.service = "unknown";
    }

    public RecognitionException(String message, String service) {
        super(message + " (service: " + service + ")");
        this.service = service;
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
        this.service = "unknown";
    }

    public RecognitionException(String message, String service, Throwable cause) {
        super(message + " (service: " + service + ")", cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
