package com.phillippitts.vinylscrobbler.exception;

/**
 * Thrown inside the run loop when the session cannot continue (device gone after the reopen
 * budget is spent, unexpected failure outside a cycle). Stops the session and releases the source.
 */
public class FatalSessionException extends VinylScrobblerException {

    public FatalSessionException(String message) {
        super(message);
    }

    public FatalSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
