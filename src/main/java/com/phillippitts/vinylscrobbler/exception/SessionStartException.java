package com.phillippitts.vinylscrobbler.exception;

/**
 * Thrown when a session cannot be started for a reason other than one already running: the
 * session executor refused the loop, or the previous loop still holds the audio device.
 */
public class SessionStartException extends VinylScrobblerException {

    public SessionStartException(String message) {
        super(message);
    }

    public SessionStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
