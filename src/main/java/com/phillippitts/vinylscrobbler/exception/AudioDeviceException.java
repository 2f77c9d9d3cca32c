package com.phillippitts.vinylscrobbler.exception;

/**
 * Thrown when the audio input cannot be opened or read.
 *
 * <p>{@link Reason#STREAM_CLOSED} and {@link Reason#IO_ERROR} are per-cycle errors: the session
 * reopens the source and skips the cycle. {@link Reason#UNAVAILABLE} means the device could not
 * be opened at all.
 */
public class AudioDeviceException extends VinylScrobblerException {

    public enum Reason { STREAM_CLOSED, IO_ERROR, UNAVAILABLE }

    private final Reason reason;
    private final Integer deviceIndex;

    public AudioDeviceException(Reason reason, Integer deviceIndex, String message) {
        super(format(reason, deviceIndex, message));
        this.reason = reason;
        this.deviceIndex = deviceIndex;
    }

    public AudioDeviceException(Reason reason, Integer deviceIndex, String message, Throwable cause) {
        super(format(reason, deviceIndex, message), cause);
        this.reason = reason;
        this.deviceIndex = deviceIndex;
    }

    public Reason getReason() {
        return reason;
    }

    /** Device index the error relates to, or null for the system default device. */
    public Integer getDeviceIndex() {
        return deviceIndex;
    }

    private static String format(Reason reason, Integer deviceIndex, String message) {
        String device = deviceIndex == null ? "default" : String.valueOf(deviceIndex);
        return message + " (reason: " + reason + ", device: " + device + ")";
    }
}
