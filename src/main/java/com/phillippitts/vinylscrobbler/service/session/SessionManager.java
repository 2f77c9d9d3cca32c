package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.domain.SessionStatus;

import java.util.Optional;

/**
 * Owns the listening session: starts and stops the detection loop and exposes its state.
 *
 * <p>At most one session runs at a time. {@link #start(Integer)} and {@link #stop()} are mutually
 * exclusive and never queue.
 *
 * @see DefaultSessionManager
 */
public interface SessionManager {

    /**
     * Starts listening on a device.
     *
     * @param deviceIndex device index, or null to use the configured or automatically picked device
     * @return {@code true} if a session was started, {@code false} if one is already running
     * @throws com.phillippitts.vinylscrobbler.exception.SessionStartException if the loop could not be
     *         scheduled or the previous session still holds the audio device
     */
    boolean start(Integer deviceIndex);

    /**
     * Stops the running session and waits for its loop to exit, at most {@code session.stop-timeout-ms}.
     * A loop still running after that keeps the device claimed until it exits.
     *
     * @return {@code true} if a session was stopped, {@code false} if none was running or it is
     *         already stopping
     */
    boolean stop();

    /** Latest status snapshot. */
    SessionStatus status();

    boolean isRunning();

    /** Message of the error that ended the last session, cleared on the next start. */
    Optional<String> lastFatalError();

    ListenerRegistration addTrackListener(TrackListener listener);

    ListenerRegistration addStatusListener(StatusListener listener);
}
