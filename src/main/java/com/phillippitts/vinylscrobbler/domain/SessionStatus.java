package com.phillippitts.vinylscrobbler.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the session as seen by listeners and the REST surface.
 *
 * <p>Invariant: {@code currentTrack} is null whenever {@code running} is false.
 *
 * @param running       whether a run loop is active
 * @param currentDevice audio device index of the session (null when never started)
 * @param currentTrack  confirmed track currently playing (null when none)
 * @param activity      level monitor classification of the last probe
 * @param debug         diagnostics
 */
public record SessionStatus(
        boolean running,
        Integer currentDevice,
        Track currentTrack,
        Activity activity,
        DebugInfo debug
) {

    public SessionStatus {
        if (!running && currentTrack != null) {
            throw new IllegalArgumentException("currentTrack must be null when not running");
        }
        Objects.requireNonNull(activity, "activity must not be null");
        Objects.requireNonNull(debug, "debug must not be null");
    }

    public static SessionStatus idle() {
        return new SessionStatus(false, null, null, Activity.STANDBY, DebugInfo.empty());
    }

    public Optional<Integer> device() {
        return Optional.ofNullable(currentDevice);
    }

    public Optional<Track> track() {
        return Optional.ofNullable(currentTrack);
    }
}
