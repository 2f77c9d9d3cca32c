package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.domain.ActivityState;
import com.phillippitts.vinylscrobbler.domain.DebugInfo;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.domain.TrackKey;

import java.util.Objects;

/**
 * Mutable per-session detection state. Owned by the session's run loop thread; never shared.
 */
public final class CycleState {

    private ActivityState activity;
    private DebugInfo debug = DebugInfo.empty();
    private Track currentTrack;
    private TrackKey lastReported;
    private int noMatchStreak;
    private boolean trackChanged;

    public CycleState(ActivityState initial) {
        this.activity = Objects.requireNonNull(initial, "initial");
    }

    public ActivityState activity() {
        return activity;
    }

    void setActivity(ActivityState activity) {
        this.activity = activity;
    }

    public DebugInfo debug() {
        return debug;
    }

    void setDebug(DebugInfo debug) {
        this.debug = debug;
    }

    void recordError(String message) {
        this.debug = debug.withLastError(message);
    }

    /** Confirmed track, or null when nothing is playing. */
    public Track currentTrack() {
        return currentTrack;
    }

    /**
     * Replaces the current track when its {@code (artist, title)} differs and flags the change.
     */
    void setCurrentTrack(Track track) {
        if (!Track.sameTrack(currentTrack, track)) {
            currentTrack = track;
            trackChanged = true;
        }
    }

    /** Returns whether the track changed since the last call, and resets the flag. */
    boolean consumeTrackChanged() {
        boolean changed = trackChanged;
        trackChanged = false;
        return changed;
    }

    public TrackKey lastReported() {
        return lastReported;
    }

    void setLastReported(TrackKey lastReported) {
        this.lastReported = lastReported;
    }

    public int noMatchStreak() {
        return noMatchStreak;
    }

    void setNoMatchStreak(int noMatchStreak) {
        this.noMatchStreak = noMatchStreak;
    }
}
