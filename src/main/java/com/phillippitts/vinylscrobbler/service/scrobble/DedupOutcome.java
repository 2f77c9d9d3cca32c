package com.phillippitts.vinylscrobbler.service.scrobble;

import com.phillippitts.vinylscrobbler.domain.TrackKey;

/**
 * What one {@link ScrobbleDeduplicator#report} call did.
 *
 * @param lastReported dedup anchor to pass to the next call (null when nothing was reported yet)
 * @param action       the step taken
 */
public record DedupOutcome(TrackKey lastReported, Action action) {

    public enum Action {
        /** Nothing identified: now-playing cleared, anchor kept. */
        CLEARED,
        /** Same pair as last time: no call made. */
        UNCHANGED,
        /** New pair announced and scrobbled. */
        REPORTED,
        /** The sink failed; anchor kept so the next detection retries. */
        FAILED
    }

    public boolean reported() {
        return action == Action.REPORTED;
    }
}
