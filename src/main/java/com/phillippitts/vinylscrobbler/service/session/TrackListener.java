package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.domain.Track;

/**
 * Receives the current track whenever it changes.
 */
@FunctionalInterface
public interface TrackListener {

    /**
     * @param track the new current track, or null when nothing is playing
     */
    void onTrackChanged(Track track);
}
