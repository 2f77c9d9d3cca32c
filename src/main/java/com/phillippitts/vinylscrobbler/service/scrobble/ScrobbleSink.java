package com.phillippitts.vinylscrobbler.service.scrobble;

import com.phillippitts.vinylscrobbler.exception.ScrobbleException;

import java.time.Instant;

/**
 * Destination for now-playing updates and scrobbles.
 *
 * <p>All methods may block on network I/O and report failure with {@link ScrobbleException}.
 */
public interface ScrobbleSink {

    /**
     * Announces the track as currently playing.
     *
     * @throws ScrobbleException on failure
     */
    void updateNowPlaying(String artist, String title);

    /**
     * Records a play.
     *
     * @param timestamp when the track started playing
     * @throws ScrobbleException on failure
     */
    void scrobble(String artist, String title, Instant timestamp);

    /**
     * Withdraws the current now-playing status. Sinks without such an operation let it expire.
     *
     * @throws ScrobbleException on failure
     */
    void clearNowPlaying();

    /** Short name for logs and metrics. */
    String getSinkName();
}
