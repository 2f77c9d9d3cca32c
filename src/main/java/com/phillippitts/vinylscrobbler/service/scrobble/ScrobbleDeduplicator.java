package com.phillippitts.vinylscrobbler.service.scrobble;

import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.domain.TrackKey;
import com.phillippitts.vinylscrobbler.exception.ScrobbleException;
import com.phillippitts.vinylscrobbler.service.metrics.DetectionMetrics;
import com.phillippitts.vinylscrobbler.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns identifications into sink calls without repeating a scrobble for the same track.
 *
 * <p>Policy: scrobble on change. A pair different from the last reported one gets a now-playing
 * update followed by a scrobble stamped with the current time. The same pair again is a no-op.
 * No identification clears now-playing but keeps the anchor, so a track that briefly drops out
 * is not scrobbled twice.
 *
 * <p>Stateless: the caller holds the anchor and passes it back on every call.
 */
public class ScrobbleDeduplicator {

    private static final Logger LOG = LogManager.getLogger(ScrobbleDeduplicator.class);

    private final ScrobbleSink sink;
    private final DetectionMetrics metrics;
    private final Clock clock;

    public ScrobbleDeduplicator(ScrobbleSink sink, DetectionMetrics metrics) {
        this(sink, metrics, Clock.systemUTC());
    }

    public ScrobbleDeduplicator(ScrobbleSink sink, DetectionMetrics metrics, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Reports an identification.
     *
     * @param identified   newly confirmed track, or empty when nothing was identified
     * @param lastReported anchor returned by the previous call (null initially)
     * @return the new anchor and the action taken
     */
    public DedupOutcome report(Optional<Track> identified, TrackKey lastReported) {
        Objects.requireNonNull(identified, "identified");
        if (identified.isEmpty()) {
            try {
                sink.clearNowPlaying();
                metrics.recordScrobble("clear_now_playing", true);
            } catch (ScrobbleException e) {
                metrics.recordScrobble("clear_now_playing", false);
                LOG.warn("Clearing now-playing on {} failed: {}", sink.getSinkName(), e.getMessage());
            }
            return new DedupOutcome(lastReported, DedupOutcome.Action.CLEARED);
        }

        TrackKey key = identified.get().key();
        if (key.equals(lastReported)) {
            LOG.debug("Still playing {}", key);
            return new DedupOutcome(lastReported, DedupOutcome.Action.UNCHANGED);
        }

        String artist = key.artist();
        String title = key.title();
        try {
            sink.updateNowPlaying(artist, title);
            metrics.recordScrobble("now_playing", true);
        } catch (ScrobbleException e) {
            metrics.recordScrobble("now_playing", false);
            LOG.warn("Now-playing update for {} on {} failed: {}",
                    LogSanitizer.track(artist, title), sink.getSinkName(), e.getMessage());
            return new DedupOutcome(lastReported, DedupOutcome.Action.FAILED);
        }
        Instant now = clock.instant();
        try {
            sink.scrobble(artist, title, now);
            metrics.recordScrobble("scrobble", true);
        } catch (ScrobbleException e) {
            metrics.recordScrobble("scrobble", false);
            LOG.warn("Scrobble of {} on {} failed: {}",
                    LogSanitizer.track(artist, title), sink.getSinkName(), e.getMessage());
            return new DedupOutcome(lastReported, DedupOutcome.Action.FAILED);
        }
        LOG.info("Scrobbled {} via {}", LogSanitizer.track(artist, title), sink.getSinkName());
        return new DedupOutcome(key, DedupOutcome.Action.REPORTED);
    }
}
