package com.phillippitts.vinylscrobbler.service.scrobble;

import com.phillippitts.vinylscrobbler.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;

/**
 * Sink used when no scrobbling service is configured: writes every report to the log.
 */
public class LoggingScrobbleSink implements ScrobbleSink {

    private static final Logger LOG = LogManager.getLogger(LoggingScrobbleSink.class);

    @Override
    public void updateNowPlaying(String artist, String title) {
        LOG.info("Now playing: {}", LogSanitizer.track(artist, title));
    }

    @Override
    public void scrobble(String artist, String title, Instant timestamp) {
        LOG.info("Scrobble: {} at {}", LogSanitizer.track(artist, title), timestamp);
    }

    @Override
    public void clearNowPlaying() {
        LOG.info("Now playing cleared");
    }

    @Override
    public String getSinkName() {
        return "log";
    }
}
