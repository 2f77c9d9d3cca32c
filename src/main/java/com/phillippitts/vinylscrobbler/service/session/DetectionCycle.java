package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioStream;
import com.phillippitts.vinylscrobbler.service.audio.capture.SampleRecorder;
import com.phillippitts.vinylscrobbler.service.level.LevelMonitor;
import com.phillippitts.vinylscrobbler.service.level.LevelReading;
import com.phillippitts.vinylscrobbler.service.metrics.DetectionMetrics;
import com.phillippitts.vinylscrobbler.service.recognition.AggressiveFallback;
import com.phillippitts.vinylscrobbler.service.recognition.ConsistencyChecker;
import com.phillippitts.vinylscrobbler.service.scrobble.DedupOutcome;
import com.phillippitts.vinylscrobbler.service.scrobble.ScrobbleDeduplicator;
import com.phillippitts.vinylscrobbler.util.LogSanitizer;
import com.phillippitts.vinylscrobbler.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * One iteration of the detection loop.
 *
 * <p>Order of work:
 * <ol>
 *   <li>Probe loudness and update the level monitor state; stop here while in Standby</li>
 *   <li>Run a consistency check on fresh samples</li>
 *   <li>On a miss, bump the miss streak; once it reaches the trigger, run the aggressive fallback</li>
 *   <li>Report the outcome through the deduplicator and update the current track</li>
 * </ol>
 *
 * <p>A miss below the trigger keeps the current track and makes no sink call. An exhausted
 * fallback clears now-playing and the current track, and resets the streak.
 */
public class DetectionCycle {

    private static final Logger LOG = LogManager.getLogger(DetectionCycle.class);

    private final SampleRecorder recorder;
    private final LevelMonitor levelMonitor;
    private final ConsistencyChecker checker;
    private final AggressiveFallback fallback;
    private final ScrobbleDeduplicator deduplicator;
    private final DetectionProperties.Cycle pacing;
    private final Sleeper sleeper;
    private final DetectionMetrics metrics;
    private final Clock clock;

    public DetectionCycle(SampleRecorder recorder,
                          LevelMonitor levelMonitor,
                          ConsistencyChecker checker,
                          AggressiveFallback fallback,
                          ScrobbleDeduplicator deduplicator,
                          DetectionProperties.Cycle pacing,
                          Sleeper sleeper,
                          DetectionMetrics metrics,
                          Clock clock) {
        this.recorder = Objects.requireNonNull(recorder);
        this.levelMonitor = Objects.requireNonNull(levelMonitor);
        this.checker = Objects.requireNonNull(checker);
        this.fallback = Objects.requireNonNull(fallback);
        this.deduplicator = Objects.requireNonNull(deduplicator);
        this.pacing = Objects.requireNonNull(pacing);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    /** Fresh state for a new session. */
    public CycleState newState() {
        return new CycleState(levelMonitor.initialState());
    }

    /**
     * Runs one cycle against the open stream, updating {@code state} in place.
     *
     * @throws InterruptedException if the session is stopping
     * @throws com.phillippitts.vinylscrobbler.exception.AudioDeviceException if the stream fails
     */
    public void run(AudioStream stream, CycleState state) throws InterruptedException {
        PcmBuffer probe = recorder.recordProbe(stream);
        LevelReading reading = levelMonitor.evaluate(probe, state.activity());
        state.setActivity(reading.state());
        state.setDebug(state.debug().withAudioLevel(reading.level()));
        if (reading.transitioned()) {
            metrics.recordActivityTransition(reading.state().activity().name());
        }
        if (reading.state().isStandby()) {
            return;
        }

        LOG.info("Starting song detection");
        state.setDebug(state.debug().withDetectionStarted(clock.instant()));
        ConsistencyChecker.SampleSource samples = () -> recorder.recordSample(stream);

        Optional<Track> confirmed = checker.check(samples);
        if (confirmed.isEmpty()) {
            int streak = state.noMatchStreak() + 1;
            state.setNoMatchStreak(streak);
            if (!fallback.shouldRun(streak)) {
                LOG.debug("No consistent match (miss streak {}); keeping current track", streak);
                return;
            }
            LOG.info("{} misses in a row; running aggressive fallback", streak);
            confirmed = fallback.run(samples);
            if (confirmed.isEmpty()) {
                state.setNoMatchStreak(0);
                DedupOutcome outcome = deduplicator.report(Optional.empty(), state.lastReported());
                state.setLastReported(outcome.lastReported());
                if (state.currentTrack() != null) {
                    LOG.info("Lost track of {}", state.currentTrack().key());
                }
                state.setCurrentTrack(null);
                return;
            }
        }

        state.setNoMatchStreak(0);
        Track track = confirmed.get();
        DedupOutcome outcome = deduplicator.report(confirmed, state.lastReported());
        state.setLastReported(outcome.lastReported());
        if (!Track.sameTrack(state.currentTrack(), track)) {
            LOG.info("Now playing {}", LogSanitizer.track(track.artist(), track.title()));
        }
        state.setCurrentTrack(track);
    }

    /**
     * Sleeps until the next cycle: the standby poll interval while in Standby, the cycle interval otherwise.
     */
    public void pause(CycleState state) throws InterruptedException {
        sleeper.sleep(state.activity().isStandby() ? pacing.getStandbyPollMs() : pacing.getIntervalMs());
    }

    /** Pause after a failed cycle. */
    public void backoff() throws InterruptedException {
        sleeper.sleep(pacing.getErrorBackoffMs());
    }
}
