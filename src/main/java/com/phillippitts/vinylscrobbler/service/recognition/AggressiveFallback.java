package com.phillippitts.vinylscrobbler.service.recognition;

import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.service.metrics.DetectionMetrics;
import com.phillippitts.vinylscrobbler.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Bounded burst of consistency checks used after repeated misses.
 *
 * <p>Runs up to {@code count} full checks, {@code intervalMs} apart, and returns the first
 * confirmed track. Callers decide when to invoke it (after {@code triggerStreak} misses).
 */
public class AggressiveFallback {

    private static final Logger LOG = LogManager.getLogger(AggressiveFallback.class);

    private final ConsistencyChecker checker;
    private final int count;
    private final long intervalMs;
    private final int triggerStreak;
    private final Sleeper sleeper;
    private final DetectionMetrics metrics;

    public AggressiveFallback(ConsistencyChecker checker,
                              DetectionProperties.Aggressive props,
                              Sleeper sleeper,
                              DetectionMetrics metrics) {
        this(checker, props.getCount(), props.getIntervalMs(), props.getTriggerStreak(), sleeper, metrics);
    }

    public AggressiveFallback(ConsistencyChecker checker,
                              int count,
                              long intervalMs,
                              int triggerStreak,
                              Sleeper sleeper,
                              DetectionMetrics metrics) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got: " + count);
        }
        if (triggerStreak < 1) {
            throw new IllegalArgumentException("triggerStreak must be >= 1, got: " + triggerStreak);
        }
        this.checker = Objects.requireNonNull(checker, "checker");
        this.count = count;
        this.intervalMs = Math.max(0, intervalMs);
        this.triggerStreak = triggerStreak;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /** Whether a miss streak of this length calls for the fallback. */
    public boolean shouldRun(int noMatchStreak) {
        return noMatchStreak >= triggerStreak;
    }

    /**
     * Runs the burst.
     *
     * @return the first confirmed track, or empty when every round failed
     * @throws InterruptedException if the session is stopping
     */
    public Optional<Track> run(ConsistencyChecker.SampleSource samples) throws InterruptedException {
        for (int round = 1; round <= count; round++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Aggressive fallback interrupted");
            }
            LOG.info("Aggressive check {}/{}", round, count);
            Optional<Track> track = checker.check(samples);
            if (track.isPresent()) {
                metrics.recordFallback(true);
                return track;
            }
            if (round < count) {
                sleeper.sleep(intervalMs);
            }
        }
        metrics.recordFallback(false);
        LOG.info("Aggressive fallback exhausted after {} rounds", count);
        return Optional.empty();
    }

    public int getTriggerStreak() {
        return triggerStreak;
    }
}
