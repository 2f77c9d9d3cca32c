package com.phillippitts.vinylscrobbler.service.recognition;

import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.domain.TrackKey;
import com.phillippitts.vinylscrobbler.exception.RecognitionException;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;
import com.phillippitts.vinylscrobbler.service.metrics.DetectionMetrics;
import com.phillippitts.vinylscrobbler.util.LogSanitizer;
import com.phillippitts.vinylscrobbler.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Confirms a track by majority vote over several independently captured samples.
 *
 * <p>Each of the {@code checks} rounds captures a fresh sample and asks the recognizer about it,
 * with {@code checkDelayMs} between rounds. Guesses without a usable artist/title, below the
 * confidence threshold, or lost to a {@link RecognitionException} are not counted. The most
 * frequent pair wins if it reached {@code threshold} votes; ties go to the pair seen first.
 * The reported confidence is the mean over the winning pair's samples only.
 *
 * <p>Device errors from the sample source are not handled here and end the check.
 */
public class ConsistencyChecker {

    private static final Logger LOG = LogManager.getLogger(ConsistencyChecker.class);

    /** Supplies one freshly captured sample per call. */
    @FunctionalInterface
    public interface SampleSource {
        PcmBuffer next() throws InterruptedException;
    }

    private final RecognitionService recognizer;
    private final int checks;
    private final int threshold;
    private final double confidenceThreshold;
    private final long checkDelayMs;
    private final Sleeper sleeper;
    private final DetectionMetrics metrics;

    public ConsistencyChecker(RecognitionService recognizer,
                              DetectionProperties.Consistency props,
                              Sleeper sleeper,
                              DetectionMetrics metrics) {
        this(recognizer, props.getChecks(), props.getThreshold(), props.getConfidenceThreshold(),
                props.getCheckDelayMs(), sleeper, metrics);
    }

    public ConsistencyChecker(RecognitionService recognizer,
                              int checks,
                              int threshold,
                              double confidenceThreshold,
                              long checkDelayMs,
                              Sleeper sleeper,
                              DetectionMetrics metrics) {
        if (checks < 1) {
            throw new IllegalArgumentException("checks must be >= 1, got: " + checks);
        }
        if (threshold < 1 || threshold > checks) {
            throw new IllegalArgumentException("threshold must be in [1, " + checks + "], got: " + threshold);
        }
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.checks = checks;
        this.threshold = threshold;
        this.confidenceThreshold = confidenceThreshold;
        this.checkDelayMs = Math.max(0, checkDelayMs);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs one full vote.
     *
     * @param samples source of fresh samples, called exactly {@code checks} times unless interrupted
     * @return the confirmed track, or empty when no pair reached the threshold
     * @throws InterruptedException if the session is stopping
     */
    public Optional<Track> check(SampleSource samples) throws InterruptedException {
        Objects.requireNonNull(samples, "samples");
        List<RecognitionResult> accepted = new ArrayList<>(checks);
        for (int i = 0; i < checks; i++) {
            ensureNotInterrupted();
            PcmBuffer sample = samples.next();
            Optional<RecognitionResult> guess = identify(sample);
            ensureNotInterrupted();
            if (guess.isPresent() && isCountable(guess.get())) {
                accepted.add(guess.get());
                LOG.debug("Consistency check {}/{}: {} (confidence {})", i + 1, checks,
                        LogSanitizer.track(guess.get().artist(), guess.get().title()), guess.get().confidence());
            } else {
                LOG.debug("Consistency check {}/{}: no usable result", i + 1, checks);
            }
            if (i < checks - 1) {
                sleeper.sleep(checkDelayMs);
            }
        }
        Optional<Track> confirmed = vote(accepted, threshold, Instant.now());
        metrics.recordConsistency(confirmed.isPresent());
        if (confirmed.isPresent()) {
            LOG.info("Consistent match: {} (avg confidence {})",
                    LogSanitizer.track(confirmed.get().artist(), confirmed.get().title()),
                    String.format("%.2f", confirmed.get().confidence()));
        } else {
            LOG.debug("No consistent match in {} samples ({} usable)", checks, accepted.size());
        }
        return confirmed;
    }

    /**
     * Majority vote with first-encountered tie-break.
     *
     * @param accepted  countable guesses in sampling order
     * @param threshold votes required
     * @param at        detection timestamp for the resulting track
     */
    static Optional<Track> vote(List<RecognitionResult> accepted, int threshold, Instant at) {
        Map<TrackKey, List<Double>> tally = new LinkedHashMap<>();
        for (RecognitionResult r : accepted) {
            r.key().ifPresent(k -> tally.computeIfAbsent(k, x -> new ArrayList<>()).add(r.confidence()));
        }
        TrackKey best = null;
        List<Double> bestScores = List.of();
        for (Map.Entry<TrackKey, List<Double>> e : tally.entrySet()) {
            if (e.getValue().size() > bestScores.size()) {
                best = e.getKey();
                bestScores = e.getValue();
            }
        }
        if (best == null || bestScores.size() < threshold) {
            return Optional.empty();
        }
        double mean = bestScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return Optional.of(Track.of(best, mean, at));
    }

    private Optional<RecognitionResult> identify(PcmBuffer sample) {
        long t0 = System.nanoTime();
        try {
            Optional<RecognitionResult> result = recognizer.identify(sample);
            metrics.recordRecognition(recognizer.getServiceName(),
                    result.isPresent() ? "match" : "no_match", System.nanoTime() - t0);
            return result;
        } catch (RecognitionException e) {
            metrics.recordRecognition(recognizer.getServiceName(), "error", System.nanoTime() - t0);
            LOG.warn("Recognition failed, counting sample as no match: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isCountable(RecognitionResult r) {
        return r.key().isPresent() && r.confidence() >= confidenceThreshold;
    }

    private static void ensureNotInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Consistency check interrupted");
        }
    }

    public int getChecks() {
        return checks;
    }
}
