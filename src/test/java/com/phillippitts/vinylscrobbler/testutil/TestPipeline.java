package com.phillippitts.vinylscrobbler.testutil;

import com.phillippitts.vinylscrobbler.config.properties.AudioCaptureProperties;
import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.domain.Activity;
import com.phillippitts.vinylscrobbler.service.audio.capture.SampleRecorder;
import com.phillippitts.vinylscrobbler.service.level.LevelMonitor;
import com.phillippitts.vinylscrobbler.service.level.LoudnessMetric;
import com.phillippitts.vinylscrobbler.service.metrics.DetectionMetrics;
import com.phillippitts.vinylscrobbler.service.recognition.AggressiveFallback;
import com.phillippitts.vinylscrobbler.service.recognition.ConsistencyChecker;
import com.phillippitts.vinylscrobbler.service.scrobble.ScrobbleDeduplicator;
import com.phillippitts.vinylscrobbler.service.scrobble.ScrobbleSink;
import com.phillippitts.vinylscrobbler.service.session.DetectionCycle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Real detection pipeline wired to test doubles.
 *
 * <p>Audio is 8kHz mono: a probe (100 ms) is one read, a sample (1 s) two reads. By default the level
 * monitor flips on a single buffer (windows of 1, PEAK 0.05/0.1); tests may widen the windows. Each consistency check takes 2 samples
 * and needs both to agree; the fallback runs 2 rounds after 3 misses. Pacing values are distinct
 * so tests can tell pauses apart.
 */
public final class TestPipeline {

    public static final long INTERVAL_MS = 3_000;
    public static final long STANDBY_POLL_MS = 500;
    public static final long BACKOFF_MS = 1_000;
    public static final Instant NOW = Instant.parse("2024-05-01T20:15:00Z");

    public final AudioCaptureProperties captureProps = new AudioCaptureProperties(8_000, 1, 4_096, 1_000, 100, null, 3);
    public final ScriptedAudioSource source;
    public final ScriptedRecognitionService recognizer = new ScriptedRecognitionService();
    public final RecordingScrobbleSink sink = new RecordingScrobbleSink();
    public final RecordingSleeper sleeper = new RecordingSleeper();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final DetectionMetrics metrics = new DetectionMetrics(registry);
    public int activityWindow = 1;
    public int standbyWindow = 1;

    public TestPipeline(short initialAmplitude) {
        this.source = new ScriptedAudioSource(8_000, initialAmplitude);
    }

    public DetectionCycle cycle() {
        return cycle(sink);
    }

    /** Same pipeline, reporting to {@code target} instead of {@link #sink}. */
    public DetectionCycle cycle(ScrobbleSink target) {
        SampleRecorder recorder = new SampleRecorder(captureProps);
        LevelMonitor monitor = new LevelMonitor(LoudnessMetric.PEAK, 0.05, 0.1, activityWindow, standbyWindow,
                Activity.STANDBY);
        ConsistencyChecker checker = new ConsistencyChecker(recognizer, 2, 2, 0.0, 0, sleeper, metrics);
        AggressiveFallback fallback = new AggressiveFallback(checker, 2, 0, 3, sleeper, metrics);
        ScrobbleDeduplicator dedup = new ScrobbleDeduplicator(target, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
        DetectionProperties.Cycle pacing = new DetectionProperties.Cycle();
        pacing.setIntervalMs(INTERVAL_MS);
        pacing.setStandbyPollMs(STANDBY_POLL_MS);
        pacing.setErrorBackoffMs(BACKOFF_MS);
        return new DetectionCycle(recorder, monitor, checker, fallback, dedup, pacing, sleeper, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
