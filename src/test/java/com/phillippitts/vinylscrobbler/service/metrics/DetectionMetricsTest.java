package com.phillippitts.vinylscrobbler.service.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionMetricsTest {

    private MeterRegistry registry;
    private DetectionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DetectionMetrics(registry);
    }

    @Test
    void recordsRecognitionLatencyAndOutcome() {
        metrics.recordRecognition("audd", "match", TimeUnit.MILLISECONDS.toNanos(250));
        metrics.recordRecognition("audd", "no_match", TimeUnit.MILLISECONDS.toNanos(150));

        assertThat(registry.get("vinylscrobbler.recognition.latency").tag("service", "audd").timer().count())
                .isEqualTo(2);
        assertThat(registry.get("vinylscrobbler.recognition.attempts")
                .tag("outcome", "match").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("vinylscrobbler.recognition.attempts")
                .tag("outcome", "no_match").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsConsistencyResults() {
        metrics.recordConsistency(true);
        metrics.recordConsistency(false);
        metrics.recordConsistency(false);

        assertThat(registry.get("vinylscrobbler.consistency").tag("result", "confirmed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("vinylscrobbler.consistency").tag("result", "inconclusive").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void recordsFallbackResults() {
        metrics.recordFallback(false);

        assertThat(registry.get("vinylscrobbler.fallback").tag("result", "exhausted").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("vinylscrobbler.fallback").tag("result", "recovered").counter()).isNull();
    }

    @Test
    void recordsScrobbleSubmissionsPerOperation() {
        metrics.recordScrobble("scrobble", true);
        metrics.recordScrobble("now_playing", false);

        assertThat(registry.get("vinylscrobbler.scrobble")
                .tags("operation", "scrobble", "outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("vinylscrobbler.scrobble")
                .tags("operation", "now_playing", "outcome", "failure").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsActivityTransitionsAndDroppedUpdates() {
        metrics.recordActivityTransition("ACTIVE");
        metrics.incrementListenerDropped("track");
        metrics.incrementListenerDropped("track");

        assertThat(registry.get("vinylscrobbler.activity.transitions").tag("to", "ACTIVE").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("vinylscrobbler.listener.dropped").tag("kind", "track").counter().count())
                .isEqualTo(2.0);
    }
}
