package com.phillippitts.vinylscrobbler.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the detection pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Recognition latency and outcome per service</li>
 *   <li>Consistency check and aggressive fallback results</li>
 *   <li>Now-playing and scrobble submissions</li>
 *   <li>Activity transitions and dropped listener updates</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class DetectionMetrics {

    private static final String METRIC_PREFIX = "vinylscrobbler";

    private final MeterRegistry registry;

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one recognition call.
     *
     * @param service       recognition service name
     * @param outcome       {@code match}, {@code no_match} or {@code error}
     * @param durationNanos call duration in nanoseconds
     */
    public void recordRecognition(String service, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".recognition.latency")
                .description("Time taken by a recognition call")
                .tag("service", service)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".recognition.attempts")
                .description("Recognition calls by outcome")
                .tag("service", service)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records the result of one majority vote.
     */
    public void recordConsistency(boolean confirmed) {
        Counter.builder(METRIC_PREFIX + ".consistency")
                .description("Consistency checks by result")
                .tag("result", confirmed ? "confirmed" : "inconclusive")
                .register(registry)
                .increment();
    }

    /**
     * Records an aggressive fallback run.
     */
    public void recordFallback(boolean recovered) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Aggressive fallback runs by result")
                .tag("result", recovered ? "recovered" : "exhausted")
                .register(registry)
                .increment();
    }

    /**
     * Records a now-playing or scrobble submission.
     *
     * @param operation {@code now_playing}, {@code scrobble} or {@code clear_now_playing}
     * @param success   whether the sink accepted it
     */
    public void recordScrobble(String operation, boolean success) {
        Counter.builder(METRIC_PREFIX + ".scrobble")
                .description("Scrobble sink submissions by outcome")
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records a level monitor transition into {@code activity}.
     */
    public void recordActivityTransition(String activity) {
        Counter.builder(METRIC_PREFIX + ".activity.transitions")
                .description("Activity state transitions")
                .tag("to", activity)
                .register(registry)
                .increment();
    }

    /**
     * Records an update dropped because a listener's mailbox was full.
     */
    public void incrementListenerDropped(String kind) {
        Counter.builder(METRIC_PREFIX + ".listener.dropped")
                .description("Listener updates dropped on a full mailbox")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
