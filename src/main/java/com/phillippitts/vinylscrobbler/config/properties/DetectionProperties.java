package com.phillippitts.vinylscrobbler.config.properties;

import com.phillippitts.vinylscrobbler.domain.Activity;
import com.phillippitts.vinylscrobbler.service.level.LoudnessMetric;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the detection pipeline: level gating, majority voting,
 * aggressive fallback and run-loop pacing.
 *
 * <p>Defaults mirror a turntable feeding a USB interface: peak metric on normalized samples,
 * three samples per consistency check with two required to agree.
 */
@Validated
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    @Valid
    private Level level = new Level();
    @Valid
    private Consistency consistency = new Consistency();
    @Valid
    private Aggressive aggressive = new Aggressive();
    @Valid
    private Cycle cycle = new Cycle();

    public Level getLevel() {
        return level;
    }

    public void setLevel(Level level) {
        this.level = level;
    }

    public Consistency getConsistency() {
        return consistency;
    }

    public void setConsistency(Consistency consistency) {
        this.consistency = consistency;
    }

    public Aggressive getAggressive() {
        return aggressive;
    }

    public void setAggressive(Aggressive aggressive) {
        this.aggressive = aggressive;
    }

    public Cycle getCycle() {
        return cycle;
    }

    public void setCycle(Cycle cycle) {
        this.cycle = cycle;
    }

    /**
     * Level monitor hysteresis. The metric and both thresholds are one configuration pair:
     * PEAK thresholds are fractions of full scale, RMS thresholds are raw 16-bit amplitudes.
     */
    public static class Level {
        @NotNull
        private LoudnessMetric metric = LoudnessMetric.PEAK;
        @DecimalMin("0.0")
        private double silenceThreshold = 0.05;
        @DecimalMin("0.0")
        private double activityThreshold = 0.1;
        @Min(1)
        private int activityWindow = 2;
        @Min(1)
        private int standbyWindow = 5;
        /** State a session starts in; STANDBY requires activity-window loud probes before recognizing. */
        @NotNull
        private Activity initialState = Activity.STANDBY;

        @AssertTrue(message = "activity-threshold must be >= silence-threshold")
        public boolean isThresholdOrderValid() {
            return activityThreshold >= silenceThreshold;
        }

        public LoudnessMetric getMetric() {
            return metric;
        }

        public void setMetric(LoudnessMetric metric) {
            this.metric = metric;
        }

        public double getSilenceThreshold() {
            return silenceThreshold;
        }

        public void setSilenceThreshold(double silenceThreshold) {
            this.silenceThreshold = silenceThreshold;
        }

        public double getActivityThreshold() {
            return activityThreshold;
        }

        public void setActivityThreshold(double activityThreshold) {
            this.activityThreshold = activityThreshold;
        }

        public int getActivityWindow() {
            return activityWindow;
        }

        public void setActivityWindow(int activityWindow) {
            this.activityWindow = activityWindow;
        }

        public int getStandbyWindow() {
            return standbyWindow;
        }

        public void setStandbyWindow(int standbyWindow) {
            this.standbyWindow = standbyWindow;
        }

        public Activity getInitialState() {
            return initialState;
        }

        public void setInitialState(Activity initialState) {
            this.initialState = initialState;
        }
    }

    /**
     * Majority vote over repeated recognition samples.
     */
    public static class Consistency {
        @Min(1)
        @Max(10)
        private int checks = 3;
        @Min(1)
        private int threshold = 2;
        @DecimalMin("0.0")
        private double confidenceThreshold = 0.0;
        @Min(0)
        private long checkDelayMs = 1_000;

        @AssertTrue(message = "consistency threshold must not exceed the number of checks")
        public boolean isThresholdWithinChecks() {
            return threshold <= checks;
        }

        public int getChecks() {
            return checks;
        }

        public void setChecks(int checks) {
            this.checks = checks;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public long getCheckDelayMs() {
            return checkDelayMs;
        }

        public void setCheckDelayMs(long checkDelayMs) {
            this.checkDelayMs = checkDelayMs;
        }
    }

    /**
     * Rapid retries after repeated misses.
     */
    public static class Aggressive {
        @Min(1)
        @Max(10)
        private int count = 3;
        @Min(0)
        private long intervalMs = 2_000;
        /** Consecutive consistency failures before the fallback runs. */
        @Min(1)
        private int triggerStreak = 3;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getTriggerStreak() {
            return triggerStreak;
        }

        public void setTriggerStreak(int triggerStreak) {
            this.triggerStreak = triggerStreak;
        }
    }

    /**
     * Run-loop pacing.
     */
    public static class Cycle {
        @Min(0)
        private long intervalMs = 3_000;
        @Min(0)
        private long standbyPollMs = 500;
        @Min(0)
        private long errorBackoffMs = 1_000;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getStandbyPollMs() {
            return standbyPollMs;
        }

        public void setStandbyPollMs(long standbyPollMs) {
            this.standbyPollMs = standbyPollMs;
        }

        public long getErrorBackoffMs() {
            return errorBackoffMs;
        }

        public void setErrorBackoffMs(long errorBackoffMs) {
            this.errorBackoffMs = errorBackoffMs;
        }
    }
}
