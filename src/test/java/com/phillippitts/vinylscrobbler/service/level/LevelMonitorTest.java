package com.phillippitts.vinylscrobbler.service.level;

import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.domain.Activity;
import com.phillippitts.vinylscrobbler.domain.ActivityState;
import com.phillippitts.vinylscrobbler.testutil.TestAudio;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LevelMonitorTest {

    // silence < 0.05, activity > 0.1, 2 loud buffers to wake, 3 quiet buffers to sleep
    private final LevelMonitor monitor = new LevelMonitor(LoudnessMetric.PEAK, 0.05, 0.1, 2, 3, Activity.STANDBY);

    @Test
    void needsActivityWindowLoudBuffersToWake() {
        ActivityState s = monitor.initialState();

        LevelReading first = monitor.evaluate(TestAudio.loud(800), s);
        LevelReading second = monitor.evaluate(TestAudio.loud(800), first.state());

        assertThat(first.state().activity()).isEqualTo(Activity.STANDBY);
        assertThat(first.transitioned()).isFalse();
        assertThat(second.state().activity()).isEqualTo(Activity.ACTIVE);
        assertThat(second.transitioned()).isTrue();
        assertThat(second.level()).isGreaterThan(0.1);
    }

    @Test
    void needsStandbyWindowQuietBuffersToSleep() {
        ActivityState s = ActivityState.initial(Activity.ACTIVE);

        s = monitor.apply(0.0, s);
        s = monitor.apply(0.0, s);
        assertThat(s.activity()).isEqualTo(Activity.ACTIVE);
        assertThat(s.consecutiveBelowThreshold()).isEqualTo(2);

        s = monitor.apply(0.0, s);
        assertThat(s.activity()).isEqualTo(Activity.STANDBY);
    }

    @Test
    void defaultStandbyWindowKeepsActiveThroughFourQuietBuffers() {
        LevelMonitor fiveToSleep = new LevelMonitor(LoudnessMetric.PEAK, 0.05, 0.1, 2, 5, Activity.ACTIVE);
        ActivityState s = fiveToSleep.initialState();

        for (int i = 1; i <= 4; i++) {
            LevelReading reading = fiveToSleep.evaluate(TestAudio.silent(800), s);
            assertThat(reading.state().activity()).isEqualTo(Activity.ACTIVE);
            assertThat(reading.transitioned()).isFalse();
            s = reading.state();
        }
        LevelReading fifth = fiveToSleep.evaluate(TestAudio.silent(800), s);

        assertThat(fifth.state().activity()).isEqualTo(Activity.STANDBY);
        assertThat(fifth.transitioned()).isTrue();
    }

    @Test
    void loudBufferResetsQuietRun() {
        ActivityState s = ActivityState.initial(Activity.ACTIVE);

        s = monitor.apply(0.01, s);
        s = monitor.apply(0.01, s);
        s = monitor.apply(0.5, s);
        s = monitor.apply(0.01, s);
        s = monitor.apply(0.01, s);

        assertThat(s.activity()).isEqualTo(Activity.ACTIVE);
        assertThat(s.consecutiveBelowThreshold()).isEqualTo(2);
        assertThat(s.consecutiveAboveThreshold()).isZero();
    }

    @Test
    void levelBetweenThresholdsChangesNothing() {
        ActivityState s = new ActivityState(Activity.STANDBY, 0, 1);

        LevelReading reading = monitor.evaluate(TestAudio.constant(TestAudio.MIDDLING, 800), s);

        assertThat(reading.state()).isEqualTo(s);
        assertThat(reading.transitioned()).isFalse();
    }

    @Test
    void levelExactlyAtThresholdIsDeadBand() {
        ActivityState s = new ActivityState(Activity.ACTIVE, 1, 0);

        assertThat(monitor.apply(0.05, s)).isEqualTo(s);
        assertThat(monitor.apply(0.1, s)).isEqualTo(s);
    }

    @Test
    void quietBuffersInStandbyKeepCounting() {
        ActivityState s = monitor.initialState();

        for (int i = 0; i < 10; i++) {
            s = monitor.apply(0.0, s);
        }

        assertThat(s.activity()).isEqualTo(Activity.STANDBY);
        assertThat(s.consecutiveBelowThreshold()).isEqualTo(10);
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThatThrownBy(() -> new LevelMonitor(LoudnessMetric.PEAK, 0.2, 0.1, 1, 1, Activity.STANDBY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("activityThreshold");
    }

    @Test
    void readsInitialStateFromProperties() {
        DetectionProperties.Level props = new DetectionProperties.Level();
        props.setInitialState(Activity.ACTIVE);
        props.setMetric(LoudnessMetric.RMS);

        LevelMonitor fromProps = new LevelMonitor(props);

        assertThat(fromProps.initialState().activity()).isEqualTo(Activity.ACTIVE);
        assertThat(fromProps.getMetric()).isEqualTo(LoudnessMetric.RMS);
    }
}
