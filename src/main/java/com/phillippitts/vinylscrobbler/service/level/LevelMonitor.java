package com.phillippitts.vinylscrobbler.service.level;

import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.domain.Activity;
import com.phillippitts.vinylscrobbler.domain.ActivityState;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Classifies probe buffers as Active or Standby with hysteresis.
 *
 * <p>Transition rule:
 * <ul>
 *   <li>level below the silence threshold: below-counter +1, above-counter reset; Active becomes
 *       Standby once the below-counter reaches the standby window</li>
 *   <li>level above the activity threshold: above-counter +1, below-counter reset; Standby becomes
 *       Active once the above-counter reaches the activity window</li>
 *   <li>anything in between leaves counters and state untouched</li>
 * </ul>
 *
 * <p>Stateless and thread-safe; the caller owns the {@link ActivityState}.
 */
public class LevelMonitor {

    private static final Logger LOG = LogManager.getLogger(LevelMonitor.class);

    private final LoudnessMetric metric;
    private final double silenceThreshold;
    private final double activityThreshold;
    private final int activityWindow;
    private final int standbyWindow;
    private final Activity initialActivity;

    public LevelMonitor(DetectionProperties.Level props) {
        this(props.getMetric(), props.getSilenceThreshold(), props.getActivityThreshold(),
                props.getActivityWindow(), props.getStandbyWindow(), props.getInitialState());
    }

    public LevelMonitor(LoudnessMetric metric,
                        double silenceThreshold,
                        double activityThreshold,
                        int activityWindow,
                        int standbyWindow,
                        Activity initialActivity) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        if (activityThreshold < silenceThreshold) {
            throw new IllegalArgumentException("activityThreshold (" + activityThreshold
                    + ") must be >= silenceThreshold (" + silenceThreshold + ")");
        }
        if (activityWindow < 1 || standbyWindow < 1) {
            throw new IllegalArgumentException("windows must be >= 1");
        }
        this.silenceThreshold = silenceThreshold;
        this.activityThreshold = activityThreshold;
        this.activityWindow = activityWindow;
        this.standbyWindow = standbyWindow;
        this.initialActivity = Objects.requireNonNull(initialActivity, "initialActivity must not be null");
    }

    /** State a new session starts from. */
    public ActivityState initialState() {
        return ActivityState.initial(initialActivity);
    }

    /**
     * Measures the buffer and applies the transition rule.
     *
     * @param pcm     probe buffer
     * @param current state before this buffer
     * @return updated state and the measured level
     */
    public LevelReading evaluate(PcmBuffer pcm, ActivityState current) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(current, "current must not be null");
        double level = metric.measure(pcm);
        ActivityState next = apply(level, current);
        boolean transitioned = next.activity() != current.activity();
        if (transitioned) {
            LOG.info("Activity {} -> {} (level={}, metric={})",
                    current.activity(), next.activity(), String.format("%.4f", level), metric);
        } else {
            LOG.debug("Level {} ({}), state={}", String.format("%.4f", level), metric, next);
        }
        return new LevelReading(next, level, transitioned);
    }

    ActivityState apply(double level, ActivityState current) {
        if (level < silenceThreshold) {
            int below = current.consecutiveBelowThreshold() + 1;
            Activity activity = current.activity();
            if (activity == Activity.ACTIVE && below >= standbyWindow) {
                activity = Activity.STANDBY;
            }
            return new ActivityState(activity, below, 0);
        }
        if (level > activityThreshold) {
            int above = current.consecutiveAboveThreshold() + 1;
            Activity activity = current.activity();
            if (activity == Activity.STANDBY && above >= activityWindow) {
                activity = Activity.ACTIVE;
            }
            return new ActivityState(activity, 0, above);
        }
        return current;
    }

    public LoudnessMetric getMetric() {
        return metric;
    }
}
