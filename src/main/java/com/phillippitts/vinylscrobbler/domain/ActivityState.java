package com.phillippitts.vinylscrobbler.domain;

import java.util.Objects;

/**
 * Hysteresis state of the level monitor: the current {@link Activity} plus the two run-length
 * counters used to decide transitions.
 *
 * <p>Immutable; the level monitor returns a new instance per evaluated buffer. Reset at session start.
 *
 * @param activity                  current classification
 * @param consecutiveBelowThreshold run length of buffers below the silence threshold
 * @param consecutiveAboveThreshold run length of buffers above the activity threshold
 */
public record ActivityState(
        Activity activity,
        int consecutiveBelowThreshold,
        int consecutiveAboveThreshold
) {

    public ActivityState {
        Objects.requireNonNull(activity, "activity must not be null");
        if (consecutiveBelowThreshold < 0 || consecutiveAboveThreshold < 0) {
            throw new IllegalArgumentException("counters must be non-negative");
        }
    }

    /** Fresh state with both counters at zero. */
    public static ActivityState initial(Activity activity) {
        return new ActivityState(activity, 0, 0);
    }

    public boolean isStandby() {
        return activity == Activity.STANDBY;
    }
}
