package com.phillippitts.vinylscrobbler.service.level;

import com.phillippitts.vinylscrobbler.domain.ActivityState;

import java.util.Objects;

/**
 * Result of evaluating one probe buffer.
 *
 * @param state        updated hysteresis state
 * @param level        raw metric value, for diagnostics
 * @param transitioned whether the activity flipped on this buffer
 */
public record LevelReading(ActivityState state, double level, boolean transitioned) {

    public LevelReading {
        Objects.requireNonNull(state, "state must not be null");
    }
}
