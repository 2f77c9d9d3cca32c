package com.phillippitts.vinylscrobbler.domain;

import java.time.Instant;

/**
 * Diagnostic snapshot exposed with every status update. Never used for control decisions.
 *
 * @param audioLevel      loudness metric of the last probe
 * @param lastDetectionAt when the last recognition round started (null before the first)
 * @param detectionCount  number of recognition rounds started in this session
 * @param lastError       message of the last recovered or fatal error (null when none)
 */
public record DebugInfo(
        double audioLevel,
        Instant lastDetectionAt,
        int detectionCount,
        String lastError
) {

    public static DebugInfo empty() {
        return new DebugInfo(0.0, null, 0, null);
    }

    public DebugInfo withAudioLevel(double level) {
        return new DebugInfo(level, lastDetectionAt, detectionCount, lastError);
    }

    public DebugInfo withDetectionStarted(Instant at) {
        return new DebugInfo(audioLevel, at, detectionCount + 1, lastError);
    }

    public DebugInfo withLastError(String error) {
        return new DebugInfo(audioLevel, lastDetectionAt, detectionCount, error);
    }
}
