package com.phillippitts.vinylscrobbler.service.level;

import com.phillippitts.vinylscrobbler.service.audio.AudioFormat;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;

/**
 * Loudness measures the level monitor can gate on.
 *
 * <p>The metric decides the scale of the configured thresholds:
 * {@link #PEAK} works on samples normalized to [-1, 1], {@link #RMS} on raw 16-bit amplitudes.
 */
public enum LoudnessMetric {

    /** Largest absolute normalized sample value, in [0, 1]. */
    PEAK {
        @Override
        public double measure(PcmBuffer pcm) {
            int frames = pcm.frameCount();
            int max = 0;
            for (int i = 0; i < frames; i++) {
                int abs = Math.abs(pcm.sample(i));
                if (abs > max) {
                    max = abs;
                }
            }
            return max / AudioFormat.FULL_SCALE;
        }
    },

    /** Root-mean-square of the raw 16-bit samples, in [0, 32768]. */
    RMS {
        @Override
        public double measure(PcmBuffer pcm) {
            int frames = pcm.frameCount();
            if (frames == 0) {
                return 0.0;
            }
            double sumSquares = 0.0;
            for (int i = 0; i < frames; i++) {
                int s = pcm.sample(i);
                sumSquares += (double) s * s;
            }
            return Math.sqrt(sumSquares / frames);
        }
    };

    /**
     * Computes the metric over the whole buffer. An empty buffer measures 0.
     */
    public abstract double measure(PcmBuffer pcm);
}
