package com.phillippitts.vinylscrobbler.service.audio.capture;

import com.phillippitts.vinylscrobbler.config.properties.AudioCaptureProperties;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads fixed-length samples from an open stream in chunk-sized pieces.
 *
 * <p>The interrupt flag is checked between chunks so a stop request does not wait for a whole
 * recognition sample to be captured.
 */
public class SampleRecorder {

    private final AudioCaptureProperties props;

    public SampleRecorder(AudioCaptureProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Captures {@code durationMs} of audio.
     *
     * @throws InterruptedException if the calling thread was interrupted between chunks
     * @throws com.phillippitts.vinylscrobbler.exception.AudioDeviceException on stream failure
     */
    public PcmBuffer record(AudioStream stream, int durationMs) throws InterruptedException {
        int remaining = Math.max(1, props.framesFor(durationMs));
        int chunk = props.getChunkFrames();
        List<PcmBuffer> parts = new ArrayList<>(remaining / chunk + 1);
        while (remaining > 0) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while recording");
            }
            int frames = Math.min(chunk, remaining);
            parts.add(stream.read(frames));
            remaining -= frames;
        }
        return parts.size() == 1 ? parts.get(0) : PcmBuffer.concat(parts);
    }

    /** One recognition-length sample. */
    public PcmBuffer recordSample(AudioStream stream) throws InterruptedException {
        return record(stream, props.getSampleDurationMs());
    }

    /** One loudness probe. */
    public PcmBuffer recordProbe(AudioStream stream) throws InterruptedException {
        return record(stream, props.getLevelCheckMs());
    }
}
