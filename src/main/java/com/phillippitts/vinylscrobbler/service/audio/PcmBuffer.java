package com.phillippitts.vinylscrobbler.service.audio;

import java.util.List;
import java.util.Objects;

/**
 * A block of mono PCM16LE audio at a known sample rate.
 *
 * <p>The byte array is not copied; treat instances as read-only once handed over.
 *
 * @param data       PCM16LE mono samples (length must be even)
 * @param sampleRate sample rate in Hz
 */
public record PcmBuffer(byte[] data, int sampleRate) {

    public PcmBuffer {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length % AudioFormat.BLOCK_ALIGN != 0) {
            throw new IllegalArgumentException("PCM16 data must be block aligned, got " + data.length + " bytes");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
    }

    public static PcmBuffer empty(int sampleRate) {
        return new PcmBuffer(new byte[0], sampleRate);
    }

    /**
     * Builds a buffer from signed 16-bit sample values.
     */
    public static PcmBuffer ofSamples(short[] samples, int sampleRate) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) (samples[i] & 0xFF);
            out[2 * i + 1] = (byte) ((samples[i] >> 8) & 0xFF);
        }
        return new PcmBuffer(out, sampleRate);
    }

    /**
     * Concatenates buffers of the same sample rate.
     *
     * @throws IllegalArgumentException if the list is empty or sample rates differ
     */
    public static PcmBuffer concat(List<PcmBuffer> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        int rate = parts.get(0).sampleRate();
        int total = 0;
        for (PcmBuffer p : parts) {
            if (p.sampleRate() != rate) {
                throw new IllegalArgumentException("Sample rate mismatch: " + rate + " vs " + p.sampleRate());
            }
            total += p.data().length;
        }
        byte[] out = new byte[total];
        int pos = 0;
        for (PcmBuffer p : parts) {
            System.arraycopy(p.data(), 0, out, pos, p.data().length);
            pos += p.data().length;
        }
        return new PcmBuffer(out, rate);
    }

    public int frameCount() {
        return data.length / AudioFormat.BLOCK_ALIGN;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    /** Signed sample value at frame {@code index}. */
    public int sample(int index) {
        int i = index * 2;
        return (data[i] & 0xFF) | (data[i + 1] << 8);
    }

    public long durationMs() {
        return frameCount() * 1000L / sampleRate;
    }
}
