package com.phillippitts.vinylscrobbler.service.audio;

/**
 * Single source of truth for the analysis audio format.
 * Always 16-bit signed PCM, mono, little-endian; the sample rate is configurable.
 */
public final class AudioFormat {

    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Channels after down-mixing (mono). */
    public static final int CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per mono frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes

    /** Full-scale magnitude of a 16-bit sample, used to normalize to [-1, 1]. */
    public static final double FULL_SCALE = 32768.0;

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** Bytes per second of mono PCM at the given rate. */
    public static int byteRate(int sampleRate) {
        return sampleRate * BLOCK_ALIGN;
    }

    /** Java Sound format for capturing {@code channels} channels at {@code sampleRate}. */
    public static javax.sound.sampled.AudioFormat captureFormat(int sampleRate, int channels) {
        return new javax.sound.sampled.AudioFormat(sampleRate, BITS_PER_SAMPLE, channels, SIGNED, BIG_ENDIAN);
    }
}
