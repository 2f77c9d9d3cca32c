package com.phillippitts.vinylscrobbler.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the live audio input.
 *
 * Capture format is always 16-bit signed PCM, little-endian; multi-channel input is
 * down-mixed to mono before analysis.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Capture sample rate in Hz. */
    @Min(8_000)
    @Max(192_000)
    private final int sampleRate;

    /** Channels requested from the device. */
    @Min(1)
    @Max(2)
    private final int channels;

    /** Frames per read from the TargetDataLine. */
    @Min(256)
    @Max(65_536)
    private final int chunkFrames;

    /** Length of each recognition sample in milliseconds. */
    @Min(1_000)
    @Max(30_000)
    private final int sampleDurationMs;

    /** Length of the loudness probe taken at the start of every cycle. */
    @Min(20)
    @Max(10_000)
    private final int levelCheckMs;

    /** Device index used when start is requested without one; null selects automatically. */
    private final Integer deviceIndex;

    /** Consecutive failed reopen attempts tolerated before the session is stopped. */
    @Min(1)
    @Max(20)
    private final int maxReopenAttempts;

    @ConstructorBinding
    public AudioCaptureProperties(Integer sampleRate,
                                  Integer channels,
                                  Integer chunkFrames,
                                  Integer sampleDurationMs,
                                  Integer levelCheckMs,
                                  Integer deviceIndex,
                                  Integer maxReopenAttempts) {
        this.sampleRate = sampleRate == null ? 44_100 : sampleRate;
        this.channels = channels == null ? 1 : channels;
        this.chunkFrames = chunkFrames == null ? 4096 : chunkFrames;
        this.sampleDurationMs = sampleDurationMs == null ? 5_000 : sampleDurationMs;
        this.levelCheckMs = levelCheckMs == null ? 100 : levelCheckMs;
        this.deviceIndex = deviceIndex;
        this.maxReopenAttempts = maxReopenAttempts == null ? 3 : maxReopenAttempts;
    }

    /**
     * Defaults for tests and programmatic wiring.
     */
    public static AudioCaptureProperties defaults() {
        return new AudioCaptureProperties(null, null, null, null, null, null, null);
    }

    public int getSampleRate() { return sampleRate; }
    public int getChannels() { return channels; }
    public int getChunkFrames() { return chunkFrames; }
    public int getSampleDurationMs() { return sampleDurationMs; }
    public int getLevelCheckMs() { return levelCheckMs; }
    public Integer getDeviceIndex() { return deviceIndex; }
    public int getMaxReopenAttempts() { return maxReopenAttempts; }

    /** Mono frames needed to cover the given duration at the configured rate. */
    public int framesFor(int durationMs) {
        return (int) ((long) sampleRate * durationMs / 1000L);
    }
}
