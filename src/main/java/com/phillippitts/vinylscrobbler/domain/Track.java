package com.phillippitts.vinylscrobbler.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model for an identified track.
 *
 * <p>Identity for deduplication purposes is {@link #key()}; confidence and detection time
 * are informational only.
 *
 * @param artist     performing artist
 * @param title      track title
 * @param confidence mean recognizer confidence over the agreeing samples (0.0 when unknown)
 * @param detectedAt when the track was confirmed
 */
public record Track(
        String artist,
        String title,
        double confidence,
        Instant detectedAt
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if artist/title are sentinel values or confidence is negative
     * @throws NullPointerException if detectedAt is null
     */
    public Track {
        if (!TrackKey.isValid(artist, title)) {
            throw new IllegalArgumentException("Track requires a real artist and title, got: "
                    + artist + " / " + title);
        }
        if (confidence < 0.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be non-negative, got: " + confidence);
        }
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");
    }

    /**
     * Creates a Track detected now.
     */
    public static Track of(String artist, String title, double confidence) {
        return new Track(artist, title, confidence, Instant.now());
    }

    /**
     * Creates a Track from a confirmed key.
     */
    public static Track of(TrackKey key, double confidence, Instant detectedAt) {
        return new Track(key.artist(), key.title(), confidence, detectedAt);
    }

    public TrackKey key() {
        return new TrackKey(artist, title);
    }

    /** Returns whether both tracks refer to the same {@code (artist, title)}; null-safe. */
    public static boolean sameTrack(Track a, Track b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.key().equals(b.key());
    }
}
