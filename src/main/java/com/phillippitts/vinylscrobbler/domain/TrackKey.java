package com.phillippitts.vinylscrobbler.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Identity of a track for deduplication and majority voting: the {@code (artist, title)} pair.
 *
 * <p>Equality is exact (case-sensitive) on both components, matching what the recognizer returns.
 *
 * @param artist performing artist (never blank)
 * @param title  track title (never blank)
 */
public record TrackKey(String artist, String title) {

    /** Values the recognizer uses when it has nothing to report. */
    private static final Set<String> SENTINELS = Set.of("unknown", "none");

    public TrackKey {
        if (!isMeaningful(artist)) {
            throw new IllegalArgumentException("artist must be a non-sentinel value, got: " + artist);
        }
        if (!isMeaningful(title)) {
            throw new IllegalArgumentException("title must be a non-sentinel value, got: " + title);
        }
    }

    /**
     * Returns whether the value is usable as an artist or title: non-null, non-blank and not
     * one of the "unknown"/"none" placeholders.
     */
    public static boolean isMeaningful(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return !SENTINELS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /** Returns whether both components are meaningful, i.e. a key can be built from them. */
    public static boolean isValid(String artist, String title) {
        return isMeaningful(artist) && isMeaningful(title);
    }

    /** Null-safe identity comparison. */
    public static boolean same(TrackKey a, TrackKey b) {
        return Objects.equals(a, b);
    }

    @Override
    public String toString() {
        return title + " by " + artist;
    }
}
