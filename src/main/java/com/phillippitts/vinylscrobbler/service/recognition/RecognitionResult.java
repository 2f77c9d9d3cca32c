package com.phillippitts.vinylscrobbler.service.recognition;

import com.phillippitts.vinylscrobbler.domain.TrackKey;

import java.util.Optional;

/**
 * Raw guess returned by a {@link RecognitionService} for one sample.
 *
 * <p>Artist and title are passed through as the service reported them and may be blank or a
 * placeholder such as "unknown"; use {@link #key()} to get a usable identity.
 *
 * @param artist     reported artist
 * @param title      reported title
 * @param confidence reported confidence, 0.0 when the service gives none
 */
public record RecognitionResult(String artist, String title, double confidence) {

    /** Identity of the guess, empty when artist or title is missing or a placeholder. */
    public Optional<TrackKey> key() {
        return TrackKey.isValid(artist, title) ? Optional.of(new TrackKey(artist, title)) : Optional.empty();
    }
}
