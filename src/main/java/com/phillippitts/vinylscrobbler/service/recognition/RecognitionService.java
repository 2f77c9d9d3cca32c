package com.phillippitts.vinylscrobbler.service.recognition;

import com.phillippitts.vinylscrobbler.exception.RecognitionException;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;

import java.util.Optional;

/**
 * Identifies the music in an audio sample using an external service.
 *
 * <p>Implementations are called from the session run loop, one sample at a time. They may block
 * on network I/O; wrap them in {@link TimeLimitedRecognitionService} to bound the wait.
 */
public interface RecognitionService {

    /**
     * Identifies the sample.
     *
     * @param sample mono PCM16LE audio
     * @return the service's guess, or empty when nothing matched
     * @throws RecognitionException on service failure, timeout or an unreadable response
     */
    Optional<RecognitionResult> identify(PcmBuffer sample);

    /** Short name for logs and metrics. */
    String getServiceName();
}
