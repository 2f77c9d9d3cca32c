package com.phillippitts.vinylscrobbler.service.audio.capture;

import com.phillippitts.vinylscrobbler.exception.AudioDeviceException;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;

/**
 * An open input stream delivering mono PCM16LE audio.
 */
public interface AudioStream extends AutoCloseable {

    /**
     * Blocks until {@code frames} mono frames are available.
     *
     * @throws AudioDeviceException with reason {@code STREAM_CLOSED} or {@code IO_ERROR}
     */
    PcmBuffer read(int frames);

    boolean isOpen();

    /** Releases the device. Idempotent; never throws. */
    @Override
    void close();
}
