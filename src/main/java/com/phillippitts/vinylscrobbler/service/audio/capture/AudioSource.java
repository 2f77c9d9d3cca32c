package com.phillippitts.vinylscrobbler.service.audio.capture;

import com.phillippitts.vinylscrobbler.exception.AudioDeviceException;

/**
 * Opens exclusive audio input streams.
 *
 * <p>Implementations must allow the same device to be opened again after its previous stream
 * was closed, since the session reopens the device after {@code STREAM_CLOSED} and {@code IO_ERROR}.
 */
public interface AudioSource {

    /**
     * Opens the device for reading.
     *
     * @param deviceIndex device index from {@link AudioDeviceCatalog}, or null for the default input
     * @return an open stream owned by the caller
     * @throws AudioDeviceException with reason {@code UNAVAILABLE} if the device cannot be opened
     */
    AudioStream open(Integer deviceIndex);
}
