package com.phillippitts.vinylscrobbler.service.audio.capture;

/**
 * Input-capable audio device as listed by {@link AudioDeviceCatalog}.
 *
 * @param index    position in the catalog, used to open the device
 * @param name     mixer name
 * @param channels maximum input channels (-1 when the driver does not say)
 */
public record AudioDevice(int index, String name, int channels) {
}
