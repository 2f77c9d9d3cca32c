package com.phillippitts.vinylscrobbler.service.audio.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Line;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lists input-capable mixers and picks the default one.
 *
 * <p>Indices are positions in {@link #listInputDevices()}; they stay stable as long as no device
 * is plugged in or removed.
 */
public class AudioDeviceCatalog {

    private static final Logger LOG = LogManager.getLogger(AudioDeviceCatalog.class);

    /** Abstraction over {@link AudioSystem#getMixerInfo()} (for testing). */
    public interface MixerLookup {
        List<Mixer> inputMixers();
    }

    private final MixerLookup lookup;

    public AudioDeviceCatalog() {
        this(AudioDeviceCatalog::systemInputMixers);
    }

    public AudioDeviceCatalog(MixerLookup lookup) {
        this.lookup = lookup;
    }

    /**
     * @return input devices in catalog order
     */
    public List<AudioDevice> listInputDevices() {
        List<Mixer> mixers = lookup.inputMixers();
        List<AudioDevice> devices = new ArrayList<>(mixers.size());
        for (int i = 0; i < mixers.size(); i++) {
            Mixer m = mixers.get(i);
            devices.add(new AudioDevice(i, m.getMixerInfo().getName(), maxChannels(m)));
        }
        return devices;
    }

    /**
     * Device used when a session is started without an index: the first whose name contains
     * "usb" (turntables and phono preamps usually are), otherwise the first input device.
     */
    public Optional<AudioDevice> defaultDevice() {
        List<AudioDevice> devices = listInputDevices();
        for (AudioDevice d : devices) {
            if (d.name() != null && d.name().toLowerCase(Locale.ROOT).contains("usb")) {
                LOG.debug("Default input device: {} (usb)", d);
                return Optional.of(d);
            }
        }
        return devices.stream().findFirst();
    }

    /** Mixer at the given catalog index. */
    public Optional<Mixer> mixerAt(int index) {
        List<Mixer> mixers = lookup.inputMixers();
        if (index < 0 || index >= mixers.size()) {
            return Optional.empty();
        }
        return Optional.of(mixers.get(index));
    }

    private static List<Mixer> systemInputMixers() {
        List<Mixer> result = new ArrayList<>();
        for (Mixer.Info info : AudioSystem.getMixerInfo()) {
            Mixer m = AudioSystem.getMixer(info);
            if (m.isLineSupported(new Line.Info(TargetDataLine.class))) {
                result.add(m);
            }
        }
        return result;
    }

    private static int maxChannels(Mixer m) {
        int max = -1;
        for (Line.Info li : m.getTargetLineInfo()) {
            if (li instanceof javax.sound.sampled.DataLine.Info dli) {
                for (javax.sound.sampled.AudioFormat f : dli.getFormats()) {
                    max = Math.max(max, f.getChannels());
                }
            }
        }
        return max;
    }
}
