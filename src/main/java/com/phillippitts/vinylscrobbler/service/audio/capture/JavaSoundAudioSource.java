package com.phillippitts.vinylscrobbler.service.audio.capture;

import com.phillippitts.vinylscrobbler.config.properties.AudioCaptureProperties;
import com.phillippitts.vinylscrobbler.exception.AudioDeviceException;
import com.phillippitts.vinylscrobbler.service.audio.AudioFormat;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Objects;
import java.util.Optional;

import static com.phillippitts.vinylscrobbler.exception.AudioDeviceException.Reason.IO_ERROR;
import static com.phillippitts.vinylscrobbler.exception.AudioDeviceException.Reason.STREAM_CLOSED;
import static com.phillippitts.vinylscrobbler.exception.AudioDeviceException.Reason.UNAVAILABLE;

/**
 * Java Sound input producing mono PCM16LE at the configured rate.
 *
 * <p>Captures 16-bit signed little-endian frames with the configured channel count and
 * averages channels down to mono. Each {@link #open(Integer)} returns a fresh stream, so a
 * device can be reopened after its line was closed.
 */
public class JavaSoundAudioSource implements AudioSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Integer deviceIndex)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    public JavaSoundAudioSource(AudioCaptureProperties props, AudioDeviceCatalog catalog) {
        this(props, catalogProvider(catalog));
    }

    // Package-private for tests
    JavaSoundAudioSource(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider catalogProvider(AudioDeviceCatalog catalog) {
        return (format, deviceIndex) -> {
            DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
            TargetDataLine line;
            if (deviceIndex != null) {
                Optional<Mixer> mixer = catalog.mixerAt(deviceIndex);
                if (mixer.isEmpty()) {
                    throw new LineUnavailableException("No input device at index " + deviceIndex);
                }
                line = (TargetDataLine) mixer.get().getLine(info);
            } else {
                line = (TargetDataLine) AudioSystem.getLine(info);
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public AudioStream open(Integer deviceIndex) {
        javax.sound.sampled.AudioFormat fmt =
                AudioFormat.captureFormat(props.getSampleRate(), props.getChannels());
        try {
            TargetDataLine line = provider.open(fmt, deviceIndex);
            line.start();
            LOG.info("Opened audio input: device={}, rate={}Hz, channels={}",
                    deviceIndex == null ? "default" : deviceIndex, props.getSampleRate(), props.getChannels());
            return new LineStream(line, deviceIndex, props.getSampleRate(), props.getChannels());
        } catch (LineUnavailableException e) {
            throw new AudioDeviceException(UNAVAILABLE, deviceIndex, "Audio input unavailable: " + e.getMessage(), e);
        } catch (SecurityException | IllegalArgumentException e) {
            throw new AudioDeviceException(UNAVAILABLE, deviceIndex, "Audio input cannot be opened: " + e.getMessage(), e);
        }
    }

    static final class LineStream implements AudioStream {
        private final TargetDataLine line;
        private final Integer deviceIndex;
        private final int sampleRate;
        private final int channels;
        private volatile boolean closed;

        LineStream(TargetDataLine line, Integer deviceIndex, int sampleRate, int channels) {
            this.line = line;
            this.deviceIndex = deviceIndex;
            this.sampleRate = sampleRate;
            this.channels = channels;
        }

        @Override
        public PcmBuffer read(int frames) {
            if (frames < 0) {
                throw new IllegalArgumentException("frames must be >= 0");
            }
            if (closed || !line.isOpen()) {
                throw new AudioDeviceException(STREAM_CLOSED, deviceIndex, "Audio stream is closed");
            }
            int frameBytes = AudioFormat.BLOCK_ALIGN * channels;
            byte[] raw = new byte[frames * frameBytes];
            int filled = 0;
            while (filled < raw.length) {
                int n;
                try {
                    n = line.read(raw, filled, raw.length - filled);
                } catch (IllegalArgumentException e) {
                    throw new AudioDeviceException(IO_ERROR, deviceIndex, "Audio read failed: " + e.getMessage(), e);
                }
                if (n <= 0) {
                    if (closed || !line.isOpen()) {
                        throw new AudioDeviceException(STREAM_CLOSED, deviceIndex, "Audio stream closed during read");
                    }
                    if (!line.isActive()) {
                        throw new AudioDeviceException(IO_ERROR, deviceIndex, "Audio line stopped delivering data");
                    }
                    continue;
                }
                filled += n;
            }
            return new PcmBuffer(channels == 1 ? raw : downMix(raw, channels), sampleRate);
        }

        @Override
        public boolean isOpen() {
            return !closed && line.isOpen();
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                line.stop();
            } catch (RuntimeException e) {
                LOG.debug("Ignoring failure stopping line: {}", e.toString());
            }
            try {
                line.close();
            } catch (RuntimeException e) {
                LOG.debug("Ignoring failure closing line: {}", e.toString());
            }
            LOG.info("Closed audio input: device={}", deviceIndex == null ? "default" : deviceIndex);
        }
    }

    /** Averages interleaved PCM16LE channels into a mono PCM16LE array. */
    static byte[] downMix(byte[] interleaved, int channels) {
        int frameBytes = AudioFormat.BLOCK_ALIGN * channels;
        int frames = interleaved.length / frameBytes;
        byte[] mono = new byte[frames * AudioFormat.BLOCK_ALIGN];
        for (int f = 0; f < frames; f++) {
            int sum = 0;
            for (int c = 0; c < channels; c++) {
                int i = f * frameBytes + c * 2;
                sum += (interleaved[i] & 0xFF) | (interleaved[i + 1] << 8);
            }
            int avg = sum / channels;
            mono[2 * f] = (byte) (avg & 0xFF);
            mono[2 * f + 1] = (byte) ((avg >> 8) & 0xFF);
        }
        return mono;
    }
}
