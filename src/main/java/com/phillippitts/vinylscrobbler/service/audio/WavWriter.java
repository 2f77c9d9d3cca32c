package com.phillippitts.vinylscrobbler.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import static com.phillippitts.vinylscrobbler.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.vinylscrobbler.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.vinylscrobbler.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.vinylscrobbler.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Encodes mono PCM16LE buffers as minimal WAV payloads for upload to the recognizer.
 *
 * <p>Format: 16-bit signed PCM, mono, little-endian, at the buffer's sample rate.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Returns a complete WAV file (44-byte RIFF header followed by the samples).
     *
     * @param pcm mono PCM16LE buffer
     * @return WAV bytes
     */
    public static byte[] toWav(PcmBuffer pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.data().length);
        try {
            write(pcm, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new IllegalStateException("Failed to encode WAV: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    static void write(PcmBuffer pcm, OutputStream os) throws IOException {
        byte[] data = pcm.data();
        // ChunkID: "RIFF"
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        // ChunkSize: 36 + Subchunk2Size
        writeLEInt(os, 36 + data.length);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        // Subchunk1Size: 16 for PCM
        writeLEInt(os, 16);
        // AudioFormat: 1 for PCM
        writeLEShort(os, (short) 1);
        writeLEShort(os, (short) CHANNELS);
        writeLEInt(os, pcm.sampleRate());
        writeLEInt(os, AudioFormat.byteRate(pcm.sampleRate()));
        writeLEShort(os, (short) BLOCK_ALIGN);
        writeLEShort(os, (short) BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, data.length);
        os.write(data);
        os.flush();
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
