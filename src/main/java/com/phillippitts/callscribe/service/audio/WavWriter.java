package com.phillippitts.callscribe.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.callscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.callscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.callscribe.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.callscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.callscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Writes 16 kHz mono PCM with a canonical 44-byte RIFF header, the input whisper.cpp and the
 * faster-whisper script read.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void writePcm16LeMono16kHz(byte[] pcm, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(new byte[] {'R', 'I', 'F', 'F'});
            writeLEInt(os, 36 + pcm.length);
            os.write(new byte[] {'W', 'A', 'V', 'E'});

            os.write(new byte[] {'f', 'm', 't', ' '});
            writeLEInt(os, 16);
            writeLEShort(os, (short) 1); // PCM
            writeLEShort(os, (short) REQUIRED_CHANNELS);
            writeLEInt(os, REQUIRED_SAMPLE_RATE);
            writeLEInt(os, REQUIRED_BYTE_RATE);
            writeLEShort(os, (short) REQUIRED_BLOCK_ALIGN);
            writeLEShort(os, (short) REQUIRED_BITS_PER_SAMPLE);

            os.write(new byte[] {'d', 'a', 't', 'a'});
            writeLEInt(os, pcm.length);
            os.write(pcm);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write WAV file to " + wavPath.getFileName(), e);
        }
    }

    /**
     * @return {@code seconds} of digital silence in the required format
     */
    public static byte[] silence(double seconds) {
        int samples = (int) Math.round(seconds * REQUIRED_SAMPLE_RATE);
        return new byte[samples * AudioFormat.BYTES_PER_SAMPLE];
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
