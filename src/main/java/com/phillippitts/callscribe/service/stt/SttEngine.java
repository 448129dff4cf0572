package com.phillippitts.callscribe.service.stt;

import com.phillippitts.callscribe.domain.TranscriptionResult;
import com.phillippitts.callscribe.exception.ModelNotFoundException;
import com.phillippitts.callscribe.exception.TranscriptionException;

/**
 * Contract for speech-to-text engines.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with its configuration</li>
 *   <li>{@link #initialize()} validates binaries or loads the model (may throw {@link ModelNotFoundException})</li>
 *   <li>{@link #transcribe(byte[])} converts one segment (may throw {@link TranscriptionException})</li>
 *   <li>{@link #close()} releases resources</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must accept concurrent calls with distinct inputs; one call
 * runs per speaker segment.
 *
 * <p>Audio Format: input is the format defined by
 * {@link com.phillippitts.callscribe.service.audio.AudioFormat}: 16 kHz, 16-bit signed PCM,
 * mono, little-endian, without a header.
 */
public interface SttEngine extends AutoCloseable {

    void initialize();

    /**
     * Transcribes one decoded segment.
     *
     * @param pcm16k raw PCM in the required format
     * @return result whose text may be empty
     * @throws TranscriptionException if the engine fails or times out
     * @throws IllegalArgumentException if the audio is null or empty
     */
    TranscriptionResult transcribe(byte[] pcm16k);

    /**
     * @return engine name for logs and metrics tags (e.g. "whisper", "faster-whisper", "vosk")
     */
    String getEngineName();

    boolean isHealthy();

    @Override
    void close();
}
