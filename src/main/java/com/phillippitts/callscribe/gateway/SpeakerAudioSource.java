package com.phillippitts.callscribe.gateway;

import java.time.Duration;

/**
 * Decoded audio of a single speaker: signed 16-bit little-endian mono PCM frames.
 */
public interface SpeakerAudioSource extends AutoCloseable {

    /** Sample rate of the frames returned by {@link #poll(Duration)}. */
    int sampleRate();

    /**
     * Waits up to {@code timeout} for the next frame.
     *
     * @return the next PCM frame, or {@code null} when none arrived in time or the stream ended
     */
    byte[] poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
