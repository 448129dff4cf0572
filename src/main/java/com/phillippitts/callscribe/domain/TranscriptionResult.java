package com.phillippitts.callscribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Text produced by a speech-to-text engine for one segment.
 *
 * @param text transcribed text, empty for silence or unintelligible audio
 * @param confidence engine confidence in [0.0, 1.0]; 1.0 when the engine reports none
 * @param timestamp when the result was produced
 * @param engineName engine that produced it
 */
public record TranscriptionResult(
        String text,
        double confidence,
        Instant timestamp,
        String engineName
) {

    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    public static TranscriptionResult of(String text, double confidence, String engineName) {
        return new TranscriptionResult(text, confidence, Instant.now(), engineName);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
