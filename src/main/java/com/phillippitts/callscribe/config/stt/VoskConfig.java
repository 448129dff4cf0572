package com.phillippitts.callscribe.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the in-process Vosk engine ("stt.vosk").
 *
 * @param modelPath directory of the unpacked Vosk model
 * @param sampleRate sample rate fed to the recognizer; segments are decoded to 16 kHz
 * @param maxAlternatives recognizer alternatives (1 keeps the plain result format)
 */
@ConfigurationProperties(prefix = "stt.vosk")
@Validated
public record VoskConfig(
        @NotBlank(message = "Vosk model path must not be blank")
        String modelPath,

        @Positive(message = "Sample rate must be positive")
        int sampleRate,

        @Positive(message = "Max alternatives must be positive")
        int maxAlternatives
) {

    @ConstructorBinding
    public VoskConfig {
    }

    public VoskConfig() {
        this("models/vosk-model-small-en-us-0.15", 16_000, 1);
    }
}
