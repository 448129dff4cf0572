package com.phillippitts.callscribe.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp engine.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.model-path=models/ggml-base.bin
 * stt.whisper.timeout-seconds=120
 * stt.whisper.language=auto
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param modelPath Path to the GGML model file (.bin)
 * @param timeoutSeconds Maximum time to wait for one segment
 * @param language Language code, or "auto" for detection
 * @param threads Number of CPU threads per process
 * @param maxStdoutBytes Cap on accumulated stdout
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {

    @ConstructorBinding
    public WhisperConfig {
    }

    public WhisperConfig() {
        this("tools/whisper.cpp/main", "models/ggml-base.bin", 120, "auto", 4, 1_048_576);
    }
}
