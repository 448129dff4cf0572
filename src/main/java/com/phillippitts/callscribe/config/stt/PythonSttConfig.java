package com.phillippitts.callscribe.config.stt;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the faster-whisper engine, which runs a Python helper script per segment.
 *
 * <p>The command is split on whitespace and checked against an allowlist before use, see
 * {@link com.phillippitts.callscribe.service.stt.python.PythonCommand}. The WAV path is appended
 * as the last argument.
 *
 * @param command e.g. {@code ./.venv/bin/python scripts/transcribe_faster_whisper.py}
 * @param timeoutSeconds per-segment process timeout
 * @param maxStdoutBytes cap on accumulated stdout
 */
@ConfigurationProperties(prefix = "stt.python")
@Validated
public record PythonSttConfig(
        String command,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {

    @ConstructorBinding
    public PythonSttConfig {
        command = command == null ? "" : command.trim();
    }

    public PythonSttConfig() {
        this("", 600, 1_048_576);
    }
}
