package com.phillippitts.callscribe.service.stt.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One external engine invocation.
 *
 * @param engine engine name for error attribution
 * @param command executable followed by its arguments
 * @param workingDir working directory, or {@code null} to inherit
 * @param timeout wall-clock limit, the process is destroyed afterwards
 * @param maxStdoutBytes cap on accumulated stdout
 * @param diagnostics extra key/values attached to failures (model path, binary)
 */
public record ProcessSpec(
        String engine,
        List<String> command,
        Path workingDir,
        Duration timeout,
        int maxStdoutBytes,
        Map<String, String> diagnostics
) {

    public ProcessSpec {
        Objects.requireNonNull(engine, "engine");
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Objects.requireNonNull(timeout, "timeout");
        diagnostics = diagnostics == null ? Map.of() : Map.copyOf(diagnostics);
    }
}
