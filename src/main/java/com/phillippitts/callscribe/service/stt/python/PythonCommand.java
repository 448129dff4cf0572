package com.phillippitts.callscribe.service.stt.python;

import com.phillippitts.callscribe.exception.InvalidConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed and allowlisted command line for the faster-whisper helper script.
 *
 * <p>Only these shapes are accepted:
 * <ul>
 *   <li>executable {@code python}, {@code python3}, {@code python3.11} from PATH, or the project's
 *       {@code ./.venv/bin/python} / {@code ./.venv/bin/python3}</li>
 *   <li>first argument {@code scripts/transcribe_faster_whisper.py} relative to the working directory</li>
 *   <li>no shell metacharacters anywhere; no shell is ever involved</li>
 * </ul>
 *
 * @param executable the python executable as written in the configuration
 * @param arguments script path followed by optional flags
 */
public record PythonCommand(String executable, List<String> arguments) {

    static final String PROPERTY = "stt.python.command";
    static final Path ALLOWED_SCRIPT = Path.of("scripts", "transcribe_faster_whisper.py");

    private static final Pattern PYTHON_NAME = Pattern.compile("^python(\\d+(\\.\\d+)?)?$");
    private static final Pattern SHELL_META = Pattern.compile("[;&|<>`$\"'\\\\]");

    public PythonCommand {
        arguments = List.copyOf(arguments);
    }

    /**
     * Validates and splits a configured command line.
     *
     * @throws InvalidConfigurationException if the command is empty or outside the allowlist
     */
    public static PythonCommand parse(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            throw new InvalidConfigurationException(PROPERTY, "is empty");
        }
        if (SHELL_META.matcher(commandLine).find()) {
            throw new InvalidConfigurationException(PROPERTY, "must not contain shell metacharacters or quotes");
        }
        List<String> parts = new ArrayList<>(Arrays.asList(commandLine.trim().split("\\s+")));
        String executable = parts.remove(0);

        Path cwd = Path.of("").toAbsolutePath().normalize();
        Path exePath = Path.of(executable);
        if (!PYTHON_NAME.matcher(String.valueOf(exePath.getFileName())).matches()) {
            throw new InvalidConfigurationException(PROPERTY,
                    "command must be python/python3 or ./.venv/bin/python (got: " + executable + ")");
        }
        if (executable.contains("/")) {
            Path resolved = cwd.resolve(exePath).normalize();
            boolean venv = resolved.equals(cwd.resolve(".venv/bin/python"))
                    || resolved.equals(cwd.resolve(".venv/bin/python3"));
            if (!venv) {
                throw new InvalidConfigurationException(PROPERTY,
                        "only the project virtualenv python may be given as a path (got: " + executable + ")");
            }
            if (!Files.exists(resolved)) {
                throw new InvalidConfigurationException(PROPERTY, "venv python not found: " + executable);
            }
        }

        if (parts.isEmpty()) {
            throw new InvalidConfigurationException(PROPERTY, "must include " + ALLOWED_SCRIPT);
        }
        Path script = cwd.resolve(parts.get(0)).normalize();
        if (!script.equals(cwd.resolve(ALLOWED_SCRIPT))) {
            throw new InvalidConfigurationException(PROPERTY,
                    "script must be ./" + ALLOWED_SCRIPT + " (got: " + parts.get(0) + ")");
        }
        return new PythonCommand(executable, parts);
    }

    /**
     * @return the full argument vector with the audio file appended
     */
    public List<String> withInput(Path audioFile) {
        List<String> cmd = new ArrayList<>(arguments.size() + 2);
        cmd.add(executable);
        cmd.addAll(arguments);
        cmd.add(audioFile.toAbsolutePath().toString());
        return cmd;
    }
}
