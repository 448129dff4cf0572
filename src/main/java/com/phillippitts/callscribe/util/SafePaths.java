package com.phillippitts.callscribe.util;

import com.phillippitts.callscribe.exception.InvalidConfigurationException;

import java.nio.file.Path;

/**
 * Resolves configured paths against the working directory and refuses ones that escape it.
 */
public final class SafePaths {

    private SafePaths() {}

    /**
     * Resolves {@code value} for the property {@code property}.
     *
     * @param allowAbsolute whether an absolute spelling is accepted; it must still point inside
     *                      the working directory
     * @return normalized absolute path
     * @throws InvalidConfigurationException when the value is blank or escapes the working directory
     */
    public static Path resolveWithinCwd(String property, String value, boolean allowAbsolute) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(property, "must not be blank");
        }
        Path cwd = Path.of("").toAbsolutePath().normalize();
        Path raw = Path.of(value.trim());
        if (raw.isAbsolute() && !allowAbsolute) {
            throw new InvalidConfigurationException(property, "absolute paths are not allowed: " + value);
        }
        Path resolved = cwd.resolve(raw).normalize();
        if (!resolved.startsWith(cwd)) {
            throw new InvalidConfigurationException(property, "path escapes the working directory: " + value);
        }
        return resolved;
    }
}
