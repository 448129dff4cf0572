package com.phillippitts.callscribe.util;

import java.nio.file.Path;
import java.util.regex.Pattern;

/** Utility for privacy-safe logging and for cleaning user-supplied labels. */
public final class LogSanitizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern TEMP_PATH = Pattern.compile(
            Pattern.quote(System.getProperty("java.io.tmpdir").replaceAll("/+$", "")) + "[^\\s'\"),]*");

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Collapses a display name or text fragment onto a single line and caps its length,
     * marking a cut with an ellipsis.
     *
     * @return cleaned value, or "" when nothing printable remains
     */
    public static String sanitizeLabel(String s, int max) {
        if (s == null) {
            return "";
        }
        String oneLine = WHITESPACE.matcher(CONTROL.matcher(s).replaceAll(" ")).replaceAll(" ").trim();
        if (oneLine.length() <= max) {
            return oneLine;
        }
        return max <= 1 ? truncate(oneLine, max) : oneLine.substring(0, max - 1) + "\u2026";
    }

    /**
     * Removes control characters except newline and tab.
     */
    public static String stripControlChars(String s) {
        return s == null ? "" : CONTROL.matcher(s).replaceAll("");
    }

    /**
     * Prepares an error message for an operator-facing alert: temp file paths and the working
     * directory are masked and the result is capped at {@code max} characters.
     */
    public static String redactError(String message, int max) {
        if (message == null) {
            return "";
        }
        String cwd = Path.of("").toAbsolutePath().toString();
        String redacted = TEMP_PATH.matcher(message).replaceAll("<tmpfile>");
        if (cwd.length() > 1) {
            redacted = redacted.replace(cwd, "<cwd>");
        }
        return truncate(redacted.trim(), max);
    }
}
