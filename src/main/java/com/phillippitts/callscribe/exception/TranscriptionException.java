package com.phillippitts.callscribe.exception;

/**
 * A speech-to-text engine could not turn a segment into text: process timeout or non-zero exit,
 * native model error, or no free slot under the engine's concurrency limit.
 *
 * <p>Always carries the engine name; the segment pipeline counts failures per engine.
 */
public class TranscriptionException extends CallScribeException {

    private final String engineName;

    public TranscriptionException(String message, String engineName) {
        this(message, engineName, null);
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super("[" + engineName + "] " + message, cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
