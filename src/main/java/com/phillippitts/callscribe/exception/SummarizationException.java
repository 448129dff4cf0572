package com.phillippitts.callscribe.exception;

/**
 * Thrown by a summary client when the language model call fails or returns nothing usable.
 * Callers fall back to the extractive summary instead of propagating it.
 */
public class SummarizationException extends CallScribeException {

    public SummarizationException(String message) {
        super(message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
