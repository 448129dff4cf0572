package com.phillippitts.callscribe.exception;

/**
 * Base exception for all callScribe-specific errors.
 *
 * <p>Unchecked so that failures inside executor tasks and event handlers surface through
 * {@link java.util.concurrent.CompletableFuture} completion without declaring throws clauses.
 */
public class CallScribeException extends RuntimeException {

    public CallScribeException(String message) {
        super(message);
    }

    public CallScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallScribeException(Throwable cause) {
        super(cause);
    }
}
