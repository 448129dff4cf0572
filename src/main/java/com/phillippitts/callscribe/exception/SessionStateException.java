package com.phillippitts.callscribe.exception;

/**
 * Thrown when a manual session command does not apply to the current session state,
 * for example a join while a session is already recording.
 */
public class SessionStateException extends CallScribeException {

    public SessionStateException(String message) {
        super(message);
    }
}
