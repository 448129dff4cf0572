package com.phillippitts.callscribe.exception;

/**
 * Thrown when a report cannot be delivered to a destination.
 *
 * <p>Raised per attempt by targets, and by the dispatcher once when a required target
 * has exhausted its retries.
 */
public class DeliveryException extends CallScribeException {

    private final String target;

    public DeliveryException(String target, String message) {
        super(target + ": " + message);
        this.target = target;
    }

    public DeliveryException(String target, String message, Throwable cause) {
        super(target + ": " + message, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
