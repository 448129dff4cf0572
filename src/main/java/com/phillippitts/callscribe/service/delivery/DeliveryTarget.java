package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.exception.DeliveryException;

/**
 * A destination for session reports.
 *
 * <p>Implementations perform a single attempt per {@link #send} call; retries are owned by
 * {@link DeliveryDispatcher}.
 */
public interface DeliveryTarget {

    /** Short identifier used in logs, metrics and dispatch reports. */
    String name();

    /** Whether a failure of this target fails the whole dispatch. */
    boolean isRequired();

    /** Whether operational alerts are sent here. */
    boolean receivesAlerts();

    /** Retries after the first attempt. */
    int maxRetries();

    RetryPolicy retryPolicy();

    /**
     * Delivers one message.
     *
     * @throws DeliveryException when the destination rejected the message or was unreachable
     */
    void send(DeliveryMessage message);
}
