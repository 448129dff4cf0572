package com.phillippitts.callscribe.testutil;

import com.phillippitts.callscribe.exception.DeliveryException;
import com.phillippitts.callscribe.service.delivery.DeliveryMessage;
import com.phillippitts.callscribe.service.delivery.DeliveryTarget;
import com.phillippitts.callscribe.service.delivery.RetryPolicy;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivery target that records messages and fails its first {@code failuresBeforeSuccess} attempts.
 */
public class RecordingDeliveryTarget implements DeliveryTarget {

    private final String name;
    private final boolean required;
    private final boolean alerts;
    private final int maxRetries;
    private final AtomicInteger failuresLeft;
    private final AtomicInteger attempts = new AtomicInteger();
    private final List<DeliveryMessage> delivered = new CopyOnWriteArrayList<>();

    public RecordingDeliveryTarget(String name, boolean required, int maxRetries, int failuresBeforeSuccess) {
        this(name, required, false, maxRetries, failuresBeforeSuccess);
    }

    public RecordingDeliveryTarget(String name, boolean required, boolean alerts, int maxRetries,
                                   int failuresBeforeSuccess) {
        this.name = name;
        this.required = required;
        this.alerts = alerts;
        this.maxRetries = maxRetries;
        this.failuresLeft = new AtomicInteger(failuresBeforeSuccess);
    }

    public static RecordingDeliveryTarget alwaysFailing(String name, boolean required, int maxRetries) {
        return new RecordingDeliveryTarget(name, required, maxRetries, Integer.MAX_VALUE);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isRequired() {
        return required;
    }

    @Override
    public boolean receivesAlerts() {
        return alerts;
    }

    @Override
    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return attempt -> 100L * attempt;
    }

    @Override
    public void send(DeliveryMessage message) {
        attempts.incrementAndGet();
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new DeliveryException(name, "HTTP 502 from " + name);
        }
        delivered.add(message);
    }

    public int attempts() {
        return attempts.get();
    }

    public List<DeliveryMessage> delivered() {
        return delivered;
    }
}
