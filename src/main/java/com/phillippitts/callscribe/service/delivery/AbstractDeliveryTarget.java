package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import com.phillippitts.callscribe.exception.DeliveryException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Base class holding the retry and requirement settings shared by HTTP targets.
 */
abstract class AbstractDeliveryTarget implements DeliveryTarget {

    private static final int MAX_BODY_CHARS = 300;

    private final String name;
    private final boolean required;
    private final int maxRetries;
    private final RetryPolicy retryPolicy;

    protected AbstractDeliveryTarget(String name, DeliveryProperties.Target settings) {
        this.name = Objects.requireNonNull(name, "name");
        this.required = settings.isRequired();
        this.maxRetries = settings.getMaxRetries();
        this.retryPolicy = new ExponentialBackoffRetryPolicy(
                settings.getRetryBaseDelay().toMillis(), settings.getRetryMaxDelay().toMillis());
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
        return false;
    }

    @Override
    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * Converts a client failure into a {@link DeliveryException}, keeping the status and a
     * bounded slice of the response body.
     */
    protected DeliveryException failure(RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            String body = response.getResponseBodyAsString();
            if (body.length() > MAX_BODY_CHARS) {
                body = body.substring(0, MAX_BODY_CHARS);
            }
            return new DeliveryException(name, "HTTP " + response.getStatusCode().value() + " " + body, e);
        }
        return new DeliveryException(name, redact(e.getMessage()), e);
    }

    /** Hook for targets whose URLs embed credentials. */
    protected String redact(String message) {
        return message;
    }
}
