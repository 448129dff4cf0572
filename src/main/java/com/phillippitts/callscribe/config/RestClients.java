package com.phillippitts.callscribe.config;

import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Builds per-destination REST clients from the auto-configured builder.
 */
final class RestClients {

    private RestClients() {
    }

    static RestClient withTimeout(RestClient.Builder builder, Duration timeout) {
        return builder.clone().requestFactory(requestFactory(timeout)).build();
    }

    static RestClient withTimeout(RestClient.Builder builder, Duration timeout, String baseUrl) {
        return builder.clone().baseUrl(baseUrl).requestFactory(requestFactory(timeout)).build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(millis);
        factory.setReadTimeout(millis);
        return factory;
    }
}
