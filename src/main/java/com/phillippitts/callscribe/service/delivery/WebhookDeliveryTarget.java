package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts the structured report payload as JSON to a generic HTTP endpoint.
 */
public class WebhookDeliveryTarget extends AbstractDeliveryTarget {

    static final String NAME = "webhook";

    private final RestClient client;
    private final String url;

    public WebhookDeliveryTarget(DeliveryProperties.Webhook settings, RestClient client) {
        super(NAME, settings);
        this.client = client;
        this.url = settings.getUrl();
    }

    @Override
    public void send(DeliveryMessage message) {
        try {
            client.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(message.payload().toString())
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw failure(e);
        }
    }
}
