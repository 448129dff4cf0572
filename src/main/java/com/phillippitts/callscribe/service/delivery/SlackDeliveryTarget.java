package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Posts reports to a Slack incoming webhook.
 */
public class SlackDeliveryTarget extends AbstractDeliveryTarget {

    static final String NAME = "slack";

    private final RestClient client;
    private final DeliveryProperties.Slack settings;

    public SlackDeliveryTarget(DeliveryProperties.Slack settings, RestClient client) {
        super(NAME, settings);
        this.client = client;
        this.settings = settings;
    }

    @Override
    public void send(DeliveryMessage message) {
        List<String> parts = TextSplitter.split(message.text(), settings.getMaxChars());
        for (String part : parts) {
            post(payloadFor(part));
        }
    }

    JSONObject payloadFor(String text) {
        JSONObject payload = new JSONObject().put("text", text);
        putIfPresent(payload, "channel", settings.getChannel());
        putIfPresent(payload, "username", settings.getUsername());
        putIfPresent(payload, "icon_emoji", settings.getIconEmoji());
        return payload;
    }

    private void post(JSONObject payload) {
        try {
            client.post()
                    .uri(settings.getWebhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload.toString())
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw failure(e);
        }
    }

    @Override
    protected String redact(String message) {
        // webhook URLs are secrets
        String url = settings.getWebhookUrl();
        return message == null || url.isEmpty() ? message : message.replace(url, "<webhook-url>");
    }

    private static void putIfPresent(JSONObject json, String key, String value) {
        if (value != null && !value.isBlank()) {
            json.put(key, value.trim());
        }
    }
}
