package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import com.phillippitts.callscribe.exception.DeliveryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Sends reports to a Telegram chat through the Bot API {@code sendMessage} method.
 *
 * <p>Long reports are sent as several messages, see {@link TextSplitter}. The bot token is part
 * of the request URL and is masked in every error message.
 */
public class TelegramDeliveryTarget extends AbstractDeliveryTarget {

    private static final Logger LOG = LogManager.getLogger(TelegramDeliveryTarget.class);
    static final String NAME = "telegram";

    private final RestClient client;
    private final String apiBaseUrl;
    private final String botToken;
    private final String chatId;
    private final int maxChars;

    public TelegramDeliveryTarget(DeliveryProperties.Telegram settings, RestClient client) {
        super(NAME, settings);
        this.client = client;
        this.apiBaseUrl = stripTrailingSlash(settings.getApiBaseUrl());
        this.botToken = settings.getBotToken();
        this.chatId = settings.getChatId();
        this.maxChars = settings.getMaxChars();
    }

    @Override
    public boolean receivesAlerts() {
        return true;
    }

    @Override
    public void send(DeliveryMessage message) {
        List<String> parts = TextSplitter.split(message.text(), maxChars);
        for (int i = 0; i < parts.size(); i++) {
            sendPart(parts.get(i));
            LOG.debug("Telegram part {}/{} sent ({} chars)", i + 1, parts.size(), parts.get(i).length());
        }
    }

    private void sendPart(String text) {
        JSONObject body = new JSONObject()
                .put("chat_id", chatId)
                .put("text", text)
                .put("disable_web_page_preview", true);
        String response;
        try {
            response = client.post()
                    .uri(apiBaseUrl + "/bot" + botToken + "/sendMessage")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body.toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw failure(e);
        }
        try {
            JSONObject json = new JSONObject(response == null ? "{}" : response);
            if (!json.optBoolean("ok", false)) {
                throw new DeliveryException(NAME, "API returned ok=false: " + json.optString("description", "?"));
            }
        } catch (JSONException e) {
            throw new DeliveryException(NAME, "Unparseable API response", e);
        }
    }

    @Override
    protected String redact(String message) {
        if (message == null || botToken.isEmpty()) {
            return message;
        }
        return message.replace(botToken, "<token>");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
