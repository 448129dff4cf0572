package com.phillippitts.callscribe.service.delivery;

import org.json.JSONObject;

import java.util.Objects;

/**
 * A report ready for delivery.
 *
 * @param text human-readable report, used by chat targets
 * @param payload structured form, used by the JSON webhook
 */
public record DeliveryMessage(String text, JSONObject payload) {

    public DeliveryMessage {
        Objects.requireNonNull(text, "text");
        payload = payload == null ? new JSONObject() : payload;
    }

    /**
     * An operator alert: text only, the payload carries the same text under {@code alert}.
     */
    public static DeliveryMessage alert(String text) {
        return new DeliveryMessage(text, new JSONObject().put("alert", text));
    }
}
