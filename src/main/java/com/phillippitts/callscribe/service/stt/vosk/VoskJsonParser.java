package com.phillippitts.callscribe.service.stt.vosk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses Vosk recognizer JSON into text and confidence.
 *
 * <p>Handles the final-result format {@code {"text": "...", "result": [...]}} and the
 * alternatives format {@code {"alternatives": [{"text": "...", "confidence": ...}]}}.
 * Output above {@link #MAX_JSON_SIZE} is truncated before parsing.
 */
final class VoskJsonParser {

    private static final Logger LOG = LogManager.getLogger(VoskJsonParser.class);

    private static final int MAX_JSON_SIZE = 1_048_576;

    private VoskJsonParser() {
    }

    static VoskTranscription parse(String json) {
        if (json == null || json.isBlank()) {
            return new VoskTranscription("", 1.0);
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); truncating", MAX_JSON_SIZE, json.length());
            json = json.substring(0, MAX_JSON_SIZE);
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("alternatives")) {
                JSONArray alternatives = obj.getJSONArray("alternatives");
                if (alternatives.isEmpty()) {
                    return new VoskTranscription("", 1.0);
                }
                JSONObject first = alternatives.getJSONObject(0);
                // alternatives confidence is not normalized
                return new VoskTranscription(first.optString("text", "").trim(),
                        clamp(first.optDouble("confidence", 1.0)));
            }
            return new VoskTranscription(obj.optString("text", "").trim(), averageWordConfidence(obj));
        } catch (JSONException e) {
            LOG.warn("Failed to parse Vosk JSON response ({} chars): {}", json.length(), e.getMessage());
            return new VoskTranscription("", 1.0);
        }
    }

    private static double averageWordConfidence(JSONObject obj) {
        JSONArray words = obj.optJSONArray("result");
        if (words == null || words.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < words.length(); i++) {
            JSONObject word = words.getJSONObject(i);
            if (word.has("conf")) {
                sum += word.getDouble("conf");
                count++;
            }
        }
        return count > 0 ? clamp(sum / count) : 1.0;
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }

    record VoskTranscription(String text, double confidence) {
    }
}
