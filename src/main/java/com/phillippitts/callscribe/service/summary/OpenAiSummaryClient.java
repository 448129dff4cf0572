package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.exception.SummarizationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * OpenAI chat-completions client. The prompt is sent as a single user message.
 */
public class OpenAiSummaryClient implements SummaryClient {

    private static final Logger LOG = LogManager.getLogger(OpenAiSummaryClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final RestClient client;
    private final String apiKey;
    private final String model;
    private final double temperature;

    /**
     * @param client REST client whose base URL is the API root, for example
     *        {@code https://api.openai.com/v1}, with timeouts already applied
     */
    public OpenAiSummaryClient(SummaryProperties.OpenAi settings, RestClient client) {
        this.client = client;
        this.apiKey = settings.getApiKey();
        this.model = settings.getModel();
        this.temperature = settings.getTemperature();
    }

    @Override
    public String complete(String prompt) {
        JSONObject request = new JSONObject()
                .put("model", model)
                .put("temperature", temperature)
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", prompt)));
        long start = System.nanoTime();
        String response;
        try {
            response = client.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request.toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            String body = e.getResponseBodyAsString();
            throw new SummarizationException("OpenAI error: " + e.getStatusCode().value() + " "
                    + body.substring(0, Math.min(body.length(), MAX_ERROR_BODY_CHARS)), e);
        } catch (RestClientException e) {
            throw new SummarizationException("OpenAI request failed: " + e.getMessage(), e);
        }
        String text = extractContent(response);
        LOG.debug("OpenAI completion: model={}, promptChars={}, completionChars={}, ms={}",
                model, prompt.length(), text.length(), (System.nanoTime() - start) / 1_000_000L);
        return text;
    }

    static String extractContent(String response) {
        try {
            JSONObject json = new JSONObject(response == null ? "{}" : response);
            JSONArray choices = json.optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new SummarizationException("OpenAI returned no choices");
            }
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            String content = message == null ? "" : message.optString("content", "").trim();
            if (content.isEmpty()) {
                throw new SummarizationException("OpenAI returned empty summary");
            }
            return content;
        } catch (JSONException e) {
            throw new SummarizationException("Unparseable OpenAI response", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String name() {
        return "openai:" + model;
    }
}
