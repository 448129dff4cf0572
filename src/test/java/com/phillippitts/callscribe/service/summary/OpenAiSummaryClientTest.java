package com.phillippitts.callscribe.service.summary;

import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.exception.SummarizationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiSummaryClientTest {

    private static final String URL = "https://llm.test/v1/chat/completions";

    private SummaryProperties.OpenAi settings;
    private MockRestServiceServer server;
    private OpenAiSummaryClient client;

    @BeforeEach
    void setUp() {
        settings = new SummaryProperties.OpenAi();
        settings.setApiKey("sk-test");
        settings.setModel("gpt-test");
        settings.setTemperature(0.1);
        RestClient.Builder builder = RestClient.builder().baseUrl("https://llm.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OpenAiSummaryClient(settings, builder.build());
    }

    @Test
    void sendsPromptAsSingleUserMessage() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-test"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("summarize this"))
                .andRespond(withSuccess(
                        "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  - done  \"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.complete("summarize this")).isEqualTo("- done");
        server.verify();
    }

    @Test
    void httpErrorBecomesSummarizationException() {
        server.expect(requestTo(URL))
                .andRespond(withBadRequest().body("{\"error\":\"context too long\"}")
                        .contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.complete("x"))
                .isInstanceOf(SummarizationException.class)
                .hasMessageContaining("400")
                .hasMessageContaining("context too long");
    }

    @Test
    void emptyChoicesIsFailure() {
        assertThatThrownBy(() -> OpenAiSummaryClient.extractContent("{\"choices\":[]}"))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("OpenAI returned no choices");
    }

    @Test
    void blankContentIsFailure() {
        assertThatThrownBy(() -> OpenAiSummaryClient.extractContent(
                "{\"choices\":[{\"message\":{\"content\":\"   \"}}]}"))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("OpenAI returned empty summary");
    }

    @Test
    void malformedJsonIsFailure() {
        assertThatThrownBy(() -> OpenAiSummaryClient.extractContent("<html>"))
                .isInstanceOf(SummarizationException.class)
                .hasMessage("Unparseable OpenAI response");
    }

    @Test
    void unavailableWithoutApiKey() {
        settings.setApiKey(" ");

        OpenAiSummaryClient keyless = new OpenAiSummaryClient(settings, RestClient.create());

        assertThat(keyless.isAvailable()).isFalse();
        assertThat(client.isAvailable()).isTrue();
        assertThat(client.name()).isEqualTo("openai:gpt-test");
    }
}
