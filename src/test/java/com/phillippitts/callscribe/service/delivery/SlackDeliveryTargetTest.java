package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SlackDeliveryTargetTest {

    private static final String HOOK = "https://hooks.slack.test/services/T0/B0/xyz";

    private DeliveryProperties.Slack settings;
    private MockRestServiceServer server;
    private SlackDeliveryTarget target;

    @BeforeEach
    void setUp() {
        settings = new DeliveryProperties.Slack();
        settings.setWebhookUrl(HOOK);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        target = new SlackDeliveryTarget(settings, builder.build());
    }

    @Test
    void postsTextToWebhook() {
        server.expect(requestTo(HOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.text").value("report body"))
                .andExpect(jsonPath("$.channel").doesNotExist())
                .andRespond(withSuccess());

        target.send(new DeliveryMessage("report body", null));

        server.verify();
    }

    @Test
    void optionalFieldsOnlyWhenSet() {
        settings.setChannel(" #standups ");
        settings.setIconEmoji(":memo:");

        JSONObject payload = target.payloadFor("x");

        assertThat(payload.getString("channel")).isEqualTo("#standups");
        assertThat(payload.getString("icon_emoji")).isEqualTo(":memo:");
        assertThat(payload.has("username")).isFalse();
    }

    @Test
    void webhookUrlIsMasked() {
        assertThat(target.redact("I/O error on POST request for \"" + HOOK + "\""))
                .doesNotContain("xyz")
                .contains("<webhook-url>");
        assertThat(target.isRequired()).isFalse();
        assertThat(target.receivesAlerts()).isFalse();
    }
}
