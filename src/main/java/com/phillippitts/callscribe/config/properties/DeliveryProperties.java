package com.phillippitts.callscribe.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Delivery destinations for call summaries.
 *
 * <p>Each destination carries its own retry and size policy. Telegram is required by default:
 * a session whose summary cannot reach it is reported as failed.
 */
@Validated
@ConfigurationProperties(prefix = "delivery")
public class DeliveryProperties {

    @Valid
    private Telegram telegram = new Telegram();

    @Valid
    private Slack slack = new Slack();

    @Valid
    private Webhook webhook = new Webhook();

    public Telegram getTelegram() {
        return telegram;
    }

    public void setTelegram(Telegram telegram) {
        this.telegram = telegram;
    }

    public Slack getSlack() {
        return slack;
    }

    public void setSlack(Slack slack) {
        this.slack = slack;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public void setWebhook(Webhook webhook) {
        this.webhook = webhook;
    }

    /**
     * Settings shared by every destination.
     */
    public static class Target {
        private boolean enabled;
        private boolean required;
        @NotNull
        private Duration timeout = Duration.ofSeconds(15);
        @Min(0)
        private int maxRetries = 2;
        @NotNull
        private Duration retryBaseDelay = Duration.ofMillis(800);
        @NotNull
        private Duration retryMaxDelay = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRequired() {
            return required;
        }

        public void setRequired(boolean required) {
            this.required = required;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryBaseDelay() {
            return retryBaseDelay;
        }

        public void setRetryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
        }

        public Duration getRetryMaxDelay() {
            return retryMaxDelay;
        }

        public void setRetryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
        }
    }

    public static class Telegram extends Target {
        private String botToken = "";
        private String chatId = "";
        private String apiBaseUrl = "https://api.telegram.org";
        @Min(100)
        private int maxChars = 3800;

        public Telegram() {
            setEnabled(true);
            setRequired(true);
            setTimeout(Duration.ofSeconds(30));
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getChatId() {
            return chatId;
        }

        public void setChatId(String chatId) {
            this.chatId = chatId;
        }

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }
    }

    public static class Slack extends Target {
        private String webhookUrl = "";
        private String channel = "";
        private String username = "";
        private String iconEmoji = "";
        @Min(100)
        private int maxChars = 35_000;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getIconEmoji() {
            return iconEmoji;
        }

        public void setIconEmoji(String iconEmoji) {
            this.iconEmoji = iconEmoji;
        }

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }
    }

    public static class Webhook extends Target {
        private String url = "";

        public Webhook() {
            setMaxRetries(1);
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }
}
