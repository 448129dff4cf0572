package com.phillippitts.callscribe.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Summarization settings: provider selection, map-reduce chunking, prompt resources and the
 * extractive fallback.
 */
@Validated
@ConfigurationProperties(prefix = "summary")
public class SummaryProperties {

    public enum Provider { OPENAI, NONE }

    @NotNull
    private Provider provider = Provider.OPENAI;

    /** Transcripts longer than this are summarized chunk by chunk. */
    @Min(500)
    private int chunkChars = 12_000;

    @Min(1)
    private int maxChunks = 8;

    @Valid
    private Prompt prompt = new Prompt();

    @Valid
    private OpenAi openai = new OpenAi();

    @Valid
    private Fallback fallback = new Fallback();

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public int getChunkChars() {
        return chunkChars;
    }

    public void setChunkChars(int chunkChars) {
        this.chunkChars = chunkChars;
    }

    public int getMaxChunks() {
        return maxChunks;
    }

    public void setMaxChunks(int maxChunks) {
        this.maxChunks = maxChunks;
    }

    public Prompt getPrompt() {
        return prompt;
    }

    public void setPrompt(Prompt prompt) {
        this.prompt = prompt;
    }

    public OpenAi getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAi openai) {
        this.openai = openai;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    /**
     * Locations of the prompt templates, resolved as Spring resources.
     */
    public static class Prompt {
        private String summary = "classpath:prompts/summary.txt";
        private String chunk = "classpath:prompts/chunk.txt";
        private String merge = "classpath:prompts/merge.txt";

        public String getSummary() {
            return summary;
        }

        public void setSummary(String summary) {
            this.summary = summary;
        }

        public String getChunk() {
            return chunk;
        }

        public void setChunk(String chunk) {
            this.chunk = chunk;
        }

        public String getMerge() {
            return merge;
        }

        public void setMerge(String merge) {
            this.merge = merge;
        }
    }

    /**
     * OpenAI chat-completions client.
     */
    public static class OpenAi {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    /**
     * Extractive summary used when the language model is unavailable.
     */
    public static class Fallback {
        @Min(1)
        private int minBullets = 5;
        @Min(1)
        private int maxBullets = 10;
        private List<String> cueWords = new ArrayList<>(List.of(
                "decide", "decided", "agree", "agreed", "todo", "action", "deadline", "next step",
                "will", "need to", "must", "plan", "problem", "issue", "release", "deploy"));
        private List<String> fillerWords = new ArrayList<>(List.of(
                "um", "uh", "like", "you know", "okay", "ok", "yeah"));

        public int getMinBullets() {
            return minBullets;
        }

        public void setMinBullets(int minBullets) {
            this.minBullets = minBullets;
        }

        public int getMaxBullets() {
            return maxBullets;
        }

        public void setMaxBullets(int maxBullets) {
            this.maxBullets = maxBullets;
        }

        public List<String> getCueWords() {
            return cueWords;
        }

        public void setCueWords(List<String> cueWords) {
            this.cueWords = cueWords;
        }

        public List<String> getFillerWords() {
            return fillerWords;
        }

        public void setFillerWords(List<String> fillerWords) {
            this.fillerWords = fillerWords;
        }
    }
}
