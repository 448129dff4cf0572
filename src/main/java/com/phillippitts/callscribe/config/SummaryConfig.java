package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.service.summary.ExtractiveSummarizer;
import com.phillippitts.callscribe.service.summary.MapReduceSummarizer;
import com.phillippitts.callscribe.service.summary.OpenAiSummaryClient;
import com.phillippitts.callscribe.service.summary.PromptTemplates;
import com.phillippitts.callscribe.service.summary.SummaryClient;
import com.phillippitts.callscribe.service.summary.UnavailableSummaryClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.client.RestClient;

/**
 * Summarization beans. Without a provider or an API key the pipeline still runs and every
 * session gets the extractive summary.
 */
@Configuration
public class SummaryConfig {

    private static final Logger LOG = LogManager.getLogger(SummaryConfig.class);

    @Bean
    @ConditionalOnMissingBean(SummaryClient.class)
    public SummaryClient summaryClient(SummaryProperties properties, RestClient.Builder builder) {
        if (properties.getProvider() == SummaryProperties.Provider.NONE) {
            LOG.info("Summary provider disabled; extractive summaries only");
            return new UnavailableSummaryClient("summary.provider=NONE");
        }
        SummaryProperties.OpenAi openai = properties.getOpenai();
        if (openai.getApiKey() == null || openai.getApiKey().isBlank()) {
            LOG.warn("summary.openai.api-key is not set; extractive summaries only");
            return new UnavailableSummaryClient("summary.openai.api-key is not set");
        }
        RestClient client = RestClients.withTimeout(builder, openai.getTimeout(), openai.getBaseUrl());
        LOG.info("Summary provider: OpenAI model={}", openai.getModel());
        return new OpenAiSummaryClient(openai, client);
    }

    @Bean
    public PromptTemplates promptTemplates(ResourceLoader resourceLoader, SummaryProperties properties) {
        return new PromptTemplates(resourceLoader, properties.getPrompt());
    }

    @Bean
    public ExtractiveSummarizer extractiveSummarizer(SummaryProperties properties) {
        return new ExtractiveSummarizer(properties.getFallback());
    }

    @Bean
    public MapReduceSummarizer mapReduceSummarizer(SummaryClient client,
                                                   PromptTemplates templates,
                                                   ExtractiveSummarizer fallback,
                                                   SummaryProperties properties) {
        return new MapReduceSummarizer(client, templates, fallback, properties);
    }
}
