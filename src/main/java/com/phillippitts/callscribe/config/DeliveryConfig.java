package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import com.phillippitts.callscribe.service.delivery.DeliveryDispatcher;
import com.phillippitts.callscribe.service.delivery.DeliveryTarget;
import com.phillippitts.callscribe.service.delivery.SlackDeliveryTarget;
import com.phillippitts.callscribe.service.delivery.TelegramDeliveryTarget;
import com.phillippitts.callscribe.service.delivery.WebhookDeliveryTarget;
import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers the enabled delivery destinations, each with its own timeout.
 */
@Configuration
public class DeliveryConfig {

    private static final Logger LOG = LogManager.getLogger(DeliveryConfig.class);

    @Bean
    public DeliveryDispatcher deliveryDispatcher(DeliveryProperties properties,
                                                 RestClient.Builder builder,
                                                 CallScribeMetrics metrics) {
        List<DeliveryTarget> targets = new ArrayList<>();

        DeliveryProperties.Telegram telegram = properties.getTelegram();
        if (telegram.isEnabled()) {
            targets.add(new TelegramDeliveryTarget(telegram,
                    RestClients.withTimeout(builder, telegram.getTimeout())));
        }

        DeliveryProperties.Slack slack = properties.getSlack();
        if (slack.isEnabled()) {
            if (isBlank(slack.getWebhookUrl())) {
                LOG.warn("delivery.slack.enabled=true but delivery.slack.webhook-url is empty; Slack skipped");
            } else {
                targets.add(new SlackDeliveryTarget(slack, RestClients.withTimeout(builder, slack.getTimeout())));
            }
        }

        DeliveryProperties.Webhook webhook = properties.getWebhook();
        if (webhook.isEnabled()) {
            if (isBlank(webhook.getUrl())) {
                LOG.warn("delivery.webhook.enabled=true but delivery.webhook.url is empty; webhook skipped");
            } else {
                targets.add(new WebhookDeliveryTarget(webhook,
                        RestClients.withTimeout(builder, webhook.getTimeout())));
            }
        }

        if (targets.isEmpty()) {
            LOG.warn("No delivery targets enabled; summaries are archived only");
        } else {
            LOG.info("Delivery targets: {}", targets.stream().map(DeliveryTarget::name).toList());
        }
        return new DeliveryDispatcher(targets, metrics);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
