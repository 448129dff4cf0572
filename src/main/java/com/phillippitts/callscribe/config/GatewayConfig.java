package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.gateway.DetachedVoiceGateway;
import com.phillippitts.callscribe.gateway.VoiceGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to a gateway that sees no channels when no platform adapter is on the classpath.
 */
@Configuration
public class GatewayConfig {

    @Bean
    @ConditionalOnMissingBean(VoiceGateway.class)
    public VoiceGateway voiceGateway() {
        return new DetachedVoiceGateway();
    }
}
