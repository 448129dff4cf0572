package com.phillippitts.callscribe.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Operator alerts sent through the delivery targets when decoding or transcription keeps failing.
 * The {@code stt-error-*} switch and cooldown apply to both stages; each stage has its own
 * cooldown window.
 */
@Validated
@ConfigurationProperties(prefix = "alerts")
public class AlertProperties {

    private boolean sttErrorNotify = true;

    @NotNull
    private Duration sttErrorCooldown = Duration.ofMinutes(10);

    public boolean isSttErrorNotify() {
        return sttErrorNotify;
    }

    public void setSttErrorNotify(boolean sttErrorNotify) {
        this.sttErrorNotify = sttErrorNotify;
    }

    public Duration getSttErrorCooldown() {
        return sttErrorCooldown;
    }

    public void setSttErrorCooldown(Duration sttErrorCooldown) {
        this.sttErrorCooldown = sttErrorCooldown;
    }
}
