package com.phillippitts.callscribe.config.properties;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for the voice session health indicator.
 */
@Validated
@ConfigurationProperties(prefix = "health")
public class HealthProperties {

    /** Captured audio needed before a session without accepted segments is judged. */
    @PositiveOrZero
    private double minAudioSeconds = 10.0;

    public double getMinAudioSeconds() {
        return minAudioSeconds;
    }

    public void setMinAudioSeconds(double minAudioSeconds) {
        this.minAudioSeconds = minAudioSeconds;
    }
}
