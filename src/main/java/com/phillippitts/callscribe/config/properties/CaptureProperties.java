package com.phillippitts.callscribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Segment boundary detection for per-speaker capture.
 */
@Validated
@ConfigurationProperties(prefix = "capture")
public class CaptureProperties {

    /** A segment ends when no frame arrives for this long. */
    @NotNull
    private Duration silenceTimeout = Duration.ofMillis(2500);

    /** Shorter segments are discarded without transcription. */
    @DecimalMin("0.3")
    @DecimalMax("60.0")
    private double minSegmentSeconds = 1.0;

    public Duration getSilenceTimeout() {
        return silenceTimeout;
    }

    public void setSilenceTimeout(Duration silenceTimeout) {
        this.silenceTimeout = silenceTimeout;
    }

    public double getMinSegmentSeconds() {
        return minSegmentSeconds;
    }

    public void setMinSegmentSeconds(double minSegmentSeconds) {
        this.minSegmentSeconds = minSegmentSeconds;
    }
}
