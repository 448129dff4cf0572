package com.phillippitts.callscribe.service.health;

import com.phillippitts.callscribe.config.properties.HealthProperties;
import com.phillippitts.callscribe.exception.SessionStateException;
import com.phillippitts.callscribe.service.session.SessionCoordinator;
import com.phillippitts.callscribe.service.session.SessionMetricsSnapshot;
import com.phillippitts.callscribe.service.session.SessionStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of voice capture, exposed as {@code voiceSession} under /actuator/health.
 *
 * <p>Judges the current session, or the last finished one when idle:
 * <ul>
 *   <li>DEGRADED, reason stt-failing: audio captured, nothing accepted, transcription failing</li>
 *   <li>DEGRADED, reason decode-failing: audio captured, nothing accepted, decoding failing</li>
 *   <li>UP, reason no-speech, ok or idle otherwise</li>
 * </ul>
 */
@Component("voiceSession")
public class SessionHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final SessionCoordinator coordinator;
    private final SessionHealthEvaluator evaluator;

    public SessionHealthIndicator(SessionCoordinator coordinator, HealthProperties properties) {
        this.coordinator = coordinator;
        this.evaluator = new SessionHealthEvaluator(properties.getMinAudioSeconds());
    }

    @Override
    public Health health() {
        SessionStatus status;
        try {
            status = coordinator.status();
        } catch (SessionStateException e) {
            return Health.unknown().withDetail("reason", "session-loop-unresponsive").build();
        }
        SessionMetricsSnapshot metrics = status.latestSessionMetrics();
        SessionHealthEvaluator.CaptureHealth health = evaluator.evaluate(metrics);

        Health.Builder builder = health.isDegraded() ? Health.status(DEGRADED) : Health.up();
        builder.withDetail("reason", health.reason())
                .withDetail("state", status.state().name());
        if (metrics != null) {
            builder.withDetail("audioSeconds", Math.round(metrics.audioSeconds() * 10) / 10.0)
                    .withDetail("segmentsAccepted", metrics.segmentsAccepted())
                    .withDetail("sttFailures", metrics.sttFailures())
                    .withDetail("decodeFailures", metrics.decodeFailures());
            if (metrics.lastError() != null) {
                builder.withDetail("lastError", metrics.lastError());
            }
        }
        return builder.build();
    }
}
