package com.phillippitts.callscribe.service.metrics;

import com.phillippitts.callscribe.service.capture.SegmentOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for capture, transcription, delivery and session outcomes.
 *
 * <p>Exposed at /actuator/prometheus. Per-session counters for the status endpoint live in
 * {@link com.phillippitts.callscribe.service.session.SessionMetrics}; these meters are process-wide.
 */
@Component
public class CallScribeMetrics {

    private static final String METRIC_PREFIX = "callscribe";

    private final MeterRegistry registry;

    public CallScribeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSegment(SegmentOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".segments")
                .description("Captured speech segments by outcome")
                .tag("outcome", tagValue(outcome.kind().name()))
                .register(registry)
                .increment();
        if (outcome.wasCaptured()) {
            DistributionSummary.builder(METRIC_PREFIX + ".segment.seconds")
                    .description("Duration of captured segments")
                    .baseUnit("seconds")
                    .register(registry)
                    .record(outcome.seconds());
        }
    }

    public void recordCaptureRejected() {
        Counter.builder(METRIC_PREFIX + ".captures.rejected")
                .description("Speaking-start events dropped because the capture cap was reached")
                .register(registry)
                .increment();
    }

    /**
     * @param engineName engine that ran
     * @param durationNanos wall-clock time of the call
     * @param success whether the engine returned a result
     */
    public void recordTranscription(String engineName, long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken to transcribe one segment")
                .tag("engine", engineName)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordDelivery(String target, boolean success, int attempts) {
        Counter.builder(METRIC_PREFIX + ".delivery")
                .description("Report deliveries by target and result")
                .tag("target", target)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
        DistributionSummary.builder(METRIC_PREFIX + ".delivery.attempts")
                .description("Attempts needed per delivery")
                .tag("target", target)
                .register(registry)
                .record(attempts);
    }

    public void recordSummary(String source) {
        Counter.builder(METRIC_PREFIX + ".summaries")
                .description("Summaries by source (llm or fallback)")
                .tag("source", tagValue(source))
                .register(registry)
                .increment();
    }

    public void recordSession(String outcome) {
        Counter.builder(METRIC_PREFIX + ".sessions")
                .description("Finished sessions by finalize outcome")
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .increment();
    }

    private static String tagValue(String raw) {
        return raw.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
