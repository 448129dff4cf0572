package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import com.phillippitts.callscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Delivers a report to every enabled target, in configuration order.
 *
 * <p>Targets are isolated: each gets its own retries with exponential backoff, and one target
 * exhausting them never prevents the others from being attempted. Only a failed
 * {@linkplain DeliveryTarget#isRequired() required} target fails the dispatch.
 */
public class DeliveryDispatcher {

    private static final Logger LOG = LogManager.getLogger(DeliveryDispatcher.class);
    private static final int MAX_LOGGED_ERROR_CHARS = 300;

    /** Waits between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final List<DeliveryTarget> targets;
    private final CallScribeMetrics metrics;
    private final Sleeper sleeper;

    public DeliveryDispatcher(List<DeliveryTarget> targets, CallScribeMetrics metrics) {
        this(targets, metrics, Thread::sleep);
    }

    public DeliveryDispatcher(List<DeliveryTarget> targets, CallScribeMetrics metrics, Sleeper sleeper) {
        this.targets = List.copyOf(targets);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public List<DeliveryTarget> targets() {
        return targets;
    }

    /**
     * @return per-target outcomes when every required target succeeded
     * @throws RequiredDeliveryFailedException when a required target failed; all targets have
     *         been attempted by then
     */
    public DispatchReport dispatch(DeliveryMessage message) {
        if (targets.isEmpty()) {
            LOG.warn("No delivery targets enabled; report not delivered");
        }
        List<DispatchReport.TargetOutcome> outcomes = new ArrayList<>(targets.size());
        for (DeliveryTarget target : targets) {
            DispatchReport.TargetOutcome outcome = deliverWithRetries(target, message);
            metrics.recordDelivery(target.name(), outcome.success(), outcome.attempts());
            outcomes.add(outcome);
        }
        DispatchReport report = new DispatchReport(outcomes);
        List<DispatchReport.TargetOutcome> failedRequired = report.failedRequired();
        if (!failedRequired.isEmpty()) {
            throw new RequiredDeliveryFailedException(failedRequired.get(0), report);
        }
        return report;
    }

    /**
     * Sends an operational alert once, without retries, to every alert-capable target.
     * Failures are logged; this method never throws.
     */
    public void sendAlert(String text) {
        DeliveryMessage alert = DeliveryMessage.alert(text);
        for (DeliveryTarget target : targets) {
            if (!target.receivesAlerts()) {
                continue;
            }
            try {
                target.send(alert);
                LOG.info("Alert delivered via {}", target.name());
            } catch (RuntimeException e) {
                LOG.warn("Alert delivery via {} failed: {}", target.name(),
                        LogSanitizer.redactError(e.getMessage(), MAX_LOGGED_ERROR_CHARS));
            }
        }
    }

    private DispatchReport.TargetOutcome deliverWithRetries(DeliveryTarget target, DeliveryMessage message) {
        int maxAttempts = Math.max(0, target.maxRetries()) + 1;
        String lastError = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                target.send(message);
                LOG.info("Delivered via {} (attempt {}/{})", target.name(), attempt, maxAttempts);
                return new DispatchReport.TargetOutcome(target.name(), target.isRequired(), true, attempt, null);
            } catch (RuntimeException e) {
                lastError = LogSanitizer.redactError(e.getMessage(), MAX_LOGGED_ERROR_CHARS);
                if (attempt >= maxAttempts) {
                    break;
                }
                long delay = target.retryPolicy().computeDelayMs(attempt);
                LOG.warn("Delivery via {} failed (attempt {}/{}), retrying in {} ms: {}",
                        target.name(), attempt, maxAttempts, delay, lastError);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    lastError = "interrupted while waiting to retry";
                    break;
                }
            }
        }
        LOG.error("Delivery via {} failed after {} attempt(s): {}", target.name(), attempt, lastError);
        return new DispatchReport.TargetOutcome(target.name(), target.isRequired(), false, attempt, lastError);
    }
}
