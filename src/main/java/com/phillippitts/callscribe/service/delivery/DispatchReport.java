package com.phillippitts.callscribe.service.delivery;

import java.util.List;

/**
 * Per-target results of one dispatch.
 */
public record DispatchReport(List<TargetOutcome> outcomes) {

    public DispatchReport {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * @param target target name
     * @param required whether the target was required
     * @param success whether some attempt succeeded
     * @param attempts attempts made, at least 1
     * @param error last error message when all attempts failed, else {@code null}
     */
    public record TargetOutcome(String target, boolean required, boolean success, int attempts, String error) {
    }

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(TargetOutcome::success);
    }

    public List<TargetOutcome> failedRequired() {
        return outcomes.stream().filter(o -> o.required() && !o.success()).toList();
    }

    public long deliveredCount() {
        return outcomes.stream().filter(TargetOutcome::success).count();
    }
}
