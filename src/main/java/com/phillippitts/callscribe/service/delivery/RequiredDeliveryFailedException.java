package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.exception.DeliveryException;

/**
 * Thrown by {@link DeliveryDispatcher#dispatch} when a required target exhausted its retries.
 * Optional targets have already been attempted; their results are in {@link #getReport()}.
 */
public class RequiredDeliveryFailedException extends DeliveryException {

    private final transient DispatchReport report;

    public RequiredDeliveryFailedException(DispatchReport.TargetOutcome failed, DispatchReport report) {
        super(failed.target(), "required target failed after " + failed.attempts() + " attempt(s): "
                + failed.error());
        this.report = report;
    }

    public DispatchReport getReport() {
        return report;
    }
}
