package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.service.delivery.DispatchReport;
import com.phillippitts.callscribe.service.summary.SummaryResult;

import java.nio.file.Path;

/**
 * Outcome of finalizing one session.
 *
 * @param transcriptFile archived transcript, {@code null} when writing failed
 * @param summarySource producer of the summary, {@code null} when skipped
 * @param dispatch per-target delivery results, {@code null} when skipped
 * @param error failure description for {@link Outcome#FAILED}
 */
public record FinalizeResult(
        Outcome outcome,
        Path transcriptFile,
        SummaryResult.Source summarySource,
        DispatchReport dispatch,
        String error
) {

    public enum Outcome {
        DELIVERED,
        /** Empty short call: transcript archived, nothing summarized or sent. */
        SKIPPED,
        FAILED
    }

    public static FinalizeResult failed(String error) {
        return new FinalizeResult(Outcome.FAILED, null, null, null, error);
    }
}
