package com.phillippitts.callscribe.service.session;

import java.time.Instant;

/**
 * Immutable copy of {@link SessionMetrics}.
 */
public record SessionMetricsSnapshot(
        long segmentsCaptured,
        long segmentsAccepted,
        long segmentsEmpty,
        long segmentsDiscarded,
        long decodeFailures,
        long sttFailures,
        long captureFailures,
        long capturesRejected,
        double audioSeconds,
        Instant lastSpeechAt,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        String lastError
) {

    public static SessionMetricsSnapshot empty() {
        return new SessionMetricsSnapshot(0, 0, 0, 0, 0, 0, 0, 0, 0.0, null, null, null, null);
    }
}
