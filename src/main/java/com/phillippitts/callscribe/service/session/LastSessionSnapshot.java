package com.phillippitts.callscribe.service.session;

import java.time.Instant;
import java.util.List;

/**
 * What remains of a session after reset, for the status endpoint and health checks.
 *
 * @param outcome finalize outcome ({@code DELIVERED}, {@code SKIPPED}, {@code FAILED})
 * @param barrierTimedOut whether the finalize barrier gave up on in-flight captures
 * @param abandonedCaptures captures still running when the barrier settled
 */
public record LastSessionSnapshot(
        String sessionId,
        String channelId,
        String channelName,
        Instant startedAt,
        Instant endedAt,
        List<String> participants,
        int transcriptEntries,
        boolean barrierTimedOut,
        int abandonedCaptures,
        String outcome,
        SessionMetricsSnapshot metrics
) {
}
