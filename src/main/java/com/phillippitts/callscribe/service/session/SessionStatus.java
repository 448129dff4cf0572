package com.phillippitts.callscribe.service.session;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the coordinator, built on the session loop.
 *
 * @param state current state
 * @param manualMode whether automatic channel selection is suspended
 * @param candidateChannelId channel being debounced, if any
 * @param current active session, {@code null} when none
 * @param cumulative counters across all sessions since startup
 * @param lastSession most recently finalized session, {@code null} before the first one
 */
public record SessionStatus(
        SessionState state,
        boolean manualMode,
        String candidateChannelId,
        ActiveSession current,
        SessionMetricsSnapshot cumulative,
        LastSessionSnapshot lastSession
) {

    /**
     * View of the session being recorded or finalized.
     */
    public record ActiveSession(
            String sessionId,
            String channelId,
            String channelName,
            Instant startedAt,
            List<String> participants,
            int transcriptEntries,
            long transcriptEntriesDropped,
            int pendingCaptures,
            boolean finishing,
            SessionMetricsSnapshot metrics
    ) {
    }

    /**
     * Metrics of the current session, else of the last one, else {@code null}.
     */
    public SessionMetricsSnapshot latestSessionMetrics() {
        if (current != null) {
            return current.metrics();
        }
        return lastSession == null ? null : lastSession.metrics();
    }
}
