package com.phillippitts.callscribe.service.session.event;

import java.time.Instant;

/**
 * Published when a captured segment could not be decoded or transcribed.
 *
 * @param sessionId session the segment belonged to
 * @param channelName voice channel name, for operator alerts
 * @param stage failing stage
 * @param engine speech-to-text engine name, or {@code null} for decode failures
 * @param error failure message, not yet redacted
 * @param timestamp when the failure happened
 */
public record SegmentFailureEvent(
        String sessionId,
        String channelName,
        Stage stage,
        String engine,
        String error,
        Instant timestamp
) {

    public enum Stage { DECODE, STT }
}
