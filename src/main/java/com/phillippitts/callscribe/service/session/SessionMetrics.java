package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.service.capture.SegmentOutcome;
import com.phillippitts.callscribe.util.LogSanitizer;

import java.time.Instant;

/**
 * Capture and transcription counters for one session (or cumulative across sessions).
 * Not thread-safe: updated only on the session loop.
 */
public final class SessionMetrics {

    private static final int MAX_ERROR_CHARS = 300;

    private long segmentsCaptured;
    private long segmentsAccepted;
    private long segmentsEmpty;
    private long segmentsDiscarded;
    private long decodeFailures;
    private long sttFailures;
    private long captureFailures;
    private long capturesRejected;
    private double audioSeconds;
    private Instant lastSpeechAt;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;
    private String lastError;

    public void apply(SegmentOutcome outcome) {
        Instant at = outcome.completedAt();
        if (outcome.wasCaptured()) {
            segmentsCaptured++;
            audioSeconds += outcome.seconds();
            lastSpeechAt = at;
        }
        switch (outcome.kind()) {
            case ACCEPTED -> {
                segmentsAccepted++;
                lastSuccessAt = at;
            }
            case EMPTY -> {
                segmentsEmpty++;
                lastSuccessAt = at;
            }
            case DISCARDED -> segmentsDiscarded++;
            case DECODE_FAILED -> decodeFailures++;
            case STT_FAILED -> sttFailures++;
            case CAPTURE_FAILED -> captureFailures++;
        }
        if (outcome.isFailure()) {
            lastFailureAt = at;
            lastError = LogSanitizer.redactError(outcome.error(), MAX_ERROR_CHARS);
        }
    }

    public void recordRejected() {
        capturesRejected++;
    }

    public SessionMetricsSnapshot snapshot() {
        return new SessionMetricsSnapshot(segmentsCaptured, segmentsAccepted, segmentsEmpty, segmentsDiscarded,
                decodeFailures, sttFailures, captureFailures, capturesRejected, audioSeconds,
                lastSpeechAt, lastSuccessAt, lastFailureAt, lastError);
    }
}
