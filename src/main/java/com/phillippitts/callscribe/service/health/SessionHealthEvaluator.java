package com.phillippitts.callscribe.service.health;

import com.phillippitts.callscribe.service.session.SessionMetricsSnapshot;

/**
 * Classifies capture health from session counters.
 *
 * <p>A session is only judged once it has captured enough audio: below the threshold nothing
 * can be concluded from a lack of accepted segments.
 */
public final class SessionHealthEvaluator {

    public enum CaptureHealth {
        /** No session has run yet. */
        IDLE(false, "idle"),
        OK(false, "ok"),
        /** Audio arrived but every segment transcribed to nothing. */
        NO_SPEECH(false, "no-speech"),
        DECODE_FAILING(true, "decode-failing"),
        STT_FAILING(true, "stt-failing");

        private final boolean degraded;
        private final String reason;

        CaptureHealth(boolean degraded, String reason) {
            this.degraded = degraded;
            this.reason = reason;
        }

        public boolean isDegraded() {
            return degraded;
        }

        public String reason() {
            return reason;
        }
    }

    private final double minAudioSeconds;

    public SessionHealthEvaluator(double minAudioSeconds) {
        this.minAudioSeconds = minAudioSeconds;
    }

    public CaptureHealth evaluate(SessionMetricsSnapshot metrics) {
        if (metrics == null) {
            return CaptureHealth.IDLE;
        }
        if (metrics.audioSeconds() <= minAudioSeconds || metrics.segmentsAccepted() > 0) {
            return CaptureHealth.OK;
        }
        if (metrics.sttFailures() > 0) {
            return CaptureHealth.STT_FAILING;
        }
        if (metrics.decodeFailures() > 0) {
            return CaptureHealth.DECODE_FAILING;
        }
        return CaptureHealth.NO_SPEECH;
    }
}
