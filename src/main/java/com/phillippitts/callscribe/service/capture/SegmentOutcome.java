package com.phillippitts.callscribe.service.capture;

import java.time.Instant;

/**
 * Result of one capture task, always produced even when capture, decode or transcription failed.
 *
 * @param kind what happened to the segment
 * @param speakerId platform user id
 * @param speakerLabel sanitized display name
 * @param seconds captured audio duration
 * @param text transcript text, non-empty only for {@link Kind#ACCEPTED}
 * @param error failure description for the failure kinds, otherwise {@code null}
 * @param completedAt completion time, used as the transcript entry timestamp
 */
public record SegmentOutcome(
        Kind kind,
        String speakerId,
        String speakerLabel,
        double seconds,
        String text,
        String error,
        Instant completedAt
) {

    public enum Kind {
        /** Transcribed to non-empty text. */
        ACCEPTED,
        /** Transcribed, but the engine heard nothing. */
        EMPTY,
        /** Shorter than the minimum segment length; never transcribed. */
        DISCARDED,
        DECODE_FAILED,
        STT_FAILED,
        /** The audio stream itself failed or the work directory was unusable. */
        CAPTURE_FAILED
    }

    public static SegmentOutcome accepted(String speakerId, String label, double seconds, String text) {
        return new SegmentOutcome(Kind.ACCEPTED, speakerId, label, seconds, text, null, Instant.now());
    }

    public static SegmentOutcome empty(String speakerId, String label, double seconds) {
        return new SegmentOutcome(Kind.EMPTY, speakerId, label, seconds, "", null, Instant.now());
    }

    public static SegmentOutcome discarded(String speakerId, String label, double seconds) {
        return new SegmentOutcome(Kind.DISCARDED, speakerId, label, seconds, "", null, Instant.now());
    }

    public static SegmentOutcome failed(Kind kind, String speakerId, String label, double seconds, String error) {
        return new SegmentOutcome(kind, speakerId, label, seconds, "", error, Instant.now());
    }

    public boolean isFailure() {
        return kind == Kind.DECODE_FAILED || kind == Kind.STT_FAILED || kind == Kind.CAPTURE_FAILED;
    }

    /** Whether audio was recorded and kept long enough to be counted as captured. */
    public boolean wasCaptured() {
        return kind != Kind.DISCARDED && kind != Kind.CAPTURE_FAILED;
    }
}
