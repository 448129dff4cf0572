package com.phillippitts.callscribe.service.session;

import java.time.Instant;

/**
 * One transcribed utterance.
 *
 * @param timestamp completion time of the segment
 * @param speakerLabel sanitized display name
 * @param text sanitized transcript text, never blank
 * @param seconds audio duration of the segment
 */
public record TranscriptEntry(Instant timestamp, String speakerLabel, String text, double seconds) {

    /** Rendered transcript line, {@code [speaker] text}. */
    public String line() {
        return "[" + speakerLabel + "] " + text;
    }
}
