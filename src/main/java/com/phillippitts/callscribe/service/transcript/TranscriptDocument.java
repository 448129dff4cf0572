package com.phillippitts.callscribe.service.transcript;

import java.time.Instant;
import java.util.List;

/**
 * Everything written to a transcript archive file.
 *
 * @param body rendered transcript, or the no-speech placeholder
 */
public record TranscriptDocument(
        String channelName,
        Instant startedAt,
        Instant endedAt,
        List<String> participants,
        String body
) {

    public TranscriptDocument {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    /** Comma separated participant names, or {@code (none)}. */
    public String participantList() {
        return participants.isEmpty() ? "(none)" : String.join(", ", participants);
    }
}
