package com.phillippitts.callscribe.service.session;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a sealed session, handed from the session loop to the finalize executor.
 *
 * @param transcript rendered {@code [speaker] text} lines, empty when nothing was said
 * @param transcriptEntries number of entries in {@code transcript}
 * @param barrierTimedOut whether in-flight captures were abandoned
 */
public record FinalizeRequest(
        String sessionId,
        String channelId,
        String channelName,
        Instant startedAt,
        Instant endedAt,
        List<String> participants,
        String transcript,
        int transcriptEntries,
        boolean barrierTimedOut,
        int abandonedCaptures
) {

    public FinalizeRequest {
        participants = participants == null ? List.of() : List.copyOf(participants);
        transcript = transcript == null ? "" : transcript;
    }

    public Duration duration() {
        return Duration.between(startedAt, endedAt);
    }

    public boolean hasSpeech() {
        return transcriptEntries > 0;
    }
}
