package com.phillippitts.callscribe.service.capture;

import java.nio.file.Path;

/**
 * Session facts a capture task needs, copied when the task starts.
 *
 * @param sessionId owning session
 * @param channelName voice channel name, for failure alerts
 * @param speakerId platform user id
 * @param speakerLabel sanitized display name
 * @param workDir session temp directory for PCM files
 */
public record SegmentContext(
        String sessionId,
        String channelName,
        String speakerId,
        String speakerLabel,
        Path workDir
) {
}
