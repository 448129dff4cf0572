package com.phillippitts.callscribe.service.capture;

import com.phillippitts.callscribe.gateway.SpeakerAudioSource;
import com.phillippitts.callscribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Records one speaker's audio from speaking-start until the stream goes quiet.
 *
 * <p>Frames are appended to a PCM file in the session work directory. The segment ends when
 * no frame arrives within the silence timeout or the stream ends. Segments shorter than the
 * minimum length are deleted on the spot and reported as discarded.
 */
public final class SegmentCaptureTask {

    private static final Logger LOG = LogManager.getLogger(SegmentCaptureTask.class);

    private final Duration silenceTimeout;
    private final double minSegmentSeconds;

    public SegmentCaptureTask(Duration silenceTimeout, double minSegmentSeconds) {
        this.silenceTimeout = Objects.requireNonNull(silenceTimeout, "silenceTimeout");
        this.minSegmentSeconds = minSegmentSeconds;
    }

    /**
     * Result of recording: a segment, or only a duration when it was too short.
     */
    public record Result(CapturedSegment segment, double seconds) {
        public boolean discarded() {
            return segment == null;
        }
    }

    /**
     * Blocks until the segment ends.
     *
     * @throws IOException if the PCM file cannot be written; the partial file is removed
     * @throws InterruptedException if the capture thread is interrupted; the partial file is removed
     */
    public Result capture(String speakerId, SpeakerAudioSource source, Path workDir)
            throws IOException, InterruptedException {
        Path pcm = null;
        long bytes = 0;
        boolean keep = false;
        try {
            pcm = Files.createTempFile(workDir, "seg-" + safeId(speakerId) + "-", ".pcm");
            try (OutputStream out = Files.newOutputStream(pcm)) {
                byte[] frame;
                while ((frame = source.poll(silenceTimeout)) != null) {
                    out.write(frame);
                    bytes += frame.length;
                }
            }
            double seconds = AudioFormat.secondsOf(bytes, source.sampleRate());
            if (seconds < minSegmentSeconds) {
                LOG.debug("Discarding {}s segment (min {}s)", String.format("%.2f", seconds), minSegmentSeconds);
                return new Result(null, seconds);
            }
            keep = true;
            return new Result(new CapturedSegment(speakerId, pcm, source.sampleRate(), seconds), seconds);
        } finally {
            source.close();
            if (!keep && pcm != null) {
                Files.deleteIfExists(pcm);
            }
        }
    }

    private static String safeId(String speakerId) {
        String id = speakerId == null ? "" : speakerId.replaceAll("[^A-Za-z0-9]", "");
        return id.isEmpty() ? "unknown" : id;
    }
}
