package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.gateway.SpeakerAudioSource;
import com.phillippitts.callscribe.gateway.VoiceConnection;
import com.phillippitts.callscribe.service.capture.SegmentOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * The recording in progress. Created on a successful join and discarded after reset.
 *
 * <p>Confined to the session loop thread; capture tasks only see the immutable
 * {@link com.phillippitts.callscribe.service.capture.SegmentContext} copied at start.
 */
final class VoiceSession {

    private static final Logger LOG = LogManager.getLogger(VoiceSession.class);

    /**
     * An in-flight capture task and the stream it reads.
     *
     * @param applied completes on the session loop once the task's outcome has been applied
     */
    record PendingCapture(SpeakerAudioSource source, CompletableFuture<Void> applied) {
    }

    private final String id = UUID.randomUUID().toString();
    private final String guildId;
    private final String channelId;
    private final String channelName;
    private final Instant startedAt;
    private final VoiceConnection connection;
    private final boolean manual;
    private final Path workDir;
    private final TranscriptBuffer transcript;
    private final SessionMetrics metrics = new SessionMetrics();
    private final Map<String, String> participants = new LinkedHashMap<>();
    private final Map<String, PendingCapture> pending = new LinkedHashMap<>();

    private Instant endedAt;
    private boolean sealed;
    private boolean barrierTimedOut;
    private int abandonedCaptures;
    private boolean introAttempted;
    private boolean humansSeen;

    VoiceSession(String guildId, String channelId, String channelName, Instant startedAt,
                 VoiceConnection connection, boolean manual, Path workDir, TranscriptBuffer transcript) {
        this.guildId = guildId;
        this.channelId = channelId;
        this.channelName = channelName;
        this.startedAt = startedAt;
        this.connection = connection;
        this.manual = manual;
        this.workDir = workDir;
        this.transcript = transcript;
    }

    String id() {
        return id;
    }

    String guildId() {
        return guildId;
    }

    String channelId() {
        return channelId;
    }

    String channelName() {
        return channelName;
    }

    VoiceConnection connection() {
        return connection;
    }

    boolean isManual() {
        return manual;
    }

    Path workDir() {
        return workDir;
    }

    TranscriptBuffer transcript() {
        return transcript;
    }

    SessionMetrics metrics() {
        return metrics;
    }

    void addParticipant(String speakerId, String label) {
        participants.putIfAbsent(speakerId, label);
    }

    List<String> participantNames() {
        return List.copyOf(participants.values());
    }

    /** Set once; later calls are no-ops. */
    boolean markFinishing(Instant now) {
        if (endedAt != null) {
            return false;
        }
        endedAt = now;
        return true;
    }

    boolean isFinishing() {
        return endedAt != null;
    }

    Instant endedAt() {
        return endedAt;
    }

    boolean isCapturing(String speakerId) {
        return pending.containsKey(speakerId);
    }

    void track(String speakerId, PendingCapture capture) {
        pending.put(speakerId, capture);
    }

    /** Removes the capture only when it is still the one tracked for the speaker. */
    void untrack(String speakerId, CompletableFuture<Void> applied) {
        PendingCapture current = pending.get(speakerId);
        if (current != null && current.applied() == applied) {
            pending.remove(speakerId);
        }
    }

    int pendingCount() {
        return pending.size();
    }

    List<CompletableFuture<Void>> pendingCaptures() {
        return pending.values().stream().map(PendingCapture::applied).toList();
    }

    /**
     * Applies a finished capture: counters always, transcript only for accepted text.
     * Ignored once the session is sealed.
     *
     * @return whether a transcript entry was added
     */
    boolean recordOutcome(SegmentOutcome outcome) {
        if (sealed) {
            return false;
        }
        metrics.apply(outcome);
        if (outcome.kind() == SegmentOutcome.Kind.ACCEPTED) {
            return transcript.append(outcome.completedAt(), outcome.speakerLabel(), outcome.text(), outcome.seconds());
        }
        return false;
    }

    /** Freezes the transcript after the finalize barrier; later outcomes are dropped. */
    void seal(boolean timedOut, int abandoned) {
        sealed = true;
        barrierTimedOut = timedOut;
        abandonedCaptures = abandoned;
    }

    boolean isSealed() {
        return sealed;
    }

    /** Whether a human was ever seen in the channel during this session. */
    boolean humansSeen() {
        return humansSeen;
    }

    void markHumansSeen() {
        humansSeen = true;
    }

    boolean introAttempted() {
        return introAttempted;
    }

    void markIntroAttempted() {
        introAttempted = true;
    }

    FinalizeRequest toFinalizeRequest() {
        return new FinalizeRequest(id, channelId, channelName, startedAt, endedAt, participantNames(),
                transcript.render(), transcript.size(), barrierTimedOut, abandonedCaptures);
    }

    SessionStatus.ActiveSession view() {
        return new SessionStatus.ActiveSession(id, channelId, channelName, startedAt, participantNames(),
                transcript.size(), transcript.droppedCount(), pending.size(), isFinishing(), metrics.snapshot());
    }

    LastSessionSnapshot snapshot(String outcome) {
        return new LastSessionSnapshot(id, channelId, channelName, startedAt, endedAt, participantNames(),
                transcript.size(), barrierTimedOut, abandonedCaptures, outcome, metrics.snapshot());
    }

    /** Closes the streams of captures still running so their tasks end promptly. */
    void closePendingSources() {
        for (PendingCapture capture : new ArrayList<>(pending.values())) {
            try {
                capture.source().close();
            } catch (RuntimeException e) {
                LOG.debug("Closing audio source failed: {}", e.toString());
            }
        }
        pending.clear();
    }

    void deleteWorkDir() {
        if (workDir == null || !Files.exists(workDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(workDir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOG.warn("Failed to delete {}: {}", p.getFileName(), e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Failed to clean session directory {}: {}", workDir.getFileName(), e.toString());
        }
    }
}
