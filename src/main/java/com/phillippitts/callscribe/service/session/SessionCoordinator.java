package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.config.properties.SessionProperties;
import com.phillippitts.callscribe.config.properties.TranscriptProperties;
import com.phillippitts.callscribe.exception.InvalidConfigurationException;
import com.phillippitts.callscribe.exception.SessionStateException;
import com.phillippitts.callscribe.gateway.GuildMember;
import com.phillippitts.callscribe.gateway.SpeakerAudioSource;
import com.phillippitts.callscribe.gateway.VoiceChannelInfo;
import com.phillippitts.callscribe.gateway.VoiceConnection;
import com.phillippitts.callscribe.gateway.VoiceGateway;
import com.phillippitts.callscribe.service.capture.SegmentContext;
import com.phillippitts.callscribe.service.capture.SegmentOutcome;
import com.phillippitts.callscribe.service.capture.SegmentPipeline;
import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import com.phillippitts.callscribe.service.session.event.SessionFinalizedEvent;
import com.phillippitts.callscribe.util.LogSanitizer;
import com.phillippitts.callscribe.util.SafePaths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the single voice session: channel selection, debounced join, per-speaker capture,
 * the finalize barrier and reset.
 *
 * <p>All session state is confined to one scheduled thread, the session loop. Membership
 * changes, periodic ticks, speaking-start events, join and capture completions, timers and the
 * manual REST commands are all submitted to it, so no field below needs synchronization. Capture
 * tasks run on the capture executor and summarization plus delivery on the finalize executor;
 * their results come back to the loop as {@link CompletableFuture} completions.
 *
 * <p>Every loop task is guarded: an exception is logged and the loop keeps running.
 */
@Component
public class SessionCoordinator implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SessionCoordinator.class);
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_LABEL_CHARS = 64;
    private static final int MAX_LOGGED_NAME_CHARS = 80;
    static final String MDC_SESSION_ID = "sessionId";

    private final VoiceGateway gateway;
    private final SessionProperties properties;
    private final TranscriptProperties transcriptProperties;
    private final SegmentPipeline pipeline;
    private final SessionFinalizer finalizer;
    private final Executor captureExecutor;
    private final Executor finalizeExecutor;
    private final ApplicationEventPublisher publisher;
    private final CallScribeMetrics metrics;
    private final String guildId;

    private final ScheduledExecutorService loop;
    private final RearmableTimer debounceTimer;
    private final RearmableTimer introTimer;
    private final RearmableTimer graceTimer;
    private volatile boolean running;

    // loop-confined
    private final SessionMetrics cumulative = new SessionMetrics();
    private VoiceSession session;
    private LastSessionSnapshot lastSession;
    private String candidateChannelId;
    private Instant nonEmptySince;
    private boolean joinInProgress;
    private long joinAttempt;
    private boolean manualMode;
    private Instant introHumansSince;

    public SessionCoordinator(VoiceGateway gateway,
                              SessionProperties properties,
                              TranscriptProperties transcriptProperties,
                              SegmentPipeline pipeline,
                              SessionFinalizer finalizer,
                              @Qualifier("captureExecutor") Executor captureExecutor,
                              @Qualifier("finalizeExecutor") Executor finalizeExecutor,
                              ApplicationEventPublisher publisher,
                              CallScribeMetrics metrics) {
        this.gateway = gateway;
        this.properties = properties;
        this.transcriptProperties = transcriptProperties;
        this.pipeline = pipeline;
        this.finalizer = finalizer;
        this.captureExecutor = captureExecutor;
        this.finalizeExecutor = finalizeExecutor;
        this.publisher = publisher;
        this.metrics = metrics;
        this.guildId = properties.getGuildId();

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("session-loop-");
        threadFactory.setDaemon(true);
        this.loop = Executors.newSingleThreadScheduledExecutor(threadFactory);
        this.debounceTimer = new RearmableTimer(loop);
        this.introTimer = new RearmableTimer(loop);
        this.graceTimer = new RearmableTimer(loop);
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        gateway.addMembershipListener(this::requestTick);
        LOG.info("Session coordinator started (guild={}, debounce={}, barrierTimeout={})",
                guildId, properties.getJoinDebounce(), properties.getFinalizeBarrierTimeout());
        requestTick();
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            callOnLoop(() -> {
                abandonSession();
                return null;
            });
        } catch (RuntimeException e) {
            LOG.warn("Session loop did not shut down cleanly: {}", e.getMessage());
        }
        loop.shutdownNow();
        LOG.info("Session coordinator stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ---------------------------------------------------------------- public API

    /** Asks the loop to re-evaluate channels; safe from any thread. */
    public void requestTick() {
        execute(this::tick);
    }

    public SessionStatus status() {
        return callOnLoop(this::buildStatus);
    }

    /**
     * Joins the given channel now and suspends automatic selection until {@link #resumeAuto()}.
     *
     * @throws SessionStateException when a session is recording or a join is in progress
     * @throws IllegalArgumentException when the channel is not a voice channel of the guild
     */
    public SessionStatus joinManually(String channelId) {
        return callOnLoop(() -> {
            if (session != null || joinInProgress) {
                throw new SessionStateException("Cannot join while " + state());
            }
            VoiceChannelInfo channel = gateway.voiceChannels(guildId).stream()
                    .filter(c -> c.id().equals(channelId))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown voice channel: " + channelId));
            manualMode = true;
            clearCandidate();
            startJoin(channel, true);
            return buildStatus();
        });
    }

    /**
     * Finalizes the current session now, or cancels a join in progress. Automatic selection
     * stays suspended until {@link #resumeAuto()}.
     *
     * @throws SessionStateException when there is nothing to leave
     */
    public SessionStatus leaveManually() {
        return callOnLoop(() -> {
            if (session == null) {
                if (!joinInProgress) {
                    throw new SessionStateException("No active session");
                }
                joinAttempt++;
                joinInProgress = false;
                manualMode = true;
                LOG.info("Join cancelled by manual leave");
                return buildStatus();
            }
            if (session.isFinishing()) {
                throw new SessionStateException("Session is already finalizing");
            }
            manualMode = true;
            clearCandidate();
            beginFinalize("manual leave");
            return buildStatus();
        });
    }

    /** Resumes automatic channel selection. */
    public SessionStatus resumeAuto() {
        return callOnLoop(() -> {
            if (manualMode) {
                LOG.info("Automatic channel selection resumed");
            }
            manualMode = false;
            tick();
            return buildStatus();
        });
    }

    // ---------------------------------------------------------------- tick

    private void tick() {
        if (!running) {
            return;
        }
        if (session != null) {
            checkActiveSession();
            return;
        }
        if (joinInProgress || manualMode) {
            return;
        }
        Optional<VoiceChannelInfo> pick = ChannelSelector.pick(gateway.voiceChannels(guildId));
        if (pick.isEmpty()) {
            clearCandidate();
            return;
        }
        VoiceChannelInfo channel = pick.get();
        Instant now = Instant.now();
        if (!channel.id().equals(candidateChannelId)) {
            candidateChannelId = channel.id();
            nonEmptySince = now;
            LOG.debug("Candidate channel {} ({} humans)", logName(channel.name()), channel.humanCount());
        }
        Duration elapsed = Duration.between(nonEmptySince, now);
        Duration debounce = properties.getJoinDebounce();
        if (elapsed.compareTo(debounce) < 0) {
            schedule(debounceTimer, debounce.minus(elapsed).plus(properties.getJoinRecheckSlack()), this::tick);
            return;
        }
        startJoin(channel, false);
    }

    private void clearCandidate() {
        candidateChannelId = null;
        nonEmptySince = null;
        debounceTimer.cancel();
    }

    private void checkActiveSession() {
        if (session.isFinishing()) {
            return;
        }
        int humans = humansIn(session.channelId());
        if (humans == 0) {
            // a manual session may start in an empty channel; it ends once people have come and gone
            if (session.isManual() && !session.humansSeen()) {
                return;
            }
            beginFinalize("channel empty");
            return;
        }
        session.markHumansSeen();
        evaluateIntro(humans);
    }

    private int humansIn(String channelId) {
        return gateway.voiceChannels(guildId).stream()
                .filter(c -> c.id().equals(channelId))
                .findFirst()
                .map(VoiceChannelInfo::humanCount)
                .orElse(0);
    }

    // ---------------------------------------------------------------- join

    private void startJoin(VoiceChannelInfo channel, boolean manual) {
        joinInProgress = true;
        long attempt = ++joinAttempt;
        debounceTimer.cancel();
        LOG.info("Joining voice channel {} ({} humans, manual={})",
                logName(channel.name()), channel.humanCount(), manual);

        CompletableFuture<VoiceConnection> join;
        try {
            join = gateway.join(guildId, channel.id());
        } catch (RuntimeException e) {
            join = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<VoiceConnection> gatewayJoin = join;
        gatewayJoin.copy()
                .orTimeout(properties.getJoinTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((connection, error) -> execute(
                        () -> onJoinCompleted(attempt, channel, manual, gatewayJoin, connection, error)));
    }

    private void onJoinCompleted(long attempt, VoiceChannelInfo channel, boolean manual,
                                 CompletableFuture<VoiceConnection> gatewayJoin,
                                 VoiceConnection connection, Throwable error) {
        if (attempt != joinAttempt || !running) {
            if (connection != null) {
                LOG.info("Discarding superseded voice connection to {}", logName(channel.name()));
                disconnectQuietly(connection);
            }
            return;
        }
        joinInProgress = false;
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                LOG.warn("Join to {} timed out after {}", logName(channel.name()), properties.getJoinTimeout());
                // a connection arriving after the timeout is not used
                gatewayJoin.thenAccept(this::disconnectQuietly);
            } else {
                LOG.warn("Join to {} failed: {}", logName(channel.name()), cause.toString());
            }
            clearCandidate();
            return;
        }

        Path workDir;
        try {
            workDir = Files.createTempDirectory("callscribe-session-");
        } catch (IOException e) {
            LOG.error("Cannot create session work directory; leaving {}", logName(channel.name()), e);
            disconnectQuietly(connection);
            return;
        }
        session = new VoiceSession(guildId, channel.id(), channel.name(), Instant.now(), connection, manual,
                workDir, new TranscriptBuffer(transcriptProperties.getMaxItems(),
                        transcriptProperties.getMaxSegmentChars()));
        clearCandidate();
        introHumansSince = null;
        ThreadContext.put(MDC_SESSION_ID, session.id());

        String sessionId = session.id();
        connection.onSpeakingStart(userId -> execute(() -> onSpeakingStart(sessionId, userId)));
        LOG.info("Session {} started in {} (manual={})", sessionId, logName(channel.name()), manual);
        checkActiveSession();
    }

    // ---------------------------------------------------------------- capture

    private void onSpeakingStart(String sessionId, String userId) {
        if (session == null || !session.id().equals(sessionId) || session.isFinishing()) {
            return;
        }
        if (session.isCapturing(userId)) {
            return;
        }
        Optional<GuildMember> member = gateway.member(guildId, userId);
        if (member.isEmpty() || member.get().bot()) {
            return;
        }
        if (session.pendingCount() >= properties.getMaxConcurrentCaptures()) {
            rejectCapture(userId, "capture cap " + properties.getMaxConcurrentCaptures() + " reached");
            return;
        }
        String label = LogSanitizer.sanitizeLabel(member.get().displayName(), MAX_LABEL_CHARS);
        if (label.isEmpty()) {
            label = "user:" + userId;
        }
        session.addParticipant(userId, label);

        SpeakerAudioSource source;
        try {
            source = session.connection().subscribe(userId);
        } catch (RuntimeException e) {
            LOG.warn("Cannot subscribe to speaker {}: {}", userId, e.toString());
            SegmentOutcome failed = SegmentOutcome.failed(SegmentOutcome.Kind.CAPTURE_FAILED, userId, label, 0.0,
                    e.toString());
            session.recordOutcome(failed);
            cumulative.apply(failed);
            return;
        }

        SegmentContext ctx = new SegmentContext(sessionId, session.channelName(), userId, label, session.workDir());
        CompletableFuture<SegmentOutcome> task;
        try {
            task = CompletableFuture.supplyAsync(() -> pipeline.process(ctx, source), captureExecutor);
        } catch (RejectedExecutionException e) {
            source.close();
            rejectCapture(userId, "capture executor saturated");
            return;
        }
        CompletableFuture<Void> applied = new CompletableFuture<>();
        session.track(userId, new VoiceSession.PendingCapture(source, applied));
        task.whenComplete((outcome, error) -> execute(() -> onCaptureCompleted(ctx, applied, outcome, error)));
    }

    private void rejectCapture(String userId, String reason) {
        session.metrics().recordRejected();
        cumulative.recordRejected();
        metrics.recordCaptureRejected();
        LOG.warn("Capture for speaker {} rejected: {}", userId, reason);
    }

    private void onCaptureCompleted(SegmentContext ctx, CompletableFuture<Void> applied,
                                    SegmentOutcome outcome, Throwable error) {
        try {
            SegmentOutcome result = outcome != null ? outcome
                    : SegmentOutcome.failed(SegmentOutcome.Kind.CAPTURE_FAILED, ctx.speakerId(), ctx.speakerLabel(),
                    0.0, String.valueOf(error));
            if (session == null || !session.id().equals(ctx.sessionId())) {
                LOG.debug("Ignoring capture result of ended session {}", ctx.sessionId());
                return;
            }
            session.untrack(ctx.speakerId(), applied);
            if (session.isSealed()) {
                LOG.debug("Ignoring capture result after finalize barrier: speaker={}", ctx.speakerId());
                return;
            }
            if (session.recordOutcome(result)) {
                LOG.debug("Transcript entry added: speaker={}, chars={}", ctx.speakerId(), result.text().length());
            }
            cumulative.apply(result);
        } finally {
            applied.complete(null);
        }
    }

    // ---------------------------------------------------------------- intro

    private void evaluateIntro(int humans) {
        SessionProperties.Intro intro = properties.getIntro();
        if (!intro.isEnabled() || session.introAttempted()) {
            return;
        }
        if (humans < intro.getMinHumans()) {
            introHumansSince = null;
            introTimer.cancel();
            return;
        }
        Instant now = Instant.now();
        if (introHumansSince == null) {
            introHumansSince = now;
        }
        Duration elapsed = Duration.between(introHumansSince, now);
        if (elapsed.compareTo(intro.getDelay()) >= 0) {
            playIntro(intro);
            return;
        }
        schedule(introTimer, intro.getDelay().minus(elapsed).plus(properties.getJoinRecheckSlack()), this::tick);
    }

    private void playIntro(SessionProperties.Intro intro) {
        session.markIntroAttempted();
        introTimer.cancel();
        Path clip;
        try {
            clip = SafePaths.resolveWithinCwd("session.intro.path", intro.getPath(), false);
        } catch (InvalidConfigurationException e) {
            LOG.warn("Intro not played: {}", e.getMessage());
            return;
        }
        if (!Files.isRegularFile(clip)) {
            LOG.warn("Intro not played: {} not found", intro.getPath());
            return;
        }
        String sessionId = session.id();
        CompletableFuture<Void> playback;
        try {
            playback = session.connection().play(clip);
        } catch (RuntimeException e) {
            LOG.warn("Intro playback failed: {}", e.toString());
            return;
        }
        playback.copy()
                .orTimeout(intro.getPlaybackTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((v, error) -> {
                    if (error == null) {
                        LOG.info("Intro played in session {}", sessionId);
                    } else {
                        LOG.warn("Intro playback did not finish in session {}: {}", sessionId, error.toString());
                    }
                });
    }

    // ---------------------------------------------------------------- finalize

    private void beginFinalize(String reason) {
        if (session == null || !session.markFinishing(Instant.now())) {
            return;
        }
        introTimer.cancel();
        String sessionId = session.id();
        LOG.info("Session {} finishing ({}); {} capture(s) in flight", sessionId, reason, session.pendingCount());
        schedule(graceTimer, properties.getFinalizeGrace(), () -> runBarrier(sessionId));
    }

    private void runBarrier(String sessionId) {
        if (!isCurrent(sessionId) || session.isSealed()) {
            return;
        }
        List<CompletableFuture<Void>> inFlight = session.pendingCaptures();
        if (inFlight.isEmpty()) {
            onBarrierSettled(sessionId, false);
            return;
        }
        LOG.info("Waiting up to {} for {} capture(s)", properties.getFinalizeBarrierTimeout(), inFlight.size());
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0]))
                .handle((v, error) -> Boolean.FALSE)
                .completeOnTimeout(Boolean.TRUE, properties.getFinalizeBarrierTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenAccept(timedOut -> execute(() -> onBarrierSettled(sessionId, timedOut)));
    }

    private void onBarrierSettled(String sessionId, boolean timedOut) {
        if (!isCurrent(sessionId) || session.isSealed()) {
            return;
        }
        int abandoned = timedOut ? session.pendingCount() : 0;
        session.seal(timedOut, abandoned);
        if (timedOut) {
            LOG.warn("Finalize barrier timed out; abandoning {} capture(s)", abandoned);
        }
        session.closePendingSources();

        FinalizeRequest request = session.toFinalizeRequest();
        CompletableFuture<FinalizeResult> result;
        try {
            result = CompletableFuture.supplyAsync(() -> finalizer.finalizeSession(request), finalizeExecutor);
        } catch (RejectedExecutionException e) {
            LOG.error("Finalize executor rejected session {}", sessionId);
            result = CompletableFuture.completedFuture(FinalizeResult.failed("finalize executor rejected the task"));
        }
        result.whenComplete((finalized, error) -> execute(() -> onFinalized(sessionId,
                finalized != null ? finalized : FinalizeResult.failed(String.valueOf(error)))));
    }

    private void onFinalized(String sessionId, FinalizeResult result) {
        if (!isCurrent(sessionId)) {
            return;
        }
        LOG.info("Session {} finalized: outcome={}, summary={}, transcript={}", sessionId, result.outcome(),
                result.summarySource(), result.transcriptFile() == null ? "-" : result.transcriptFile().getFileName());
        metrics.recordSession(result.outcome().name());
        reset(result.outcome().name());
    }

    private void reset(String outcome) {
        VoiceSession ended = session;
        session = null;
        introTimer.cancel();
        graceTimer.cancel();
        introHumansSince = null;
        lastSession = ended.snapshot(outcome);
        disconnectQuietly(ended.connection());
        ended.closePendingSources();
        ended.deleteWorkDir();
        ThreadContext.remove(MDC_SESSION_ID);
        try {
            publisher.publishEvent(new SessionFinalizedEvent(lastSession));
        } catch (RuntimeException e) {
            LOG.warn("Session finalized listener threw: {}", e.toString());
        }
        requestTick();
    }

    /** Shutdown path: drop the session without summarizing it. */
    private void abandonSession() {
        joinAttempt++;
        joinInProgress = false;
        debounceTimer.cancel();
        introTimer.cancel();
        graceTimer.cancel();
        if (session != null) {
            session.markFinishing(Instant.now());
            LOG.warn("Shutting down with session {} unfinished; transcript discarded", session.id());
            reset("ABORTED");
        }
    }

    // ---------------------------------------------------------------- loop plumbing

    private SessionState state() {
        if (session != null) {
            if (session.isFinishing()) {
                return SessionState.FINALIZING;
            }
            return session.isManual() ? SessionState.MANUAL_ACTIVE : SessionState.ACTIVE;
        }
        if (joinInProgress) {
            return SessionState.JOINING;
        }
        return candidateChannelId != null ? SessionState.CANDIDATE : SessionState.IDLE;
    }

    private SessionStatus buildStatus() {
        return new SessionStatus(state(), manualMode, candidateChannelId,
                session == null ? null : session.view(), cumulative.snapshot(), lastSession);
    }

    private boolean isCurrent(String sessionId) {
        return session != null && session.id().equals(sessionId);
    }

    private void schedule(RearmableTimer timer, Duration delay, Runnable task) {
        timer.schedule(delay, () -> guarded(task));
    }

    private void execute(Runnable task) {
        if (loop.isShutdown()) {
            return;
        }
        try {
            loop.execute(() -> guarded(task));
        } catch (RejectedExecutionException e) {
            LOG.debug("Session loop is shut down; event dropped");
        }
    }

    private static void guarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Session loop task failed", e);
        }
    }

    private <T> T callOnLoop(Callable<T> command) {
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                result.complete(command.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        try {
            return result.get(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SessionStateException("Session command failed: " + e.getCause());
        } catch (TimeoutException e) {
            throw new SessionStateException("Session loop did not respond within " + COMMAND_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionStateException("Interrupted while waiting for the session loop");
        }
    }

    private void disconnectQuietly(VoiceConnection connection) {
        try {
            connection.disconnect();
        } catch (RuntimeException e) {
            LOG.warn("Voice disconnect failed: {}", e.toString());
        }
    }

    private static String logName(String name) {
        return LogSanitizer.sanitizeLabel(name, MAX_LOGGED_NAME_CHARS);
    }
}
