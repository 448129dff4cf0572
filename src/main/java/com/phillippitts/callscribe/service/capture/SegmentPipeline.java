package com.phillippitts.callscribe.service.capture;

import com.phillippitts.callscribe.config.properties.CaptureProperties;
import com.phillippitts.callscribe.domain.TranscriptionResult;
import com.phillippitts.callscribe.exception.SegmentDecodeException;
import com.phillippitts.callscribe.exception.TranscriptionException;
import com.phillippitts.callscribe.gateway.SpeakerAudioSource;
import com.phillippitts.callscribe.service.audio.SegmentDecoder;
import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import com.phillippitts.callscribe.service.session.event.SegmentFailureEvent;
import com.phillippitts.callscribe.service.stt.SttEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs one speaker segment end to end: capture, decode, transcribe.
 *
 * <p>{@link #process} never throws for expected failures. Every path returns a
 * {@link SegmentOutcome}, deletes the segment's temp file, and for decode and transcription
 * failures publishes a {@link SegmentFailureEvent}. A failure affects only its own segment.
 */
@Component
public class SegmentPipeline {

    private static final Logger LOG = LogManager.getLogger(SegmentPipeline.class);

    private final SegmentCaptureTask captureTask;
    private final SegmentDecoder decoder;
    private final SttEngine engine;
    private final ApplicationEventPublisher publisher;
    private final CallScribeMetrics metrics;

    @Autowired
    public SegmentPipeline(CaptureProperties captureProperties,
                           SegmentDecoder decoder,
                           SttEngine engine,
                           ApplicationEventPublisher publisher,
                           CallScribeMetrics metrics) {
        this(new SegmentCaptureTask(captureProperties.getSilenceTimeout(), captureProperties.getMinSegmentSeconds()),
                decoder, engine, publisher, metrics);
    }

    SegmentPipeline(SegmentCaptureTask captureTask,
                    SegmentDecoder decoder,
                    SttEngine engine,
                    ApplicationEventPublisher publisher,
                    CallScribeMetrics metrics) {
        this.captureTask = Objects.requireNonNull(captureTask, "captureTask");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public SegmentOutcome process(SegmentContext ctx, SpeakerAudioSource source) {
        SegmentOutcome outcome = run(ctx, source);
        metrics.recordSegment(outcome);
        return outcome;
    }

    private SegmentOutcome run(SegmentContext ctx, SpeakerAudioSource source) {
        SegmentCaptureTask.Result captured;
        try {
            captured = captureTask.capture(ctx.speakerId(), source, ctx.workDir());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SegmentOutcome.failed(SegmentOutcome.Kind.CAPTURE_FAILED, ctx.speakerId(), ctx.speakerLabel(),
                    0.0, "capture interrupted");
        } catch (IOException | RuntimeException e) {
            LOG.warn("Capture failed for speaker {}: {}", ctx.speakerId(), e.toString());
            return SegmentOutcome.failed(SegmentOutcome.Kind.CAPTURE_FAILED, ctx.speakerId(), ctx.speakerLabel(),
                    0.0, e.toString());
        }
        if (captured.discarded()) {
            return SegmentOutcome.discarded(ctx.speakerId(), ctx.speakerLabel(), captured.seconds());
        }

        CapturedSegment segment = captured.segment();
        try {
            return transcribe(ctx, segment);
        } finally {
            try {
                Files.deleteIfExists(segment.pcmFile());
            } catch (IOException e) {
                LOG.warn("Failed to delete segment file {}: {}", segment.pcmFile().getFileName(), e.toString());
            }
        }
    }

    private SegmentOutcome transcribe(SegmentContext ctx, CapturedSegment segment) {
        byte[] pcm16k;
        try {
            pcm16k = decoder.decode(segment);
        } catch (SegmentDecodeException e) {
            LOG.warn("Decode failed for {}s segment of speaker {}: {}",
                    String.format("%.1f", segment.seconds()), ctx.speakerId(), e.getMessage());
            publishFailure(ctx, SegmentFailureEvent.Stage.DECODE, null, e);
            return SegmentOutcome.failed(SegmentOutcome.Kind.DECODE_FAILED, ctx.speakerId(), ctx.speakerLabel(),
                    segment.seconds(), e.getMessage());
        }

        long start = System.nanoTime();
        try {
            TranscriptionResult result = engine.transcribe(pcm16k);
            metrics.recordTranscription(engine.getEngineName(), System.nanoTime() - start, true);
            String text = result.text().trim();
            LOG.debug("Segment transcribed: speaker={}, seconds={}, chars={}",
                    ctx.speakerId(), String.format("%.1f", segment.seconds()), text.length());
            return text.isEmpty()
                    ? SegmentOutcome.empty(ctx.speakerId(), ctx.speakerLabel(), segment.seconds())
                    : SegmentOutcome.accepted(ctx.speakerId(), ctx.speakerLabel(), segment.seconds(), text);
        } catch (TranscriptionException | IllegalArgumentException e) {
            metrics.recordTranscription(engine.getEngineName(), System.nanoTime() - start, false);
            LOG.warn("STT failed for speaker {}: {}", ctx.speakerId(), e.getMessage());
            publishFailure(ctx, SegmentFailureEvent.Stage.STT, engine.getEngineName(), e);
            return SegmentOutcome.failed(SegmentOutcome.Kind.STT_FAILED, ctx.speakerId(), ctx.speakerLabel(),
                    segment.seconds(), e.getMessage());
        }
    }

    private void publishFailure(SegmentContext ctx, SegmentFailureEvent.Stage stage, String engineName, Exception e) {
        try {
            publisher.publishEvent(new SegmentFailureEvent(ctx.sessionId(), ctx.channelName(), stage, engineName,
                    e.getMessage(), Instant.now()));
        } catch (RuntimeException listenerFailure) {
            LOG.warn("Segment failure listener threw: {}", listenerFailure.toString());
        }
    }
}
