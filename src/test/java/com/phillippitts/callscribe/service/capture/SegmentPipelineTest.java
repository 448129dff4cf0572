package com.phillippitts.callscribe.service.capture;

import com.phillippitts.callscribe.exception.SegmentDecodeException;
import com.phillippitts.callscribe.service.audio.PcmSegmentDecoder;
import com.phillippitts.callscribe.service.audio.SegmentDecoder;
import com.phillippitts.callscribe.service.metrics.CallScribeMetrics;
import com.phillippitts.callscribe.service.session.event.SegmentFailureEvent;
import com.phillippitts.callscribe.testutil.EventCapturingPublisher;
import com.phillippitts.callscribe.testutil.FakeSpeakerAudioSource;
import com.phillippitts.callscribe.testutil.FakeSttEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentPipelineTest {

    @TempDir
    Path workDir;

    private SimpleMeterRegistry registry;
    private EventCapturingPublisher publisher;
    private SegmentContext ctx;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new EventCapturingPublisher();
        ctx = new SegmentContext("s-1", "Standup", "u1", "Alice", workDir);
    }

    private SegmentPipeline pipeline(SegmentDecoder decoder, FakeSttEngine engine) {
        return new SegmentPipeline(new SegmentCaptureTask(Duration.ofMillis(100), 0.5), decoder, engine,
                publisher, new CallScribeMetrics(registry));
    }

    private long filesInWorkDir() throws IOException {
        try (Stream<Path> files = Files.list(workDir)) {
            return files.count();
        }
    }

    private double segments(String outcome) {
        return registry.get("callscribe.segments").tag("outcome", outcome).counter().count();
    }

    @Test
    void acceptedSegmentIsTrimmedAndFileDeleted() throws IOException {
        FakeSttEngine engine = new FakeSttEngine("whisper", "  ship it on friday \n");

        SegmentOutcome outcome = pipeline(new PcmSegmentDecoder(), engine)
                .process(ctx, FakeSpeakerAudioSource.ofSeconds(1.5, 48_000));

        assertThat(outcome.kind()).isEqualTo(SegmentOutcome.Kind.ACCEPTED);
        assertThat(outcome.text()).isEqualTo("ship it on friday");
        assertThat(outcome.speakerLabel()).isEqualTo("Alice");
        assertThat(engine.lastInputBytes()).isEqualTo(48_000);
        assertThat(filesInWorkDir()).isZero();
        assertThat(segments("accepted")).isEqualTo(1.0);
    }

    @Test
    void blankTranscriptionIsEmptyOutcome() {
        SegmentOutcome outcome = pipeline(new PcmSegmentDecoder(), new FakeSttEngine("whisper", "   "))
                .process(ctx, FakeSpeakerAudioSource.ofSeconds(1, 48_000));

        assertThat(outcome.kind()).isEqualTo(SegmentOutcome.Kind.EMPTY);
        assertThat(outcome.wasCaptured()).isTrue();
        assertThat(publisher.eventsOfType(SegmentFailureEvent.class)).isEmpty();
    }

    @Test
    void shortSegmentIsNeverTranscribed() {
        FakeSttEngine engine = new FakeSttEngine("whisper", "hi");

        SegmentOutcome outcome = pipeline(new PcmSegmentDecoder(), engine)
                .process(ctx, FakeSpeakerAudioSource.ofSeconds(0.3, 48_000));

        assertThat(outcome.kind()).isEqualTo(SegmentOutcome.Kind.DISCARDED);
        assertThat(engine.calls()).isZero();
        assertThat(segments("discarded")).isEqualTo(1.0);
    }

    @Test
    void sttFailurePublishesEventAndCleansUp() throws IOException {
        SegmentOutcome outcome = pipeline(new PcmSegmentDecoder(), FakeSttEngine.failing("whisper"))
                .process(ctx, FakeSpeakerAudioSource.ofSeconds(1, 48_000));

        assertThat(outcome.kind()).isEqualTo(SegmentOutcome.Kind.STT_FAILED);
        assertThat(outcome.isFailure()).isTrue();
        assertThat(publisher.eventsOfType(SegmentFailureEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.stage()).isEqualTo(SegmentFailureEvent.Stage.STT);
            assertThat(e.engine()).isEqualTo("whisper");
            assertThat(e.channelName()).isEqualTo("Standup");
        });
        assertThat(filesInWorkDir()).isZero();
        assertThat(segments("stt-failed")).isEqualTo(1.0);
    }

    @Test
    void decodeFailureSkipsEngine() {
        FakeSttEngine engine = new FakeSttEngine("whisper", "never");
        SegmentDecoder broken = segment -> {
            throw new SegmentDecodeException("corrupt frame", null);
        };

        SegmentOutcome outcome = pipeline(broken, engine).process(ctx, FakeSpeakerAudioSource.ofSeconds(1, 48_000));

        assertThat(outcome.kind()).isEqualTo(SegmentOutcome.Kind.DECODE_FAILED);
        assertThat(outcome.error()).isEqualTo("corrupt frame");
        assertThat(engine.calls()).isZero();
        assertThat(publisher.eventsOfType(SegmentFailureEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.stage()).isEqualTo(SegmentFailureEvent.Stage.DECODE));
    }

    @Test
    void unusableWorkDirIsCaptureFailure() {
        SegmentContext badCtx = new SegmentContext("s-1", "Standup", "u1", "Alice", workDir.resolve("missing"));
        FakeSpeakerAudioSource source = FakeSpeakerAudioSource.ofSeconds(1, 48_000);

        SegmentOutcome outcome = pipeline(new PcmSegmentDecoder(), new FakeSttEngine("whisper", "x"))
                .process(badCtx, source);

        assertThat(outcome.kind()).isEqualTo(SegmentOutcome.Kind.CAPTURE_FAILED);
        assertThat(outcome.wasCaptured()).isFalse();
        assertThat(source.isClosed()).isTrue();
    }
}
