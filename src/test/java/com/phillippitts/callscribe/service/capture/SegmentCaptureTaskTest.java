package com.phillippitts.callscribe.service.capture;

import com.phillippitts.callscribe.gateway.SpeakerAudioSource;
import com.phillippitts.callscribe.testutil.FakeSpeakerAudioSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SegmentCaptureTaskTest {

    @TempDir
    Path workDir;

    private final SegmentCaptureTask task = new SegmentCaptureTask(Duration.ofMillis(100), 0.5);

    private long filesInWorkDir() throws IOException {
        try (Stream<Path> files = Files.list(workDir)) {
            return files.count();
        }
    }

    @Test
    void recordsUntilStreamEnds() throws Exception {
        FakeSpeakerAudioSource source = FakeSpeakerAudioSource.ofSeconds(1.5, 48_000);

        SegmentCaptureTask.Result result = task.capture("u1", source, workDir);

        assertThat(result.discarded()).isFalse();
        assertThat(result.seconds()).isCloseTo(1.5, within(0.01));
        CapturedSegment segment = result.segment();
        assertThat(segment.sampleRate()).isEqualTo(48_000);
        assertThat(Files.size(segment.pcmFile())).isEqualTo(144_000L);
        assertThat(segment.pcmFile().getFileName().toString()).startsWith("seg-u1-").endsWith(".pcm");
        assertThat(source.isClosed()).isTrue();
    }

    @Test
    void shortSegmentIsDiscardedAndFileRemoved() throws Exception {
        FakeSpeakerAudioSource source = FakeSpeakerAudioSource.ofSeconds(0.2, 48_000);

        SegmentCaptureTask.Result result = task.capture("u1", source, workDir);

        assertThat(result.discarded()).isTrue();
        assertThat(result.seconds()).isCloseTo(0.2, within(0.01));
        assertThat(filesInWorkDir()).isZero();
    }

    @Test
    void failingStreamRemovesPartialFile() throws IOException {
        SpeakerAudioSource broken = new SpeakerAudioSource() {
            private int polls;

            @Override
            public int sampleRate() {
                return 48_000;
            }

            @Override
            public byte[] poll(Duration timeout) {
                if (polls++ == 0) {
                    return new byte[1920];
                }
                throw new IllegalStateException("decoder crashed");
            }

            @Override
            public void close() {
            }
        };

        assertThatThrownBy(() -> task.capture("u1", broken, workDir))
                .isInstanceOf(IllegalStateException.class);
        assertThat(filesInWorkDir()).isZero();
    }

    @Test
    void unsafeSpeakerIdIsStrippedFromFileName() throws Exception {
        SegmentCaptureTask.Result result = task.capture("../../x", FakeSpeakerAudioSource.ofSeconds(1, 48_000), workDir);

        assertThat(result.segment().pcmFile().getParent()).isEqualTo(workDir);
        assertThat(result.segment().pcmFile().getFileName().toString()).startsWith("seg-x-");
    }
}
