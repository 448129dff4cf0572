package com.phillippitts.callscribe.service.stt.python;

import com.phillippitts.callscribe.config.stt.PythonSttConfig;
import com.phillippitts.callscribe.domain.TranscriptionResult;
import com.phillippitts.callscribe.exception.ModelNotFoundException;
import com.phillippitts.callscribe.exception.TranscriptionException;
import com.phillippitts.callscribe.service.audio.WavWriter;
import com.phillippitts.callscribe.service.stt.AbstractSttEngine;
import com.phillippitts.callscribe.service.stt.SttEngineNames;
import com.phillippitts.callscribe.service.stt.process.ProcessRunner;
import com.phillippitts.callscribe.service.stt.process.ProcessSpec;
import com.phillippitts.callscribe.service.stt.util.ConcurrencyGuard;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Speech-to-text through the bundled faster-whisper Python script.
 *
 * <p>The script prints the recognized text on stdout and nothing else. The command line is
 * parsed once at initialization and checked by {@link PythonCommand}.
 */
public class FasterWhisperSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(FasterWhisperSttEngine.class);

    private final PythonSttConfig config;
    private final ProcessRunner runner;
    private volatile PythonCommand command;

    public FasterWhisperSttEngine(PythonSttConfig config, ConcurrencyGuard guard, ProcessRunner runner) {
        super(guard);
        this.config = Objects.requireNonNull(config, "config");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    protected void doInitialize() {
        PythonCommand parsed = PythonCommand.parse(config.command());
        Path script = Path.of("").toAbsolutePath().resolve(PythonCommand.ALLOWED_SCRIPT);
        if (!Files.isRegularFile(script)) {
            throw new ModelNotFoundException(script.toString());
        }
        this.command = parsed;
        LOG.info("faster-whisper engine ready: executable={}, args={}", parsed.executable(), parsed.arguments());
    }

    @Override
    protected TranscriptionResult doTranscribe(byte[] pcm16k) {
        Path wav = null;
        try {
            wav = Files.createTempFile("callscribe-fw-", ".wav");
            WavWriter.writePcm16LeMono16kHz(pcm16k, wav);
            String stdout = runner.run(new ProcessSpec(
                    getEngineName(),
                    command.withInput(wav),
                    null,
                    Duration.ofSeconds(config.timeoutSeconds()),
                    config.maxStdoutBytes(),
                    Map.of("executable", command.executable())));
            return TranscriptionResult.of(stdout.trim(), 1.0, getEngineName());
        } catch (IOException e) {
            throw new TranscriptionException("Failed to create temp WAV: " + e.getMessage(), getEngineName(), e);
        } finally {
            if (wav != null) {
                try {
                    Files.deleteIfExists(wav);
                } catch (IOException e) {
                    LOG.warn("Failed to delete temp WAV {}: {}", wav.getFileName(), e.toString());
                }
            }
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.FASTER_WHISPER;
    }

    @Override
    protected void doClose() {
        command = null;
    }
}
