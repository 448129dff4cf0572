package com.phillippitts.callscribe.service.stt.whisper;

import com.phillippitts.callscribe.config.stt.WhisperConfig;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Speech-to-text through the whisper.cpp command line binary.
 *
 * <p>Each call writes the segment to a temporary WAV file, runs
 * <pre>
 * ${binary} -m ${model} -f ${wav} -l ${language} -t ${threads} -nt -np
 * </pre>
 * and reads the transcript from stdout. The temporary file is deleted whatever the outcome.
 */
public class WhisperSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperSttEngine.class);

    /** Markers whisper.cpp prints for silence or noise instead of words. */
    private static final Pattern NON_SPEECH = Pattern.compile("\\[(BLANK_AUDIO|MUSIC|NOISE|SILENCE)]",
            Pattern.CASE_INSENSITIVE);

    private final WhisperConfig config;
    private final ProcessRunner runner;

    public WhisperSttEngine(WhisperConfig config, ConcurrencyGuard guard, ProcessRunner runner) {
        super(guard);
        this.config = Objects.requireNonNull(config, "config");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    protected void doInitialize() {
        Path binary = resolvePath(config.binaryPath());
        Path model = resolvePath(config.modelPath());
        if (!Files.isRegularFile(binary)) {
            throw new ModelNotFoundException(binary.toString());
        }
        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException(model.toString());
        }
        LOG.info("Whisper engine ready: binary={}, model={}, language={}, threads={}",
                binary, model, config.language(), config.threads());
    }

    @Override
    protected TranscriptionResult doTranscribe(byte[] pcm16k) {
        Path wav = null;
        try {
            wav = Files.createTempFile("callscribe-whisper-", ".wav");
            WavWriter.writePcm16LeMono16kHz(pcm16k, wav);
            String stdout = runner.run(new ProcessSpec(
                    getEngineName(),
                    buildCommand(wav),
                    wav.getParent(),
                    Duration.ofSeconds(config.timeoutSeconds()),
                    config.maxStdoutBytes(),
                    Map.of("binaryPath", config.binaryPath(), "modelPath", config.modelPath())));
            return TranscriptionResult.of(parseText(stdout), 1.0, getEngineName());
        } catch (IOException e) {
            throw new TranscriptionException("Failed to create temp WAV: " + e.getMessage(), getEngineName(), e);
        } finally {
            deleteQuietly(wav);
        }
    }

    List<String> buildCommand(Path wav) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(config.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(config.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wav.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(config.language());
        cmd.add("-t");
        cmd.add(String.valueOf(config.threads()));
        cmd.add("-nt");
        cmd.add("-np");
        return cmd;
    }

    /**
     * Joins output lines into one line of text and drops non-speech markers.
     */
    static String parseText(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return "";
        }
        String text = NON_SPEECH.matcher(stdout).replaceAll(" ");
        return text.replaceAll("\\s+", " ").trim();
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        return path.isAbsolute() ? path : Path.of("").toAbsolutePath().resolve(path).normalize();
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp WAV {}: {}", path.getFileName(), e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.WHISPER;
    }

    @Override
    protected void doClose() {
        // processes are per call; nothing held between segments
    }
}
