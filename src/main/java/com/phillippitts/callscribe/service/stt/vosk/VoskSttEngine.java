package com.phillippitts.callscribe.service.stt.vosk;

import com.phillippitts.callscribe.config.stt.VoskConfig;
import com.phillippitts.callscribe.domain.TranscriptionResult;
import com.phillippitts.callscribe.exception.ModelNotFoundException;
import com.phillippitts.callscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.callscribe.service.stt.AbstractSttEngine;
import com.phillippitts.callscribe.service.stt.SttEngineNames;
import com.phillippitts.callscribe.service.stt.util.ConcurrencyGuard;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.vosk.Model;
import org.vosk.Recognizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * In-process speech-to-text with a local Vosk model.
 *
 * <p>The native {@link Model} is loaded once and shared; a {@link Recognizer} is created per
 * segment because recognizers are not thread-safe.
 */
public class VoskSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(VoskSttEngine.class);

    private final VoskConfig config;

    // @GuardedBy("lock")
    private Model model;

    public VoskSttEngine(VoskConfig config, ConcurrencyGuard guard) {
        super(guard);
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    protected void doInitialize() {
        if (!Files.isDirectory(Path.of(config.modelPath()))) {
            throw new ModelNotFoundException(config.modelPath());
        }
        LOG.info("Initializing Vosk engine: modelPath={}, sampleRate={}", config.modelPath(), config.sampleRate());
        try {
            this.model = new Model(config.modelPath());
        } catch (IOException | RuntimeException | UnsatisfiedLinkError e) {
            safeCloseUnlocked();
            throw TranscriptionExceptionBuilder.create("Failed to initialize Vosk")
                    .engine(SttEngineNames.VOSK)
                    .cause(e)
                    .metadata("modelPath", config.modelPath())
                    .metadata("sampleRate", config.sampleRate())
                    .build();
        }
    }

    @Override
    protected TranscriptionResult doTranscribe(byte[] pcm16k) {
        Model localModel;
        synchronized (lock) {
            localModel = this.model;
        }
        try (Recognizer recognizer = new Recognizer(localModel, config.sampleRate())) {
            if (config.maxAlternatives() > 1) {
                recognizer.setMaxAlternatives(config.maxAlternatives());
            }
            recognizer.acceptWaveForm(pcm16k, pcm16k.length);
            VoskJsonParser.VoskTranscription parsed = VoskJsonParser.parse(recognizer.getFinalResult());
            LOG.debug("Vosk parsed {} chars, confidence={}", parsed.text().length(), parsed.confidence());
            return TranscriptionResult.of(parsed.text(), parsed.confidence(), getEngineName());
        } catch (IOException e) {
            throw TranscriptionExceptionBuilder.create("Vosk recognizer failed")
                    .engine(SttEngineNames.VOSK)
                    .cause(e)
                    .metadata("bytes", pcm16k.length)
                    .build();
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.VOSK;
    }

    @Override
    protected void doClose() {
        safeCloseUnlocked();
        LOG.info("Vosk engine closed");
    }

    private void safeCloseUnlocked() {
        if (model != null) {
            model.close();
            model = null;
        }
    }
}
