package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.config.stt.PythonSttConfig;
import com.phillippitts.callscribe.config.stt.SttProperties;
import com.phillippitts.callscribe.config.stt.VoskConfig;
import com.phillippitts.callscribe.config.stt.WhisperConfig;
import com.phillippitts.callscribe.service.stt.SttEngine;
import com.phillippitts.callscribe.service.stt.SttEngineNames;
import com.phillippitts.callscribe.service.stt.process.ProcessRunner;
import com.phillippitts.callscribe.service.stt.python.FasterWhisperSttEngine;
import com.phillippitts.callscribe.service.stt.util.ConcurrencyGuard;
import com.phillippitts.callscribe.service.stt.vosk.VoskSttEngine;
import com.phillippitts.callscribe.service.stt.whisper.WhisperSttEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the single speech-to-text engine selected by {@code stt.engine}.
 *
 * <p>An engine that fails to initialize is still registered: the application keeps watching the
 * channel, every segment fails at the STT stage, and the failure surfaces through health and
 * operational alerts instead of a startup crash. Startup validation catches missing files earlier
 * when it is enabled.
 */
@Configuration
public class SttEngineConfig {

    private static final Logger LOG = LogManager.getLogger(SttEngineConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(SttEngine.class)
    public SttEngine sttEngine(SttProperties stt,
                               WhisperConfig whisper,
                               VoskConfig vosk,
                               PythonSttConfig python) {
        SttProperties.Concurrency limits = stt.getConcurrency();
        SttEngine engine = switch (stt.getEngine()) {
            case WHISPER_CPP -> new WhisperSttEngine(whisper,
                    guard(limits, SttEngineNames.WHISPER), new ProcessRunner());
            case FASTER_WHISPER -> new FasterWhisperSttEngine(python,
                    guard(limits, SttEngineNames.FASTER_WHISPER), new ProcessRunner());
            case VOSK -> new VoskSttEngine(vosk, guard(limits, SttEngineNames.VOSK));
        };
        try {
            engine.initialize();
            LOG.info("STT engine '{}' ready (max concurrent transcriptions={})",
                    engine.getEngineName(), limits.getMax());
        } catch (RuntimeException e) {
            LOG.error("STT engine '{}' failed to initialize; segments will fail until this is fixed: {}",
                    engine.getEngineName(), e.getMessage());
        }
        return engine;
    }

    private static ConcurrencyGuard guard(SttProperties.Concurrency limits, String engineName) {
        return new ConcurrencyGuard(limits.getMax(), limits.getAcquireTimeoutMs(), engineName);
    }
}
