package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.domain.TranscriptionResult;
import com.phillippitts.callscribe.service.audio.AudioFormat;
import com.phillippitts.callscribe.service.stt.SttEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one second of silence through the STT engine after startup.
 *
 * <p>Success means the engine returned without an exception; the text is expected to be empty.
 * A failure is logged and never stops the application.
 */
@Component
@ConditionalOnProperty(name = "stt.selftest.enabled", havingValue = "true", matchIfMissing = true)
class SttSelfTest implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(SttSelfTest.class);

    private final SttEngine engine;

    SttSelfTest(SttEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run(ApplicationArguments args) {
        runSelfTest();
    }

    // Visible for tests
    boolean runSelfTest() {
        byte[] silence = new byte[AudioFormat.REQUIRED_BYTE_RATE];
        try {
            TranscriptionResult result = engine.transcribe(silence);
            LOG.info("STT self-test OK: engine={}, resultLen={}", engine.getEngineName(), result.text().length());
            return true;
        } catch (RuntimeException e) {
            LOG.error("STT self-test FAILED: engine={}, error={}", engine.getEngineName(), e.getMessage());
            return false;
        }
    }
}
