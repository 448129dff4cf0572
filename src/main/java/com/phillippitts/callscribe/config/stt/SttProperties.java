package com.phillippitts.callscribe.config.stt;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine selection and shared limits for speech-to-text ("stt").
 */
@Validated
@ConfigurationProperties(prefix = "stt")
public class SttProperties {

    public enum EngineKind { WHISPER_CPP, FASTER_WHISPER, VOSK }

    @NotNull
    private EngineKind engine = EngineKind.WHISPER_CPP;

    @Valid
    private Concurrency concurrency = new Concurrency();

    private SelfTest selftest = new SelfTest();

    public EngineKind getEngine() {
        return engine;
    }

    public void setEngine(EngineKind engine) {
        this.engine = engine;
    }

    public Concurrency getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(Concurrency concurrency) {
        this.concurrency = concurrency;
    }

    public SelfTest getSelftest() {
        return selftest;
    }

    public void setSelftest(SelfTest selftest) {
        this.selftest = selftest;
    }

    /**
     * Bounds simultaneous transcriptions so that many speakers do not saturate the CPU.
     */
    public static class Concurrency {
        @Min(1)
        private int max = 2;
        @Min(0)
        private long acquireTimeoutMs = 60_000;

        public int getMax() {
            return max;
        }

        public void setMax(int max) {
            this.max = max;
        }

        public long getAcquireTimeoutMs() {
            return acquireTimeoutMs;
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = acquireTimeoutMs;
        }
    }

    public static class SelfTest {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
