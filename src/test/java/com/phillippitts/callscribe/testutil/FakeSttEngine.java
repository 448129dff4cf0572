package com.phillippitts.callscribe.testutil;

import com.phillippitts.callscribe.domain.TranscriptionResult;
import com.phillippitts.callscribe.exception.TranscriptionException;
import com.phillippitts.callscribe.service.stt.SttEngine;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for SttEngine with canned output.
 *
 * <p>{@code cannedText} and {@code failing} are public so that multi-step tests can flip them
 * between segments.
 */
public class FakeSttEngine implements SttEngine {
    private final String engineName;
    public volatile String cannedText;
    public volatile boolean failing;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile int lastInputBytes;

    public FakeSttEngine(String name, String text) {
        this.engineName = name;
        this.cannedText = text;
    }

    public static FakeSttEngine failing(String name) {
        FakeSttEngine engine = new FakeSttEngine(name, "");
        engine.failing = true;
        return engine;
    }

    @Override
    public void initialize() {
        // No-op for fake
    }

    @Override
    public TranscriptionResult transcribe(byte[] pcm16k) {
        calls.incrementAndGet();
        lastInputBytes = pcm16k.length;
        if (failing) {
            throw new TranscriptionException("Engine configured to fail", engineName);
        }
        return new TranscriptionResult(cannedText, 1.0, Instant.now(), engineName);
    }

    public int calls() {
        return calls.get();
    }

    public int lastInputBytes() {
        return lastInputBytes;
    }

    @Override
    public String getEngineName() {
        return engineName;
    }

    @Override
    public boolean isHealthy() {
        return !failing;
    }

    @Override
    public void close() {
        // No-op for fake
    }
}
