package com.phillippitts.callscribe.service.stt;

import com.phillippitts.callscribe.domain.TranscriptionResult;
import com.phillippitts.callscribe.exception.TranscriptionException;
import com.phillippitts.callscribe.service.stt.util.ConcurrencyGuard;

/**
 * Base class for engines: idempotent lifecycle plus a per-engine concurrency guard.
 *
 * <p>Template methods: subclasses implement {@link #doInitialize()}, {@link #doClose()} and
 * {@link #doTranscribe(byte[])}. {@link #transcribe(byte[])} validates input, checks the engine
 * state and holds a permit of the {@link ConcurrencyGuard} for the duration of the call.
 *
 * <p><b>Thread Safety:</b> state transitions are synchronized on {@link #lock}; transcription
 * itself runs outside the lock so several segments can be processed at once.
 */
public abstract class AbstractSttEngine implements SttEngine {

    /** Guards {@link #initialized} and {@link #closed}. */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    private final ConcurrencyGuard concurrencyGuard;

    protected AbstractSttEngine(ConcurrencyGuard concurrencyGuard) {
        this.concurrencyGuard = concurrencyGuard;
    }

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Engine-specific initialization, called within the lock.
     *
     * @throws TranscriptionException or {@link com.phillippitts.callscribe.exception.ModelNotFoundException}
     *         if the engine cannot be prepared
     */
    protected abstract void doInitialize();

    @Override
    public final TranscriptionResult transcribe(byte[] pcm16k) {
        if (pcm16k == null || pcm16k.length == 0) {
            throw new IllegalArgumentException("audio must not be null or empty");
        }
        ensureInitialized();
        concurrencyGuard.acquire();
        try {
            return doTranscribe(pcm16k);
        } catch (TranscriptionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TranscriptionException(
                    getEngineName() + " transcription failed: " + e.getMessage(), getEngineName(), e);
        } finally {
            concurrencyGuard.release();
        }
    }

    protected abstract TranscriptionResult doTranscribe(byte[] pcm16k);

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup; must not throw.
     */
    protected abstract void doClose();

    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new TranscriptionException(
                        getEngineName() + " engine not initialized or closed", getEngineName());
            }
        }
    }
}
