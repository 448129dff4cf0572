package com.phillippitts.callscribe.service.stt.util;

import com.phillippitts.callscribe.exception.TranscriptionException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent transcriptions of one engine with a semaphore.
 *
 * <p>Waiting is bounded: a capture task that cannot get a permit in time fails with a
 * {@link TranscriptionException} and is counted like any other STT failure.
 *
 * <pre>{@code
 * guard.acquire();
 * try {
 *     // ... run the engine ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String engineName;

    public ConcurrencyGuard(int permits, long timeoutMs, String engineName) {
        this.semaphore = new Semaphore(Math.max(1, permits));
        this.timeoutMs = Math.max(0, timeoutMs);
        this.engineName = engineName;
    }

    /**
     * @throws TranscriptionException if no permit is available within the timeout or the
     *         thread is interrupted while waiting
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TranscriptionException(
                        engineName + " concurrency limit reached after " + timeoutMs + "ms wait", engineName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException(
                    engineName + " transcription interrupted while waiting for semaphore", engineName, e);
        }
    }

    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
