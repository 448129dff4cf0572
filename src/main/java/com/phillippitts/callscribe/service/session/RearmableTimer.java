package com.phillippitts.callscribe.service.session;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A single pending delayed task: scheduling again replaces the previous one.
 * Confined to the session loop thread.
 */
final class RearmableTimer {

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;

    RearmableTimer(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    void schedule(Duration delay, Runnable task) {
        cancel();
        pending = scheduler.schedule(task, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }
}
