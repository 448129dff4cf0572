package com.phillippitts.callscribe.service.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;

class RearmableTimerTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void reschedulingReplacesPendingTask() {
        RearmableTimer timer = new RearmableTimer(scheduler);
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        timer.schedule(Duration.ofMillis(200), first::incrementAndGet);
        timer.schedule(Duration.ofMillis(50), second::incrementAndGet);

        await().atMost(Duration.ofSeconds(2)).until(() -> second.get() == 1);
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).until(() -> first.get() == 0);
    }

    @Test
    void cancelledTaskNeverRuns() {
        RearmableTimer timer = new RearmableTimer(scheduler);
        AtomicInteger fired = new AtomicInteger();

        timer.schedule(Duration.ofMillis(100), fired::incrementAndGet);
        timer.cancel();

        await().during(Duration.ofMillis(250)).atMost(Duration.ofSeconds(2)).until(() -> fired.get() == 0);
    }
}
