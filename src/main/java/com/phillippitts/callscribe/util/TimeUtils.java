package com.phillippitts.callscribe.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Small time helpers shared by the capture pipeline and the session loop.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds from {@code now} until {@code deadline}, never negative.
     */
    public static long millisUntil(Instant now, Instant deadline) {
        return Math.max(0L, Duration.between(now, deadline).toMillis());
    }

    /**
     * File-name friendly ISO timestamp: colons are not allowed on every file system.
     */
    public static String fileStamp(Instant instant) {
        return instant.toString().replace(':', '-');
    }
}
