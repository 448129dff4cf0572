package com.phillippitts.callscribe.util;

import java.time.Duration;

/**
 * Timeouts used when supervising external speech-to-text processes.
 */
public final class ProcessTimeouts {

    /** Time given to stream gobblers to flush after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
