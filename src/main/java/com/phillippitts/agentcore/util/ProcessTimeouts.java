package com.phillippitts.agentcore.util;

import java.time.Duration;

/**
 * Timeouts for subprocess and helper-thread cleanup used by the process-backed providers.
 */
public final class ProcessTimeouts {

    /** Time for stream gobblers to flush after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Graceful {@link Process#destroy()} window before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Window after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
    }
}
