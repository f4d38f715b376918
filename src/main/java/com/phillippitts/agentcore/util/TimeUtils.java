package com.phillippitts.agentcore.util;

import java.time.Duration;

/**
 * Conversions around {@link System#nanoTime()} based timing and deadlines.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /** Elapsed milliseconds since a {@code System.nanoTime()} reading. */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns a {@code System.nanoTime()} deadline {@code budget} from now, or
     * {@link Long#MAX_VALUE} when the budget is null, zero or negative (no deadline).
     */
    public static long deadlineAfter(Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return Long.MAX_VALUE;
        }
        return System.nanoTime() + budget.toNanos();
    }

    /** Milliseconds left until a deadline from {@link #deadlineAfter}; never negative. */
    public static long remainingMillis(long deadlineNanos) {
        if (deadlineNanos == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, (deadlineNanos - System.nanoTime()) / NANOS_PER_MILLI);
    }

    public static boolean isExpired(long deadlineNanos) {
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }
}
