package com.phillippitts.strategist.util;

/**
 * Time arithmetic shared by agent latency logging and the polling hints of the HTTP layer.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final long MILLIS_PER_SECOND = 1_000L;

    private TimeUtils() {
    }

    /**
     * Milliseconds since {@code startNanos}, a {@link System#nanoTime()} reading.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Whole seconds for a {@code Retry-After} header: rounded up, never below one.
     */
    public static long retryAfterSeconds(long pollAfterMillis) {
        long seconds = (pollAfterMillis + MILLIS_PER_SECOND - 1) / MILLIS_PER_SECOND;
        return Math.max(1, seconds);
    }
}
