package com.phillippitts.livefacts.util;

import java.time.Duration;

/**
 * Duration helpers for the pacing arithmetic of delivery loops.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns {@code target - spent}, but never less than {@code floor}.
     *
     * <p>Typical usage:
     * <pre>
     * Duration wait = TimeUtils.remainingOrFloor(interval, elapsed, floorSleep);
     * </pre>
     */
    public static Duration remainingOrFloor(Duration target, Duration spent, Duration floor) {
        Duration remaining = target.minus(spent);
        return remaining.compareTo(floor) < 0 ? floor : remaining;
    }

    /**
     * Returns the smaller of two durations.
     */
    public static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Calculates the elapsed duration since a nanosecond timestamp from {@link System#nanoTime()}.
     */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Sleeps for {@code d}; returns immediately for zero or negative durations.
     *
     * @throws InterruptedException if the thread is interrupted, which is how session tasks
     *                              are cancelled
     */
    public static void sleep(Duration d) throws InterruptedException {
        if (d.isZero() || d.isNegative()) {
            return;
        }
        Thread.sleep(d.toMillis(), (int) (d.toNanosPart() % 1_000_000));
    }
}
