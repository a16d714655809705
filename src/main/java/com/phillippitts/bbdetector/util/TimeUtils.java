package com.phillippitts.bbdetector.util;

import java.time.Duration;

/**
 * Utility methods for time conversions used by the engine's tick cadence.
 *
 * @since 0.1
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Tick interval for a frame rate, e.g. 10 fps → 100 ms.
     *
     * @throws IllegalArgumentException if fps is not positive
     */
    public static Duration tickInterval(int fps) {
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be > 0, got " + fps);
        }
        return Duration.ofNanos(1_000_000_000L / fps);
    }

    /** Formats milliseconds as H:MM:SS, the way session timers are displayed. */
    public static String formatClock(long millis) {
        long totalSeconds = Math.max(0, millis) / 1000;
        return String.format("%d:%02d:%02d", totalSeconds / 3600, (totalSeconds % 3600) / 60, totalSeconds % 60);
    }
}
