package com.example.parex;

import java.time.Duration;

/**
 * Traversal statistics for a completed run.
 *
 * @param files         files seen, matched or not
 * @param dirs          directories seen
 * @param duration      wall-clock time of the run
 * @param entriesPerSec {@code floor((files + dirs) / seconds)}, 0 for non-positive durations
 */
public record ScanStats(
        long files,
        long dirs,
        Duration duration,
        long entriesPerSec
) {
    public static ScanStats compute(long files, long dirs, Duration duration) {
        double seconds = duration.toNanos() / 1_000_000_000.0;
        long rate = seconds > 0.0 ? (long) Math.floor((files + dirs) / seconds) : 0L;
        return new ScanStats(files, dirs, duration, rate);
    }
}
