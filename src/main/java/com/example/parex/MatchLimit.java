package com.example.parex;

import java.nio.file.Path;

/**
 * Decides when a run has found enough matches.
 *
 * <p>Workers never block on each other: each one increments the shared counter and acts on
 * its own post-increment value. A worker that sees the limit already exceeded quits without
 * recording its path; the worker that reaches the limit records and quits. Peers may count
 * a few more matches before they observe the stop, so the reported count is clamped when
 * the run is finalized.
 */
interface MatchLimit {
    boolean reached(long count);

    boolean exceeded(long count);

    long clamp(long value);

    /**
     * Counts one match for {@code path} and returns the verdict for the calling worker.
     */
    default WalkState onMatch(AggregationState state, Path path) {
        long count = state.incrementMatches();
        if (exceeded(count)) {
            return WalkState.QUIT;
        }
        state.recordPath(path);
        return reached(count) ? WalkState.QUIT : WalkState.CONTINUE;
    }

    /**
     * Limit used when none is configured (never stops early).
     */
    MatchLimit NO_LIMIT = new MatchLimit() {
        @Override
        public boolean reached(long count) {
            return false;
        }

        @Override
        public boolean exceeded(long count) {
            return false;
        }

        @Override
        public long clamp(long value) {
            return value;
        }
    };

    static MatchLimit atMost(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + limit);
        }
        return new MatchLimit() {
            @Override
            public boolean reached(long count) {
                return count >= limit;
            }

            @Override
            public boolean exceeded(long count) {
                return count > limit;
            }

            @Override
            public long clamp(long value) {
                return Math.min(value, limit);
            }
        };
    }
}
