package com.example.parex;

import java.util.Optional;

/**
 * Traversal parameters shared between the engine and the source. Immutable for a run.
 *
 * @param threads  worker count; advisory for the source
 * @param maxDepth inclusive depth bound, root = 0
 * @param limit    maximum number of matches to report
 */
public record WalkConfig(
        int threads,
        Optional<Integer> maxDepth,
        Optional<Long> limit
) {
    public WalkConfig {
        maxDepth = maxDepth == null ? Optional.empty() : maxDepth;
        limit = limit == null ? Optional.empty() : limit;
    }

    /**
     * Returns true if an entry at the given depth is within the configured bound.
     */
    public boolean withinDepth(int depth) {
        return maxDepth.map(max -> depth <= max).orElse(true);
    }
}
