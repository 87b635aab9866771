package com.example.parex;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Turns the shared run state into an exact {@link SearchResults} once all workers are done.
 */
final class ResultFinalizer {
    private ResultFinalizer() {
    }

    static SearchResults finish(AggregationState state, MatchLimit limit, Duration duration) {
        long matches = limit.clamp(state.matches());
        List<Path> paths = state.paths();
        // Workers racing past the limit may each have recorded a path before observing the stop.
        int keep = (int) limit.clamp(paths.size());
        if (keep < paths.size()) {
            paths = paths.subList(0, keep);
        }
        ScanStats stats = ScanStats.compute(state.files(), state.dirs(), duration);
        return new SearchResults(matches, paths, stats, state.errors());
    }
}
