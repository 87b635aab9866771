package com.example.parex;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable outcome of a completed search.
 *
 * <p>{@code paths} and {@code errors} are empty unless collection was enabled on the builder.
 * Path order follows discovery on each worker and is not stable across parallel runs.
 */
public record SearchResults(
        long matches,
        List<Path> paths,
        ScanStats stats,
        List<ParexException> errors
) {
    public SearchResults {
        paths = List.copyOf(paths);
        errors = List.copyOf(errors);
    }
}
