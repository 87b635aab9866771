package com.example.parex;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public record SearchConfig(
        Path root,
        Optional<String> pattern,
        Optional<String> extension,
        Optional<String> mediaType,
        Optional<Duration> olderThan,
        Optional<Long> limit,
        int threadCount,
        Optional<Integer> maxDepth,
        boolean followLinks,
        boolean collectPaths,
        boolean collectErrors,
        Optional<Path> outputFile
) {
}
