package com.example.parex;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters and collections shared by every worker during one run.
 *
 * <p>Counters are plain atomics. Path and error lists are only allocated when collection is
 * enabled and are guarded per append, never across a matcher call.
 */
final class AggregationState {
    private final AtomicLong matches = new AtomicLong();
    private final AtomicLong files = new AtomicLong();
    private final AtomicLong dirs = new AtomicLong();
    private final List<Path> paths;
    private final List<ParexException> errors;
    private final AtomicReference<ParexException> fatal = new AtomicReference<>();

    AggregationState(boolean collectPaths, boolean collectErrors) {
        this.paths = collectPaths ? new ArrayList<>() : null;
        this.errors = collectErrors ? new ArrayList<>() : null;
    }

    void countKind(EntryKind kind) {
        // Symlinks and other kinds are visible to the matcher but not tallied.
        if (kind == EntryKind.FILE) {
            files.incrementAndGet();
        } else if (kind == EntryKind.DIRECTORY) {
            dirs.incrementAndGet();
        }
    }

    long incrementMatches() {
        return matches.incrementAndGet();
    }

    void recordPath(Path path) {
        if (paths == null) {
            return;
        }
        synchronized (paths) {
            paths.add(path);
        }
    }

    void recordError(ParexException error) {
        if (errors == null) {
            return;
        }
        synchronized (errors) {
            errors.add(error);
        }
    }

    /**
     * Keeps the first fatal error reported; later ones are dropped.
     */
    void recordFatal(ParexException error) {
        fatal.compareAndSet(null, error);
    }

    boolean hasFatal() {
        return fatal.get() != null;
    }

    void throwIfFatal() throws ParexException {
        ParexException error = fatal.get();
        if (error != null) {
            throw error;
        }
    }

    long matches() {
        return matches.get();
    }

    long files() {
        return files.get();
    }

    long dirs() {
        return dirs.get();
    }

    List<Path> paths() {
        if (paths == null) {
            return Collections.emptyList();
        }
        synchronized (paths) {
            return new ArrayList<>(paths);
        }
    }

    List<ParexException> errors() {
        if (errors == null) {
            return Collections.emptyList();
        }
        synchronized (errors) {
            return new ArrayList<>(errors);
        }
    }
}
