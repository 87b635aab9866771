package com.example.parex;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Error raised or reported during a search.
 *
 * <p>Recoverable errors (permission denied, not found, symlink loops and I/O failures) are
 * local to one entry: the walk keeps going and the error is kept only when the caller asked
 * for error collection. Every other kind is fatal and aborts the run.
 */
public class ParexException extends Exception {
    private final ErrorKind kind;
    private final Path path;

    public ParexException(ErrorKind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = path;
    }

    public static ParexException permissionDenied(Path path) {
        return new ParexException(ErrorKind.PERMISSION_DENIED, path, "permission denied: " + path, null);
    }

    public static ParexException notFound(Path path) {
        return new ParexException(ErrorKind.NOT_FOUND, path, "path not found: " + path, null);
    }

    public static ParexException invalidSource(Path path) {
        return new ParexException(ErrorKind.INVALID_SOURCE, path, "invalid source: " + path, null);
    }

    public static ParexException invalidSource(String detail) {
        return new ParexException(ErrorKind.INVALID_SOURCE, null, "invalid source: " + detail, null);
    }

    public static ParexException symlinkLoop(Path path) {
        return new ParexException(ErrorKind.SYMLINK_LOOP, path, "symlink loop: " + path, null);
    }

    public static ParexException invalidPattern(String detail) {
        return new ParexException(ErrorKind.INVALID_PATTERN, null, "invalid pattern: " + detail, null);
    }

    public static ParexException invalidThreadCount(int threads) {
        return new ParexException(ErrorKind.INVALID_THREAD_COUNT, null, "invalid thread count: " + threads, null);
    }

    public static ParexException threadPool(String detail, Throwable cause) {
        return new ParexException(ErrorKind.THREAD_POOL, null, "thread pool failure: " + detail, cause);
    }

    public static ParexException io(Path path, IOException cause) {
        return new ParexException(ErrorKind.IO, path, "IO error at " + path, cause);
    }

    public static ParexException source(Throwable cause) {
        return new ParexException(ErrorKind.SOURCE, null, "source error: " + cause.getMessage(), cause);
    }

    public static ParexException matcher(Throwable cause) {
        return new ParexException(ErrorKind.MATCHER, null, "matcher error: " + cause.getMessage(), cause);
    }

    /**
     * Maps a filesystem failure onto the matching recoverable kind.
     */
    public static ParexException fromIOException(Path path, IOException ex) {
        if (ex instanceof AccessDeniedException) {
            return permissionDenied(path);
        }
        if (ex instanceof NoSuchFileException) {
            return notFound(path);
        }
        if (ex instanceof FileSystemLoopException) {
            return symlinkLoop(path);
        }
        return io(path, ex);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * The path the error occurred at, for "skipped: path" style reporting.
     */
    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    public boolean isRecoverable() {
        return kind.isRecoverable();
    }

    public boolean isFatal() {
        return !kind.isRecoverable();
    }
}
