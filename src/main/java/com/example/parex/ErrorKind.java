package com.example.parex;

public enum ErrorKind {
    PERMISSION_DENIED(true),
    NOT_FOUND(true),
    INVALID_SOURCE(false),
    SYMLINK_LOOP(true),
    INVALID_PATTERN(false),
    INVALID_THREAD_COUNT(false),
    THREAD_POOL(false),
    IO(true),
    SOURCE(false),
    MATCHER(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
