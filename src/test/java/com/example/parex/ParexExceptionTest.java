package com.example.parex;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParexExceptionTest {
    @Test
    void classifiesRecoverableKinds() {
        Path path = Path.of("x");
        assertTrue(ParexException.permissionDenied(path).isRecoverable());
        assertTrue(ParexException.notFound(path).isRecoverable());
        assertTrue(ParexException.symlinkLoop(path).isRecoverable());
        assertTrue(ParexException.io(path, new IOException("boom")).isRecoverable());

        assertTrue(ParexException.invalidSource(path).isFatal());
        assertTrue(ParexException.invalidPattern("[").isFatal());
        assertTrue(ParexException.invalidThreadCount(0).isFatal());
        assertTrue(ParexException.threadPool("gone", null).isFatal());
        assertTrue(ParexException.source(new RuntimeException("x")).isFatal());
        assertTrue(ParexException.matcher(new RuntimeException("x")).isFatal());
    }

    @Test
    void exposesPathOnlyWhenKnown() {
        assertEquals(Path.of("a", "b"), ParexException.notFound(Path.of("a", "b")).path().orElseThrow());
        assertFalse(ParexException.invalidThreadCount(0).path().isPresent());
        assertEquals("permission denied: secret", ParexException.permissionDenied(Path.of("secret")).getMessage());
    }

    @Test
    void mapsFilesystemFailures() {
        Path path = Path.of("dir");
        assertEquals(ErrorKind.PERMISSION_DENIED,
                ParexException.fromIOException(path, new AccessDeniedException("dir")).kind());
        assertEquals(ErrorKind.NOT_FOUND,
                ParexException.fromIOException(path, new NoSuchFileException("dir")).kind());
        assertEquals(ErrorKind.SYMLINK_LOOP,
                ParexException.fromIOException(path, new FileSystemLoopException("dir")).kind());

        IOException other = new IOException("device error");
        ParexException mapped = ParexException.fromIOException(path, other);
        assertEquals(ErrorKind.IO, mapped.kind());
        assertSame(other, mapped.getCause());
    }
}
