package com.example.parex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * Attributes a matcher may load for an entry on demand.
 */
public record EntryMetadata(
        long size,
        Instant createdTime,
        Instant lastModifiedTime,
        Instant lastAccessTime
) {
    public static EntryMetadata read(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return new EntryMetadata(
                attrs.size(),
                attrs.creationTime().toInstant(),
                attrs.lastModifiedTime().toInstant(),
                attrs.lastAccessTime().toInstant()
        );
    }
}
