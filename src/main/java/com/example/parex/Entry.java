package com.example.parex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A single item produced by a {@link Source}.
 *
 * <p>The path is treated as an opaque locator, so non-filesystem sources can use any
 * {@link Path} that identifies their records. Metadata is never loaded by the engine; a
 * matcher that needs it calls {@link #metadata(MetadataLoader)}, which caches the value on
 * this instance. An entry is handed to exactly one matcher evaluation and is not meant to
 * be shared between threads.
 */
public final class Entry {
    private final Path path;
    private final String name;
    private final EntryKind kind;
    private final int depth;
    private EntryMetadata metadata;

    public Entry(Path path, String name, EntryKind kind, int depth) {
        this.path = Objects.requireNonNull(path, "path");
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative: " + depth);
        }
        this.depth = depth;
    }

    /**
     * Builds an entry for a filesystem path, classifying it without following links.
     */
    public static Entry fromPath(Path path, int depth) {
        EntryKind kind;
        if (Files.isSymbolicLink(path)) {
            kind = EntryKind.SYMLINK;
        } else if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            kind = EntryKind.DIRECTORY;
        } else if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
            kind = EntryKind.FILE;
        } else {
            kind = EntryKind.OTHER;
        }
        Path fileName = path.getFileName();
        return new Entry(path, fileName == null ? path.toString() : fileName.toString(), kind, depth);
    }

    public Path path() {
        return path;
    }

    public String name() {
        return name;
    }

    public EntryKind kind() {
        return kind;
    }

    public int depth() {
        return depth;
    }

    /**
     * Returns the cached metadata, if some matcher already loaded it.
     */
    public Optional<EntryMetadata> metadata() {
        return Optional.ofNullable(metadata);
    }

    /**
     * Returns the cached metadata, loading it on first access.
     */
    public EntryMetadata metadata(MetadataLoader loader) throws IOException {
        if (metadata == null) {
            metadata = loader.load(path);
        }
        return metadata;
    }

    @Override
    public String toString() {
        return "Entry{" + kind + " " + path + " depth=" + depth + "}";
    }

    /**
     * Loads metadata for a path.
     */
    @FunctionalInterface
    public interface MetadataLoader {
        EntryMetadata load(Path path) throws IOException;

        MetadataLoader FILESYSTEM = EntryMetadata::read;
    }
}
