package com.example.parex;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Built-in matchers. Anything more specific belongs to the caller's own {@link Matcher}.
 */
public final class Matchers {
    private static final Logger LOGGER = LoggerFactory.getLogger(Matchers.class);
    private static final Matcher ALL = entry -> true;

    private Matchers() {
    }

    public static Matcher all() {
        return ALL;
    }

    /**
     * Matches entries whose name contains {@code pattern}, ignoring case.
     */
    public static Matcher substring(String pattern) {
        String needle = Objects.requireNonNull(pattern, "pattern").toLowerCase(Locale.ROOT);
        return entry -> entry.name().toLowerCase(Locale.ROOT).contains(needle);
    }

    /**
     * Matches entries whose name ends with {@code .extension}, ignoring case.
     */
    public static Matcher extension(String extension) {
        String value = Objects.requireNonNull(extension, "extension").toLowerCase(Locale.ROOT);
        String suffix = value.startsWith(".") ? value : "." + value;
        return entry -> entry.name().toLowerCase(Locale.ROOT).endsWith(suffix);
    }

    /**
     * Matches files last modified more than {@code age} before now. Loads metadata lazily and
     * caches it on the entry.
     */
    public static Matcher olderThan(Duration age, Clock clock) {
        return olderThan(age, clock, Entry.MetadataLoader.FILESYSTEM);
    }

    static Matcher olderThan(Duration age, Clock clock, Entry.MetadataLoader loader) {
        Objects.requireNonNull(age, "age");
        Objects.requireNonNull(clock, "clock");
        return entry -> {
            if (entry.kind() != EntryKind.FILE) {
                return false;
            }
            try {
                Instant cutoff = clock.instant().minus(age);
                return entry.metadata(loader).lastModifiedTime().isBefore(cutoff);
            } catch (IOException ex) {
                LOGGER.debug("Failed to read metadata for {}", entry.path(), ex);
                return false;
            }
        };
    }

    /**
     * Matches files whose detected media type starts with {@code prefix}, e.g. {@code image/}.
     */
    public static Matcher mediaType(Tika tika, String prefix) {
        Objects.requireNonNull(tika, "tika");
        String expected = Objects.requireNonNull(prefix, "prefix").toLowerCase(Locale.ROOT);
        return entry -> {
            if (entry.kind() != EntryKind.FILE) {
                return false;
            }
            try {
                return tika.detect(entry.path()).toLowerCase(Locale.ROOT).startsWith(expected);
            } catch (IOException ex) {
                LOGGER.debug("Failed to detect media type for {}", entry.path(), ex);
                return false;
            }
        };
    }

    /**
     * Matches entries accepted by every given matcher. Evaluation stops at the first rejection.
     */
    public static Matcher allOf(List<Matcher> matchers) {
        List<Matcher> copy = List.copyOf(matchers);
        if (copy.isEmpty()) {
            return ALL;
        }
        if (copy.size() == 1) {
            return copy.get(0);
        }
        return entry -> {
            for (Matcher matcher : copy) {
                if (!matcher.isMatch(entry)) {
                    return false;
                }
            }
            return true;
        };
    }
}
