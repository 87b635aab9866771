package com.example.parex;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SearchConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.root == null || raw.root.isBlank()) {
            throw new IllegalArgumentException("Config must include a root path.");
        }
        if (raw.limit != null && raw.limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative.");
        }
        if (raw.maxDepth != null && raw.maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative.");
        }

        // Thread count is validated by the search itself so a bad value surfaces as a search error.
        int threadCount = raw.threadCount != null
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());

        return new SearchConfig(
                Path.of(raw.root),
                nonBlank(raw.pattern),
                nonBlank(raw.extension),
                nonBlank(raw.mediaType),
                nonBlank(raw.olderThan).map(ConfigLoader::parseDuration),
                Optional.ofNullable(raw.limit),
                threadCount,
                Optional.ofNullable(raw.maxDepth),
                raw.followLinks != null && raw.followLinks,
                raw.collectPaths != null && raw.collectPaths,
                raw.collectErrors != null && raw.collectErrors,
                nonBlank(raw.outputFile).map(Path::of)
        );
    }

    private static Optional<String> nonBlank(String value) {
        return Optional.ofNullable(value).filter(candidate -> !candidate.isBlank());
    }

    private static Duration parseDuration(String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("olderThan must be an ISO-8601 duration such as P30D: " + value, ex);
        }
    }

    private static class RawConfig {
        public String root;
        public String pattern;
        public String extension;
        public String mediaType;
        public String olderThan;
        public Long limit;
        public Integer threadCount;
        public Integer maxDepth;
        public Boolean followLinks;
        public Boolean collectPaths;
        public Boolean collectErrors;
        public String outputFile;
    }
}
