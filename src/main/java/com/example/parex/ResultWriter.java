package com.example.parex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Writes search results as a pretty-printed JSON report.
 */
public final class ResultWriter {
    private final ObjectMapper mapper;

    public ResultWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    public void write(SearchResults results, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), Report.from(results));
    }

    public void write(SearchResults results, OutputStream out) throws IOException {
        out.write(mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(Report.from(results)));
        out.flush();
    }

    record Report(
            long matches,
            List<String> paths,
            long files,
            long dirs,
            Duration duration,
            long entriesPerSec,
            List<ErrorReport> errors
    ) {
        static Report from(SearchResults results) {
            return new Report(
                    results.matches(),
                    results.paths().stream().map(Path::toString).toList(),
                    results.stats().files(),
                    results.stats().dirs(),
                    results.stats().duration(),
                    results.stats().entriesPerSec(),
                    results.errors().stream().map(ErrorReport::from).toList()
            );
        }
    }

    record ErrorReport(String kind, String path, String message, boolean recoverable) {
        static ErrorReport from(ParexException error) {
            return new ErrorReport(
                    error.kind().name(),
                    error.path().map(Path::toString).orElse(null),
                    error.getMessage(),
                    error.isRecoverable()
            );
        }
    }
}
