package com.example.parex;

import com.example.parex.source.DirectorySource;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar parex.jar <config.json>");
            System.exit(1);
        }
        SearchConfig config = new ConfigLoader().load(Path.of(args[0]));
        SearchResults results;
        try {
            results = builderFor(config, Clock.systemUTC()).run();
        } catch (ParexException ex) {
            LOGGER.error("Search failed: {}", ex.getMessage(), ex);
            System.exit(2);
            return;
        }

        ResultWriter writer = new ResultWriter();
        if (config.outputFile().isPresent()) {
            writer.write(results, config.outputFile().get());
            LOGGER.info("Wrote {} matches to {}", results.matches(), config.outputFile().get());
        } else {
            writer.write(results, System.out);
        }
    }

    static SearchBuilder builderFor(SearchConfig config, Clock clock) {
        List<Matcher> matchers = new ArrayList<>();
        config.extension().map(Matchers::extension).ifPresent(matchers::add);
        config.mediaType().map(prefix -> Matchers.mediaType(new Tika(), prefix)).ifPresent(matchers::add);
        config.olderThan().map(age -> Matchers.olderThan(age, clock)).ifPresent(matchers::add);

        SearchBuilder builder = Parex.search()
                .source(new DirectorySource(config.root(), config.followLinks()))
                .threads(config.threadCount())
                .collectPaths(config.collectPaths())
                .collectErrors(config.collectErrors());
        if (config.pattern().isPresent()) {
            matchers.add(0, Matchers.substring(config.pattern().get()));
        }
        if (!matchers.isEmpty()) {
            builder.withMatcher(Matchers.allOf(matchers));
        }
        config.limit().ifPresent(builder::limit);
        config.maxDepth().ifPresent(builder::maxDepth);
        return builder;
    }
}
