package com.example.parex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Runs one search: feeds every item a source produces through the matcher, updates the shared
 * state and tells the source when to stop.
 *
 * <p>Sources implementing {@link ParallelSource} are driven through their own worker pool when
 * more than one thread is configured; every other source is consumed on the calling thread.
 */
final class MatchEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(MatchEngine.class);

    private final WalkConfig config;
    private final Matcher matcher;
    private final MatchLimit limit;
    private final boolean collectErrors;
    private final AggregationState state;

    MatchEngine(WalkConfig config, Matcher matcher, boolean collectPaths, boolean collectErrors) {
        this.config = config;
        this.matcher = matcher;
        this.limit = config.limit().map(MatchLimit::atMost).orElse(MatchLimit.NO_LIMIT);
        this.collectErrors = collectErrors;
        this.state = new AggregationState(collectPaths, collectErrors);
    }

    /**
     * Executes the run and returns the finalized results. Blocks until the source has quiesced.
     *
     * @throws ParexException the first fatal error met during traversal
     */
    SearchResults run(Source source) throws ParexException {
        long start = System.nanoTime();
        if (source instanceof ParallelSource && config.threads() > 1) {
            LOGGER.debug("Starting parallel search with {} threads.", config.threads());
            try {
                ((ParallelSource) source).walkParallel(config, this::handle);
            } catch (RuntimeException ex) {
                state.recordFatal(ParexException.source(ex));
            }
        } else {
            LOGGER.debug("Starting sequential search.");
            consume(source);
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - start);

        if (state.hasFatal()) {
            LOGGER.warn("Search aborted after {} matches.", state.matches());
            state.throwIfFatal();
        }
        SearchResults results = ResultFinalizer.finish(state, limit, duration);
        LOGGER.info("Search completed: {} matches, {} files, {} dirs in {} ms.",
                results.matches(), results.stats().files(), results.stats().dirs(), duration.toMillis());
        return results;
    }

    private void consume(Source source) throws ParexException {
        try (Stream<EntryResult> items = source.walk(config)) {
            Iterator<EntryResult> iterator = items.iterator();
            // Only this thread observes the counter, so checking before each pull is exact.
            while (!limit.reached(state.matches()) && iterator.hasNext()) {
                if (handle(iterator.next()) == WalkState.QUIT) {
                    break;
                }
            }
        } catch (RuntimeException ex) {
            state.recordFatal(ParexException.source(ex));
        }
    }

    /**
     * Applies one item to the run state and returns the verdict for the producing worker.
     */
    WalkState handle(EntryResult item) {
        if (state.hasFatal()) {
            return WalkState.QUIT;
        }
        if (!item.isSuccess()) {
            ParexException error = item.getError();
            if (error.isFatal()) {
                state.recordFatal(error);
                return WalkState.QUIT;
            }
            LOGGER.debug("Skipping {}: {}", error.path().map(Object::toString).orElse("<unknown>"), error.getMessage());
            if (collectErrors) {
                state.recordError(error);
            }
            return WalkState.CONTINUE;
        }

        Entry entry = item.getEntry();
        state.countKind(entry.kind());
        boolean matched;
        try {
            matched = matcher.isMatch(entry);
        } catch (RuntimeException ex) {
            state.recordFatal(ParexException.matcher(ex));
            return WalkState.QUIT;
        }
        if (!matched) {
            return WalkState.CONTINUE;
        }
        return limit.onMatch(state, entry.path());
    }
}
