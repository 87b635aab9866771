package com.example.parex;

import java.util.Optional;

/**
 * Configures and runs a search. Obtained from {@link Parex#search()}.
 *
 * <pre>{@code
 * SearchResults results = Parex.search()
 *         .source(new DirectorySource(root))
 *         .matching("invoice")
 *         .limit(10)
 *         .collectPaths(true)
 *         .run();
 * }</pre>
 */
public final class SearchBuilder {
    private Source source;
    private Matcher matcher;
    private String pattern;
    private Long limit;
    private int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
    private Integer maxDepth;
    private boolean collectPaths;
    private boolean collectErrors;

    SearchBuilder() {
    }

    public SearchBuilder source(Source value) {
        this.source = value;
        return this;
    }

    /**
     * Sets a custom matcher, replacing any pattern set with {@link #matching(String)}.
     */
    public SearchBuilder withMatcher(Matcher value) {
        this.matcher = value;
        this.pattern = null;
        return this;
    }

    /**
     * Case-insensitive substring match on entry names.
     */
    public SearchBuilder matching(String value) {
        this.pattern = value;
        this.matcher = null;
        return this;
    }

    /**
     * Stops after {@code n} matches. The reported count never exceeds it.
     */
    public SearchBuilder limit(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + n);
        }
        this.limit = n;
        return this;
    }

    /**
     * Worker count for parallel sources. Defaults to the number of available processors.
     */
    public SearchBuilder threads(int n) {
        this.threads = n;
        return this;
    }

    /**
     * Inclusive depth bound; children of the root are at depth 1.
     */
    public SearchBuilder maxDepth(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative: " + depth);
        }
        this.maxDepth = depth;
        return this;
    }

    public SearchBuilder collectPaths(boolean yes) {
        this.collectPaths = yes;
        return this;
    }

    public SearchBuilder collectErrors(boolean yes) {
        this.collectErrors = yes;
        return this;
    }

    /**
     * Runs the search and blocks until it completes.
     *
     * @throws ParexException for invalid configuration, before anything is traversed, or for
     *                        the first fatal error met during traversal
     */
    public SearchResults run() throws ParexException {
        if (source == null) {
            throw ParexException.invalidSource("no source provided");
        }
        if (threads < 1) {
            throw ParexException.invalidThreadCount(threads);
        }
        Matcher resolved = matcher;
        if (pattern != null) {
            if (pattern.isBlank()) {
                throw ParexException.invalidPattern("pattern must not be blank");
            }
            resolved = Matchers.substring(pattern);
        }
        if (resolved == null) {
            resolved = Matchers.all();
        }

        WalkConfig config = new WalkConfig(threads, Optional.ofNullable(maxDepth), Optional.ofNullable(limit));
        return new MatchEngine(config, resolved, collectPaths, collectErrors).run(source);
    }
}
