package com.example.parex;

import com.example.parex.source.ListSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchEngineTest {
    private static Entry file(String name, int depth) {
        return new Entry(Path.of("root", name), name, EntryKind.FILE, depth);
    }

    private static Entry dir(String name, int depth) {
        return new Entry(Path.of("root", name), name, EntryKind.DIRECTORY, depth);
    }

    private static ListSource invoices() {
        return ListSource.of(
                file("invoice_jan.txt", 1),
                file("invoice_feb.txt", 1),
                file("report.txt", 1),
                file("notes.md", 1),
                dir("subdir", 1),
                file("subdir/invoice_mar.txt", 2),
                file("subdir/other.rs", 2)
        );
    }

    private static ListSource numbered(int count) {
        List<EntryResult> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(EntryResult.success(file("entry-" + i, 1)));
        }
        return new ListSource(items);
    }

    @Test
    void countsSubstringMatchesWithoutLimit() throws Exception {
        SearchResults results = Parex.search()
                .source(invoices())
                .matching("INVOICE")
                .threads(1)
                .collectPaths(true)
                .run();

        assertEquals(3L, results.matches());
        assertEquals(3, results.paths().size());
        assertEquals(6L, results.stats().files());
        assertEquals(1L, results.stats().dirs());
        assertTrue(results.paths().stream().allMatch(path -> path.toString().contains("invoice")));
    }

    @Test
    void sequentialLimitStopsExactly() throws Exception {
        SearchResults results = Parex.search()
                .source(invoices())
                .matching("invoice")
                .threads(1)
                .limit(2)
                .collectPaths(true)
                .run();

        assertEquals(2L, results.matches());
        assertEquals(2, results.paths().size());
    }

    @Test
    void parallelLimitIsClampedToExactCount() throws Exception {
        for (int run = 0; run < 20; run++) {
            SearchResults results = Parex.search()
                    .source(numbered(2000))
                    .threads(8)
                    .limit(10)
                    .collectPaths(true)
                    .run();

            assertEquals(10L, results.matches());
            assertEquals(10, results.paths().size());
        }
    }

    @Test
    void zeroLimitReportsNoMatches() throws Exception {
        for (int threads : new int[] {1, 4}) {
            SearchResults results = Parex.search()
                    .source(invoices())
                    .threads(threads)
                    .limit(0)
                    .collectPaths(true)
                    .run();

            assertEquals(0L, results.matches());
            assertTrue(results.paths().isEmpty());
        }
    }

    @Test
    void oneAndManyThreadsAgree() throws Exception {
        Matcher even = entry -> Integer.parseInt(entry.name().substring("entry-".length())) % 2 == 0;
        SearchResults single = Parex.search().source(numbered(5000)).withMatcher(even).threads(1).run();
        SearchResults parallel = Parex.search().source(numbered(5000)).withMatcher(even).threads(8).run();

        assertEquals(2500L, single.matches());
        assertEquals(single.matches(), parallel.matches());
        assertEquals(single.stats().files(), parallel.stats().files());
    }

    @Test
    void repeatedRunsProduceIdenticalCounts() throws Exception {
        ListSource source = numbered(3000);
        SearchResults first = Parex.search().source(source).matching("7").threads(6).run();
        SearchResults second = Parex.search().source(source).matching("7").threads(6).run();

        assertEquals(first.matches(), second.matches());
        assertEquals(first.stats().files(), second.stats().files());
        assertEquals(first.stats().dirs(), second.stats().dirs());
    }

    @Test
    void neverMatchingStillTalliesEverything() throws Exception {
        SearchResults results = Parex.search()
                .source(invoices())
                .withMatcher(entry -> false)
                .threads(1)
                .collectPaths(true)
                .run();

        assertEquals(0L, results.matches());
        assertTrue(results.paths().isEmpty());
        assertEquals(6L, results.stats().files());
        assertEquals(1L, results.stats().dirs());
    }

    @Test
    void pathsAreEmptyUnlessRequested() throws Exception {
        SearchResults results = Parex.search().source(invoices()).threads(1).run();

        assertEquals(7L, results.matches());
        assertTrue(results.paths().isEmpty());
    }

    @Test
    void symlinksAndOtherEntriesAreMatchedButNotTallied() throws Exception {
        ListSource source = ListSource.of(
                file("a.txt", 1),
                new Entry(Path.of("root", "link"), "link", EntryKind.SYMLINK, 1),
                new Entry(Path.of("root", "fifo"), "fifo", EntryKind.OTHER, 1)
        );
        SearchResults results = Parex.search().source(source).threads(1).run();

        assertEquals(3L, results.matches());
        assertEquals(1L, results.stats().files());
        assertEquals(0L, results.stats().dirs());
    }

    @Test
    void collectsRecoverableErrorsOnlyWhenRequested() throws Exception {
        List<EntryResult> items = new ArrayList<>();
        items.add(EntryResult.success(file("invoice_jan.txt", 1)));
        items.add(EntryResult.failure(ParexException.permissionDenied(Path.of("root", "private"))));
        items.add(EntryResult.success(file("report.txt", 1)));

        SearchResults collected = Parex.search()
                .source(new ListSource(items))
                .matching("invoice")
                .threads(1)
                .collectErrors(true)
                .run();
        SearchResults dropped = Parex.search()
                .source(new ListSource(items))
                .matching("invoice")
                .threads(1)
                .run();

        assertEquals(1, collected.errors().size());
        assertEquals(ErrorKind.PERMISSION_DENIED, collected.errors().get(0).kind());
        assertTrue(dropped.errors().isEmpty());
        assertEquals(collected.matches(), dropped.matches());
        assertEquals(collected.stats().files(), dropped.stats().files());
        assertEquals(2L, dropped.stats().files());
    }

    @Test
    void fatalErrorFromSourceAbortsRun() {
        List<EntryResult> items = new ArrayList<>();
        items.add(EntryResult.success(file("a.txt", 1)));
        items.add(EntryResult.failure(ParexException.source(new IllegalStateException("cursor closed"))));
        items.add(EntryResult.success(file("b.txt", 1)));

        for (int threads : new int[] {1, 4}) {
            ParexException error = assertThrows(ParexException.class, () -> Parex.search()
                    .source(new ListSource(items))
                    .threads(threads)
                    .run());
            assertEquals(ErrorKind.SOURCE, error.kind());
            assertTrue(error.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    void failingMatcherAbortsRun() {
        Matcher broken = entry -> {
            throw new IllegalArgumentException("bad entry " + entry.name());
        };

        ParexException error = assertThrows(ParexException.class, () -> Parex.search()
                .source(invoices())
                .withMatcher(broken)
                .threads(1)
                .run());

        assertEquals(ErrorKind.MATCHER, error.kind());
        assertTrue(error.isFatal());
    }

    @Test
    void failingSourceStreamAbortsRun() {
        Source source = config -> Stream.generate(() -> {
            throw new UncheckedIOException(new IOException("disk gone"));
        });

        ParexException error = assertThrows(ParexException.class, () -> Parex.search()
                .source(source)
                .threads(1)
                .run());

        assertEquals(ErrorKind.SOURCE, error.kind());
    }

    @Test
    void failingParallelSourceAbortsRun() {
        ParallelSource source = new ParallelSource() {
            @Override
            public Stream<EntryResult> walk(WalkConfig config) {
                throw new IllegalStateException("cursor closed");
            }

            @Override
            public void walkParallel(WalkConfig config, EntryVisitor visitor) {
                throw new IllegalStateException("cursor closed");
            }
        };

        for (int threads : new int[] {1, 4}) {
            ParexException error = assertThrows(ParexException.class, () -> Parex.search()
                    .source(source)
                    .threads(threads)
                    .run());
            assertEquals(ErrorKind.SOURCE, error.kind());
            assertTrue(error.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    void maxDepthIsPassedToSource() throws Exception {
        SearchResults results = Parex.search()
                .source(invoices())
                .matching("invoice")
                .threads(1)
                .maxDepth(1)
                .run();

        assertEquals(2L, results.matches());
        assertEquals(4L, results.stats().files());
    }
}
