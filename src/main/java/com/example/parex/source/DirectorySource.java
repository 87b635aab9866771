package com.example.parex.source;

import com.example.parex.Entry;
import com.example.parex.EntryKind;
import com.example.parex.EntryResult;
import com.example.parex.EntryVisitor;
import com.example.parex.ParallelSource;
import com.example.parex.ParexException;
import com.example.parex.WalkConfig;
import com.example.parex.WalkState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a directory tree. The root itself is not emitted; its children are at depth 1.
 *
 * <p>Sequential walks are breadth-first and lazy: a directory is listed only when the
 * consumer pulls past the entries already buffered. Parallel walks list one directory per
 * task on a fixed pool and stop scheduling new directories once the visitor asks to quit.
 * Unreadable directories are reported as recoverable errors and the walk goes on.
 */
public final class DirectorySource implements ParallelSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectorySource.class);

    private final Path root;
    private final boolean followLinks;

    public DirectorySource(Path root) {
        this(root, false);
    }

    public DirectorySource(Path root, boolean followLinks) {
        this.root = root;
        this.followLinks = followLinks;
    }

    @Override
    public Stream<EntryResult> walk(WalkConfig config) throws ParexException {
        checkRoot();
        Iterator<EntryResult> iterator = new BreadthFirstIterator(config);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        );
    }

    @Override
    public void walkParallel(WalkConfig config, EntryVisitor visitor) throws ParexException {
        checkRoot();
        new ParallelWalk(config, visitor).run();
    }

    private void checkRoot() throws ParexException {
        if (root == null || !Files.isDirectory(root)) {
            throw ParexException.invalidSource(root);
        }
    }

    /**
     * Lists one directory, turning each child into an item. Subdirectories to descend into are
     * handed to {@code descend}.
     */
    private List<EntryResult> list(PendingDirectory directory, WalkConfig config, Descender descend) {
        List<EntryResult> items = new ArrayList<>();
        int childDepth = directory.depth() + 1;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory.path())) {
            for (Path child : stream) {
                Entry entry = Entry.fromPath(child, childDepth);
                items.add(EntryResult.success(entry));
                if (!config.withinDepth(childDepth + 1) || !shouldDescend(entry)) {
                    continue;
                }
                Set<Path> ancestors = directory.ancestors();
                if (followLinks) {
                    Path real = realPath(child);
                    // Only a directory that contains itself is a loop; reaching it twice is not.
                    if (ancestors.contains(real)) {
                        items.add(EntryResult.failure(ParexException.symlinkLoop(child)));
                        continue;
                    }
                    ancestors = new HashSet<>(ancestors);
                    ancestors.add(real);
                }
                descend.accept(new PendingDirectory(child, childDepth, ancestors));
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to list directory {}", directory.path(), ex);
            items.add(EntryResult.failure(ParexException.fromIOException(directory.path(), ex)));
        }
        return items;
    }

    private boolean shouldDescend(Entry entry) {
        if (entry.kind() == EntryKind.DIRECTORY) {
            return true;
        }
        return followLinks && entry.kind() == EntryKind.SYMLINK && Files.isDirectory(entry.path());
    }

    private PendingDirectory rootDirectory() {
        Set<Path> ancestors = followLinks ? Set.of(realPath(root)) : Set.of();
        return new PendingDirectory(root, 0, ancestors);
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize();
        }
    }

    @FunctionalInterface
    private interface Descender {
        void accept(PendingDirectory directory);
    }

    /**
     * A directory still to be listed, with the real paths of itself and its ancestors when
     * links are followed.
     */
    private record PendingDirectory(Path path, int depth, Set<Path> ancestors) {
    }

    private final class BreadthFirstIterator implements Iterator<EntryResult> {
        private final WalkConfig config;
        private final Deque<PendingDirectory> pending = new ArrayDeque<>();
        private final Deque<EntryResult> ready = new ArrayDeque<>();

        private BreadthFirstIterator(WalkConfig config) {
            this.config = config;
            if (config.withinDepth(1)) {
                pending.addLast(rootDirectory());
            }
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && !pending.isEmpty()) {
                PendingDirectory next = pending.removeFirst();
                ready.addAll(list(next, config, pending::addLast));
            }
            return !ready.isEmpty();
        }

        @Override
        public EntryResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.removeFirst();
        }
    }

    private final class ParallelWalk {
        private final WalkConfig config;
        private final EntryVisitor visitor;
        private final AtomicBoolean quit = new AtomicBoolean();
        private final AtomicLong outstanding = new AtomicLong();
        private final CountDownLatch done = new CountDownLatch(1);
        private final AtomicReference<Throwable> failure = new AtomicReference<>();
        private ExecutorService executor;

        private ParallelWalk(WalkConfig config, EntryVisitor visitor) {
            this.config = config;
            this.visitor = visitor;
        }

        void run() throws ParexException {
            if (!config.withinDepth(1)) {
                return;
            }
            executor = WorkerPool.create(config.threads(), "directory-source");
            ParexException interrupted = null;
            try {
                submit(rootDirectory());
                done.await();
            } catch (InterruptedException ex) {
                quit.set(true);
                Thread.currentThread().interrupt();
                interrupted = ParexException.threadPool("interrupted while walking " + root, ex);
            } finally {
                WorkerPool.shutdown(executor, interrupted);
            }
            if (interrupted != null) {
                throw interrupted;
            }
            Throwable error = failure.get();
            if (error != null) {
                throw ParexException.source(error);
            }
        }

        private void submit(PendingDirectory directory) {
            if (quit.get()) {
                return;
            }
            outstanding.incrementAndGet();
            try {
                executor.execute(() -> process(directory));
            } catch (RejectedExecutionException ex) {
                failure.compareAndSet(null, ex);
                quit.set(true);
                finishTask();
            }
        }

        private void process(PendingDirectory directory) {
            try {
                if (quit.get()) {
                    return;
                }
                List<PendingDirectory> subdirectories = new ArrayList<>();
                List<EntryResult> items = list(directory, config, subdirectories::add);
                for (EntryResult item : items) {
                    if (quit.get()) {
                        return;
                    }
                    if (visitor.visit(item) == WalkState.QUIT) {
                        quit.set(true);
                        return;
                    }
                }
                for (PendingDirectory subdirectory : subdirectories) {
                    submit(subdirectory);
                }
            } catch (RuntimeException ex) {
                failure.compareAndSet(null, ex);
                quit.set(true);
            } finally {
                finishTask();
            }
        }

        private void finishTask() {
            if (outstanding.decrementAndGet() == 0) {
                done.countDown();
            }
        }
    }
}
