package com.example.parex.source;

import com.example.parex.Entry;
import com.example.parex.EntryResult;
import com.example.parex.EntryVisitor;
import com.example.parex.ParallelSource;
import com.example.parex.ParexException;
import com.example.parex.WalkConfig;
import com.example.parex.WalkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * In-memory source over a fixed list of items.
 *
 * <p>In parallel mode the workers share one cursor into the list, so each item is visited at
 * most once. Entries deeper than the configured bound are skipped; errors are always
 * delivered.
 */
public final class ListSource implements ParallelSource {
    private final List<EntryResult> items;

    public ListSource(List<EntryResult> items) {
        this.items = List.copyOf(items);
    }

    public static ListSource of(Entry... entries) {
        List<EntryResult> items = new ArrayList<>(entries.length);
        Arrays.stream(entries).map(EntryResult::success).forEach(items::add);
        return new ListSource(items);
    }

    @Override
    public Stream<EntryResult> walk(WalkConfig config) {
        return items.stream().filter(item -> inScope(item, config));
    }

    @Override
    public void walkParallel(WalkConfig config, EntryVisitor visitor) throws ParexException {
        ExecutorService executor = WorkerPool.create(config.threads(), "list-source");
        AtomicInteger cursor = new AtomicInteger();
        AtomicBoolean quit = new AtomicBoolean();
        List<Future<?>> workers = new ArrayList<>();
        ParexException failure = null;
        try {
            for (int i = 0; i < config.threads(); i++) {
                workers.add(executor.submit(() -> {
                    while (!quit.get()) {
                        int index = cursor.getAndIncrement();
                        if (index >= items.size()) {
                            return;
                        }
                        EntryResult item = items.get(index);
                        if (inScope(item, config) && visitor.visit(item) == WalkState.QUIT) {
                            quit.set(true);
                        }
                    }
                }));
            }
            for (Future<?> worker : workers) {
                worker.get();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            failure = ParexException.threadPool("interrupted while waiting for workers", ex);
        } catch (ExecutionException ex) {
            failure = ParexException.source(ex.getCause());
        } finally {
            WorkerPool.shutdown(executor, failure);
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static boolean inScope(EntryResult item, WalkConfig config) {
        return !item.isSuccess() || config.withinDepth(item.getEntry().depth());
    }
}
