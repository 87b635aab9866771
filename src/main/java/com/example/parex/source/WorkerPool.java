package com.example.parex.source;

import com.example.parex.ParexException;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class WorkerPool {
    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private WorkerPool() {
    }

    static ExecutorService create(int threads, String name) throws ParexException {
        if (threads < 1) {
            throw ParexException.invalidThreadCount(threads);
        }
        int poolId = POOL_IDS.incrementAndGet();
        AtomicInteger workerIds = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, name + "-" + poolId + "-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    /**
     * Stops accepting work and joins every worker.
     */
    static void shutdown(ExecutorService executor) throws ParexException {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.HOURS)) {
                executor.shutdownNow();
                throw ParexException.threadPool("workers did not terminate", null);
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw ParexException.threadPool("interrupted while joining workers", ex);
        }
    }

    /**
     * Joins the pool without masking {@code primary}: a join failure is attached to it as a
     * suppressed exception and only thrown on its own when there is no primary error.
     */
    static void shutdown(ExecutorService executor, ParexException primary) throws ParexException {
        try {
            shutdown(executor);
        } catch (ParexException ex) {
            if (primary == null) {
                throw ex;
            }
            primary.addSuppressed(ex);
        }
    }
}
