package com.example.parex;

/**
 * Callback a {@link ParallelSource} invokes from its worker threads, once per item.
 */
@FunctionalInterface
public interface EntryVisitor {
    /**
     * Handles one item. A {@link WalkState#QUIT} verdict asks the source to stop dispatching
     * further work; items already in flight on other workers may still be delivered.
     */
    WalkState visit(EntryResult item);
}
