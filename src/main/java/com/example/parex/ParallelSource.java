package com.example.parex;

/**
 * A source that owns a worker pool and pushes items to a visitor from several threads.
 *
 * <p>Implementations must honour {@link WalkConfig#maxDepth()}, stop dispatching new work
 * once any visit returns {@link WalkState#QUIT}, and join all workers before returning.
 */
public interface ParallelSource extends Source {
    void walkParallel(WalkConfig config, EntryVisitor visitor) throws ParexException;
}
