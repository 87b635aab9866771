package com.example.parex;

import java.util.stream.Stream;

/**
 * Anything the engine can search: directories, in-memory collections, database cursors.
 *
 * <p>This is the pull shape: the returned stream is consumed by a single thread, which
 * stops pulling once enough matches are found, and closed afterwards. Recoverable problems
 * should be yielded as {@link EntryResult#failure} items instead of thrown.
 */
public interface Source {
    /**
     * Opens a lazy stream over the source's items.
     *
     * @throws ParexException if the source cannot be traversed at all
     */
    Stream<EntryResult> walk(WalkConfig config) throws ParexException;
}
