package org.calista.decipher.dictionary;

import java.util.List;

/**
 * Dictionary — read-only word set consulted by the deadend test.
 *
 * <p>Implementations hold uppercase words and must be safe to share across solves.</p>
 */
public interface Dictionary {

    /** Case-normalized literal membership; punctuation is not stripped. */
    boolean contains(String word);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /** Always the same order: lexicographic (useful for snapshots/debugging). */
    List<String> snapshotSorted();
}
