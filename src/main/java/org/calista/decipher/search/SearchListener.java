package org.calista.decipher.search;

import org.calista.decipher.cipher.Key;
import org.calista.decipher.cipher.RemainingPool;

/**
 * Observer of the key search. All hooks default to no-op.
 *
 * <p>Key and pool are the live search state: read them, never mutate or retain them.</p>
 */
public interface SearchListener {

    SearchListener NOOP = new SearchListener() {};

    /** A level starts assigning {@code cipher}. */
    default void onEnter(int depth, char cipher, Key key, RemainingPool pool) {}

    /** {@code cipher -> plain} was tried and judged. */
    default void onTrial(int depth, char cipher, char plain, DeadendEvaluator.Verdict verdict) {}

    /** Every candidate of this level failed; key and pool are back to their state at {@link #onEnter}. */
    default void onExhausted(int depth, char cipher, Key key, RemainingPool pool) {}

    /** Combines listeners, invoked in order. */
    static SearchListener compose(SearchListener first, SearchListener second) {
        if (first == null || first == NOOP) return second == null ? NOOP : second;
        if (second == null || second == NOOP) return first;
        return new SearchListener() {
            @Override
            public void onEnter(int depth, char cipher, Key key, RemainingPool pool) {
                first.onEnter(depth, cipher, key, pool);
                second.onEnter(depth, cipher, key, pool);
            }

            @Override
            public void onTrial(int depth, char cipher, char plain, DeadendEvaluator.Verdict verdict) {
                first.onTrial(depth, cipher, plain, verdict);
                second.onTrial(depth, cipher, plain, verdict);
            }

            @Override
            public void onExhausted(int depth, char cipher, Key key, RemainingPool pool) {
                first.onExhausted(depth, cipher, key, pool);
                second.onExhausted(depth, cipher, key, pool);
            }
        };
    }
}
