package org.calista.decipher.search;

/**
 * No complete key was produced: the search space was exhausted under the threshold,
 * or the search budget ran out first.
 */
public final class SearchExhaustedException extends IllegalStateException {

    private final SolveResult.Status status;

    public SearchExhaustedException(SolveResult.Status status, String message) {
        super(message);
        this.status = status;
    }

    public SolveResult.Status status() {
        return status;
    }
}
