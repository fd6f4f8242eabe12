package org.calista.decipher.search;

/**
 * Outcome and counters of one {@link KeyAssigner} run.
 */
public final class SearchReport {

    public enum Outcome {
        /** Every cipher letter is mapped. */
        FOUND,
        /** The whole space under the threshold was searched without success. */
        EXHAUSTED,
        /** maxTrials or timeout hit before a decision. */
        BUDGET_EXCEEDED
    }

    public final Outcome outcome;
    /** Candidate letters tried (evaluator calls). */
    public final long trials;
    public final long deadends;
    public final long backtracks;
    /** Deepest level reached (number of cipher letters mapped at once). */
    public final int maxDepth;

    public SearchReport(Outcome outcome, long trials, long deadends, long backtracks, int maxDepth) {
        this.outcome = outcome;
        this.trials = trials;
        this.deadends = deadends;
        this.backtracks = backtracks;
        this.maxDepth = maxDepth;
    }

    public boolean found() {
        return outcome == Outcome.FOUND;
    }

    @Override
    public String toString() {
        return "SearchReport{" + outcome
                + ", trials=" + trials
                + ", deadends=" + deadends
                + ", backtracks=" + backtracks
                + ", maxDepth=" + maxDepth + '}';
    }
}
