package org.calista.decipher.search;

import org.calista.decipher.cipher.Key;

import java.util.List;
import java.util.Optional;

/**
 * Final output of one solve.
 *
 * <p>
 * An unsolved result never carries a key or decoded text: callers get an explicit
 * status instead of a silently partial mapping.
 * </p>
 */
public final class SolveResult {

    public enum Status {
        SOLVED,
        EXHAUSTED,
        BUDGET_EXCEEDED;

        static Status of(SearchReport.Outcome o) {
            switch (o) {
                case FOUND:
                    return SOLVED;
                case BUDGET_EXCEEDED:
                    return BUDGET_EXCEEDED;
                default:
                    return EXHAUSTED;
            }
        }
    }

    public final Status status;
    /** Case-normalized text the search ran on. */
    public final String ciphertext;
    /** Cipher letters in the order they were assigned. */
    public final List<Character> cipherOrder;
    public final SearchReport report;
    public final long elapsedMs;
    /** Debug trace (deterministic, safe to log). Empty when tracing is off. */
    public final List<String> trace;

    private final Key key;
    private final String plaintext;

    SolveResult(Status status,
                String ciphertext,
                List<Character> cipherOrder,
                Key key,
                String plaintext,
                SearchReport report,
                long elapsedMs,
                List<String> trace) {
        this.status = status;
        this.ciphertext = ciphertext;
        this.cipherOrder = (cipherOrder == null ? List.of() : List.copyOf(cipherOrder));
        this.key = (status == Status.SOLVED ? key : null);
        this.plaintext = (status == Status.SOLVED ? plaintext : null);
        this.report = report;
        this.elapsedMs = elapsedMs;
        this.trace = (trace == null ? List.of() : List.copyOf(trace));
    }

    public boolean solved() {
        return status == Status.SOLVED;
    }

    /** Copy of the recovered key; empty unless solved. */
    public Optional<Key> key() {
        return key == null ? Optional.empty() : Optional.of(key.copy());
    }

    /** Decoded text; empty unless solved. */
    public Optional<String> plaintext() {
        return Optional.ofNullable(plaintext);
    }

    /**
     * @throws SearchExhaustedException unless solved
     */
    public Key requireKey() {
        if (key == null) {
            throw new SearchExhaustedException(status, "No key found: status=" + status
                    + (report == null ? "" : ", trials=" + report.trials));
        }
        return key.copy();
    }

    @Override
    public String toString() {
        return "SolveResult{" + status
                + (key != null ? ", key=" + key : "")
                + (report != null ? ", trials=" + report.trials : "")
                + ", elapsedMs=" + elapsedMs + '}';
    }
}
