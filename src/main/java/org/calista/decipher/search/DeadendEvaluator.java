package org.calista.decipher.search;

import org.calista.decipher.cipher.Key;

/**
 * DeadendEvaluator — judges whether a partial key is still worth extending.
 *
 * Contracts:
 * - Deterministic: same (ciphertext, key) -> same Verdict.
 * - Total: never throws on well-formed input, never mutates the key.
 * - Monotonic evidence: with no fully resolved token there is nothing to reject.
 */
public interface DeadendEvaluator {

    Verdict evaluate(String ciphertext, Key key);

    default boolean isDeadend(String ciphertext, Key key) {
        return evaluate(ciphertext, key).deadend;
    }

    /**
     * Verdict for one partial key, with the counts behind it (safe to log/trace).
     */
    final class Verdict {

        private static final Verdict NO_EVIDENCE = new Verdict(false, 0, 0);

        public final boolean deadend;
        /** Fully resolved tokens in the decoded text. */
        public final int resolved;
        /** Resolved tokens found in the dictionary. */
        public final int valid;

        public Verdict(boolean deadend, int resolved, int valid) {
            this.deadend = deadend;
            this.resolved = resolved;
            this.valid = valid;
        }

        public static Verdict noEvidence() {
            return NO_EVIDENCE;
        }

        /** valid / resolved, or 1.0 when nothing is resolved yet. */
        public double ratio() {
            return resolved == 0 ? 1.0 : (double) valid / (double) resolved;
        }

        @Override
        public String toString() {
            return (deadend ? "deadend" : "viable") + "(" + valid + "/" + resolved + ")";
        }
    }
}
