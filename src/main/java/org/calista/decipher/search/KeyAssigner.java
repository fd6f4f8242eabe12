package org.calista.decipher.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.cipher.Alphabet;
import org.calista.decipher.cipher.Key;
import org.calista.decipher.cipher.RemainingPool;

import java.util.List;
import java.util.Objects;

/**
 * KeyAssigner — depth-first backtracking search for a complete key.
 *
 * <p>
 * Variable order is the given cipher order (fixed for the whole run); value order is the
 * pool order at the time a level is entered. The first complete assignment wins.
 * </p>
 *
 * Contracts:
 * - On entry no letter of the order is mapped yet, and no pool letter is already a key target.
 * - On FOUND the key maps every cipher letter of the order; the pool holds the unused letters.
 * - On any other outcome key and pool are exactly as they were passed in.
 * - A failed branch restores key and pool before the next candidate is tried.
 *
 * <p>Stateless between runs: per-run counters live in {@link Run}, so one instance may serve
 * concurrent solves as long as each brings its own key and pool.</p>
 */
public final class KeyAssigner {

    private static final Logger log = LogManager.getLogger(KeyAssigner.class);

    public static final class Config {
        /** Max evaluator calls per run. 0 => unlimited. */
        public long maxTrials = 0;
        /** Wall-clock budget per run. 0 => unlimited. */
        public long timeoutMs = 0;

        public Config maxTrials(long v) {
            this.maxTrials = Math.max(0, v);
            return this;
        }

        public Config timeoutMs(long v) {
            this.timeoutMs = Math.max(0, v);
            return this;
        }
    }

    private final DeadendEvaluator evaluator;
    private final Config cfg;
    private final SearchListener listener;

    public KeyAssigner(DeadendEvaluator evaluator) {
        this(evaluator, new Config(), SearchListener.NOOP);
    }

    public KeyAssigner(DeadendEvaluator evaluator, Config cfg, SearchListener listener) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.cfg = (cfg == null ? new Config() : cfg);
        this.listener = (listener == null ? SearchListener.NOOP : listener);
    }

    /**
     * Extends {@code key} until every letter of {@code cipherOrder} is mapped.
     *
     * @param ciphertext  text judged by the evaluator at every trial
     * @param cipherOrder distinct cipher letters in assignment order, none of them mapped in {@code key}
     * @param key         partial key, mutated in place
     * @param pool        plaintext letters still free, mutated in lockstep with {@code key}
     * @throws IllegalArgumentException if key, pool and order are inconsistent
     */
    public SearchReport assign(String ciphertext, List<Character> cipherOrder, Key key, RemainingPool pool) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(cipherOrder, "cipherOrder");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(pool, "pool");
        checkStart(cipherOrder, key, pool);

        Run run = new Run(ciphertext, cipherOrder, key, pool, deadlineNs());
        boolean found = search(run, 0);

        SearchReport.Outcome outcome = found
                ? SearchReport.Outcome.FOUND
                : (run.aborted ? SearchReport.Outcome.BUDGET_EXCEEDED : SearchReport.Outcome.EXHAUSTED);

        if (log.isDebugEnabled()) {
            log.debug("assign done: outcome={}, letters={}, trials={}, deadends={}, backtracks={}, maxDepth={}",
                    outcome, cipherOrder.size(), run.trials, run.deadends, run.backtracks, run.maxDepth);
        }
        return new SearchReport(outcome, run.trials, run.deadends, run.backtracks, run.maxDepth);
    }

    // ---------------------------------------------------------------------
    // Recursion
    // ---------------------------------------------------------------------

    private boolean search(Run run, int depth) {
        if (depth > run.maxDepth) run.maxDepth = depth;
        if (depth == run.order.size()) return true;

        final char cipher = run.order.get(depth);
        final RemainingPool pool = run.pool;
        final Key key = run.key;

        listener.onEnter(depth, cipher, key, pool);

        for (int i = 0; i < pool.capacity(); i++) {
            if (!pool.isAvailable(i)) continue;
            if (run.overBudget()) break;

            char plain = pool.letterAt(i);
            key.assign(cipher, plain);
            run.trials++;

            DeadendEvaluator.Verdict v = evaluator.evaluate(run.ciphertext, key);
            listener.onTrial(depth, cipher, plain, v);

            if (v.deadend) {
                key.clear(cipher);
                run.deadends++;
                continue;
            }

            pool.take(i);
            if (search(run, depth + 1)) return true;

            pool.restore(i);
            key.clear(cipher);
            run.backtracks++;

            if (run.aborted) break;
        }

        listener.onExhausted(depth, cipher, key, pool);
        return false;
    }

    private static void checkStart(List<Character> cipherOrder, Key key, RemainingPool pool) {
        boolean[] seen = new boolean[Alphabet.SIZE];
        for (Character c : cipherOrder) {
            int idx = (c == null) ? -1 : Alphabet.indexOf(c);
            if (idx < 0) throw new IllegalArgumentException("cipher order holds a non-letter: " + c);
            if (seen[idx]) throw new IllegalArgumentException("cipher letter listed twice: " + c);
            seen[idx] = true;
            if (key.isAssigned(c)) {
                throw new IllegalArgumentException("cipher letter " + c + " is already mapped to " + key.get(c));
            }
        }
        for (int i = 0; i < pool.capacity(); i++) {
            if (pool.isAvailable(i) && key.isTargetUsed(pool.letterAt(i))) {
                throw new IllegalArgumentException("pool offers " + pool.letterAt(i) + " but the key already maps to it");
            }
        }
    }

    private long deadlineNs() {
        return cfg.timeoutMs > 0 ? System.nanoTime() + cfg.timeoutMs * 1_000_000L : 0L;
    }

    /** Mutable state of one run. */
    private final class Run {
        final String ciphertext;
        final List<Character> order;
        final Key key;
        final RemainingPool pool;
        final long deadlineNs;

        long trials;
        long deadends;
        long backtracks;
        int maxDepth;
        boolean aborted;

        Run(String ciphertext, List<Character> order, Key key, RemainingPool pool, long deadlineNs) {
            this.ciphertext = ciphertext;
            this.order = order;
            this.key = key;
            this.pool = pool;
            this.deadlineNs = deadlineNs;
        }

        boolean overBudget() {
            if (aborted) return true;
            if (cfg.maxTrials > 0 && trials >= cfg.maxTrials) {
                aborted = true;
                log.debug("search budget exceeded: maxTrials={}", cfg.maxTrials);
            } else if (deadlineNs != 0L && System.nanoTime() - deadlineNs >= 0) {
                aborted = true;
                log.debug("search budget exceeded: timeoutMs={}", cfg.timeoutMs);
            }
            return aborted;
        }
    }
}
