package org.calista.decipher.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.cipher.Alphabet;
import org.calista.decipher.cipher.CharacterPolicy;
import org.calista.decipher.cipher.FrequencyAnalyzer;
import org.calista.decipher.cipher.Key;
import org.calista.decipher.cipher.RemainingPool;
import org.calista.decipher.cipher.Substitutor;
import org.calista.decipher.dictionary.Dictionary;
import org.calista.decipher.search.impl.DictionaryDeadendEvaluator;

import java.util.List;
import java.util.Objects;

/**
 * Solver — the solve entry point.
 *
 * Pipeline:
 *  1) apply the {@link CharacterPolicy} to the raw input, fold ASCII case
 *  2) rank cipher letters (FrequencyAnalyzer)
 *  3) fresh Key + RemainingPool, run KeyAssigner
 *  4) on success re-apply the Substitutor for the decoded text
 *
 * <p>
 * Immutable after build; every solve owns its own key, pool and trace, so one Solver can be
 * shared. Configuration errors (threshold outside (0,1]) are raised by {@link #builder} /
 * {@link Builder#build()}, before any search.
 * </p>
 */
public final class Solver {

    private static final Logger log = LogManager.getLogger(Solver.class);

    private final Config config;
    private final Dictionary dictionary;
    private final Substitutor substitutor;
    private final FrequencyAnalyzer analyzer;
    private final DeadendEvaluator evaluator;
    private final SearchListener listener;

    private Solver(Builder b) {
        this.dictionary = Objects.requireNonNull(b.dictionary, "dictionary");
        this.config = Objects.requireNonNull(b.config, "config").freezeAndValidate();
        this.substitutor = (b.substitutor != null) ? b.substitutor : new Substitutor();
        this.analyzer = (b.analyzer != null) ? b.analyzer : new FrequencyAnalyzer();
        this.evaluator = (b.evaluator != null)
                ? b.evaluator
                : new DictionaryDeadendEvaluator(dictionary, config.threshold, substitutor);
        this.listener = (b.listener != null) ? b.listener : SearchListener.NOOP;

        if (log.isDebugEnabled()) {
            log.debug("Solver created: dictionary={}, threshold={}, policy={}, maxTrials={}, timeoutMs={}",
                    dictionary.size(), config.threshold, config.characterPolicy, config.maxTrials, config.timeoutMs);
        }
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    /**
     * Recovers a key for {@code ciphertext}.
     *
     * @throws org.calista.decipher.cipher.UnsupportedCharacterException under {@link CharacterPolicy#REJECT}
     */
    public SolveResult solve(String ciphertext) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        long t0 = System.nanoTime();

        config.characterPolicy.check(ciphertext);
        String text = Alphabet.upper(ciphertext);

        List<Character> order = analyzer.order(text);
        Key key = new Key();
        RemainingPool pool = new RemainingPool();

        TraceRecorder trace = config.traceLines > 0 ? new TraceRecorder(config.traceLines) : null;
        SearchListener l = SearchListener.compose(listener, trace);

        KeyAssigner.Config kc = new KeyAssigner.Config()
                .maxTrials(config.maxTrials)
                .timeoutMs(config.timeoutMs);

        log.info("Solve start: chars={}, letters={}, order={}, threshold={}",
                text.length(), order.size(), order, config.threshold);

        SearchReport report = new KeyAssigner(evaluator, kc, l).assign(text, order, key, pool);
        SolveResult.Status status = SolveResult.Status.of(report.outcome);
        String plaintext = (status == SolveResult.Status.SOLVED) ? substitutor.apply(text, key) : null;
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        SolveResult result = new SolveResult(status, text, order, key, plaintext, report, elapsedMs,
                trace == null ? List.of() : trace.lines());

        logResult(result);
        return result;
    }

    private void logResult(SolveResult r) {
        if (!log.isInfoEnabled()) return;
        log.info("\n{}", SolveLogFmt.box("Solve " + r.status, b -> {
            b.kv("letters", r.cipherOrder.size());
            b.kv("trials", r.report.trials);
            b.kv("deadends", r.report.deadends);
            b.kv("backtracks", r.report.backtracks);
            b.kv("maxDepth", r.report.maxDepth);
            b.kv("elapsedMs", r.elapsedMs);
            r.key().ifPresent(k -> b.sep().kv("key", k));
        }));
    }

    // ---------------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------------

    public Config getConfig() { return config; }

    public Dictionary getDictionary() { return dictionary; }

    public Substitutor getSubstitutor() { return substitutor; }

    public DeadendEvaluator getEvaluator() { return evaluator; }

    // ---------------------------------------------------------------------
    // Builder / Config
    // ---------------------------------------------------------------------

    public static Builder builder(Dictionary dictionary) {
        return new Builder(dictionary);
    }

    public static final class Builder {
        private final Dictionary dictionary;

        private Config config = new Config();
        private Substitutor substitutor;
        private FrequencyAnalyzer analyzer;
        private DeadendEvaluator evaluator;
        private SearchListener listener;

        private Builder(Dictionary dictionary) {
            this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        }

        public Builder config(Config cfg) {
            this.config = Objects.requireNonNull(cfg, "config");
            return this;
        }

        public Builder threshold(double threshold) {
            this.config.threshold = threshold;
            return this;
        }

        public Builder substitutor(Substitutor substitutor) {
            this.substitutor = Objects.requireNonNull(substitutor, "substitutor");
            return this;
        }

        public Builder analyzer(FrequencyAnalyzer analyzer) {
            this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
            return this;
        }

        /** Replaces the dictionary-based evaluator (threshold is then up to the evaluator). */
        public Builder evaluator(DeadendEvaluator evaluator) {
            this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
            return this;
        }

        public Builder listener(SearchListener listener) {
            this.listener = listener; // nullable ok
            return this;
        }

        public Solver build() {
            return new Solver(this);
        }
    }

    public static final class Config {
        public static final double DEFAULT_THRESHOLD = 0.85;

        /** Minimum share of dictionary words among fully resolved tokens, in (0,1]. */
        public double threshold = DEFAULT_THRESHOLD;

        public CharacterPolicy characterPolicy = CharacterPolicy.PASS_THROUGH;

        /** 0 => unlimited. */
        public long maxTrials = 0;
        /** 0 => unlimited. */
        public long timeoutMs = 0;

        /** Trace lines kept per solve. 0 => tracing off. */
        public int traceLines = 0;

        private boolean frozen = false;

        /**
         * @throws IllegalArgumentException if the threshold is outside (0,1]
         */
        public Config freezeAndValidate() {
            if (frozen) return this;

            validateThreshold(threshold);
            if (characterPolicy == null) characterPolicy = CharacterPolicy.PASS_THROUGH;
            maxTrials = Math.max(0, maxTrials);
            timeoutMs = Math.max(0, timeoutMs);
            traceLines = Math.max(0, traceLines);

            frozen = true;
            return this;
        }

        public static void validateThreshold(double threshold) {
            if (!Double.isFinite(threshold) || !(threshold > 0.0) || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be within (0,1]: " + threshold);
            }
        }
    }
}
