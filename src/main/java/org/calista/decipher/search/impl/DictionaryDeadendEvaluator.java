package org.calista.decipher.search.impl;

import org.calista.decipher.cipher.Alphabet;
import org.calista.decipher.cipher.Key;
import org.calista.decipher.cipher.Substitutor;
import org.calista.decipher.dictionary.Dictionary;
import org.calista.decipher.search.DeadendEvaluator;

import java.util.List;
import java.util.Objects;

/**
 * DictionaryDeadendEvaluator — probabilistic admissibility test over dictionary coverage.
 *
 * <p>
 * Decodes the whole text with the partial key, keeps the fully resolved tokens and requires
 * the share of dictionary words among them to be strictly greater than the threshold.
 * Tokens are looked up literally (case-normalized), so "WORD," does not match "WORD".
 * Tokens without letters are ignored.
 * </p>
 *
 * <p>Threshold 0 disables rejection: every key is viable.</p>
 */
public final class DictionaryDeadendEvaluator implements DeadendEvaluator {

    private final Dictionary dictionary;
    private final double threshold;
    private final Substitutor substitutor;

    public DictionaryDeadendEvaluator(Dictionary dictionary, double threshold) {
        this(dictionary, threshold, new Substitutor());
    }

    public DictionaryDeadendEvaluator(Dictionary dictionary, double threshold, Substitutor substitutor) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.substitutor = Objects.requireNonNull(substitutor, "substitutor");
        if (!Double.isFinite(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0,1]: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public Verdict evaluate(String ciphertext, Key key) {
        List<String> tokens = substitutor.tokens(substitutor.apply(ciphertext, key));

        int resolved = 0;
        int valid = 0;
        for (String t : tokens) {
            if (!substitutor.isResolved(t) || !hasLetter(t)) continue;
            resolved++;
            if (dictionary.contains(t)) valid++;
        }

        if (resolved == 0) return Verdict.noEvidence();
        if (threshold == 0.0) return new Verdict(false, resolved, valid);

        double ratio = (double) valid / (double) resolved;
        return new Verdict(!(ratio > threshold), resolved, valid);
    }

    /** Tokens without any letter (stray punctuation, digits) carry no evidence either way. */
    private static boolean hasLetter(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (Alphabet.isLetter(token.charAt(i))) return true;
        }
        return false;
    }

    public double threshold() {
        return threshold;
    }

    public Dictionary dictionary() {
        return dictionary;
    }
}
