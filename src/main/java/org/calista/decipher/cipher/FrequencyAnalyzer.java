package org.calista.decipher.cipher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FrequencyAnalyzer — ranks the distinct letters of a ciphertext by occurrence count.
 *
 * <p>
 * Assigning the most frequent cipher letters first resolves whole tokens early, which gives
 * the deadend test a signal sooner. Counting is case-normalized; non-letters are ignored.
 * Equal counts keep the order of first appearance.
 * </p>
 */
public final class FrequencyAnalyzer {

    public List<LetterCount> count(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) return List.of();

        int[] counts = new int[Alphabet.SIZE];
        int[] first = new int[Alphabet.SIZE];

        for (int i = 0; i < ciphertext.length(); i++) {
            int slot = Alphabet.indexOf(ciphertext.charAt(i));
            if (slot < 0) continue;
            if (counts[slot] == 0) first[slot] = i;
            counts[slot]++;
        }

        ArrayList<LetterCount> out = new ArrayList<>(Alphabet.SIZE);
        for (int slot = 0; slot < Alphabet.SIZE; slot++) {
            if (counts[slot] > 0) out.add(new LetterCount(Alphabet.letterAt(slot), counts[slot], first[slot]));
        }
        Collections.sort(out);
        return Collections.unmodifiableList(out);
    }

    /** CipherOrder: the letters of {@link #count(String)} in rank order. */
    public List<Character> order(String ciphertext) {
        List<LetterCount> ranked = count(ciphertext);
        ArrayList<Character> out = new ArrayList<>(ranked.size());
        for (LetterCount lc : ranked) out.add(lc.letter);
        return Collections.unmodifiableList(out);
    }
}
