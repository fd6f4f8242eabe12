package org.calista.decipher.cipher;

import java.util.ArrayList;
import java.util.List;

/**
 * Substitutor — applies a (possibly partial) key to ciphertext.
 *
 * <p>Letters become their plaintext letter or {@link #PLACEHOLDER}; everything else passes through.
 * Stateless and thread-safe. Called at every search node, so it is a single pass with no regex.</p>
 */
public final class Substitutor {

    /** Marks a letter whose cipher letter is not mapped yet. Never a letter itself. */
    public static final char PLACEHOLDER = '_';

    public String apply(String ciphertext, Key key) {
        if (ciphertext == null || ciphertext.isEmpty()) return "";

        final int n = ciphertext.length();
        char[] out = new char[n];
        for (int i = 0; i < n; i++) {
            char c = ciphertext.charAt(i);
            if (Alphabet.isLetter(c)) {
                char p = (key == null) ? Key.UNASSIGNED : key.get(c);
                out[i] = (p == Key.UNASSIGNED) ? PLACEHOLDER : p;
            } else {
                out[i] = c;
            }
        }
        return new String(out);
    }

    /** Whitespace-delimited tokens; runs of whitespace never produce empty tokens. */
    public List<String> tokens(String text) {
        if (text == null || text.isEmpty()) return List.of();

        ArrayList<String> out = new ArrayList<>(Math.max(4, text.length() / 5));
        final int n = text.length();
        int i = 0;
        while (i < n) {
            while (i < n && Character.isWhitespace(text.charAt(i))) i++;
            int start = i;
            while (i < n && !Character.isWhitespace(text.charAt(i))) i++;
            if (i > start) out.add(text.substring(start, i));
        }
        return out;
    }

    public boolean isResolved(String token) {
        return token != null && token.indexOf(PLACEHOLDER) < 0;
    }

    /** Tokens of the decoded text that contain no placeholder, in text order. */
    public List<String> resolvedTokens(String ciphertext, Key key) {
        List<String> all = tokens(apply(ciphertext, key));
        ArrayList<String> out = new ArrayList<>(all.size());
        for (String t : all) {
            if (isResolved(t)) out.add(t);
        }
        return out;
    }
}
