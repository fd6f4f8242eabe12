package org.calista.decipher.cipher;

import java.util.Locale;

/**
 * What to do with ciphertext characters that are neither whitespace nor an ASCII letter.
 */
public enum CharacterPolicy {

    /** Keep them as punctuation: copied through unchanged, ignored by frequency analysis. */
    PASS_THROUGH,

    /** Refuse the input with {@link UnsupportedCharacterException}. */
    REJECT;

    /**
     * Applies this policy to the raw input; indices refer to {@code text} as given.
     *
     * @throws UnsupportedCharacterException under {@link #REJECT} for the first offending character
     */
    public void check(String text) {
        if (this != REJECT || text == null) return;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) continue;
            if (Alphabet.isLetter(c)) continue;
            throw new UnsupportedCharacterException(c, i);
        }
    }

    /** Lenient parse for config values; unknown or blank -> {@link #PASS_THROUGH}. */
    public static CharacterPolicy parse(String s) {
        if (s == null || s.isBlank()) return PASS_THROUGH;
        String v = s.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CharacterPolicy p : values()) {
            if (p.name().equals(v)) return p;
        }
        return PASS_THROUGH;
    }
}
