package org.calista.decipher.cipher;

/**
 * Alphabet — the 26 English letters, ordered by general-language frequency (most to least common).
 *
 * <p>This order drives value selection during the search: the likeliest plaintext letter is tried first.</p>
 */
public final class Alphabet {

    /** Canonical frequency order. */
    public static final String PLAINTEXT_ORDER = "ETAOINSHRDLCUMWFGYPBVKJXQZ";

    public static final int SIZE = 26;

    private Alphabet() {}

    /** True for 'A'..'Z' and 'a'..'z'. */
    public static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    /** Case-normalized slot 0..25, or -1 when {@code c} is not an ASCII letter. */
    public static int indexOf(char c) {
        if (c >= 'A' && c <= 'Z') return c - 'A';
        if (c >= 'a' && c <= 'z') return c - 'a';
        return -1;
    }

    public static char letterAt(int index) {
        if (index < 0 || index >= SIZE) throw new IllegalArgumentException("letter index out of range: " + index);
        return (char) ('A' + index);
    }

    public static char upper(char c) {
        return (c >= 'a' && c <= 'z') ? (char) (c - 'a' + 'A') : c;
    }

    /** ASCII-only case fold: 'a'..'z' become 'A'..'Z', every other char is kept, length never changes. */
    public static String upper(String text) {
        char[] out = text.toCharArray();
        for (int i = 0; i < out.length; i++) out[i] = upper(out[i]);
        return new String(out);
    }
}
