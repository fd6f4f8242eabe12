package org.calista.decipher.cipher;

import java.util.Objects;

/**
 * RemainingPool — plaintext letters not yet used as a mapping target.
 *
 * <p>
 * Arena layout: the letters live in a fixed array in their initial order and only an
 * availability flag changes. {@link #take(int)} / {@link #restore(int)} never shift anything,
 * so a restored letter is back at its original index by construction.
 * </p>
 */
public final class RemainingPool {

    private final char[] letters;
    private final boolean[] available;
    private int remaining;

    /** Pool over {@link Alphabet#PLAINTEXT_ORDER}. */
    public RemainingPool() {
        this(Alphabet.PLAINTEXT_ORDER);
    }

    public RemainingPool(String order) {
        Objects.requireNonNull(order, "order");
        this.letters = new char[order.length()];
        this.available = new boolean[order.length()];

        boolean[] seen = new boolean[Alphabet.SIZE];
        for (int i = 0; i < order.length(); i++) {
            char c = Alphabet.upper(order.charAt(i));
            int slot = Alphabet.indexOf(c);
            if (slot < 0) throw new IllegalArgumentException("pool letter must be A-Z: '" + order.charAt(i) + "'");
            if (seen[slot]) throw new IllegalArgumentException("duplicate pool letter: " + c);
            seen[slot] = true;
            letters[i] = c;
            available[i] = true;
        }
        this.remaining = letters.length;
    }

    /** Number of slots (available or not). */
    public int capacity() {
        return letters.length;
    }

    public int remaining() {
        return remaining;
    }

    public boolean isEmpty() {
        return remaining == 0;
    }

    public char letterAt(int index) {
        return letters[index];
    }

    public boolean isAvailable(int index) {
        return available[index];
    }

    /** Marks slot {@code index} as used and returns its letter. */
    public char take(int index) {
        if (!available[index]) throw new IllegalStateException("pool slot already taken: " + index + " (" + letters[index] + ")");
        available[index] = false;
        remaining--;
        return letters[index];
    }

    /** Puts the letter of slot {@code index} back at the same position. */
    public void restore(int index) {
        if (available[index]) throw new IllegalStateException("pool slot not taken: " + index + " (" + letters[index] + ")");
        available[index] = true;
        remaining++;
    }

    /** Available letters in pool order. */
    public String snapshot() {
        StringBuilder sb = new StringBuilder(remaining);
        for (int i = 0; i < letters.length; i++) {
            if (available[i]) sb.append(letters[i]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RemainingPool{" + snapshot() + '}';
    }
}
