package org.calista.decipher.cipher;

import java.util.Objects;

/**
 * One ranked cipher letter.
 * Comparable uses descending count, with first appearance as the tie-break.
 */
public final class LetterCount implements Comparable<LetterCount> {
    public final char letter;
    public final int count;
    /** Index of the first occurrence in the ciphertext. */
    public final int firstIndex;

    public LetterCount(char letter, int count, int firstIndex) {
        this.letter = letter;
        this.count = count;
        this.firstIndex = firstIndex;
    }

    @Override
    public int compareTo(LetterCount o) {
        int c = Integer.compare(o.count, this.count);
        if (c != 0) return c;
        return Integer.compare(this.firstIndex, o.firstIndex);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof LetterCount l)) return false;
        return letter == l.letter && count == l.count && firstIndex == l.firstIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(letter, count, firstIndex);
    }

    @Override
    public String toString() {
        return letter + "=" + count;
    }
}
