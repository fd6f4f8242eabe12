package org.calista.decipher.cipher;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Key — partial, injective mapping cipher letter -> plaintext letter.
 *
 * <p>
 * Storage is two fixed arrays (forward mapping and "target already used" flags), so
 * assign/clear are O(1) and a snapshot is a cheap array copy.
 * </p>
 *
 * Contracts:
 * - a plaintext letter is the target of at most one cipher letter
 * - unassigned slots hold {@link #UNASSIGNED}
 * - not thread-safe: a key belongs to exactly one search run
 */
public final class Key {

    public static final char UNASSIGNED = 0;

    private final char[] forward = new char[Alphabet.SIZE];
    private final boolean[] targetUsed = new boolean[Alphabet.SIZE];
    private int assigned;

    public Key() {}

    /**
     * Builds a key from explicit pairs, e.g. {@code Key.of(Map.of('X', 'T'))}.
     */
    public static Key of(Map<Character, Character> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        Key k = new Key();
        for (Map.Entry<Character, Character> e : pairs.entrySet()) {
            k.assign(e.getKey(), e.getValue());
        }
        return k;
    }

    // ---------------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------------

    /**
     * Maps {@code cipher} to {@code plain}. Re-assigning a cipher letter replaces its previous target.
     *
     * @throws IllegalStateException if {@code plain} is already the target of another cipher letter
     */
    public void assign(char cipher, char plain) {
        int ci = slot(cipher, "cipher");
        int pi = slot(plain, "plain");

        char prev = forward[ci];
        if (prev != UNASSIGNED && Alphabet.indexOf(prev) == pi) return;
        if (targetUsed[pi]) {
            throw new IllegalStateException("plaintext letter " + Alphabet.letterAt(pi) + " is already mapped");
        }

        if (prev != UNASSIGNED) {
            targetUsed[Alphabet.indexOf(prev)] = false;
        } else {
            assigned++;
        }
        forward[ci] = Alphabet.letterAt(pi);
        targetUsed[pi] = true;
    }

    /** Removes the mapping of {@code cipher}; no-op when it is unassigned. */
    public void clear(char cipher) {
        int ci = slot(cipher, "cipher");
        char prev = forward[ci];
        if (prev == UNASSIGNED) return;
        targetUsed[Alphabet.indexOf(prev)] = false;
        forward[ci] = UNASSIGNED;
        assigned--;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /** Plaintext letter for {@code cipher} (case-normalized), or {@link #UNASSIGNED}. */
    public char get(char cipher) {
        int ci = Alphabet.indexOf(cipher);
        return ci < 0 ? UNASSIGNED : forward[ci];
    }

    public boolean isAssigned(char cipher) {
        return get(cipher) != UNASSIGNED;
    }

    public boolean isTargetUsed(char plain) {
        int pi = Alphabet.indexOf(plain);
        return pi >= 0 && targetUsed[pi];
    }

    public int size() {
        return assigned;
    }

    public boolean isEmpty() {
        return assigned == 0;
    }

    /** True when every letter of {@code cipherLetters} is mapped. */
    public boolean isCompleteFor(Collection<Character> cipherLetters) {
        if (cipherLetters == null) return true;
        for (Character c : cipherLetters) {
            if (c == null || !isAssigned(c)) return false;
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Derived keys
    // ---------------------------------------------------------------------

    public Key copy() {
        Key k = new Key();
        System.arraycopy(forward, 0, k.forward, 0, forward.length);
        System.arraycopy(targetUsed, 0, k.targetUsed, 0, targetUsed.length);
        k.assigned = assigned;
        return k;
    }

    /** Plaintext -> cipher mapping over the same pairs. */
    public Key inverse() {
        Key k = new Key();
        for (int i = 0; i < forward.length; i++) {
            if (forward[i] != UNASSIGNED) k.assign(forward[i], Alphabet.letterAt(i));
        }
        return k;
    }

    /** Assigned pairs ordered by cipher letter A..Z. */
    public Map<Character, Character> asMap() {
        LinkedHashMap<Character, Character> out = new LinkedHashMap<>(assigned * 2);
        for (int i = 0; i < forward.length; i++) {
            if (forward[i] != UNASSIGNED) out.put(Alphabet.letterAt(i), forward[i]);
        }
        return out;
    }

    private static int slot(char c, String what) {
        int i = Alphabet.indexOf(c);
        if (i < 0) throw new IllegalArgumentException(what + " must be a letter A-Z: '" + c + "'");
        return i;
    }

    // ---------------------------------------------------------------------
    // Object
    // ---------------------------------------------------------------------

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Key k)) return false;
        return Arrays.equals(forward, k.forward);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(forward);
    }

    /** Compact form, e.g. {@code A->N B->O}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(assigned * 5);
        for (int i = 0; i < forward.length; i++) {
            if (forward[i] == UNASSIGNED) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Alphabet.letterAt(i)).append("->").append(forward[i]);
        }
        return sb.toString();
    }
}
