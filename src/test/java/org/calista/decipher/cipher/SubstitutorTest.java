package org.calista.decipher.cipher;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubstitutorTest {

    private final Substitutor substitutor = new Substitutor();

    @Test
    void unassignedLettersBecomePlaceholders() {
        Key key = Key.of(Map.of('A', 'N'));

        assertEquals("N_ N_", substitutor.apply("AB AB", key));
        assertEquals("__ __", substitutor.apply("AB AB", new Key()));
        assertEquals("__ __", substitutor.apply("AB AB", null));
    }

    @Test
    void nonLettersPassThroughUnchanged() {
        Key key = Key.of(Map.of('A', 'T', 'B', 'O', 'C', 'I'));

        assertEquals("TO, I!\n", substitutor.apply("AB, C!\n", key));
        assertEquals("12 TO", substitutor.apply("12 AB", key));
    }

    @Test
    void doesNotMutateKey() {
        Key key = Key.of(Map.of('A', 'T'));
        Key before = key.copy();

        substitutor.apply("ABC ABC", key);

        assertEquals(before, key);
        assertEquals(1, key.size());
    }

    @Test
    void lowercaseCipherLettersAreCaseNormalized() {
        Key key = Key.of(Map.of('A', 'N', 'B', 'O'));
        assertEquals("NO", substitutor.apply("ab", key));
    }

    @Test
    void tokensSplitOnWhitespaceRuns() {
        assertEquals(List.of("A", "BC", "D"), substitutor.tokens("  A \t BC\n\nD  "));
        assertEquals(List.of(), substitutor.tokens("   "));
        assertEquals(List.of(), substitutor.tokens(""));
    }

    @Test
    void resolvedTokensContainNoPlaceholder() {
        Key key = Key.of(Map.of('A', 'T', 'B', 'O'));
        assertEquals(List.of("TO", "T"), substitutor.resolvedTokens("AB BC A", key));
    }

    @Test
    void assigningMoreLettersNeverUnresolvesAToken() {
        String cipher = "A AB BC CAB D";
        Key k1 = Key.of(Map.of('A', 'T'));
        Key k2 = k1.copy();
        k2.assign('B', 'O');
        Key k3 = k2.copy();
        k3.assign('C', 'N');

        List<String> r1 = substitutor.resolvedTokens(cipher, k1);
        List<String> r2 = substitutor.resolvedTokens(cipher, k2);
        List<String> r3 = substitutor.resolvedTokens(cipher, k3);

        assertEquals(List.of("T"), r1);
        assertTrue(r2.containsAll(r1));
        assertTrue(r3.containsAll(r2));
        assertEquals(List.of("T", "TO", "ON", "NTO"), r3);
    }

    @Test
    void inverseKeyRecoversTheCiphertext() {
        String cipher = "XQM RBX QM";
        Key key = Key.of(Map.of('X', 'T', 'Q', 'H', 'M', 'E', 'R', 'C', 'B', 'A'));

        String plain = substitutor.apply(cipher, key);
        assertEquals("THE CAT HE", plain);
        assertEquals(-1, plain.indexOf(Substitutor.PLACEHOLDER));

        assertEquals(cipher, substitutor.apply(plain, key.inverse()));
    }
}
