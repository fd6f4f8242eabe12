package org.calista.decipher.cipher;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RemainingPoolTest {

    @Test
    void startsInFrequencyOrder() {
        RemainingPool pool = new RemainingPool();

        assertEquals(Alphabet.PLAINTEXT_ORDER, pool.snapshot());
        assertEquals(26, pool.remaining());
        assertEquals('E', pool.letterAt(0));
    }

    @Test
    void restoreReinsertsAtOriginalIndex() {
        RemainingPool pool = new RemainingPool();

        assertEquals('A', pool.take(2));
        assertEquals('N', pool.take(5));
        assertEquals("ETOISHRDLCUMWFGYPBVKJXQZ", pool.snapshot());
        assertEquals(24, pool.remaining());

        pool.restore(2);
        assertEquals("ETAOISHRDLCUMWFGYPBVKJXQZ", pool.snapshot());
        pool.restore(5);
        assertEquals(Alphabet.PLAINTEXT_ORDER, pool.snapshot());
    }

    @Test
    void takeAndRestoreAreChecked() {
        RemainingPool pool = new RemainingPool("ABC");
        pool.take(1);

        assertThrows(IllegalStateException.class, () -> pool.take(1));
        assertThrows(IllegalStateException.class, () -> pool.restore(0));
    }

    @Test
    void rejectsBadOrders() {
        assertThrows(IllegalArgumentException.class, () -> new RemainingPool("ABA"));
        assertThrows(IllegalArgumentException.class, () -> new RemainingPool("AB1"));
    }
}
