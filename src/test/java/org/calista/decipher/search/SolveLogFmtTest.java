package org.calista.decipher.search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SolveLogFmtTest {

    @Test
    void rendersAlignedBox() {
        String box = SolveLogFmt.box("solve", b -> b.kv("status", "SOLVED").sep().kv("trials", 42));

        String[] lines = box.split("\n");
        assertEquals(7, lines.length);
        assertTrue(lines[1].startsWith("| solve"));
        assertTrue(lines[3].contains("status: SOLVED"));
        assertTrue(lines[4].startsWith("|---"));
        assertTrue(lines[5].contains("trials: 42"));

        int width = lines[0].length();
        for (String l : lines) assertEquals(width, l.length(), l);
    }
}
