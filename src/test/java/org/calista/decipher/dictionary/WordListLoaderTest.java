package org.calista.decipher.dictionary;

import org.calista.decipher.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class WordListLoaderTest {

    @TempDir
    Path tmp;

    @Test
    void loadsClasspathListAndCountsLines() throws IOException {
        InMemoryDictionary.Builder b = InMemoryDictionary.builder();

        WordListLoader.Report r = new WordListLoader(new FileIO(tmp)).loadResource(b, "dictionary/tiny.txt", false);

        assertEquals(7, r.ok);
        assertEquals(1, r.bad);
        assertEquals(2, r.skipped);

        InMemoryDictionary d = b.build();
        assertTrue(d.contains("THE"));
        assertTrue(d.contains("I"));
        assertFalse(d.contains("X"));
        assertFalse(d.contains("BAD-LINE"));
    }

    @Test
    void failFastStopsAtTheFirstBadLine() {
        WordListLoader loader = new WordListLoader(new FileIO(tmp));

        IOException e = assertThrows(IOException.class,
                () -> loader.loadResource(InMemoryDictionary.builder(), "dictionary/tiny.txt", true));
        assertTrue(e.getMessage().contains("bad-line"));
    }

    @Test
    void loadsPlainAndGzipFiles() throws IOException {
        Path plain = tmp.resolve("words.txt");
        Files.writeString(plain, "the\ncat\n\ndon't\n", StandardCharsets.UTF_8);

        Path gz = tmp.resolve("more.txt.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(gz))) {
            out.write("sat\nmat\ncat\n".getBytes(StandardCharsets.UTF_8));
        }

        WordListLoader loader = new WordListLoader(new FileIO(tmp));
        InMemoryDictionary.Builder b = InMemoryDictionary.builder();

        WordListLoader.Report first = loader.loadInto(b, plain, false);
        WordListLoader.Report second = loader.loadInto(b, gz, false);

        assertEquals(3, first.ok);
        assertEquals(2, second.ok);
        assertEquals(1, second.skipped);
        assertTrue(b.build().contains("DON'T"));
    }

    @Test
    void missingFileYieldsEmptyReport() throws IOException {
        WordListLoader.Report r = new WordListLoader(new FileIO(tmp))
                .loadInto(InMemoryDictionary.builder(), tmp.resolve("nope.txt"), true);

        assertEquals(0, r.ok);
        assertEquals(0, r.bad);
        assertEquals(0, r.skipped);
    }

    @Test
    void bundledListIsAvailable() throws IOException {
        InMemoryDictionary.Builder b = InMemoryDictionary.builder();

        WordListLoader.Report r = new WordListLoader(new FileIO(tmp)).loadResource(b, WordListLoader.BUNDLED_RESOURCE, true);

        assertEquals(0, r.bad);
        assertTrue(r.ok > 100);
        assertTrue(b.build().contains("THE"));
    }

    @Test
    void wordShape() {
        assertTrue(WordListLoader.isWord("DON'T"));
        assertTrue(WordListLoader.isWord("a"));
        assertFalse(WordListLoader.isWord("'TIS"));
        assertFalse(WordListLoader.isWord("NO'"));
        assertFalse(WordListLoader.isWord("TWO WORDS"));
        assertFalse(WordListLoader.isWord("R2D2"));
    }
}
