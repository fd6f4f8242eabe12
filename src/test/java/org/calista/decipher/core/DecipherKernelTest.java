package org.calista.decipher.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.dictionary.Dictionary;
import org.calista.decipher.search.SolveResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecipherKernelTest {

    @TempDir
    Path tmp;

    private void writeConfig(boolean useBundled, List<String> files) throws IOException {
        DecipherConfig cfg = new DecipherConfig();
        cfg.dictionary.dir = "dicts";
        cfg.dictionary.files = files;
        cfg.dictionary.useBundled = useBundled;
        Files.writeString(tmp.resolve("decipher.json"), new ObjectMapper().writeValueAsString(cfg));
    }

    @Test
    void loadsConfiguredWordListsRelativeToConfigRoot() throws IOException {
        writeConfig(false, List.of("words.txt", "missing.txt"));
        Files.createDirectories(tmp.resolve("dicts"));
        Files.writeString(tmp.resolve("dicts/words.txt"), "THE\nCAT\n");

        DecipherKernel k = DecipherKernel.builder().configRoot(tmp).build(Path.of("decipher.json"));

        assertFalse(k.isDictionaryLoaded());
        assertEquals(tmp.toAbsolutePath().normalize().resolve("data"), k.io().baseDir());

        Dictionary d = k.loadDictionary();
        assertEquals(2, d.size());
        assertSame(d, k.loadDictionary());

        SolveResult r = k.solver().solve("XQM RBX");
        assertEquals("THE CAT", r.plaintext().orElseThrow());
        assertEquals(k.io().resolve("solves.jsonl"), k.eventStore().file());
    }

    @Test
    void bundledListSolvesWithoutLocalFiles() throws IOException {
        writeConfig(true, List.of());

        DecipherKernel k = DecipherKernel.builder().configRoot(tmp).build(Path.of("decipher.json"));
        Dictionary d = k.loadDictionary();

        assertTrue(d.contains("THE"));
        SolveResult r = k.solver().solve("XQM RBX");
        assertTrue(r.solved());
        for (String w : r.plaintext().orElseThrow().split(" ")) assertTrue(d.contains(w), w);
    }

    @Test
    void missingConfigIsCreated() throws IOException {
        DecipherKernel k = DecipherKernel.builder().configRoot(tmp).build(Path.of("conf/decipher.json"));

        assertTrue(Files.exists(tmp.resolve("conf/decipher.json")));
        assertEquals(0.85, k.config().search.threshold);
    }
}
