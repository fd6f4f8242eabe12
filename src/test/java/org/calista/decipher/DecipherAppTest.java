package org.calista.decipher;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.core.DecipherConfig;
import org.calista.decipher.events.EventStore;
import org.calista.decipher.events.SolveEvent;
import org.calista.decipher.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecipherAppTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private Path cfgFile;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tmp.resolve("dicts"));
        Files.writeString(tmp.resolve("dicts/words.txt"), "THE\nCAT\n");
        cfgFile = tmp.resolve("decipher.json");
        writeConfig(config());
    }

    private DecipherConfig config() {
        DecipherConfig cfg = new DecipherConfig();
        cfg.baseDir = tmp.resolve("data").toString();
        cfg.dictionary.dir = tmp.resolve("dicts").toString();
        cfg.dictionary.useBundled = false;
        return cfg;
    }

    private void writeConfig(DecipherConfig cfg) throws IOException {
        Files.writeString(cfgFile, mapper.writeValueAsString(cfg));
    }

    private DecipherApp app() {
        return new DecipherApp(cfgFile, new PrintStream(buf, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsKeyAndPlaintextAndJournalsTheRun() throws IOException {
        assertEquals(DecipherApp.EXIT_SOLVED, app().run("XQM RBX"));

        String out = output();
        assertTrue(out.startsWith("Key:"), out);
        assertTrue(out.contains("  X -> T"), out);
        assertTrue(out.contains("  B -> A"), out);
        assertTrue(out.contains("THE CAT"), out);

        Path data = tmp.resolve("data");
        List<SolveEvent> events = new EventStore(new FileIO(data), mapper, data.resolve("solves.jsonl")).readAll();
        assertEquals(1, events.size());
        assertEquals("SOLVED", events.get(0).type);
        assertEquals("THE CAT", events.get(0).plaintext);
    }

    @Test
    void unsolvableTextExitsWithOne() throws IOException {
        assertEquals(DecipherApp.EXIT_UNSOLVED, app().run("AB CD"));
        assertTrue(output().contains("No key found (EXHAUSTED, trials=676)."), output());
    }

    @Test
    void invalidThresholdExitsWithTwo() throws IOException {
        DecipherConfig cfg = config();
        cfg.search.threshold = 1.5;
        writeConfig(cfg);

        assertEquals(DecipherApp.EXIT_INVALID, app().run("XQM RBX"));
        assertEquals("", output());
    }

    @Test
    void malformedConfigExitsWithTwo() throws IOException {
        Files.writeString(cfgFile, "{ not json");

        assertEquals(DecipherApp.EXIT_INVALID, app().run("AB AB"));
        assertEquals("", output());
    }

    @Test
    void badWordListLineWithFailFastExitsWithTwo() throws IOException {
        Files.writeString(tmp.resolve("dicts/words.txt"), "THE\nC4T\n");
        DecipherConfig cfg = config();
        cfg.dictionary.failFast = true;
        writeConfig(cfg);

        assertEquals(DecipherApp.EXIT_INVALID, app().run("XQM RBX"));
        assertEquals("", output());
    }

    @Test
    void rejectedCharacterExitsWithTwo() throws IOException {
        DecipherConfig cfg = config();
        cfg.search.characterPolicy = "REJECT";
        writeConfig(cfg);

        assertEquals(DecipherApp.EXIT_INVALID, app().run("XQM, RBX"));
    }

    @Test
    void disabledJournalWritesNothing() throws IOException {
        DecipherConfig cfg = config();
        cfg.events.enabled = false;
        writeConfig(cfg);

        assertEquals(DecipherApp.EXIT_SOLVED, app().run("XQM RBX"));
        assertFalse(Files.exists(tmp.resolve("data/solves.jsonl")));
    }
}
