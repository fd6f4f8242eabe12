package org.calista.decipher.dictionary;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.io.FileIO;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * WordListLoader — fills an {@link InMemoryDictionary.Builder} from plain word lists.
 *
 * Format: one word per line, blank lines and lines starting with '#' ignored.
 * A word is letters only, optionally with inner apostrophes ("DON'T"); anything else is a bad line.
 */
public final class WordListLoader {
    private static final Logger log = LogManager.getLogger(WordListLoader.class);

    /** Bundled fallback list on the classpath. */
    public static final String BUNDLED_RESOURCE = "dictionary/common-words.txt";

    private final FileIO io;

    public WordListLoader(FileIO io) {
        this.io = Objects.requireNonNull(io, "io");
    }

    public Report loadInto(InMemoryDictionary.Builder dict, Path wordList, boolean failFast) throws IOException {
        Objects.requireNonNull(dict, "dict");
        Objects.requireNonNull(wordList, "wordList");

        if (!io.exists(wordList)) {
            log.warn("Word list not found: {}", wordList);
            return new Report(wordList.toString(), 0, 0, 0);
        }

        Counter counter = new Counter(wordList.toString(), failFast);
        try (Stream<String> lines = io.lines(wordList)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) counter.accept(dict, it.next());
        }

        Report r = counter.report();
        log.info("Word list loaded: {} (ok={}, bad={}, skipped={})", wordList, r.ok, r.bad, r.skipped);
        return r;
    }

    /** Loads a classpath resource, e.g. {@link #BUNDLED_RESOURCE}. */
    public Report loadResource(InMemoryDictionary.Builder dict, String resource, boolean failFast) throws IOException {
        Objects.requireNonNull(dict, "dict");
        Objects.requireNonNull(resource, "resource");

        InputStream in = WordListLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.warn("Word list resource not found: {}", resource);
            return new Report("classpath:" + resource, 0, 0, 0);
        }

        Counter counter = new Counter("classpath:" + resource, failFast);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) counter.accept(dict, line);
        }

        Report r = counter.report();
        log.info("Word list loaded: {} (ok={}, bad={}, skipped={})", r.source, r.ok, r.bad, r.skipped);
        return r;
    }

    static boolean isWord(String w) {
        if (w.isEmpty()) return false;
        for (int i = 0; i < w.length(); i++) {
            char c = w.charAt(i);
            if (Character.isLetter(c)) continue;
            if (c == '\'' && i > 0 && i < w.length() - 1) continue;
            return false;
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static final class Counter {
        private final String source;
        private final boolean failFast;
        private int ok, bad, skipped, lineNo;

        Counter(String source, boolean failFast) {
            this.source = source;
            this.failFast = failFast;
        }

        void accept(InMemoryDictionary.Builder dict, String raw) throws IOException {
            lineNo++;
            String w = raw == null ? "" : raw.trim();
            if (w.isEmpty() || w.startsWith("#")) return;

            if (!isWord(w)) {
                bad++;
                log.warn("Bad word-list line {}:{}: '{}'", source, lineNo, w);
                if (failFast) throw new IOException("Bad word-list line " + source + ":" + lineNo + ": '" + w + "'");
                return;
            }
            if (dict.add(w)) ok++;
            else skipped++;
        }

        Report report() {
            return new Report(source, ok, bad, skipped);
        }
    }

    public static final class Report {
        public final String source;
        /** Words added. */
        public final int ok;
        /** Malformed lines. */
        public final int bad;
        /** Duplicates and dropped single letters. */
        public final int skipped;

        public Report(String source, int ok, int bad, int skipped) {
            this.source = source;
            this.ok = ok;
            this.bad = bad;
            this.skipped = skipped;
        }
    }
}
