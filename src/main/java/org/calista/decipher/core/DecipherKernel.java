package org.calista.decipher.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.dictionary.Dictionary;
import org.calista.decipher.dictionary.InMemoryDictionary;
import org.calista.decipher.dictionary.WordListLoader;
import org.calista.decipher.events.EventStore;
import org.calista.decipher.io.FileIO;
import org.calista.decipher.search.Solver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * DecipherKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> load or create config, init I/O and journal (no dictionary yet)
 *   2) loadDictionary()   -> read word lists into an immutable dictionary (explicit, once)
 *   3) solver()           -> compose a Solver from config + dictionary
 */
public final class DecipherKernel {

    private static final Logger log = LoggerFactory.getLogger(DecipherKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final DecipherConfig cfg;
    private final Path configRoot;
    private final EventStore events;

    private volatile Dictionary dictionary;

    private DecipherKernel(FileIO io, ObjectMapper mapper, DecipherConfig cfg, Path configRoot, EventStore events) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
        this.events = Objects.requireNonNull(events, "events");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Directory the config file and relative dirs are resolved against.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /**
         * Loads/creates config and initializes I/O. Does NOT load the dictionary.
         */
        public DecipherKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            Path root = configRoot.toAbsolutePath().normalize();

            FileIO external = new FileIO(root, charset);
            Path cfgPath = configFile.isAbsolute() ? configFile : root.resolve(configFile);

            DecipherConfig cfg = DecipherConfig.loadOrCreate(external, cfgPath, om);

            Path base = Path.of(cfg.baseDir);
            FileIO io = new FileIO(base.isAbsolute() ? base : root.resolve(base), charset);

            EventStore events = new EventStore(io, om, io.resolve(cfg.events.logFile));

            DecipherKernel k = new DecipherKernel(io, om, cfg, root, events);
            log.info("DecipherKernel created: config={}, baseDir={}, threshold={}",
                    cfgPath, io.baseDir(), cfg.search.threshold);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Dictionary (explicit)
    // ---------------------------------------------------------------------

    /**
     * Reads the configured word lists (and the bundled one, if enabled).
     * Can be called once; repeated calls return the loaded dictionary.
     */
    public synchronized Dictionary loadDictionary() throws IOException {
        if (dictionary != null) return dictionary;

        WordListLoader loader = new WordListLoader(io);
        InMemoryDictionary.Builder b = InMemoryDictionary.builder();

        if (cfg.dictionary.useBundled) {
            loader.loadResource(b, WordListLoader.BUNDLED_RESOURCE, cfg.dictionary.failFast);
        }

        Path dir = Path.of(cfg.dictionary.dir);
        Path dictDir = io.resolveExternal(dir.isAbsolute() ? dir : configRoot.resolve(dir));
        int files = 0;
        for (String name : cfg.dictionary.files) {
            if (name == null || name.isBlank()) continue;
            loader.loadInto(b, dictDir.resolve(name), cfg.dictionary.failFast);
            files++;
        }

        dictionary = b.build();
        log.info("Dictionary loaded: dir={}, files={}, bundled={}, words={}, droppedSingleLetters={}",
                dictDir, files, cfg.dictionary.useBundled, dictionary.size(), b.dropped());
        if (dictionary.isEmpty()) {
            log.warn("Dictionary is empty: every fully resolved token will count as a non-word");
        }
        return dictionary;
    }

    public boolean isDictionaryLoaded() {
        return dictionary != null;
    }

    /** Solver over the loaded dictionary; loads it first if needed. */
    public Solver solver() throws IOException {
        return Solver.builder(loadDictionary())
                .config(cfg.toSolverConfig())
                .build();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public DecipherConfig config() { return cfg; }
    public EventStore eventStore() { return events; }
}
