package org.calista.decipher.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.cipher.CharacterPolicy;
import org.calista.decipher.io.FileIO;
import org.calista.decipher.search.Solver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * DecipherConfig — plain POJO config:
 * - defaults live in the fields
 * - loadOrCreate() writes a default file when it is missing or blank
 * - validate() normalizes values; an invalid threshold is rejected, not clamped
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DecipherConfig {

    private static final Logger log = LoggerFactory.getLogger(DecipherConfig.class);

    public String baseDir = "data";
    public Dictionary dictionary = new Dictionary();
    public Search search = new Search();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Dictionary {
        public String dir = "dictionaries";
        public List<String> files = List.of("words.txt");
        /** Also load the bundled common-words list from the classpath. */
        public boolean useBundled = true;
        public boolean failFast = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Search {
        public double threshold = Solver.Config.DEFAULT_THRESHOLD;
        /** PASS_THROUGH or REJECT. */
        public String characterPolicy = CharacterPolicy.PASS_THROUGH.name();
        public long maxTrials = 0;
        public long timeoutMs = 0;
        public int traceLines = 0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public boolean enabled = true;
        public String logFile = "solves.jsonl";
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or blank file is replaced by the defaults, written to disk.
     */
    public static DecipherConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            DecipherConfig created = new DecipherConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            DecipherConfig created = new DecipherConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        DecipherConfig cfg = mapper.readValue(json, DecipherConfig.class);
        if (cfg == null) cfg = new DecipherConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, DecipherConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, DecipherConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    /**
     * @throws IllegalArgumentException if {@code search.threshold} is outside (0,1]
     */
    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (dictionary == null) dictionary = new Dictionary();
        if (dictionary.dir == null || dictionary.dir.isBlank()) dictionary.dir = "dictionaries";
        if (dictionary.files == null) dictionary.files = List.of();

        if (search == null) search = new Search();
        Solver.Config.validateThreshold(search.threshold);

        CharacterPolicy policy = CharacterPolicy.parse(search.characterPolicy);
        if (search.characterPolicy != null && !search.characterPolicy.isBlank()
                && !policy.name().equalsIgnoreCase(search.characterPolicy.trim().replace('-', '_'))) {
            log.warn("Unknown search.characterPolicy '{}' -> fallback to {}", search.characterPolicy, policy);
        }
        search.characterPolicy = policy.name();

        if (search.maxTrials < 0) search.maxTrials = 0;
        if (search.timeoutMs < 0) search.timeoutMs = 0;
        if (search.traceLines < 0) search.traceLines = 0;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "solves.jsonl";
    }

    /** Solver settings from the {@code search} section. */
    public Solver.Config toSolverConfig() {
        Solver.Config c = new Solver.Config();
        c.threshold = search.threshold;
        c.characterPolicy = CharacterPolicy.parse(search.characterPolicy);
        c.maxTrials = search.maxTrials;
        c.timeoutMs = search.timeoutMs;
        c.traceLines = search.traceLines;
        return c;
    }
}
