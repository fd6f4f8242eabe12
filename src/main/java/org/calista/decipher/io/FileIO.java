package org.calista.decipher.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * FileIO — file access for config, word lists and the solve journal.
 *
 * - config: read whole, written atomically (tmp sibling + move)
 * - word lists: line streams, .gz/.gzip decompressed on the fly
 * - journal: JSONL append / read
 * - {@link #resolve(String)} keeps relative names inside the base dir
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8);
    }

    /**
     * @throws UncheckedIOException if the base dir cannot be created
     */
    public FileIO(Path baseDir, Charset charset) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create base dir " + this.baseDir, e);
        }
        log.debug("FileIO ready: baseDir={}, charset={}", this.baseDir, charset);
    }

    // ----------------------------
    // Paths
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Relative name -> absolute path under the base dir. Backslashes count as separators.
     *
     * @throws IllegalArgumentException for absolute names or names escaping the base dir
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("Absolute path not allowed here: " + relative);

        Path p = baseDir.resolve(rel).normalize();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path escapes base dir: " + relative);
        return p;
    }

    /** Normalizes a path that may live anywhere (word-list dirs, config files). */
    public Path resolveExternal(Path anyPath) {
        return Objects.requireNonNull(anyPath, "anyPath").toAbsolutePath().normalize();
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    // ----------------------------
    // Whole-file text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!isGzip(file)) return Files.readString(file, charset);
        try (GZIPInputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            return new String(in.readAllBytes(), charset);
        }
    }

    /** Replaces {@code file} atomically where the file system allows it. */
    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        createParent(file);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content, charset);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, plain replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    // ----------------------------
    // Lines
    // ----------------------------

    /** Caller closes the stream. */
    public Stream<String> lines(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!isGzip(file)) return Files.lines(file, charset);

        BufferedReader br = new BufferedReader(new InputStreamReader(new GZIPInputStream(Files.newInputStream(file)), charset));
        return br.lines().onClose(() -> {
            try {
                br.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot close " + file, e);
            }
        });
    }

    /** Appends one record; blank records are ignored. */
    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLine, "jsonLine");
        String record = jsonLine.trim();
        if (record.isEmpty()) return;

        createParent(file);
        Files.writeString(file, record + System.lineSeparator(), charset,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /** Non-blank trimmed records; a missing file reads as empty. */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return List.of();
        try (Stream<String> s = lines(file)) {
            return s.map(String::trim).filter(x -> !x.isEmpty()).collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static boolean isGzip(Path file) {
        Path name = file.getFileName();
        if (name == null) return false;
        String n = name.toString().toLowerCase(Locale.ROOT);
        return n.endsWith(".gz") || n.endsWith(".gzip");
    }
}
