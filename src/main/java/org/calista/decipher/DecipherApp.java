package org.calista.decipher;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.core.DecipherKernel;
import org.calista.decipher.events.SolveEvent;
import org.calista.decipher.search.SolveResult;
import org.calista.decipher.search.Solver;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * DecipherApp — console runner.
 *
 * Usage: {@code DecipherApp [ciphertext-file] [config-file]}; without a file the ciphertext is read from stdin.
 *
 * Lifecycle:
 *  1) build kernel (config + I/O)
 *  2) load dictionary
 *  3) solve, print key and decoded text
 *  4) journal the run
 *
 * Exit codes: 0 solved, 1 no key found, 2 bad input or configuration.
 */
public final class DecipherApp {

    private static final Logger log = LogManager.getLogger(DecipherApp.class);

    public static final int EXIT_SOLVED = 0;
    public static final int EXIT_UNSOLVED = 1;
    public static final int EXIT_INVALID = 2;

    private final Path cfgPath;
    private final PrintStream out;

    public DecipherApp(Path cfgPath, PrintStream out) {
        this.cfgPath = cfgPath;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        Path input = args.length > 0 ? Path.of(args[0]) : null;
        Path cfg = args.length > 1 ? Path.of(args[1]) : Path.of("config/decipher.json");

        String ciphertext = (input != null)
                ? Files.readString(input, StandardCharsets.UTF_8)
                : readAll(System.in);

        System.exit(new DecipherApp(cfg, System.out).run(ciphertext));
    }

    public int run(String ciphertext) throws IOException {
        DecipherKernel kernel;
        Solver solver;
        try {
            kernel = DecipherKernel.builder().build(cfgPath);
            solver = kernel.solver();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration {}: {}", cfgPath, e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            // malformed config JSON, unreadable or malformed word list (failFast)
            log.error("Failed to load configuration or dictionary from {}", cfgPath, e);
            return EXIT_INVALID;
        }

        SolveResult result;
        try {
            result = solver.solve(ciphertext);
        } catch (IllegalArgumentException e) {
            log.error("Rejected ciphertext: {}", e.getMessage());
            return EXIT_INVALID;
        }

        print(result);

        if (kernel.config().events.enabled) {
            String runId = "run-" + Long.toHexString(System.nanoTime());
            kernel.eventStore().append(SolveEvent.of(runId, result, System.currentTimeMillis()));
        }

        return result.solved() ? EXIT_SOLVED : EXIT_UNSOLVED;
    }

    private void print(SolveResult r) {
        if (!r.solved()) {
            out.println("No key found (" + r.status + ", trials=" + r.report.trials + ").");
            return;
        }

        out.println("Key:");
        for (Map.Entry<Character, Character> e : r.requireKey().asMap().entrySet()) {
            out.println("  " + e.getKey() + " -> " + e.getValue());
        }
        out.println();
        out.println(r.plaintext().orElse(""));
    }

    private static String readAll(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
