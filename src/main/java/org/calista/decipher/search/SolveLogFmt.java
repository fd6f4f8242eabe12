package org.calista.decipher.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SolveLogFmt — renders key/value lines into a box for readable solve summaries in logs.
 */
public final class SolveLogFmt {

    private SolveLogFmt() {}

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(16);

        public BoxBuilder kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public BoxBuilder sep() {
            lines.add(SEP);
            return this;
        }
    }

    private static final String SEP = "--";

    private static String renderBox(String title, List<String> lines) {
        int contentWidth = title.length();
        for (String l : lines) {
            if (SEP.equals(l)) continue;
            contentWidth = Math.max(contentWidth, l.length());
        }
        int w = Math.max(24, contentWidth + 2);

        StringBuilder out = new StringBuilder((lines.size() + 4) * (w + 4));
        out.append('+').append("-".repeat(w)).append("+\n");
        out.append("| ").append(padRight(title, w - 1)).append("|\n");
        out.append('+').append("-".repeat(w)).append("+\n");
        for (String l : lines) {
            if (SEP.equals(l)) {
                out.append('|').append("-".repeat(w)).append("|\n");
                continue;
            }
            out.append("| ").append(padRight(l, w - 1)).append("|\n");
        }
        out.append('+').append("-".repeat(w)).append('+');
        return out.toString();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
