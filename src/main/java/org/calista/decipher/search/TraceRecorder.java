package org.calista.decipher.search;

import org.calista.decipher.cipher.Key;
import org.calista.decipher.cipher.RemainingPool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects a bounded, deterministic textual trace of the search (safe to log).
 * Deadend trials are only counted, not recorded, to keep traces readable.
 */
public final class TraceRecorder implements SearchListener {

    private final int maxLines;
    private final ArrayList<String> lines;
    private long dropped;

    public TraceRecorder(int maxLines) {
        this.maxLines = Math.max(0, maxLines);
        this.lines = new ArrayList<>(Math.min(this.maxLines, 256));
    }

    @Override
    public void onEnter(int depth, char cipher, Key key, RemainingPool pool) {
        add("enter d=" + depth + " c=" + cipher + " pool=" + pool.snapshot());
    }

    @Override
    public void onTrial(int depth, char cipher, char plain, DeadendEvaluator.Verdict verdict) {
        if (verdict.deadend) return;
        add("try d=" + depth + " " + cipher + "->" + plain + " " + verdict);
    }

    @Override
    public void onExhausted(int depth, char cipher, Key key, RemainingPool pool) {
        add("backtrack d=" + depth + " c=" + cipher);
    }

    private void add(String line) {
        if (lines.size() < maxLines) lines.add(line);
        else dropped++;
    }

    public List<String> lines() {
        if (dropped == 0) return Collections.unmodifiableList(new ArrayList<>(lines));
        ArrayList<String> out = new ArrayList<>(lines);
        out.add("... " + dropped + " more");
        return Collections.unmodifiableList(out);
    }
}
