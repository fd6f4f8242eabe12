package org.calista.decipher.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.decipher.search.SolveResult;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class SolveEvent {
    public String type;        // "SOLVED", "EXHAUSTED", "BUDGET_EXCEEDED"
    public long tsEpochMs;
    public String runId;
    public String ciphertext;
    public String plaintext;   // null unless solved
    public String key;         // compact "A->N B->O", null unless solved
    public long trials;
    public long elapsedMs;

    public static SolveEvent of(String runId, SolveResult r, long tsEpochMs) {
        SolveEvent e = new SolveEvent();
        e.type = r.status.name();
        e.tsEpochMs = tsEpochMs;
        e.runId = runId;
        e.ciphertext = r.ciphertext;
        e.plaintext = r.plaintext().orElse(null);
        e.key = r.key().map(Object::toString).orElse(null);
        e.trials = r.report == null ? 0 : r.report.trials;
        e.elapsedMs = r.elapsedMs;
        return e;
    }
}
