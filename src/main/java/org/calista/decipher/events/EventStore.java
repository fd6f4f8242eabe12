package org.calista.decipher.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSONL journal of solve runs.
 */
public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public void append(SolveEvent e) throws IOException {
        Objects.requireNonNull(e, "event");
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    public List<SolveEvent> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        ArrayList<SolveEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) out.add(mapper.readValue(line, SolveEvent.class));
        return out;
    }

    public Path file() {
        return file;
    }
}
