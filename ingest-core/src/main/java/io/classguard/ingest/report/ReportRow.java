package io.classguard.ingest.report;

import java.time.Instant;
import java.util.List;

public final class ReportRow {

    private final Instant timestamp;
    private final List<String> cells;

    public ReportRow(Instant timestamp, List<String> cells) {
        this.timestamp = timestamp;
        this.cells = List.copyOf(cells);
    }

    public Instant getTimestamp() { return timestamp; }
    public List<String> getCells() { return cells; }

    @Override
    public String toString() {
        return String.join(" | ", cells);
    }
}
