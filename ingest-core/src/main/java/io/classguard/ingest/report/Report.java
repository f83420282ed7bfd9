package io.classguard.ingest.report;

import java.time.Instant;
import java.util.List;

/**
 * Tabular summary of stored readings, already formatted for display.
 * Rows are in ascending time order.
 */
public final class Report {

    private final List<String> headers;
    private final List<ReportRow> rows;
    private final Instant generatedAt;
    private final Instant since;
    private final Instant until;
    private final boolean truncated;

    public Report(List<String> headers, List<ReportRow> rows, Instant generatedAt,
                  Instant since, Instant until, boolean truncated) {
        this.headers = List.copyOf(headers);
        this.rows = List.copyOf(rows);
        this.generatedAt = generatedAt;
        this.since = since;
        this.until = until;
        this.truncated = truncated;
    }

    public static Report empty(List<String> headers, Instant generatedAt, Instant since, Instant until) {
        return new Report(headers, List.of(), generatedAt, since, until, false);
    }

    public List<String> getHeaders() { return headers; }
    public List<ReportRow> getRows() { return rows; }
    public Instant getGeneratedAt() { return generatedAt; }
    public Instant getSince() { return since; }
    public Instant getUntil() { return until; }

    /** True when older readings in the window were left out to respect the row limit. */
    public boolean isTruncated() { return truncated; }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
