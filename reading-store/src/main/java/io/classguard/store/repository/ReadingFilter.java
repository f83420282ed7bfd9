package io.classguard.store.repository;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Optional constraints on reading timestamps. {@code since} is inclusive,
 * {@code until} exclusive; {@code date} selects one calendar day in the
 * repository's zone. All set constraints apply together.
 * <p>
 * {@code maxId} limits the result to readings appended up to that sequence id,
 * so several pages of one listing see the same rows while ingestion goes on.
 */
public final class ReadingFilter {

    private static final ReadingFilter ALL = new ReadingFilter(null, null, null, null);

    private final Instant since;
    private final Instant until;
    private final LocalDate date;
    private final Long maxId;

    private ReadingFilter(Instant since, Instant until, LocalDate date, Long maxId) {
        this.since = since;
        this.until = until;
        this.date = date;
        this.maxId = maxId;
    }

    public static ReadingFilter all() {
        return ALL;
    }

    public static ReadingFilter between(Instant since, Instant until) {
        return new ReadingFilter(since, until, null, null);
    }

    public static ReadingFilter onDate(LocalDate date) {
        return new ReadingFilter(null, null, date, null);
    }

    public ReadingFilter withDate(LocalDate date) {
        return new ReadingFilter(since, until, date, maxId);
    }

    public ReadingFilter upToId(long maxId) {
        return new ReadingFilter(since, until, date, maxId);
    }

    public Instant getSince() { return since; }
    public Instant getUntil() { return until; }
    public LocalDate getDate() { return date; }
    public Long getMaxId() { return maxId; }

    @Override
    public String toString() {
        return "ReadingFilter{since=" + since + ", until=" + until + ", date=" + date + ", maxId=" + maxId + '}';
    }
}
