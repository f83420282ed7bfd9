package io.classguard.ingest.api;

import io.classguard.ingest.aggregate.AggregateBucket;
import io.classguard.ingest.aggregate.AggregationEngine;
import io.classguard.ingest.cache.LatestStateCache;
import io.classguard.ingest.cache.StateSnapshot;
import io.classguard.ingest.control.ControlDispatcher;
import io.classguard.ingest.control.ControlResult;
import io.classguard.ingest.report.Report;
import io.classguard.ingest.report.ReportGenerator;
import io.classguard.store.PersistenceException;
import io.classguard.store.model.ControlCommand;
import io.classguard.store.repository.ControlCommandRepository;
import io.classguard.store.repository.ReadingFilter;
import io.classguard.store.repository.ReadingPage;
import io.classguard.store.repository.ReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Read and control operations offered to the dashboard. Store failures on the
 * read path are logged and answered with empty results.
 */
public class ClassGuardQueryApi {

    private static final Logger logger = LoggerFactory.getLogger(ClassGuardQueryApi.class);

    private final LatestStateCache cache;
    private final ReadingRepository readings;
    private final ControlCommandRepository commands;
    private final AggregationEngine aggregation;
    private final ControlDispatcher dispatcher;
    private final ReportGenerator reports;
    private final Clock clock;

    public ClassGuardQueryApi(LatestStateCache cache, ReadingRepository readings, ControlCommandRepository commands,
                              AggregationEngine aggregation, ControlDispatcher dispatcher,
                              ReportGenerator reports, Clock clock) {
        this.cache = cache;
        this.readings = readings;
        this.commands = commands;
        this.aggregation = aggregation;
        this.dispatcher = dispatcher;
        this.reports = reports;
        this.clock = clock;
    }

    public StateSnapshot getLatest() {
        return cache.get();
    }

    /**
     * Page of stored readings, newest first. {@code date} restricts the page
     * to one calendar day in the configured zone; {@code null} lists everything.
     */
    public ReadingPage listHistory(LocalDate date, int page, int pageSize) {
        ReadingFilter filter = date == null ? ReadingFilter.all() : ReadingFilter.onDate(date);
        try {
            return readings.query(filter, page, pageSize);
        } catch (PersistenceException e) {
            logger.error("History query failed for {}, page {}", filter, page, e);
            return ReadingPage.empty(page, pageSize);
        }
    }

    /**
     * Chart series for the window ending now, split into {@code bucketCount}
     * equal buckets.
     */
    public List<AggregateBucket> getChartSeries(Duration window, int bucketCount) {
        if (window == null || window.isZero() || window.isNegative() || bucketCount <= 0) {
            return Collections.emptyList();
        }
        Instant until = clock.instant();
        Instant since = until.minus(window);
        Duration width = window.dividedBy(bucketCount);
        if (width.isZero()) {
            return Collections.emptyList();
        }
        try {
            return aggregation.aggregate(since, until, width, bucketCount);
        } catch (PersistenceException e) {
            logger.error("Chart aggregation failed for the last {}", window, e);
            return Collections.emptyList();
        }
    }

    public ControlResult issueControl(String device, boolean state, String actorRole) {
        return issueControl(device, state, actorRole, null);
    }

    public ControlResult issueControl(String device, boolean state, String actorRole, String issuedBy) {
        return dispatcher.issue(device, state, actorRole, issuedBy);
    }

    public Report buildReport(Duration window, int maxRows) {
        Instant until = clock.instant();
        Instant since = until.minus(window);
        try {
            return reports.buildReport(since, until, maxRows);
        } catch (PersistenceException e) {
            logger.error("Report generation failed for the last {}", window, e);
            return Report.empty(ReportGenerator.HEADERS, until, since, until);
        }
    }

    /** Most recent audited control commands, newest first. */
    public List<ControlCommand> recentCommands(int limit) {
        if (commands == null) {
            return Collections.emptyList();
        }
        try {
            return commands.findRecent(limit);
        } catch (PersistenceException e) {
            logger.error("Failed to load recent control commands", e);
            return Collections.emptyList();
        }
    }

    public long storedReadingCount() {
        try {
            return readings.count();
        } catch (PersistenceException e) {
            logger.error("Failed to count stored readings", e);
            return -1;
        }
    }
}
