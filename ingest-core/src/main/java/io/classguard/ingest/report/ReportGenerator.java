package io.classguard.ingest.report;

import io.classguard.store.model.Reading;
import io.classguard.store.repository.ReadingFilter;
import io.classguard.store.repository.ReadingPage;
import io.classguard.store.repository.ReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Builds the classroom history table. When the window holds more readings
 * than {@code maxRows}, the most recent ones are kept. Readings appended
 * while the report is being built are left out.
 */
public class ReportGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ReportGenerator.class);

    public static final List<String> HEADERS = List.of(
            "Time", "Temp (°C)", "Humidity (%)", "CO2 (ppm)", "Light (lux)", "Noise (dB)", "Score");
    static final String NOT_AVAILABLE = "N/A";

    private final ReadingRepository repository;
    private final DateTimeFormatter timeFormat;
    private final Clock clock;

    public ReportGenerator(ReadingRepository repository, ZoneId zone, Clock clock) {
        this.repository = repository;
        this.timeFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(zone);
        this.clock = clock;
    }

    public Report buildReport(Instant since, Instant until, int maxRows) {
        Instant generatedAt = clock.instant();
        if (maxRows <= 0 || !until.isAfter(since)) {
            return Report.empty(HEADERS, generatedAt, since, until);
        }

        // later pages must not shift when readings arrive mid-report
        ReadingFilter filter = ReadingFilter.between(since, until).upToId(repository.lastId());
        List<Reading> newestFirst = new ArrayList<>(Math.min(maxRows, ReadingRepository.MAX_PAGE_SIZE));
        long total = 0;
        int page = 1;
        while (newestFirst.size() < maxRows) {
            int pageSize = Math.min(ReadingRepository.MAX_PAGE_SIZE, maxRows);
            ReadingPage result = repository.query(filter, page, pageSize);
            total = result.getTotalItems();
            for (Reading reading : result.getItems()) {
                if (newestFirst.size() == maxRows) {
                    break;
                }
                newestFirst.add(reading);
            }
            if (!result.hasNext()) {
                break;
            }
            page++;
        }

        Collections.reverse(newestFirst);
        List<ReportRow> rows = new ArrayList<>(newestFirst.size());
        for (Reading reading : newestFirst) {
            rows.add(toRow(reading));
        }
        boolean truncated = total > rows.size();
        logger.info("Built report for [{}, {}): {} rows{}", since, until, rows.size(),
                truncated ? " (" + total + " matched)" : "");
        return new Report(HEADERS, rows, generatedAt, since, until, truncated);
    }

    private ReportRow toRow(Reading reading) {
        List<String> cells = new ArrayList<>(HEADERS.size());
        cells.add(reading.getTimestamp() == null ? NOT_AVAILABLE : timeFormat.format(reading.getTimestamp()));
        cells.add(format(reading.getTemperature(), "%.1f"));
        cells.add(format(reading.getHumidity(), "%.1f"));
        cells.add(format(reading.getCo2(), "%.0f"));
        cells.add(format(reading.getLight(), "%.0f"));
        cells.add(format(reading.getNoise(), "%.1f"));
        cells.add(Integer.toString(reading.getScore()));
        return new ReportRow(reading.getTimestamp(), cells);
    }

    private static String format(Double value, String pattern) {
        return value == null ? NOT_AVAILABLE : String.format(Locale.ROOT, pattern, value);
    }
}
