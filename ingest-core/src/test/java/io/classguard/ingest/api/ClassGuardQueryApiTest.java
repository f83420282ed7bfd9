package io.classguard.ingest.api;

import io.classguard.ingest.aggregate.AggregateBucket;
import io.classguard.ingest.aggregate.AggregationEngine;
import io.classguard.ingest.cache.LatestStateCache;
import io.classguard.ingest.control.ControlDispatcher;
import io.classguard.ingest.control.ControlResult;
import io.classguard.ingest.report.Report;
import io.classguard.ingest.report.ReportGenerator;
import io.classguard.store.PersistenceException;
import io.classguard.store.model.Reading;
import io.classguard.store.repository.ControlCommandRepository;
import io.classguard.store.repository.ReadingFilter;
import io.classguard.store.repository.ReadingPage;
import io.classguard.store.repository.ReadingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClassGuardQueryApiTest {

    private static final Instant NOW = Instant.parse("2025-03-10T10:00:00Z");

    @Mock
    private ReadingRepository readings;
    @Mock
    private ControlCommandRepository commands;
    @Mock
    private AggregationEngine aggregation;
    @Mock
    private ControlDispatcher dispatcher;
    @Mock
    private ReportGenerator reports;

    private final LatestStateCache cache = new LatestStateCache();
    private ClassGuardQueryApi api;

    @BeforeEach
    void setUp() {
        api = new ClassGuardQueryApi(cache, readings, commands, aggregation, dispatcher, reports,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("getLatest serves the cache without touching the store")
    void latestComesFromCache() {
        Reading reading = Reading.builder().temperature(25.0).receivedAt(NOW).build();
        cache.setReading(reading);

        assertThat(api.getLatest().getReading()).isEqualTo(reading);
        verifyNoInteractions(readings);
    }

    @Test
    @DisplayName("listHistory filters on the requested day")
    void historyByDate() {
        ReadingPage page = new ReadingPage(List.of(), 2, 20, 30);
        when(readings.query(any(), eq(2), eq(20))).thenReturn(page);

        assertThat(api.listHistory(LocalDate.of(2025, 3, 10), 2, 20)).isSameAs(page);

        ArgumentCaptor<ReadingFilter> filter = ArgumentCaptor.forClass(ReadingFilter.class);
        verify(readings).query(filter.capture(), eq(2), eq(20));
        assertThat(filter.getValue().getDate()).isEqualTo(LocalDate.of(2025, 3, 10));
    }

    @Test
    @DisplayName("store failures on the read path become empty answers")
    void storeFailureGivesEmptyResults() {
        when(readings.query(any(), anyInt(), anyInt())).thenThrow(new PersistenceException("down"));
        when(aggregation.aggregate(any(), any(), any(), anyInt())).thenThrow(new PersistenceException("down"));
        when(reports.buildReport(any(), any(), anyInt())).thenThrow(new PersistenceException("down"));

        assertThat(api.listHistory(null, 1, 20).isEmpty()).isTrue();
        assertThat(api.getChartSeries(Duration.ofHours(1), 12)).isEmpty();
        Report report = api.buildReport(Duration.ofHours(24), 50);
        assertThat(report.isEmpty()).isTrue();
        assertThat(report.getHeaders()).isEqualTo(ReportGenerator.HEADERS);
    }

    @Test
    @DisplayName("chart windows end now and are split evenly")
    void chartWindow() {
        List<AggregateBucket> series = List.of();
        when(aggregation.aggregate(NOW.minus(Duration.ofHours(1)), NOW, Duration.ofMinutes(5), 12)).thenReturn(series);

        assertThat(api.getChartSeries(Duration.ofHours(1), 12)).isSameAs(series);
        assertThat(api.getChartSeries(Duration.ofHours(1), 0)).isEmpty();
    }

    @Test
    @DisplayName("reports cover the window ending now")
    void reportWindow() {
        Report report = Report.empty(ReportGenerator.HEADERS, NOW, NOW.minus(Duration.ofHours(24)), NOW);
        when(reports.buildReport(NOW.minus(Duration.ofHours(24)), NOW, 50)).thenReturn(report);

        assertThat(api.buildReport(Duration.ofHours(24), 50)).isSameAs(report);
    }

    @Test
    void controlIsDelegated() {
        when(dispatcher.issue("fan", true, "admin", "teacher1")).thenReturn(ControlResult.SUCCESS);

        assertThat(api.issueControl("fan", true, "admin", "teacher1")).isEqualTo(ControlResult.SUCCESS);
    }

    @Test
    void countFailureIsReportedAsUnknown() {
        when(readings.count()).thenThrow(new PersistenceException("down"));

        assertThat(api.storedReadingCount()).isEqualTo(-1);
        when(commands.findRecent(10)).thenThrow(new PersistenceException("down"));
        assertThat(api.recentCommands(10)).isEmpty();
    }
}
