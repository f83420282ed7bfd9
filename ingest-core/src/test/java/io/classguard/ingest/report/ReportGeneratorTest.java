package io.classguard.ingest.report;

import io.classguard.ingest.TestDatabases;
import io.classguard.store.model.Reading;
import io.classguard.store.repository.ReadingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

class ReportGeneratorTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Ho_Chi_Minh");
    private static final Instant NOW = Instant.parse("2025-03-10T10:00:00Z");
    private static final Instant SINCE = NOW.minus(Duration.ofHours(24));

    private ReadingRepository repository;
    private ReportGenerator generator;

    @BeforeEach
    void setUp() {
        repository = new ReadingRepository(TestDatabases.h2(), ZONE);
        generator = new ReportGenerator(repository, ZONE, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void store(Instant ts, double temperature) {
        repository.append(Reading.builder().temperature(temperature).score(70).timestamp(ts).receivedAt(ts).build());
    }

    @Test
    @DisplayName("rows are formatted like the printed report, oldest first")
    void formatsRows() {
        repository.append(Reading.builder()
                .temperature(24.56).humidity(61.04).co2(812.4).light(333.6).noise(55.24)
                .score(80)
                .timestamp(Instant.parse("2025-03-10T01:05:00Z"))
                .receivedAt(NOW)
                .build());
        repository.append(Reading.builder()
                .co2(0.0)
                .timestamp(Instant.parse("2025-03-09T23:59:00Z"))
                .receivedAt(NOW)
                .build());
        store(SINCE.minusSeconds(1), 99.0);

        Report report = generator.buildReport(SINCE, NOW, 50);

        assertThat(report.getHeaders()).containsExactly(
                "Time", "Temp (°C)", "Humidity (%)", "CO2 (ppm)", "Light (lux)", "Noise (dB)", "Score");
        assertThat(report.getRows()).hasSize(2);
        assertThat(report.getRows().get(0).getCells())
                .containsExactly("2025-03-10 06:59", "N/A", "N/A", "0", "N/A", "N/A", "0");
        assertThat(report.getRows().get(1).getCells())
                .containsExactly("2025-03-10 08:05", "24.6", "61.0", "812", "334", "55.2", "80");
        assertThat(report.isTruncated()).isFalse();
        assertThat(report.getGeneratedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("when the window holds more than maxRows, the most recent rows are kept")
    void keepsMostRecentRows() {
        for (int i = 0; i < 7; i++) {
            store(NOW.minus(Duration.ofMinutes(70 - 10L * i)), i);
        }

        Report report = generator.buildReport(SINCE, NOW, 5);

        assertThat(report.getRows()).extracting(row -> row.getCells().get(1))
                .containsExactly("2.0", "3.0", "4.0", "5.0", "6.0");
        assertThat(report.isTruncated()).isTrue();
    }

    @Test
    @DisplayName("row limits above the page size are filled across several pages")
    void pagesBeyondMaxPageSize() {
        for (int i = 0; i < 520; i++) {
            store(NOW.minus(Duration.ofSeconds(600 - i)), i);
        }

        Report report = generator.buildReport(SINCE, NOW, 510);

        List<String> temperatures = report.getRows().stream()
                .map(row -> row.getCells().get(1))
                .collect(Collectors.toList());
        assertThat(temperatures).hasSize(510);
        assertThat(temperatures.get(0)).isEqualTo("10.0");
        assertThat(temperatures.get(509)).isEqualTo("519.0");
        assertThat(report.isTruncated()).isTrue();
    }

    @Test
    @DisplayName("readings stored while a multi-page report is built neither shift nor duplicate rows")
    void concurrentAppendsDoNotShiftPages() {
        for (int i = 0; i < 600; i++) {
            store(NOW.minus(Duration.ofSeconds(700 - i)), i);
        }
        ReadingRepository live = spy(repository);
        AtomicBoolean appended = new AtomicBoolean();
        doAnswer(invocation -> {
            Object page = invocation.callRealMethod();
            if (appended.compareAndSet(false, true)) {
                store(NOW.minusSeconds(1), 9999);
            }
            return page;
        }).when(live).query(any(), anyInt(), anyInt());
        generator = new ReportGenerator(live, ZONE, Clock.fixed(NOW, ZoneOffset.UTC));

        Report report = generator.buildReport(SINCE, NOW, 600);

        List<String> temperatures = report.getRows().stream()
                .map(row -> row.getCells().get(1))
                .collect(Collectors.toList());
        assertThat(temperatures).hasSize(600).doesNotHaveDuplicates().doesNotContain("9999.0");
        assertThat(temperatures.get(0)).isEqualTo("0.0");
        assertThat(temperatures.get(599)).isEqualTo("599.0");
        assertThat(report.isTruncated()).isFalse();
    }

    @Test
    @DisplayName("an empty window yields an empty report with headers")
    void emptyWindow() {
        Report report = generator.buildReport(SINCE, NOW, 50);

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.getHeaders()).hasSize(7);
        assertThat(generator.buildReport(SINCE, NOW, 0).isEmpty()).isTrue();
    }
}
