package io.classguard.ingest.subscriber;

import io.classguard.ingest.TestDatabases;
import io.classguard.ingest.cache.LatestStateCache;
import io.classguard.ingest.codec.PayloadCodec;
import io.classguard.store.DatabaseManager;
import io.classguard.store.PersistenceException;
import io.classguard.store.model.Device;
import io.classguard.store.model.Reading;
import io.classguard.store.repository.ReadingFilter;
import io.classguard.store.repository.ReadingRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionSubscriberTest {

    private static final String TOPIC = "classguard/sensors";
    private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

    private final FakeBrokerTransport transport = new FakeBrokerTransport();
    private final LatestStateCache cache = new LatestStateCache();
    private final PayloadCodec codec = new PayloadCodec(ZoneOffset.UTC);
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private ReadingRepository repository;
    private IngestionSubscriber subscriber;

    @BeforeEach
    void setUp() {
        repository = new ReadingRepository(TestDatabases.h2(), ZoneId.of("UTC"));
    }

    @AfterEach
    void tearDown() {
        if (subscriber != null) {
            subscriber.stop();
        }
    }

    private static IngestionSubscriber.Settings fastSettings() {
        IngestionSubscriber.Settings settings = new IngestionSubscriber.Settings();
        settings.sensorTopic = TOPIC;
        settings.storeMaxAttempts = 3;
        settings.storeRetryBackoff = new BackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(5));
        settings.reconnectBackoff = new BackoffPolicy(Duration.ofMillis(20), Duration.ofMillis(80));
        return settings;
    }

    private void start(ReadingRepository repo, IngestionSubscriber.Settings settings) {
        subscriber = new IngestionSubscriber(transport, codec, cache, repo, settings, clock);
        subscriber.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> transport.isSubscribed(TOPIC));
    }

    private static byte[] json(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("a reading updates the live view and is stored")
    void readingIsCachedAndStored() {
        start(repository, fastSettings());

        transport.deliver(TOPIC, json("{\"device_id\":\"room-101\",\"temperature\":24.5,\"co2\":700}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getStored() == 1);
        Reading live = cache.get().getReading();
        assertThat(live.getTemperature()).isEqualTo(24.5);
        assertThat(live.getReceivedAt()).isEqualTo(NOW);
        assertThat(repository.latest()).contains(live);
        assertThat(subscriber.getState()).isEqualTo(SubscriberState.SUBSCRIBED);
    }

    @Test
    @DisplayName("malformed payloads are counted and skipped without stopping ingestion")
    void malformedPayloadIsDiscarded() {
        start(repository, fastSettings());

        transport.deliver(TOPIC, json("not json"));
        transport.deliver(TOPIC, json("{\"temperature\":21}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getStored() == 1);
        assertThat(subscriber.getStats().getDecodeFailures()).isEqualTo(1);
        assertThat(subscriber.getStats().getReceived()).isEqualTo(2);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("acknowledgements update device states and are not stored")
    void ackUpdatesDeviceStatus() {
        start(repository, fastSettings());

        transport.deliver(TOPIC, json("{\"fan\":true,\"buzzer\":true}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getAcknowledgements() == 1);
        assertThat(cache.get().getDeviceStatus().isOn(Device.FAN)).isTrue();
        assertThat(cache.get().getDeviceStatus().isOn(Device.BUZZER)).isTrue();
        assertThat(cache.get().getReading().isEmpty()).isTrue();
        assertThat(repository.count()).isZero();
    }

    @Test
    @DisplayName("readings are stored in arrival order")
    void arrivalOrderIsPreserved() {
        start(repository, fastSettings());

        IntStream.rangeClosed(1, 50)
                .forEach(i -> transport.deliver(TOPIC, json("{\"temperature\":" + i + "}")));

        await().atMost(Duration.ofSeconds(10)).until(() -> subscriber.getStats().getStored() == 50);
        List<Double> newestFirst = repository.query(ReadingFilter.all(), 1, 100).getItems().stream()
                .map(Reading::getTemperature)
                .collect(Collectors.toList());
        Collections.reverse(newestFirst);
        assertThat(newestFirst).containsExactlyElementsOf(
                IntStream.rangeClosed(1, 50).mapToObj(i -> (double) i).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("a store outage drops the reading after bounded retries but keeps the live view current")
    void storeOutageDropsAfterRetries() {
        ReadingRepository failing = mock(ReadingRepository.class);
        when(failing.append(any())).thenThrow(new PersistenceException("Database operation failed"));
        start(failing, fastSettings());

        transport.deliver(TOPIC, json("{\"temperature\":30}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getDroppedReadings() == 1);
        verify(failing, times(3)).append(any());
        assertThat(cache.get().getReading().getTemperature()).isEqualTo(30.0);
        assertThat(subscriber.getStats().getStored()).isZero();
    }

    @Test
    @DisplayName("long device ids and status labels are stored like any other reading")
    void longTextFieldsAreStored() {
        String deviceId = "classroom-node-" + "x".repeat(120);
        String status = "Moderate, " + "ventilation recommended ".repeat(10);
        start(repository, fastSettings());

        transport.deliver(TOPIC, json("{\"device_id\":\"" + deviceId + "\",\"status\":\"" + status
                + "\",\"temperature\":22.0}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getStored() == 1);
        assertThat(repository.latest()).hasValueSatisfying(stored -> {
            assertThat(stored.getDeviceId()).isEqualTo(deviceId);
            assertThat(stored.getStatus()).isEqualTo(status);
        });
        assertThat(subscriber.getStats().getDroppedReadings()).isZero();
    }

    @Test
    @DisplayName("a reading the store rejects as invalid data is not retried")
    void dataErrorIsNotRetried() {
        ReadingRepository strict = mock(ReadingRepository.class);
        when(strict.append(any())).thenThrow(new PersistenceException("Database operation failed",
                new SQLException("Value too long for column", "22001")));
        start(strict, fastSettings());

        transport.deliver(TOPIC, json("{\"temperature\":30}"));
        transport.deliver(TOPIC, json("{\"temperature\":31}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getRejectedReadings() == 2);
        verify(strict, times(2)).append(any());
        assertThat(subscriber.getStats().getDroppedReadings()).isZero();
        assertThat(cache.get().getReading().getTemperature()).isEqualTo(31.0);
    }

    @Test
    @DisplayName("ingestion runs against a database that was never reachable")
    void ingestsWithoutDatabase() {
        DatabaseManager offline = new DatabaseManager("jdbc:unknown:nowhere", "sa", "");
        start(new ReadingRepository(offline, ZoneOffset.UTC), fastSettings());

        transport.deliver(TOPIC, json("{\"temperature\":26.5}"));
        transport.deliver(TOPIC, json("{\"temperature\":27.0}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getDroppedReadings() == 2);
        assertThat(cache.get().getReading().getTemperature()).isEqualTo(27.0);
        assertThat(subscriber.getState()).isEqualTo(SubscriberState.SUBSCRIBED);
        assertThat(subscriber.getStats().getStored()).isZero();
    }

    @Test
    @DisplayName("a transient store failure is retried")
    void transientStoreFailureIsRetried() {
        ReadingRepository flaky = mock(ReadingRepository.class);
        when(flaky.append(any()))
                .thenThrow(new PersistenceException("Database connection failed"))
                .thenReturn(7L);
        start(flaky, fastSettings());

        transport.deliver(TOPIC, json("{\"temperature\":30}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getStored() == 1);
        verify(flaky, times(2)).append(any());
        assertThat(subscriber.getStats().getDroppedReadings()).isZero();
    }

    @Test
    @DisplayName("connect failures back off exponentially until the broker is reachable")
    void reconnectBacksOff() {
        transport.failNextConnects(3);
        start(repository, fastSettings());

        List<Long> attempts = transport.getConnectTimesNanos();
        assertThat(attempts).hasSize(4);
        assertThat(attempts.get(1) - attempts.get(0)).isGreaterThanOrEqualTo(Duration.ofMillis(20).toNanos());
        assertThat(attempts.get(2) - attempts.get(1)).isGreaterThanOrEqualTo(Duration.ofMillis(40).toNanos());
        assertThat(attempts.get(3) - attempts.get(2)).isGreaterThanOrEqualTo(Duration.ofMillis(80).toNanos());
        assertThat(subscriber.getStats().getConnectAttempts()).isEqualTo(4);
    }

    @Test
    @DisplayName("a dropped connection is re-established and ingestion resumes")
    void resubscribesAfterConnectionLoss() {
        start(repository, fastSettings());
        transport.deliver(TOPIC, json("{\"temperature\":20}"));
        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getStored() == 1);

        transport.dropConnection();
        await().atMost(Duration.ofSeconds(5)).until(() -> transport.getConnectTimesNanos().size() == 2);
        await().atMost(Duration.ofSeconds(5)).until(() -> transport.isSubscribed(TOPIC));
        transport.deliver(TOPIC, json("{\"temperature\":21}"));

        await().atMost(Duration.ofSeconds(5)).until(() -> subscriber.getStats().getStored() == 2);
        assertThat(subscriber.getStats().getConnectionsLost()).isEqualTo(1);
        assertThat(cache.get().getReading().getTemperature()).isEqualTo(21.0);
    }

    @Test
    @DisplayName("stop releases the transport and start is idempotent")
    void lifecycle() {
        start(repository, fastSettings());
        subscriber.start();

        subscriber.stop();
        subscriber.stop();

        assertThat(subscriber.getState()).isEqualTo(SubscriberState.STOPPED);
        assertThat(transport.isClosed()).isTrue();
        assertThat(transport.getConnectTimesNanos()).hasSize(1);
    }
}
