package io.classguard.ingest.subscriber;

import io.classguard.ingest.cache.LatestStateCache;
import io.classguard.ingest.codec.ControlAck;
import io.classguard.ingest.codec.DecodeException;
import io.classguard.ingest.codec.InboundMessage;
import io.classguard.ingest.codec.PayloadCodec;
import io.classguard.store.PersistenceException;
import io.classguard.store.model.Reading;
import io.classguard.store.repository.ReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps a subscription to the sensor topic alive and feeds every message into
 * the live cache and the reading store.
 * <p>
 * Two threads are involved. The connection thread walks the
 * {@link SubscriberState} machine: connect, subscribe, wait for the link to
 * drop, back off, repeat until {@link #stop()}. The transport's callback only
 * enqueues raw messages; a single worker thread decodes them in arrival order
 * and is the only writer of readings into the cache and the store.
 */
public class IngestionSubscriber implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IngestionSubscriber.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    public static class Settings {
        public String sensorTopic = "classguard/sensors";
        public int qos = 1;
        public int queueCapacity = 1_000;
        public int storeMaxAttempts = 3;
        public BackoffPolicy storeRetryBackoff = new BackoffPolicy(Duration.ofMillis(200), Duration.ofSeconds(2));
        public BackoffPolicy reconnectBackoff = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60));
    }

    private final BrokerTransport transport;
    private final PayloadCodec codec;
    private final LatestStateCache cache;
    private final ReadingRepository repository;
    private final Settings settings;
    private final Clock clock;

    private final BlockingQueue<RawMessage> queue;
    private final IngestionStats stats = new IngestionStats();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private volatile boolean running;
    private volatile SubscriberState state = SubscriberState.DISCONNECTED;
    private ExecutorService connectionExecutor;
    private ExecutorService workerExecutor;

    public IngestionSubscriber(BrokerTransport transport, PayloadCodec codec, LatestStateCache cache,
                               ReadingRepository repository, Settings settings, Clock clock) {
        this.transport = transport;
        this.codec = codec;
        this.cache = cache;
        this.repository = repository;
        this.settings = settings;
        this.clock = clock;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, settings.queueCapacity));
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(false, true)) {
                logger.info("IngestionSubscriber already started");
                return;
            }
            running = true;
            workerExecutor = Executors.newSingleThreadExecutor(r -> daemon(r, "classguard-ingest-worker"));
            connectionExecutor = Executors.newSingleThreadExecutor(r -> daemon(r, "classguard-ingest-connection"));
            workerExecutor.execute(this::runWorker);
            connectionExecutor.execute(this::runConnectionLoop);
            logger.info("IngestionSubscriber started for topic '{}' (reconnect {}, store attempts {})",
                    settings.sensorTopic, settings.reconnectBackoff, settings.storeMaxAttempts);
        }
    }

    /**
     * Stops reconnecting, releases the broker connection, and gives the worker
     * a bounded time to finish messages already received.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!started.get() || !running) {
                return;
            }
            logger.info("Stopping IngestionSubscriber...");
            running = false;
            connectionExecutor.shutdownNow();
            awaitTermination(connectionExecutor, "connection");
            transport.disconnect();
            transport.close();

            workerExecutor.shutdown();
            awaitTermination(workerExecutor, "worker");
            if (!queue.isEmpty()) {
                logger.warn("{} received messages were not processed before shutdown", queue.size());
            }
            state = SubscriberState.STOPPED;
            logger.info("IngestionSubscriber stopped: {}", stats);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public SubscriberState getState() {
        return state;
    }

    public IngestionStats getStats() {
        return stats;
    }

    private void runConnectionLoop() {
        int consecutiveFailures = 0;
        while (running) {
            state = SubscriberState.CONNECTING;
            stats.onConnectAttempt();
            CountDownLatch lost = new CountDownLatch(1);
            try {
                transport.connect(cause -> {
                    stats.onConnectionLost();
                    lost.countDown();
                });
                transport.subscribe(settings.sensorTopic, settings.qos, this::enqueue);
                state = SubscriberState.SUBSCRIBED;
                consecutiveFailures = 0;
                logger.info("Subscribed to '{}', ingesting", settings.sensorTopic);
                lost.await();
                logger.warn("Broker connection lost, will resubscribe");
            } catch (TransportException e) {
                logger.warn("Broker unavailable: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            transport.disconnect();
            state = SubscriberState.DISCONNECTED;
            if (!running) {
                break;
            }
            consecutiveFailures++;
            Duration delay = settings.reconnectBackoff.delayFor(consecutiveFailures);
            logger.info("Reconnecting in {} ms (attempt {})", delay.toMillis(), consecutiveFailures);
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (state != SubscriberState.STOPPED) {
            state = SubscriberState.DISCONNECTED;
        }
        logger.debug("Connection loop exited");
    }

    private void enqueue(String topic, byte[] payload) {
        RawMessage message = new RawMessage(topic, payload, clock.instant());
        try {
            queue.put(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while queueing message from '{}', message not ingested", topic);
        }
    }

    private void runWorker() {
        while (running || !queue.isEmpty()) {
            RawMessage message;
            try {
                message = queue.poll(250, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message == null) {
                continue;
            }
            try {
                process(message);
            } catch (RuntimeException e) {
                logger.error("Unexpected error ingesting message from '{}'", message.topic, e);
            }
        }
        logger.debug("Ingest worker exited");
    }

    void process(RawMessage message) {
        stats.onReceived();
        InboundMessage inbound;
        try {
            inbound = codec.decode(message.payload, message.receivedAt);
        } catch (DecodeException e) {
            stats.onDecodeFailure();
            logger.warn("Discarding {} message on '{}': {}", e.getKind(), message.topic, e.getMessage());
            return;
        }

        if (inbound.isAck()) {
            ControlAck ack = inbound.getAck();
            cache.applyDeviceStates(ack.getStates());
            stats.onAcknowledgement();
            logger.debug("Device states confirmed by node: {}", ack.getStates());
            return;
        }

        Reading reading = inbound.getReading();
        // the live view must not wait on, or depend on, persistence
        cache.setReading(reading);
        persist(reading);
    }

    private void persist(Reading reading) {
        int maxAttempts = Math.max(1, settings.storeMaxAttempts);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                repository.append(reading);
                stats.onStored();
                return;
            } catch (PersistenceException e) {
                if (!e.isTransient()) {
                    stats.onRejected();
                    logger.error("Store rejected reading from '{}' at {} (SQLState {}), not retrying: {}",
                            reading.getDeviceId(), reading.getTimestamp(), e.getSqlState(), e.getMessage());
                    return;
                }
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = settings.storeRetryBackoff.delayFor(attempt);
                logger.warn("Store write failed (attempt {}/{}), retrying in {} ms: {}",
                        attempt, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying store write");
                    break;
                }
            }
        }
        stats.onDropped();
        logger.error("Dropped reading from '{}' at {} after store failures ({} dropped so far)",
                reading.getDeviceId(), reading.getTimestamp(), stats.getDroppedReadings());
    }

    private void awaitTermination(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Ingest {} thread did not finish in {} s, interrupting", name, SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    static final class RawMessage {
        final String topic;
        final byte[] payload;
        final Instant receivedAt;

        RawMessage(String topic, byte[] payload, Instant receivedAt) {
            this.topic = topic;
            this.payload = payload;
            this.receivedAt = receivedAt;
        }
    }
}
