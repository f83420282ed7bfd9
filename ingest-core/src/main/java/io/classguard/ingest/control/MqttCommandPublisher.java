package io.classguard.ingest.control;

import io.classguard.ingest.codec.PayloadCodec;
import io.classguard.ingest.subscriber.BrokerTransport;
import io.classguard.ingest.subscriber.TransportException;
import io.classguard.store.PersistenceException;
import io.classguard.store.model.ControlCommand;
import io.classguard.store.repository.ControlCommandRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes control commands on their own broker connection, separate from the
 * ingestion subscription, so a slow publish never stalls ingestion.
 * <p>
 * Commands are sent one at a time from a single thread in submission order.
 * The connection is opened lazily and reopened on the next command after a
 * failure. Each published command is recorded in the audit table when a
 * repository is configured.
 */
public class MqttCommandPublisher implements CommandPublisher {

    private static final Logger logger = LoggerFactory.getLogger(MqttCommandPublisher.class);

    public static class Settings {
        public String controlTopic = "classguard/control";
        public int qos = 1;
    }

    private final BrokerTransport transport;
    private final PayloadCodec codec;
    private final ControlCommandRepository auditRepository;
    private final Settings settings;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public MqttCommandPublisher(BrokerTransport transport, PayloadCodec codec,
                                ControlCommandRepository auditRepository, Settings settings) {
        this.transport = transport;
        this.codec = codec;
        this.auditRepository = auditRepository;
        this.settings = settings;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "classguard-control-publisher");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void submit(ControlCommand command) {
        executor.execute(() -> publish(command));
    }

    private void publish(ControlCommand command) {
        byte[] payload = codec.encodeCommand(command);
        try {
            if (!transport.isConnected()) {
                transport.connect(cause -> logger.warn("Control connection lost: {}",
                        cause == null ? "unknown cause" : cause.getMessage()));
            }
            transport.publish(settings.controlTopic, payload, settings.qos);
            published.incrementAndGet();
            logger.info("Published {} -> {} on '{}' for {}", command.getDevice().wireName(),
                    command.getState(), settings.controlTopic, command.getIssuedBy());
        } catch (TransportException e) {
            failed.incrementAndGet();
            logger.error("Failed to publish command {}: {}", command, e.getMessage());
            transport.disconnect();
            return;
        }

        if (auditRepository != null) {
            try {
                auditRepository.insert(command);
            } catch (PersistenceException e) {
                logger.error("Command {} was published but could not be audited", command, e);
            }
        }
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Pending control commands discarded on shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        transport.disconnect();
        transport.close();
        logger.info("Command publisher closed ({} published, {} failed)", published.get(), failed.get());
    }
}
