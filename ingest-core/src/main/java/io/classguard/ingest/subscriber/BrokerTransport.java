package io.classguard.ingest.subscriber;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * One publish/subscribe connection to the broker. Implementations are owned
 * by a single component and are not shared.
 */
public interface BrokerTransport extends AutoCloseable {

    /**
     * Opens the connection. {@code connectionLost} fires at most once per
     * successful connect, when the link drops without {@link #disconnect()}.
     */
    void connect(Consumer<Throwable> connectionLost) throws TransportException;

    void subscribe(String topic, int qos, BiConsumer<String, byte[]> handler) throws TransportException;

    void publish(String topic, byte[] payload, int qos) throws TransportException;

    boolean isConnected();

    /**
     * Closes the current connection if any; never throws.
     */
    void disconnect();

    @Override
    void close();
}
