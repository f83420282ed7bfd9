package io.classguard.ingest.subscriber;

import io.classguard.client.MqttBrokerClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * {@link BrokerTransport} backed by a Paho client.
 */
public class PahoBrokerTransport implements BrokerTransport {

    private static final Logger logger = LoggerFactory.getLogger(PahoBrokerTransport.class);

    private final MqttBrokerClient client;

    public PahoBrokerTransport(MqttBrokerClient client) {
        this.client = client;
    }

    @Override
    public void connect(Consumer<Throwable> connectionLost) throws TransportException {
        AtomicBoolean fired = new AtomicBoolean(false);
        client.setConnectionLostHandler(cause -> {
            if (fired.compareAndSet(false, true)) {
                connectionLost.accept(cause);
            }
        });
        try {
            client.connect();
        } catch (MqttException e) {
            throw new TransportException("Connect failed (reason " + e.getReasonCode() + ")", e);
        }
    }

    @Override
    public void subscribe(String topic, int qos, BiConsumer<String, byte[]> handler) throws TransportException {
        try {
            client.subscribe(topic, qos, handler);
        } catch (MqttException e) {
            throw new TransportException("Subscribe to '" + topic + "' failed (reason " + e.getReasonCode() + ")", e);
        }
    }

    @Override
    public void publish(String topic, byte[] payload, int qos) throws TransportException {
        try {
            client.publish(topic, payload, qos, false);
        } catch (MqttException e) {
            throw new TransportException("Publish to '" + topic + "' failed (reason " + e.getReasonCode() + ")", e);
        }
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }

    @Override
    public void disconnect() {
        try {
            client.disconnect();
        } catch (MqttException e) {
            logger.warn("Error disconnecting client {}: {}", client.getClientId(), e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (MqttException e) {
            logger.warn("Error closing client {}: {}", client.getClientId(), e.getMessage());
        }
    }
}
