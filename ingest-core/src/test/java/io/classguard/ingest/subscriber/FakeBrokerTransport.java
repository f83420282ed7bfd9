package io.classguard.ingest.subscriber;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Scriptable in-memory transport: connects can be made to fail, the link can
 * be dropped, and messages can be delivered to whatever is subscribed.
 */
public class FakeBrokerTransport implements BrokerTransport {

    public static final class Published {
        public final String topic;
        public final byte[] payload;
        public final int qos;

        Published(String topic, byte[] payload, int qos) {
            this.topic = topic;
            this.payload = payload;
            this.qos = qos;
        }
    }

    private final List<Long> connectTimesNanos = new CopyOnWriteArrayList<>();
    private final List<Published> published = new CopyOnWriteArrayList<>();
    private final Map<String, BiConsumer<String, byte[]>> subscriptions = new ConcurrentHashMap<>();
    private volatile Consumer<Throwable> connectionLost;
    private volatile boolean connected;
    private volatile boolean closed;
    private volatile int failingConnects;
    private volatile int failingPublishes;

    @Override
    public synchronized void connect(Consumer<Throwable> connectionLost) throws TransportException {
        connectTimesNanos.add(System.nanoTime());
        if (failingConnects > 0) {
            failingConnects--;
            throw new TransportException("Connection refused");
        }
        this.connectionLost = connectionLost;
        connected = true;
    }

    @Override
    public void subscribe(String topic, int qos, BiConsumer<String, byte[]> handler) throws TransportException {
        if (!connected) {
            throw new TransportException("Not connected");
        }
        subscriptions.put(topic, handler);
    }

    @Override
    public synchronized void publish(String topic, byte[] payload, int qos) throws TransportException {
        if (!connected) {
            throw new TransportException("Not connected");
        }
        if (failingPublishes > 0) {
            failingPublishes--;
            throw new TransportException("Publish timed out");
        }
        published.add(new Published(topic, payload, qos));
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
        subscriptions.clear();
    }

    @Override
    public void close() {
        disconnect();
        closed = true;
    }

    public void failNextConnects(int count) {
        failingConnects = count;
    }

    public void failNextPublishes(int count) {
        failingPublishes = count;
    }

    /** Delivers to the subscriber of {@code topic}; returns false if nobody is subscribed. */
    public boolean deliver(String topic, byte[] payload) {
        BiConsumer<String, byte[]> handler = subscriptions.get(topic);
        if (!connected || handler == null) {
            return false;
        }
        handler.accept(topic, payload);
        return true;
    }

    public void dropConnection() {
        Consumer<Throwable> callback = connectionLost;
        connected = false;
        subscriptions.clear();
        if (callback != null) {
            callback.accept(new IllegalStateException("Connection reset"));
        }
    }

    public boolean isSubscribed(String topic) {
        return connected && subscriptions.containsKey(topic);
    }

    public List<Long> getConnectTimesNanos() {
        return new ArrayList<>(connectTimesNanos);
    }

    public List<Published> getPublished() {
        return new ArrayList<>(published);
    }

    public boolean isClosed() {
        return closed;
    }
}
