package io.classguard.ingest.subscriber;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters maintained by the ingestion subscriber.
 */
public final class IngestionStats {

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong stored = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();
    private final AtomicLong droppedReadings = new AtomicLong();
    private final AtomicLong rejectedReadings = new AtomicLong();
    private final AtomicLong acknowledgements = new AtomicLong();
    private final AtomicLong connectAttempts = new AtomicLong();
    private final AtomicLong connectionsLost = new AtomicLong();

    void onReceived() { received.incrementAndGet(); }
    void onStored() { stored.incrementAndGet(); }
    void onDecodeFailure() { decodeFailures.incrementAndGet(); }
    void onDropped() { droppedReadings.incrementAndGet(); }
    void onRejected() { rejectedReadings.incrementAndGet(); }
    void onAcknowledgement() { acknowledgements.incrementAndGet(); }
    void onConnectAttempt() { connectAttempts.incrementAndGet(); }
    void onConnectionLost() { connectionsLost.incrementAndGet(); }

    public long getReceived() { return received.get(); }
    public long getStored() { return stored.get(); }
    public long getDecodeFailures() { return decodeFailures.get(); }
    public long getDroppedReadings() { return droppedReadings.get(); }
    /** Readings the store refused as invalid data; these are never retried. */
    public long getRejectedReadings() { return rejectedReadings.get(); }
    public long getAcknowledgements() { return acknowledgements.get(); }
    public long getConnectAttempts() { return connectAttempts.get(); }
    public long getConnectionsLost() { return connectionsLost.get(); }

    @Override
    public String toString() {
        return "IngestionStats{received=" + getReceived() + ", stored=" + getStored()
                + ", decodeFailures=" + getDecodeFailures() + ", dropped=" + getDroppedReadings()
                + ", rejected=" + getRejectedReadings()
                + ", acks=" + getAcknowledgements() + ", connectAttempts=" + getConnectAttempts()
                + ", connectionsLost=" + getConnectionsLost() + '}';
    }
}
