package io.classguard.ingest.codec;

import io.classguard.store.model.Reading;

/**
 * A decoded message from the sensor topic: either a reading or a control acknowledgement.
 */
public final class InboundMessage {

    private final Reading reading;
    private final ControlAck ack;

    private InboundMessage(Reading reading, ControlAck ack) {
        this.reading = reading;
        this.ack = ack;
    }

    public static InboundMessage ofReading(Reading reading) {
        return new InboundMessage(reading, null);
    }

    public static InboundMessage ofAck(ControlAck ack) {
        return new InboundMessage(null, ack);
    }

    public boolean isAck() {
        return ack != null;
    }

    public Reading getReading() {
        if (reading == null) {
            throw new IllegalStateException("Message is an acknowledgement");
        }
        return reading;
    }

    public ControlAck getAck() {
        if (ack == null) {
            throw new IllegalStateException("Message is a reading");
        }
        return ack;
    }
}
