package io.classguard.ingest.codec;

import io.classguard.store.model.Device;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Device states reported back by the classroom node after it applied a command.
 */
public final class ControlAck {

    private final Map<Device, Boolean> states;
    private final Instant receivedAt;

    public ControlAck(Map<Device, Boolean> states, Instant receivedAt) {
        this.states = Collections.unmodifiableMap(new EnumMap<>(states));
        this.receivedAt = receivedAt;
    }

    public Map<Device, Boolean> getStates() { return states; }
    public Instant getReceivedAt() { return receivedAt; }

    @Override
    public String toString() {
        return "ControlAck" + states;
    }
}
