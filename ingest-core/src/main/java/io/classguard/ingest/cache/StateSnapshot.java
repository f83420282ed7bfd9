package io.classguard.ingest.cache;

import io.classguard.store.model.DeviceStatus;
import io.classguard.store.model.Reading;

import java.util.Objects;

/**
 * The latest reading and device status, captured together.
 */
public final class StateSnapshot {

    private final Reading reading;
    private final DeviceStatus deviceStatus;

    public StateSnapshot(Reading reading, DeviceStatus deviceStatus) {
        this.reading = Objects.requireNonNull(reading, "reading");
        this.deviceStatus = Objects.requireNonNull(deviceStatus, "deviceStatus");
    }

    public Reading getReading() { return reading; }
    public DeviceStatus getDeviceStatus() { return deviceStatus; }

    StateSnapshot withReading(Reading newReading) {
        return new StateSnapshot(newReading, deviceStatus);
    }

    StateSnapshot withDeviceStatus(DeviceStatus newStatus) {
        return newStatus == deviceStatus ? this : new StateSnapshot(reading, newStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSnapshot)) return false;
        StateSnapshot other = (StateSnapshot) o;
        return reading.equals(other.reading) && deviceStatus.equals(other.deviceStatus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reading, deviceStatus);
    }

    @Override
    public String toString() {
        return "StateSnapshot{reading=" + reading + ", deviceStatus=" + deviceStatus + '}';
    }
}
