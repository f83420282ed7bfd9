package io.classguard.store.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * On/off state of every {@link Device}. Instances are immutable; the
 * {@code with*} methods return a modified copy.
 */
public final class DeviceStatus {

    private static final DeviceStatus ALL_OFF = new DeviceStatus(new EnumMap<>(Device.class));

    private final Map<Device, Boolean> states;

    private DeviceStatus(EnumMap<Device, Boolean> states) {
        for (Device device : Device.values()) {
            states.putIfAbsent(device, Boolean.FALSE);
        }
        this.states = Collections.unmodifiableMap(states);
    }

    public static DeviceStatus allOff() {
        return ALL_OFF;
    }

    public boolean isOn(Device device) {
        return states.get(device);
    }

    public DeviceStatus with(Device device, boolean on) {
        if (isOn(device) == on) {
            return this;
        }
        EnumMap<Device, Boolean> copy = new EnumMap<>(states);
        copy.put(device, on);
        return new DeviceStatus(copy);
    }

    public DeviceStatus withAll(Map<Device, Boolean> updates) {
        EnumMap<Device, Boolean> copy = new EnumMap<>(states);
        updates.forEach((device, on) -> {
            if (device != null && on != null) {
                copy.put(device, on);
            }
        });
        return new DeviceStatus(copy);
    }

    public Map<Device, Boolean> asMap() {
        return states;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceStatus)) return false;
        return states.equals(((DeviceStatus) o).states);
    }

    @Override
    public int hashCode() {
        return states.hashCode();
    }

    @Override
    public String toString() {
        return "DeviceStatus" + states;
    }
}
