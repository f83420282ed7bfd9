package io.classguard.store.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Actuators the classroom node accepts commands for.
 */
public enum Device {
    FAN("fan"),
    LIGHT("light"),
    BUZZER("buzzer");

    private final String wireName;

    Device(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Device> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Device device : values()) {
            if (device.wireName.equals(normalized)) {
                return Optional.of(device);
            }
        }
        return Optional.empty();
    }
}
