package io.classguard.store.model;

import java.util.Optional;
import java.util.function.Function;

/**
 * Numeric sensor channels carried by a {@link Reading}. The key is the field
 * name used on the sensor topic and the column name in the store.
 */
public enum Channel {
    TEMPERATURE("temperature", Reading::getTemperature),
    HUMIDITY("humidity", Reading::getHumidity),
    CO2("co2", Reading::getCo2),
    LIGHT("light", Reading::getLight),
    NOISE("noise", Reading::getNoise),
    AQI("aqi", Reading::getAqi);

    private final String key;
    private final Function<Reading, Double> accessor;

    Channel(String key, Function<Reading, Double> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    public Double read(Reading reading) {
        return accessor.apply(reading);
    }

    public static Optional<Channel> fromKey(String key) {
        for (Channel channel : values()) {
            if (channel.key.equals(key)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
