package io.classguard.store.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One decoded telemetry sample from the classroom node.
 * <p>
 * Channels are nullable: {@code null} means the sensor did not report that
 * channel in this cycle. {@code receivedAt} is always stamped by the server,
 * {@code timestamp} comes from the payload when present.
 */
public final class Reading {

    public static final String UNKNOWN_DEVICE = "unknown";
    public static final String DEFAULT_STATUS = "Unknown";

    private static final Reading EMPTY = builder().deviceId("").build();

    private final String deviceId;
    private final Double temperature;
    private final Double humidity;
    private final Double co2;
    private final Double light;
    private final Double noise;
    private final Double aqi;
    private final int score;
    private final String status;
    private final Instant timestamp;
    private final Instant receivedAt;

    private Reading(Builder builder) {
        this.deviceId = builder.deviceId;
        this.temperature = builder.temperature;
        this.humidity = builder.humidity;
        this.co2 = builder.co2;
        this.light = builder.light;
        this.noise = builder.noise;
        this.aqi = builder.aqi;
        this.score = builder.score;
        this.status = builder.status;
        this.timestamp = builder.timestamp;
        this.receivedAt = builder.receivedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The reading held before anything has been received: no channels, score 0,
     * status "Unknown" and no timestamps.
     */
    public static Reading empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return timestamp == null && receivedAt == null;
    }

    public Builder toBuilder() {
        return new Builder()
                .deviceId(deviceId)
                .temperature(temperature)
                .humidity(humidity)
                .co2(co2)
                .light(light)
                .noise(noise)
                .aqi(aqi)
                .score(score)
                .status(status)
                .timestamp(timestamp)
                .receivedAt(receivedAt);
    }

    public String getDeviceId() { return deviceId; }
    public Double getTemperature() { return temperature; }
    public Double getHumidity() { return humidity; }
    public Double getCo2() { return co2; }
    public Double getLight() { return light; }
    public Double getNoise() { return noise; }
    public Double getAqi() { return aqi; }
    public int getScore() { return score; }
    public String getStatus() { return status; }
    public Instant getTimestamp() { return timestamp; }
    public Instant getReceivedAt() { return receivedAt; }

    public Double get(Channel channel) {
        return channel.read(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reading)) return false;
        Reading other = (Reading) o;
        return score == other.score
                && Objects.equals(deviceId, other.deviceId)
                && Objects.equals(temperature, other.temperature)
                && Objects.equals(humidity, other.humidity)
                && Objects.equals(co2, other.co2)
                && Objects.equals(light, other.light)
                && Objects.equals(noise, other.noise)
                && Objects.equals(aqi, other.aqi)
                && Objects.equals(status, other.status)
                && Objects.equals(timestamp, other.timestamp)
                && Objects.equals(receivedAt, other.receivedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, temperature, humidity, co2, light, noise, aqi, score, status, timestamp, receivedAt);
    }

    @Override
    public String toString() {
        return "Reading{deviceId='" + deviceId + "', temperature=" + temperature + ", humidity=" + humidity
                + ", co2=" + co2 + ", light=" + light + ", noise=" + noise + ", aqi=" + aqi
                + ", score=" + score + ", status='" + status + "', timestamp=" + timestamp
                + ", receivedAt=" + receivedAt + '}';
    }

    public static final class Builder {
        private String deviceId = UNKNOWN_DEVICE;
        private Double temperature;
        private Double humidity;
        private Double co2;
        private Double light;
        private Double noise;
        private Double aqi;
        private int score;
        private String status = DEFAULT_STATUS;
        private Instant timestamp;
        private Instant receivedAt;

        private Builder() {
        }

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId != null ? deviceId : UNKNOWN_DEVICE;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder humidity(Double humidity) {
            this.humidity = humidity;
            return this;
        }

        public Builder co2(Double co2) {
            this.co2 = co2;
            return this;
        }

        public Builder light(Double light) {
            this.light = light;
            return this;
        }

        public Builder noise(Double noise) {
            this.noise = noise;
            return this;
        }

        public Builder aqi(Double aqi) {
            this.aqi = aqi;
            return this;
        }

        public Builder channel(Channel channel, Double value) {
            switch (channel) {
                case TEMPERATURE: return temperature(value);
                case HUMIDITY: return humidity(value);
                case CO2: return co2(value);
                case LIGHT: return light(value);
                case NOISE: return noise(value);
                case AQI: return aqi(value);
                default: throw new IllegalArgumentException("Unsupported channel: " + channel);
            }
        }

        public Builder score(int score) {
            this.score = score;
            return this;
        }

        public Builder status(String status) {
            this.status = status != null ? status : DEFAULT_STATUS;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Reading build() {
            return new Reading(this);
        }
    }
}
