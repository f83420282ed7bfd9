package io.classguard.ingest.codec;

import io.classguard.store.model.Channel;
import io.classguard.store.model.ControlCommand;
import io.classguard.store.model.Device;
import io.classguard.store.model.Reading;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;

/**
 * JSON codec for the sensor and control topics.
 * <p>
 * Sensor payloads are lenient: every field is optional, unknown fields are
 * ignored, and a field of the wrong type is treated as absent. Only bytes
 * that are not a JSON object are rejected.
 */
public class PayloadCodec {

    private static final Logger logger = LoggerFactory.getLogger(PayloadCodec.class);

    public static final int MAX_PAYLOAD_BYTES = 64 * 1024;

    static final String DEVICE_ID = "device_id";
    static final String CLASS_SCORE = "class_score";
    static final String STATUS = "status";
    static final String TIMESTAMP = "timestamp";

    private final ZoneId zone;

    /**
     * @param zone zone used for timestamps that carry no offset
     */
    public PayloadCodec(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Decodes a sensor-topic payload into either a reading or an acknowledgement.
     * An object with at least one boolean device key and no channel keys is an
     * acknowledgement.
     */
    public InboundMessage decode(byte[] payload, Instant receivedAt) throws DecodeException {
        JSONObject json = parseObject(payload);
        Map<Device, Boolean> states = deviceStates(json);
        if (!states.isEmpty() && !hasAnyChannel(json)) {
            return InboundMessage.ofAck(new ControlAck(states, receivedAt));
        }
        return InboundMessage.ofReading(toReading(json, receivedAt));
    }

    public Reading decodeReading(byte[] payload, Instant receivedAt) throws DecodeException {
        return toReading(parseObject(payload), receivedAt);
    }

    /**
     * Encodes {@code {"<device>": <state>}}. The output depends only on the command.
     */
    public byte[] encodeCommand(ControlCommand command) {
        return new JSONObject()
                .put(command.getDevice().wireName(), command.getState())
                .toString()
                .getBytes(StandardCharsets.UTF_8);
    }

    public byte[] encodeAck(Map<Device, Boolean> states) {
        JSONObject json = new JSONObject();
        states.forEach((device, on) -> json.put(device.wireName(), on.booleanValue()));
        return json.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encodes a reading in the sensor-topic format; absent channels are omitted.
     */
    public byte[] encodeReading(Reading reading) {
        JSONObject json = new JSONObject();
        json.put(DEVICE_ID, reading.getDeviceId());
        for (Channel channel : Channel.values()) {
            Double value = channel.read(reading);
            if (value != null) {
                json.put(channel.key(), value.doubleValue());
            }
        }
        json.put(CLASS_SCORE, reading.getScore());
        json.put(STATUS, reading.getStatus());
        if (reading.getTimestamp() != null) {
            json.put(TIMESTAMP, reading.getTimestamp().toString());
        }
        return json.toString().getBytes(StandardCharsets.UTF_8);
    }

    private JSONObject parseObject(byte[] payload) throws DecodeException {
        if (payload == null || payload.length == 0) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_PAYLOAD, "Empty payload");
        }
        if (payload.length > MAX_PAYLOAD_BYTES) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_PAYLOAD,
                    "Payload of " + payload.length + " bytes exceeds " + MAX_PAYLOAD_BYTES);
        }

        Object root;
        try {
            JSONTokener tokener = new JSONTokener(new String(payload, StandardCharsets.UTF_8));
            char first = tokener.nextClean();
            tokener.back();
            root = tokener.nextValue();
            // the tokener reads bare words as strings; strict JSON only allows quoted ones
            if (root instanceof String && first != '"') {
                throw new DecodeException(DecodeException.Kind.MALFORMED_PAYLOAD, "Invalid JSON: bare text");
            }
            if (tokener.nextClean() != 0) {
                throw new DecodeException(DecodeException.Kind.MALFORMED_PAYLOAD,
                        "Invalid JSON: trailing content" + tokener);
            }
        } catch (JSONException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_PAYLOAD, "Invalid JSON: " + e.getMessage(), e);
        }
        if (!(root instanceof JSONObject)) {
            throw new DecodeException(DecodeException.Kind.MISSING_REQUIRED_FIELD,
                    "Expected a JSON object but got " + (root == null ? "null" : root.getClass().getSimpleName()));
        }
        return (JSONObject) root;
    }

    private Reading toReading(JSONObject json, Instant receivedAt) {
        Reading.Builder builder = Reading.builder()
                .deviceId(optString(json, DEVICE_ID, Reading.UNKNOWN_DEVICE))
                .score(optInt(json, CLASS_SCORE, 0))
                .status(optString(json, STATUS, Reading.DEFAULT_STATUS))
                .timestamp(optTimestamp(json, receivedAt))
                .receivedAt(receivedAt);
        for (Channel channel : Channel.values()) {
            builder.channel(channel, optDouble(json, channel.key()));
        }
        return builder.build();
    }

    private Map<Device, Boolean> deviceStates(JSONObject json) {
        Map<Device, Boolean> states = new EnumMap<>(Device.class);
        for (Device device : Device.values()) {
            Object value = json.opt(device.wireName());
            if (value instanceof Boolean) {
                states.put(device, (Boolean) value);
            }
        }
        return states;
    }

    private boolean hasAnyChannel(JSONObject json) {
        for (Channel channel : Channel.values()) {
            if (json.has(channel.key())) {
                return true;
            }
        }
        return false;
    }

    private Double optDouble(JSONObject json, String key) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d)) {
                return d;
            }
        }
        logger.debug("Ignoring non-numeric value for '{}': {}", key, value);
        return null;
    }

    private int optInt(JSONObject json, String key, int defaultValue) {
        Object value = json.opt(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null && !JSONObject.NULL.equals(value)) {
            logger.debug("Ignoring non-numeric value for '{}': {}", key, value);
        }
        return defaultValue;
    }

    private String optString(JSONObject json, String key, String defaultValue) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return defaultValue;
        }
        if (value instanceof String || value instanceof Number) {
            return value.toString();
        }
        logger.debug("Ignoring non-text value for '{}': {}", key, value);
        return defaultValue;
    }

    private Instant optTimestamp(JSONObject json, Instant fallback) {
        Object value = json.opt(TIMESTAMP);
        if (!(value instanceof String)) {
            return fallback;
        }
        String text = ((String) value).trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // firmware clocks usually send local time without an offset
            try {
                return LocalDateTime.parse(text).atZone(zone).toInstant();
            } catch (DateTimeParseException e2) {
                logger.debug("Could not parse timestamp '{}', using receipt time", text);
                return fallback;
            }
        }
    }
}
