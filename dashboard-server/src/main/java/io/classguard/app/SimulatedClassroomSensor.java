package io.classguard.app;

import io.classguard.client.MqttBrokerClient;
import io.classguard.ingest.codec.DecodeException;
import io.classguard.ingest.codec.InboundMessage;
import io.classguard.ingest.codec.PayloadCodec;
import io.classguard.ingest.config.ClassGuardConfig;
import io.classguard.store.model.Device;
import io.classguard.store.model.DeviceStatus;
import io.classguard.store.model.Reading;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Stand-in for the classroom node when no hardware is attached. Publishes a
 * reading at a fixed interval and acknowledges every command it receives, the
 * same way the firmware does.
 */
public class SimulatedClassroomSensor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedClassroomSensor.class);

    static final double CO2_THRESHOLD = 1000;
    static final double LUX_THRESHOLD = 300;
    static final double TEMP_THRESHOLD = 35;
    static final double HUMIDITY_THRESHOLD = 80;
    static final double NOISE_THRESHOLD = 70;
    private static final int PENALTY = 20;

    public static class Settings {
        public String deviceId = "classroom-sim-01";
        public String sensorTopic = "classguard/sensors";
        public String controlTopic = "classguard/control";
        public int qos = 1;
        public long intervalMillis = 5_000;

        public static Settings from(ClassGuardConfig config) {
            Settings settings = new Settings();
            settings.deviceId = config.getString("simulator.device.id", settings.deviceId);
            settings.sensorTopic = config.sensorTopic();
            settings.controlTopic = config.controlTopic();
            settings.qos = config.mqttQos();
            settings.intervalMillis = config.getLong("simulator.interval.ms", settings.intervalMillis);
            return settings;
        }
    }

    private final MqttBrokerClient mqttClient;
    private final PayloadCodec codec;
    private final Settings settings;
    private final Clock clock;
    private final Random random;
    private final ExecutorService ackExecutor;

    private volatile DeviceStatus devices = DeviceStatus.allOff();
    private Thread telemetryThread;

    private double temperature = 27.0;
    private double humidity = 60.0;
    private double co2 = 600.0;
    private double light = 420.0;
    private double noise = 48.0;
    private double aqi = 40.0;

    public SimulatedClassroomSensor(MqttBrokerClient mqttClient, PayloadCodec codec, Settings settings,
                                    Clock clock, Random random) {
        this.mqttClient = mqttClient;
        this.codec = codec;
        this.settings = settings;
        this.clock = clock;
        this.random = random;
        this.ackExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "classguard-sim-ack");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() throws MqttException {
        logger.info("Starting simulated classroom sensor: {}", settings.deviceId);
        mqttClient.connect();
        mqttClient.subscribe(settings.controlTopic, settings.qos,
                (topic, payload) -> ackExecutor.execute(() -> handleCommand(payload)));
        logger.info("Sensor {} subscribed to control topic: {}", settings.deviceId, settings.controlTopic);

        telemetryThread = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    sendReading();
                    Thread.sleep(settings.intervalMillis);
                }
            } catch (InterruptedException e) {
                logger.info("Telemetry simulation stopped for sensor: {}", settings.deviceId);
                Thread.currentThread().interrupt();
            }
        }, "telemetry-" + settings.deviceId);
        telemetryThread.setDaemon(true);
        telemetryThread.start();
    }

    void handleCommand(byte[] payload) {
        InboundMessage message;
        try {
            message = codec.decode(payload, clock.instant());
        } catch (DecodeException e) {
            logger.warn("[SENSOR {}] Ignoring malformed command: {}", settings.deviceId, e.getMessage());
            return;
        }
        if (!message.isAck()) {
            logger.warn("[SENSOR {}] Ignoring control message without device states", settings.deviceId);
            return;
        }
        Map<Device, Boolean> states = message.getAck().getStates();
        devices = devices.withAll(states);
        try {
            mqttClient.publish(settings.sensorTopic, codec.encodeAck(states), settings.qos, false);
            logger.info("[SENSOR {}] Applied and acknowledged {}", settings.deviceId, states);
        } catch (MqttException e) {
            logger.error("[SENSOR {}] Failed to acknowledge {}", settings.deviceId, states, e);
        }
    }

    void sendReading() {
        Reading reading = nextReading();
        try {
            mqttClient.publish(settings.sensorTopic, codec.encodeReading(reading), settings.qos, false);
            logger.debug("[SENSOR {}] Reading sent: {}", settings.deviceId, reading);
        } catch (MqttException e) {
            logger.error("Error sending reading for sensor: {}", settings.deviceId, e);
        }
    }

    Reading nextReading() {
        // the fan pulls temperature and CO2 down, the light keeps lux up
        temperature = drift(temperature, 0.3, devices.isOn(Device.FAN) ? -0.2 : 0.05, 18, 40);
        humidity = drift(humidity, 1.0, 0, 30, 95);
        co2 = drift(co2, 25, devices.isOn(Device.FAN) ? -20 : 8, 400, 2000);
        light = drift(light, 15, devices.isOn(Device.LIGHT) ? 10 : -3, 50, 800);
        noise = drift(noise, 2.0, 0, 30, 90);
        aqi = drift(aqi, 2.0, 0, 0, 200);

        Reading reading = Reading.builder()
                .deviceId(settings.deviceId)
                .temperature(round(temperature))
                .humidity(round(humidity))
                .co2(Math.rint(co2))
                .light(Math.rint(light))
                .noise(round(noise))
                .aqi(Math.rint(aqi))
                .timestamp(clock.instant())
                .build();
        int score = classScore(reading);
        return reading.toBuilder().score(score).status(status(score)).build();
    }

    /**
     * 100 minus 20 points for each channel outside its comfort threshold.
     */
    static int classScore(Reading reading) {
        int score = 100;
        if (exceeds(reading.getCo2(), CO2_THRESHOLD)) score -= PENALTY;
        if (reading.getLight() != null && reading.getLight() < LUX_THRESHOLD) score -= PENALTY;
        if (exceeds(reading.getTemperature(), TEMP_THRESHOLD)) score -= PENALTY;
        if (exceeds(reading.getHumidity(), HUMIDITY_THRESHOLD)) score -= PENALTY;
        if (exceeds(reading.getNoise(), NOISE_THRESHOLD)) score -= PENALTY;
        return Math.max(0, score);
    }

    static String status(int score) {
        if (score >= 80) return "Good";
        if (score >= 50) return "Moderate";
        return "Poor";
    }

    private static boolean exceeds(Double value, double threshold) {
        return value != null && value > threshold;
    }

    private double drift(double current, double step, double bias, double min, double max) {
        double next = current + bias + (random.nextDouble() * 2 - 1) * step;
        return Math.max(min, Math.min(max, next));
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }

    public DeviceStatus getDeviceStatus() {
        return devices;
    }

    @Override
    public void close() {
        if (telemetryThread != null) {
            telemetryThread.interrupt();
        }
        ackExecutor.shutdownNow();
        try {
            ackExecutor.awaitTermination(2, TimeUnit.SECONDS);
            mqttClient.close();
            logger.info("Sensor {} stopped", settings.deviceId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (MqttException e) {
            logger.error("Error stopping sensor: {}", settings.deviceId, e);
        }
    }
}
