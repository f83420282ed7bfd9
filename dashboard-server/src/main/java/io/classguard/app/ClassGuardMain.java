package io.classguard.app;

import io.classguard.ingest.aggregate.AggregationEngine;
import io.classguard.ingest.api.ClassGuardQueryApi;
import io.classguard.ingest.cache.LatestStateCache;
import io.classguard.ingest.codec.PayloadCodec;
import io.classguard.ingest.config.ClassGuardConfig;
import io.classguard.ingest.control.ControlDispatcher;
import io.classguard.ingest.control.MqttCommandPublisher;
import io.classguard.ingest.report.ReportGenerator;
import io.classguard.ingest.subscriber.IngestionSubscriber;
import io.classguard.ingest.subscriber.PahoBrokerTransport;
import io.classguard.store.DatabaseManager;
import io.classguard.store.PersistenceException;
import io.classguard.store.repository.ControlCommandRepository;
import io.classguard.store.repository.ReadingRepository;
import io.classguard.web.DashboardWebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class ClassGuardMain {

    private static final Logger logger = LoggerFactory.getLogger(ClassGuardMain.class);

    public static void main(String[] args) {
        ClassGuardConfig config = ClassGuardConfig.load();
        ZoneId zone = config.zone();
        Clock clock = Clock.systemUTC();

        logger.info("=== ClassGuard ===");
        logger.info("Broker: {}:{}", config.mqttHost(), config.mqttPort());
        logger.info("Sensor topic: {}", config.sensorTopic());
        logger.info("Control topic: {}", config.controlTopic());
        logger.info("Database: {}", config.dbUrl());
        logger.info("Zone: {}", zone);
        logger.info("==================");

        DatabaseManager db = null;
        IngestionSubscriber subscriber = null;
        MqttCommandPublisher publisher = null;
        DashboardWebServer webServer = null;
        SimulatedClassroomSensor simulator = null;
        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        boolean failed = false;

        try {
            db = new DatabaseManager(config.dbUrl(), config.dbUser(), config.dbPassword());
            ReadingRepository readings = new ReadingRepository(db, zone);
            ControlCommandRepository commands = new ControlCommandRepository(db);

            LatestStateCache cache = new LatestStateCache();
            try {
                readings.latest().ifPresent(reading -> {
                    cache.setReading(reading);
                    logger.info("Live view warmed with reading from {}", reading.getTimestamp());
                });
            } catch (PersistenceException e) {
                logger.warn("Could not load the latest stored reading, starting with an empty live view");
            }

            PayloadCodec codec = new PayloadCodec(zone);
            subscriber = new IngestionSubscriber(
                    new PahoBrokerTransport(config.mqttClientBuilder("ingest").build()),
                    codec, cache, readings, config.ingestionSettings(), clock);
            publisher = new MqttCommandPublisher(
                    new PahoBrokerTransport(config.mqttClientBuilder("control").build()),
                    codec, commands, config.commandPublisherSettings());

            ControlDispatcher dispatcher = new ControlDispatcher(cache, publisher, config.privilegedRoles(), clock);
            ClassGuardQueryApi api = new ClassGuardQueryApi(cache, readings, commands,
                    new AggregationEngine(readings), dispatcher, new ReportGenerator(readings, zone, clock), clock);

            subscriber.start();

            webServer = new DashboardWebServer(DashboardWebServer.Config.from(config), api, subscriber);
            webServer.start();

            if (config.getBoolean("simulator.enabled", false)) {
                simulator = new SimulatedClassroomSensor(config.mqttClientBuilder("simulator").build(), codec,
                        SimulatedClassroomSensor.Settings.from(config), clock, new Random());
                simulator.start();
            }

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown hook triggered, performing cleanup...");
                shutdown.countDown();
                try {
                    stopped.await(15, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "classguard-shutdown"));

            logger.info("ClassGuard running... Press Ctrl+C to stop");
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("ClassGuard failed to start", e);
            failed = true;
        } finally {
            if (simulator != null) {
                simulator.close();
            }
            if (webServer != null) {
                webServer.close();
            }
            if (subscriber != null) {
                subscriber.close();
            }
            if (publisher != null) {
                publisher.close();
            }
            if (db != null) {
                db.close();
            }
            logger.info("ClassGuard cleanup completed");
            stopped.countDown();
        }
        if (failed) {
            System.exit(1);
        }
    }
}
