package io.classguard.client;

import org.eclipse.paho.client.mqttv3.*;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Thin wrapper around a Paho {@link MqttClient}. Connects over plain TCP or,
 * when keystores are configured, over mutually authenticated TLS.
 */
public class MqttBrokerClient implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(MqttBrokerClient.class);
    
    private final MqttClient mqttClient;
    private final MqttConnectOptions connOpts;
    private final String brokerUrl;
    private volatile Consumer<Throwable> connectionLostHandler = cause -> { };
    
    private MqttBrokerClient(Builder builder) throws MqttException, GeneralSecurityException, IOException {
        this.brokerUrl = (builder.tls ? "ssl://" : "tcp://") + builder.host + ":" + builder.port;
        
        this.mqttClient = new MqttClient(brokerUrl, builder.clientId, new MemoryPersistence());
        this.connOpts = new MqttConnectOptions();
        
        if (builder.tls) {
            SSLContext sslContext = createSSLContext(
                builder.clientKeystorePath,
                builder.clientKeystorePassword,
                builder.clientTruststorePath,
                builder.clientTruststorePassword
            );
            connOpts.setSocketFactory(sslContext.getSocketFactory());
        }
        if (builder.username != null) {
            connOpts.setUserName(builder.username);
            connOpts.setPassword(builder.password != null ? builder.password.toCharArray() : new char[0]);
        }
        connOpts.setCleanSession(builder.cleanSession);
        connOpts.setAutomaticReconnect(builder.autoReconnect);
        connOpts.setConnectionTimeout(builder.connectionTimeout);
        connOpts.setKeepAliveInterval(builder.keepAlive);
        
        if (builder.willTopic != null && builder.willPayload != null) {
            connOpts.setWill(builder.willTopic, builder.willPayload, builder.willQos, false);
            logger.debug("Will message configured: topic={}, qos={}", builder.willTopic, builder.willQos);
        }
        
        mqttClient.setCallback(new MqttCallback() {
            @Override
            public void connectionLost(Throwable cause) {
                logger.warn("Connection to {} lost (clientId: {}): {}", brokerUrl, mqttClient.getClientId(),
                    cause != null ? cause.getMessage() : "unknown cause");
                connectionLostHandler.accept(cause);
            }
            
            @Override
            public void messageArrived(String topic, MqttMessage message) {
                logger.debug("Unrouted message on topic '{}'", topic);
            }
            
            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
                // publish() is synchronous, nothing to track
            }
        });
        
        logger.info("MqttBrokerClient initialized for broker: {}, clientId: {}", brokerUrl, builder.clientId);
    }
    
    private SSLContext createSSLContext(String keystorePath, String keystorePassword,
                                        String truststorePath, String truststorePassword)
            throws GeneralSecurityException, IOException {
        requireReadable(keystorePath, "Keystore");
        requireReadable(truststorePath, "Truststore");
        
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        try (FileInputStream fis = new FileInputStream(keystorePath)) {
            keyStore.load(fis, keystorePassword.toCharArray());
            logger.debug("Keystore loaded successfully");
        }
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, keystorePassword.toCharArray());
        
        KeyStore trustStore = KeyStore.getInstance("PKCS12");
        try (FileInputStream fis = new FileInputStream(truststorePath)) {
            trustStore.load(fis, truststorePassword.toCharArray());
            logger.debug("Truststore loaded successfully");
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(kmf.getKeyManagers(), tmf.getTrustManagers(), null);
        logger.info("SSL Context created successfully with TLS protocol");
        return sslContext;
    }
    
    private static void requireReadable(String path, String label) throws IOException {
        File file = new File(path);
        if (!file.exists()) {
            String error = label + " file does not exist: " + path;
            logger.error(error);
            throw new FileNotFoundException(error);
        }
        if (!file.canRead()) {
            String error = label + " file is not readable: " + path;
            logger.error(error);
            throw new IOException(error);
        }
        logger.debug("{} file validated: {} (size: {} bytes)", label, path, file.length());
    }
    
    /**
     * Invoked from Paho's thread when an established connection drops.
     * Not invoked for {@link #disconnect()}.
     */
    public void setConnectionLostHandler(Consumer<Throwable> handler) {
        this.connectionLostHandler = handler != null ? handler : cause -> { };
    }
    
    public void connect() throws MqttException {
        if (!mqttClient.isConnected()) {
            logger.info("Connecting to MQTT broker {} (clientId: {})...", brokerUrl, mqttClient.getClientId());
            try {
                mqttClient.connect(connOpts);
                logger.info("Connected to MQTT broker successfully (clientId: {})", mqttClient.getClientId());
            } catch (MqttException e) {
                logger.error("Failed to connect to MQTT broker (reason code: {}): {}", e.getReasonCode(), e.getMessage());
                if (e.getCause() instanceof javax.net.ssl.SSLException) {
                    logger.error("SSL handshake failed. Check keystore and truststore configuration.");
                }
                throw e;
            }
        }
    }
    
    public void publish(String topic, byte[] payload, int qos, boolean retained) throws MqttException {
        if (!mqttClient.isConnected()) {
            throw new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED);
        }
        
        MqttMessage message = new MqttMessage(payload);
        message.setQos(qos);
        message.setRetained(retained);
        
        mqttClient.publish(topic, message);
        logger.debug("Published {} bytes to topic '{}' (qos {})", payload.length, topic, qos);
    }
    
    public void subscribe(String topic, int qos, BiConsumer<String, byte[]> messageListener) throws MqttException {
        if (!mqttClient.isConnected()) {
            throw new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED);
        }
        
        mqttClient.subscribe(topic, qos, (t, msg) -> {
            logger.debug("Received {} bytes on topic '{}'", msg.getPayload().length, t);
            messageListener.accept(t, msg.getPayload());
        });
        
        logger.info("Subscribed to topic: {} (qos {})", topic, qos);
    }
    
    public boolean isConnected() {
        return mqttClient.isConnected();
    }
    
    public String getClientId() {
        return mqttClient.getClientId();
    }
    
    public void disconnect() throws MqttException {
        if (mqttClient.isConnected()) {
            logger.info("Disconnecting MQTT client {}...", mqttClient.getClientId());
            mqttClient.disconnect();
            logger.info("MQTT client disconnected");
        }
    }
    
    @Override
    public void close() throws MqttException {
        try {
            disconnect();
        } finally {
            mqttClient.close();
        }
    }
    
    public static class Builder {
        private String host = "localhost";
        private int port = 1883;
        private String clientId;
        private boolean tls = false;
        private String clientKeystorePath;
        private String clientKeystorePassword;
        private String clientTruststorePath;
        private String clientTruststorePassword;
        private String username;
        private String password;
        private boolean cleanSession = true;
        private boolean autoReconnect = false;
        private int connectionTimeout = 30;
        private int keepAlive = 60;
        private String willTopic;
        private byte[] willPayload;
        private int willQos = 1;
        
        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }
        
        public Builder host(String host) {
            this.host = host;
            return this;
        }
        
        public Builder port(int port) {
            this.port = port;
            return this;
        }
        
        public Builder tls(boolean tls) {
            this.tls = tls;
            return this;
        }
        
        public Builder clientKeystore(String path, String password) {
            this.clientKeystorePath = path;
            this.clientKeystorePassword = password;
            return this;
        }
        
        public Builder clientTruststore(String path, String password) {
            this.clientTruststorePath = path;
            this.clientTruststorePassword = password;
            return this;
        }
        
        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }
        
        public Builder cleanSession(boolean cleanSession) {
            this.cleanSession = cleanSession;
            return this;
        }
        
        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }
        
        public Builder connectionTimeout(int seconds) {
            this.connectionTimeout = seconds;
            return this;
        }
        
        public Builder keepAlive(int seconds) {
            this.keepAlive = seconds;
            return this;
        }
        
        public Builder willMessage(String topic, byte[] payload, int qos) {
            this.willTopic = topic;
            this.willPayload = payload;
            this.willQos = qos;
            return this;
        }
        
        public MqttBrokerClient build() throws MqttException, GeneralSecurityException, IOException {
            if (clientId == null || clientId.isEmpty()) {
                throw new IllegalArgumentException("clientId is required");
            }
            if (tls && (clientKeystorePath == null || clientTruststorePath == null)) {
                throw new IllegalArgumentException("Both keystore and truststore paths are required for TLS");
            }
            return new MqttBrokerClient(this);
        }
    }
}
