package io.classguard.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsParameters;
import com.sun.net.httpserver.HttpsServer;
import io.classguard.ingest.api.ClassGuardQueryApi;
import io.classguard.ingest.config.ClassGuardConfig;
import io.classguard.ingest.control.ControlResult;
import io.classguard.ingest.subscriber.IngestionSubscriber;
import io.classguard.store.model.Device;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManagerFactory;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front end of the dashboard. Binds to loopback unless remote access is
 * enabled; operator identity and role are supplied by the authenticating proxy
 * in front of it through the {@value #ROLE_HEADER} and {@value #USER_HEADER}
 * headers.
 */
public final class DashboardWebServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DashboardWebServer.class);

    static final String ROLE_HEADER = "X-ClassGuard-Role";
    static final String USER_HEADER = "X-ClassGuard-User";

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int DEFAULT_WINDOW_MINUTES = 60;
    static final int DEFAULT_BUCKETS = 12;
    static final int DEFAULT_REPORT_HOURS = 24;
    static final int DEFAULT_REPORT_ROWS = 50;
    static final int DEFAULT_RECENT_COMMANDS = 10;

    private final HttpServer server;
    private final ExecutorService executor;
    private final ClassGuardQueryApi api;
    private final IngestionSubscriber subscriber;

    public static class Config {
        public int port = 8080;
        public boolean allowRemote = false;
        public boolean tlsEnabled = false;
        public String keystorePath;
        public String keystorePassword = "changeit";
        public String truststorePath;
        public String truststorePassword = "changeit";

        public static Config from(ClassGuardConfig config) {
            Config cfg = new Config();
            cfg.port = config.getInt("web.port", cfg.port);
            cfg.allowRemote = config.getBoolean("web.bind.remote", cfg.allowRemote);
            cfg.tlsEnabled = config.getBoolean("web.tls.enabled", cfg.tlsEnabled);
            cfg.keystorePath = config.getString("web.keystore.path", null);
            cfg.keystorePassword = config.getString("web.keystore.password", cfg.keystorePassword);
            cfg.truststorePath = config.getString("web.truststore.path", null);
            cfg.truststorePassword = config.getString("web.truststore.password", cfg.truststorePassword);
            return cfg;
        }
    }

    public DashboardWebServer(Config cfg, ClassGuardQueryApi api, IngestionSubscriber subscriber) throws IOException {
        this.api = api;
        this.subscriber = subscriber;

        InetAddress bind = cfg.allowRemote ? InetAddress.getByName("0.0.0.0") : InetAddress.getLoopbackAddress();
        if (cfg.tlsEnabled) {
            this.server = createHttpsServer(bind, cfg);
        } else {
            this.server = HttpServer.create(new InetSocketAddress(bind, cfg.port), 0);
        }

        server.createContext("/", exchange -> respondJson(exchange, 404, JsonViews.error("Not found")));
        server.createContext("/status", get("/status", this::handleStatus));
        server.createContext("/api/latest", get("/api/latest", this::handleLatest));
        server.createContext("/api/history", get("/api/history", this::handleHistory));
        server.createContext("/api/chart", get("/api/chart", this::handleChart));
        server.createContext("/api/report", get("/api/report", this::handleReport));
        server.createContext("/api/control", route("/api/control", "POST", this::handleControl));
        server.createContext("/api/control/recent", get("/api/control/recent", this::handleRecentCommands));

        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "classguard-web");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("DashboardWebServer started on {}:{}. Remote access: {}",
                server.getAddress().getAddress().getHostAddress(), getPort(),
                !server.getAddress().getAddress().isLoopbackAddress());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    private void handleStatus(HttpExchange exchange, Map<String, String> query) throws IOException {
        JSONObject body = new JSONObject().put("status", "ok");
        if (subscriber != null) {
            body.put("ingestion", JsonViews.ingestion(subscriber.getState().name(), subscriber.getStats()));
        }
        body.put("storedReadings", api.storedReadingCount());
        respondJson(exchange, 200, body);
    }

    private void handleLatest(HttpExchange exchange, Map<String, String> query) throws IOException {
        respondJson(exchange, 200, JsonViews.latest(api.getLatest()));
    }

    private void handleHistory(HttpExchange exchange, Map<String, String> query) throws IOException {
        LocalDate date = null;
        String rawDate = query.get("date");
        if (rawDate != null && !rawDate.isBlank()) {
            try {
                date = LocalDate.parse(rawDate.trim());
            } catch (DateTimeParseException e) {
                logger.debug("Ignoring invalid date '{}'", rawDate);
            }
        }
        int page = positiveInt(query, "page", 1);
        int pageSize = positiveInt(query, "pageSize", DEFAULT_PAGE_SIZE);
        respondJson(exchange, 200, JsonViews.history(api.listHistory(date, page, pageSize)));
    }

    private void handleChart(HttpExchange exchange, Map<String, String> query) throws IOException {
        int minutes = positiveInt(query, "windowMinutes", DEFAULT_WINDOW_MINUTES);
        int buckets = positiveInt(query, "buckets", DEFAULT_BUCKETS);
        respondJson(exchange, 200, JsonViews.chart(api.getChartSeries(Duration.ofMinutes(minutes), buckets))
                .put("windowMinutes", minutes));
    }

    private void handleReport(HttpExchange exchange, Map<String, String> query) throws IOException {
        int hours = positiveInt(query, "hours", DEFAULT_REPORT_HOURS);
        int maxRows = positiveInt(query, "maxRows", DEFAULT_REPORT_ROWS);
        respondJson(exchange, 200, JsonViews.report(api.buildReport(Duration.ofHours(hours), maxRows)));
    }

    private void handleRecentCommands(HttpExchange exchange, Map<String, String> query) throws IOException {
        int limit = positiveInt(query, "limit", DEFAULT_RECENT_COMMANDS);
        respondJson(exchange, 200, JsonViews.commands(api.recentCommands(limit)).toString());
    }

    private void handleControl(HttpExchange exchange, Map<String, String> query) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        JSONObject json;
        try {
            Object parsed = new JSONTokener(body).nextValue();
            if (!(parsed instanceof JSONObject)) {
                respondJson(exchange, 400, JsonViews.error("Malformed body"));
                return;
            }
            json = (JSONObject) parsed;
        } catch (JSONException e) {
            respondJson(exchange, 400, JsonViews.error("Malformed body"));
            return;
        }
        Object state = json.opt("state");
        if (!(state instanceof Boolean)) {
            respondJson(exchange, 400, JsonViews.error("Malformed body"));
            return;
        }

        String device = json.optString("device", null);
        String role = exchange.getRequestHeaders().getFirst(ROLE_HEADER);
        String user = exchange.getRequestHeaders().getFirst(USER_HEADER);
        ControlResult result = api.issueControl(device, (Boolean) state, role, user);
        switch (result) {
            case SUCCESS:
                respondJson(exchange, 200, new JSONObject()
                        .put("result", "success")
                        .put("device", Device.fromName(device).map(Device::wireName).orElse(device))
                        .put("state", state));
                break;
            case UNAUTHORIZED:
                respondJson(exchange, 403, JsonViews.error(result.getMessage()));
                break;
            default:
                respondJson(exchange, 400, JsonViews.error(result.getMessage()));
                break;
        }
    }

    private HttpHandler get(String path, Endpoint endpoint) {
        return route(path, "GET", endpoint);
    }

    private HttpHandler route(String path, String method, Endpoint endpoint) {
        return exchange -> {
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    respondJson(exchange, 404, JsonViews.error("Not found"));
                    return;
                }
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", method);
                    respondJson(exchange, 405, JsonViews.error("Method not allowed"));
                    return;
                }
                endpoint.handle(exchange, parseQuery(exchange.getRequestURI().getRawQuery()));
            } catch (RuntimeException e) {
                logger.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                respondJson(exchange, 500, JsonViews.error("Internal error"));
            } finally {
                exchange.close();
            }
        };
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int idx = pair.indexOf('=');
            String key = idx < 0 ? pair : pair.substring(0, idx);
            String value = idx < 0 ? "" : pair.substring(idx + 1);
            try {
                params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                        URLDecoder.decode(value, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                logger.debug("Skipping undecodable query parameter '{}'", pair);
            }
        }
        return params;
    }

    private static int positiveInt(Map<String, String> query, String name, int defaultValue) {
        String value = query.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static void respondJson(HttpExchange exchange, int code, JSONObject body) throws IOException {
        respondJson(exchange, code, body.toString());
    }

    private static void respondJson(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        logger.info("DashboardWebServer stopped");
    }

    private static HttpServer createHttpsServer(InetAddress bind, Config cfg) throws IOException {
        if (cfg.keystorePath == null) {
            throw new IllegalArgumentException("web.keystore.path is required when TLS is enabled");
        }
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            try (FileInputStream fis = new FileInputStream(cfg.keystorePath)) {
                keyStore.load(fis, cfg.keystorePassword.toCharArray());
            }
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, cfg.keystorePassword.toCharArray());

            TrustManagerFactory tmf = null;
            if (cfg.truststorePath != null) {
                KeyStore trustStore = KeyStore.getInstance("PKCS12");
                try (FileInputStream fis = new FileInputStream(cfg.truststorePath)) {
                    trustStore.load(fis, cfg.truststorePassword.toCharArray());
                }
                tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
                tmf.init(trustStore);
            }

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(kmf.getKeyManagers(), tmf == null ? null : tmf.getTrustManagers(), null);

            HttpsServer httpsServer = HttpsServer.create(new InetSocketAddress(bind, cfg.port), 0);
            SSLParameters params = sslContext.getDefaultSSLParameters();
            // client certificates only when a truststore to verify them is configured
            params.setNeedClientAuth(tmf != null);
            httpsServer.setHttpsConfigurator(new HttpsConfigurator(sslContext) {
                @Override
                public void configure(HttpsParameters p) {
                    p.setSSLParameters(params);
                }
            });
            return httpsServer;
        } catch (GeneralSecurityException e) {
            throw new IOException("Failed to create HTTPS server", e);
        }
    }

    @FunctionalInterface
    private interface Endpoint {
        void handle(HttpExchange exchange, Map<String, String> query) throws IOException;
    }
}
