package io.classguard.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseManager {
    
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);
    private static final String SCHEMA_RESOURCE = "schema.sql";
    
    private final String url;
    private final String user;
    private final String password;
    private volatile boolean schemaReady;
    
    /**
     * Applies the schema if the database is reachable. An unreachable database
     * is not fatal: the schema is applied on the first successful connection.
     */
    public DatabaseManager(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
        try {
            initializeDatabase();
        } catch (PersistenceException e) {
            logger.warn("Database {} not ready ({}), schema will be applied on first successful connection",
                    url, e.getMessage());
        }
    }
    
    private void initializeDatabase() {
        if (schemaReady) {
            return;
        }
        synchronized (this) {
            if (schemaReady) {
                return;
            }
            try (Connection conn = openConnection()) {
                logger.info("Connected to database: {}", url);
                createSchema(conn);
                schemaReady = true;
            } catch (SQLException | IOException e) {
                logger.error("Failed to initialize database", e);
                throw new PersistenceException("Database initialization failed", e);
            }
        }
    }
    
    private void createSchema(Connection conn) throws SQLException, IOException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IOException("Schema file not found: " + SCHEMA_RESOURCE);
            }
            
            String schema = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            // Strip "--" comments line by line before splitting on semicolons
            StringBuilder cleanedSchema = new StringBuilder();
            for (String line : schema.split("\n")) {
                int commentIndex = line.indexOf("--");
                if (commentIndex >= 0) {
                    line = line.substring(0, commentIndex);
                }
                if (!line.trim().isEmpty()) {
                    cleanedSchema.append(line).append("\n");
                }
            }
            
            try (Statement stmt = conn.createStatement()) {
                int executedCount = 0;
                for (String statement : cleanedSchema.toString().split(";")) {
                    String trimmed = statement.trim();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    logger.debug("Executing schema statement {}", executedCount + 1);
                    stmt.execute(trimmed);
                    executedCount++;
                }
                logger.info("Database schema ready. Executed {} statements.", executedCount);
            }
        }
    }
    
    /**
     * Opens a new connection for each call so repository methods can run from
     * any thread. Callers close it with try-with-resources.
     */
    public Connection getConnection() {
        initializeDatabase();
        return openConnection();
    }
    
    public boolean isSchemaReady() {
        return schemaReady;
    }
    
    private Connection openConnection() {
        try {
            return DriverManager.getConnection(url, user, password);
        } catch (SQLException e) {
            logger.error("Failed to get database connection: {}", e.getMessage());
            throw new PersistenceException("Database connection failed", e);
        }
    }
    
    public String getUrl() {
        return url;
    }
    
    public void close() {
        // Connections are per call and closed by their owners
        logger.debug("DatabaseManager.close() called for {}", url);
    }
}
