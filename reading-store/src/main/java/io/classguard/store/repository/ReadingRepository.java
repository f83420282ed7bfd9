package io.classguard.store.repository;

import io.classguard.store.DatabaseManager;
import io.classguard.store.PersistenceException;
import io.classguard.store.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public class ReadingRepository {

    private static final Logger logger = LoggerFactory.getLogger(ReadingRepository.class);

    public static final int MAX_PAGE_SIZE = 500;
    private static final int SCAN_FETCH_SIZE = 256;

    private static final String COLUMNS =
            "id, device_id, temperature, humidity, co2, light, noise, aqi, class_score, status, ts, received_at";

    private final DatabaseManager dbManager;
    private final ZoneId zone;

    public ReadingRepository(DatabaseManager dbManager, ZoneId zone) {
        this.dbManager = dbManager;
        this.zone = zone;
    }

    /**
     * Inserts the reading and returns its sequence id. Ids grow with arrival
     * order, independent of the reading's own timestamp.
     */
    public long append(Reading reading) {
        String sql = "INSERT INTO sensor_readings (device_id, temperature, humidity, co2, light, noise, aqi, "
                + "class_score, status, ts, received_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        Instant receivedAt = reading.getReceivedAt() != null ? reading.getReceivedAt() : Instant.now();
        Instant ts = reading.getTimestamp() != null ? reading.getTimestamp() : receivedAt;

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, reading.getDeviceId());
            setNullableDouble(stmt, 2, reading.getTemperature());
            setNullableDouble(stmt, 3, reading.getHumidity());
            setNullableDouble(stmt, 4, reading.getCo2());
            setNullableDouble(stmt, 5, reading.getLight());
            setNullableDouble(stmt, 6, reading.getNoise());
            setNullableDouble(stmt, 7, reading.getAqi());
            stmt.setInt(8, reading.getScore());
            stmt.setString(9, reading.getStatus());
            stmt.setObject(10, toUtc(ts));
            stmt.setObject(11, toUtc(receivedAt));

            int affected = stmt.executeUpdate();
            if (affected == 0) {
                throw new SQLException("Inserting reading failed, no rows affected.");
            }

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (keys.next()) {
                    long id = keys.getLong(1);
                    logger.debug("Reading inserted id={} ts={}", id, ts);
                    return id;
                }
                throw new SQLException("Inserting reading failed, no ID obtained.");
            }
        } catch (SQLException e) {
            logger.error("Failed to insert reading", e);
            throw new PersistenceException("Database operation failed", e);
        }
    }

    /**
     * Returns one page of readings matching the filter, newest timestamp first.
     * Page numbers outside {@code 1..totalPages} give an empty page.
     */
    public ReadingPage query(ReadingFilter filter, int page, int pageSize) {
        int size = Math.max(1, Math.min(pageSize, MAX_PAGE_SIZE));
        List<Object> params = new ArrayList<>();
        String where = whereClause(filter, params);

        try (Connection conn = dbManager.getConnection()) {
            long total = count(conn, where, params);
            long offset = (long) (page - 1) * size;
            if (page < 1 || offset >= total) {
                return new ReadingPage(List.of(), page, size, total);
            }

            String sql = "SELECT " + COLUMNS + " FROM sensor_readings" + where
                    + " ORDER BY ts DESC, id DESC LIMIT ? OFFSET ?";
            List<Reading> items = new ArrayList<>(size);
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int index = bind(stmt, params);
                stmt.setInt(index++, size);
                stmt.setLong(index, offset);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        items.add(mapResultSetToReading(rs));
                    }
                }
            }
            return new ReadingPage(items, page, size, total);
        } catch (SQLException e) {
            logger.error("Failed to query readings with {}", filter, e);
            throw new PersistenceException("Database operation failed", e);
        }
    }

    /**
     * Streams readings with {@code since <= ts < until} in ascending timestamp
     * order through a database cursor. The stream holds a connection until it
     * is closed, so callers must use try-with-resources.
     */
    public Stream<Reading> rangeScan(Instant since, Instant until) {
        String sql = "SELECT " + COLUMNS + " FROM sensor_readings WHERE ts >= ? AND ts < ? ORDER BY ts ASC, id ASC";

        Connection conn = dbManager.getConnection();
        try {
            // PostgreSQL only honours the fetch size outside auto-commit
            conn.setAutoCommit(false);
            PreparedStatement stmt = conn.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
            stmt.setFetchSize(SCAN_FETCH_SIZE);
            stmt.setObject(1, toUtc(since));
            stmt.setObject(2, toUtc(until));
            ReadingCursor cursor = new ReadingCursor(conn, stmt, stmt.executeQuery());
            return StreamSupport
                    .stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL), false)
                    .onClose(cursor::close);
        } catch (SQLException e) {
            logger.error("Failed to open range scan [{}, {})", since, until, e);
            closeConnection(conn);
            throw new PersistenceException("Database operation failed", e);
        }
    }

    /**
     * The most recently received reading, used to warm the live cache on start-up.
     */
    public Optional<Reading> latest() {
        String sql = "SELECT " + COLUMNS + " FROM sensor_readings ORDER BY id DESC LIMIT 1";
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.of(mapResultSetToReading(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            logger.error("Failed to load latest reading", e);
            throw new PersistenceException("Database operation failed", e);
        }
    }

    /**
     * Highest sequence id assigned so far, or 0 when nothing has been stored.
     */
    public long lastId() {
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT MAX(id) FROM sensor_readings");
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.error("Failed to read last reading id", e);
            throw new PersistenceException("Database operation failed", e);
        }
    }

    public long count() {
        try (Connection conn = dbManager.getConnection()) {
            return count(conn, "", List.of());
        } catch (SQLException e) {
            logger.error("Failed to count readings", e);
            throw new PersistenceException("Database operation failed", e);
        }
    }

    private long count(Connection conn, String where, List<Object> params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM sensor_readings" + where)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private String whereClause(ReadingFilter filter, List<Object> params) {
        List<String> conditions = new ArrayList<>();
        if (filter.getSince() != null) {
            conditions.add("ts >= ?");
            params.add(toUtc(filter.getSince()));
        }
        if (filter.getUntil() != null) {
            conditions.add("ts < ?");
            params.add(toUtc(filter.getUntil()));
        }
        if (filter.getDate() != null) {
            conditions.add("ts >= ?");
            params.add(toUtc(filter.getDate().atStartOfDay(zone).toInstant()));
            conditions.add("ts < ?");
            params.add(toUtc(filter.getDate().plusDays(1).atStartOfDay(zone).toInstant()));
        }
        if (filter.getMaxId() != null) {
            conditions.add("id <= ?");
            params.add(filter.getMaxId());
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private int bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        int index = 1;
        for (Object param : params) {
            stmt.setObject(index++, param);
        }
        return index;
    }

    private Reading mapResultSetToReading(ResultSet rs) throws SQLException {
        return Reading.builder()
                .deviceId(rs.getString("device_id"))
                .temperature(getNullableDouble(rs, "temperature"))
                .humidity(getNullableDouble(rs, "humidity"))
                .co2(getNullableDouble(rs, "co2"))
                .light(getNullableDouble(rs, "light"))
                .noise(getNullableDouble(rs, "noise"))
                .aqi(getNullableDouble(rs, "aqi"))
                .score(rs.getInt("class_score"))
                .status(rs.getString("status"))
                .timestamp(rs.getObject("ts", OffsetDateTime.class).toInstant())
                .receivedAt(rs.getObject("received_at", OffsetDateTime.class).toInstant())
                .build();
    }

    private static OffsetDateTime toUtc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value != null) {
            stmt.setDouble(index, value);
        } else {
            stmt.setNull(index, Types.DOUBLE);
        }
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void closeConnection(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.warn("Error closing scan connection", e);
        }
    }

    private final class ReadingCursor implements Iterator<Reading>, AutoCloseable {
        private final Connection conn;
        private final PreparedStatement stmt;
        private final ResultSet rs;
        private Reading next;
        private boolean exhausted;
        private boolean closed;

        ReadingCursor(Connection conn, PreparedStatement stmt, ResultSet rs) {
            this.conn = conn;
            this.stmt = stmt;
            this.rs = rs;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (exhausted || closed) {
                return false;
            }
            try {
                if (rs.next()) {
                    next = mapResultSetToReading(rs);
                    return true;
                }
                exhausted = true;
                return false;
            } catch (SQLException e) {
                logger.error("Range scan failed while reading rows", e);
                throw new PersistenceException("Database operation failed", e);
            }
        }

        @Override
        public Reading next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Reading current = next;
            next = null;
            return current;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                rs.close();
                stmt.close();
                conn.rollback();
            } catch (SQLException e) {
                logger.warn("Error releasing range scan cursor", e);
            } finally {
                closeConnection(conn);
            }
        }
    }
}
