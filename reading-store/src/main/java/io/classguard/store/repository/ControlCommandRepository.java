package io.classguard.store.repository;

import io.classguard.store.DatabaseManager;
import io.classguard.store.PersistenceException;
import io.classguard.store.model.ControlCommand;
import io.classguard.store.model.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public class ControlCommandRepository {

    private static final Logger logger = LoggerFactory.getLogger(ControlCommandRepository.class);

    private final DatabaseManager dbManager;

    public ControlCommandRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }

    public ControlCommand insert(ControlCommand command) {
        String sql = "INSERT INTO control_commands (device, state, issued_by, issued_at) VALUES (?, ?, ?, ?)";
        try (Connection conn = dbManager.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, command.getDevice().wireName());
            ps.setBoolean(2, command.getState());
            ps.setString(3, command.getIssuedBy());
            ps.setObject(4, command.getIssuedAt().atOffset(ZoneOffset.UTC));
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) command.setId(rs.getLong(1));
            }
            logger.debug("Control command recorded id={}", command.getId());
            return command;
        } catch (SQLException e) {
            logger.error("Failed to record control command", e);
            throw new PersistenceException("Database operation failed", e);
        }
    }

    public List<ControlCommand> findRecent(int limit) {
        String sql = "SELECT id, device, state, issued_by, issued_at FROM control_commands ORDER BY id DESC LIMIT ?";
        List<ControlCommand> commands = new ArrayList<>();
        try (Connection conn = dbManager.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Device device = Device.fromName(rs.getString("device"))
                            .orElseThrow(() -> new SQLException("Unknown device in control_commands"));
                    ControlCommand command = new ControlCommand(
                            device,
                            rs.getBoolean("state"),
                            rs.getObject("issued_at", OffsetDateTime.class).toInstant(),
                            rs.getString("issued_by"));
                    command.setId(rs.getLong("id"));
                    commands.add(command);
                }
            }
        } catch (SQLException e) {
            logger.error("Failed to load recent control commands", e);
            throw new PersistenceException("Database operation failed", e);
        }
        return commands;
    }
}
