package com.pocketapps.automation.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.pocketapps.automation.data.DataPoint;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link DataPointStore}. Values are stored as JSON text and
 * creation times as epoch milliseconds taken from the injected clock.
 */
@Slf4j
public final class SqliteDataPointStore implements DataPointStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteDataPointStore(SqliteDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
        database.executeDdl("""
                CREATE TABLE IF NOT EXISTS app_data (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    app_id INTEGER NOT NULL,
                    key TEXT NOT NULL,
                    value_json TEXT,
                    created_at_ms INTEGER NOT NULL
                )
                """, """
                CREATE INDEX IF NOT EXISTS idx_app_data_app_key_created
                ON app_data(app_id, key, created_at_ms DESC)
                """);
    }

    @Override
    public synchronized DataPoint append(long appId, String key, JsonNode value) {
        Instant createdAt = clock.instant();
        JsonNode stored = value != null ? value : NullNode.getInstance();
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "INSERT INTO app_data (app_id, key, value_json, created_at_ms) VALUES (?, ?, ?, ?)")) {
            statement.setLong(1, appId);
            statement.setString(2, key);
            statement.setString(3, MAPPER.writeValueAsString(stored));
            statement.setLong(4, createdAt.toEpochMilli());
            statement.executeUpdate();

            long id;
            try (Statement idQuery = connection.createStatement();
                 ResultSet keys = idQuery.executeQuery("SELECT last_insert_rowid()")) {
                keys.next();
                id = keys.getLong(1);
            }
            log.debug("Appended data point {} for app {} key {}", id, appId, key);
            return new DataPoint(id, appId, key, stored, createdAt);
        } catch (SQLException | JsonProcessingException e) {
            throw new StoreException("Failed to append data for app " + appId + " key " + key, e);
        }
    }

    @Override
    public synchronized List<DataPoint> findSince(long appId, String key, Instant since) {
        return query("""
                SELECT id, app_id, key, value_json, created_at_ms FROM app_data
                WHERE app_id = ? AND key = ? AND created_at_ms >= ?
                ORDER BY created_at_ms DESC, id DESC
                """, appId, key, since.toEpochMilli());
    }

    @Override
    public synchronized Optional<DataPoint> findLatest(long appId, String key) {
        List<DataPoint> rows = query("""
                SELECT id, app_id, key, value_json, created_at_ms FROM app_data
                WHERE app_id = ? AND key = ?
                ORDER BY id DESC LIMIT 1
                """, appId, key);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<DataPoint> query(String sql, Object... params) {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = statement.executeQuery()) {
                List<DataPoint> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(new DataPoint(
                            rs.getLong("id"),
                            rs.getLong("app_id"),
                            rs.getString("key"),
                            readValue(rs.getString("value_json")),
                            Instant.ofEpochMilli(rs.getLong("created_at_ms"))));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query app data", e);
        }
    }

    private static JsonNode readValue(String json) {
        if (json == null) {
            return NullNode.getInstance();
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable stored value, treating as null: {}", e.getOriginalMessage());
            return NullNode.getInstance();
        }
    }
}
