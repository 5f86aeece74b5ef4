package com.pocketapps.automation.store;

import com.pocketapps.automation.action.ActionConfig;
import com.pocketapps.automation.action.ActionConfigs;
import com.pocketapps.automation.action.ActionKind;
import com.pocketapps.automation.job.Job;
import com.pocketapps.automation.job.JobValidationException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link JobStore}. Action configuration is kept as JSON.
 * <p>
 * Rows whose action kind or configuration no longer parses are logged and
 * left out of query results, so one bad row never stops the others from
 * loading.
 */
@Slf4j
public final class SqliteJobStore implements JobStore {

    private static final String COLUMNS =
            "id, app_id, name, schedule, human_readable, action, config_json, is_active, last_run_ms, next_run_ms";

    private final SqliteDatabase database;

    public SqliteJobStore(SqliteDatabase database) {
        this.database = database;
        database.executeDdl("""
                CREATE TABLE IF NOT EXISTS automation_jobs (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    app_id INTEGER NOT NULL,
                    name TEXT NOT NULL,
                    schedule TEXT NOT NULL,
                    human_readable TEXT,
                    action TEXT NOT NULL,
                    config_json TEXT,
                    is_active INTEGER NOT NULL DEFAULT 1,
                    last_run_ms INTEGER,
                    next_run_ms INTEGER
                )
                """, """
                CREATE INDEX IF NOT EXISTS idx_automation_jobs_app
                ON automation_jobs(app_id)
                """);
    }

    @Override
    public synchronized Job insert(Job job) {
        String sql = """
                INSERT INTO automation_jobs
                    (app_id, name, schedule, human_readable, action, config_json, is_active, last_run_ms, next_run_ms)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, job.getAppId());
            statement.setString(2, job.getName());
            statement.setString(3, job.getSchedule());
            statement.setString(4, job.getHumanReadable());
            statement.setString(5, job.getAction().wireName());
            statement.setString(6, ActionConfigs.toJson(job.getConfig()));
            statement.setInt(7, job.isActive() ? 1 : 0);
            setInstant(statement, 8, job.getLastRun());
            setInstant(statement, 9, job.getNextRun());
            statement.executeUpdate();

            long id;
            try (Statement idQuery = connection.createStatement();
                 ResultSet keys = idQuery.executeQuery("SELECT last_insert_rowid()")) {
                keys.next();
                id = keys.getLong(1);
            }
            job.setId(id);
            return job;
        } catch (SQLException e) {
            throw new StoreException("Failed to insert job '" + job.getName() + "'", e);
        }
    }

    @Override
    public synchronized Optional<Job> findById(long id) {
        List<Job> jobs = query("SELECT " + COLUMNS + " FROM automation_jobs WHERE id = ?", id);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public synchronized List<Job> findActive() {
        return query("SELECT " + COLUMNS + " FROM automation_jobs WHERE is_active = 1 ORDER BY id");
    }

    @Override
    public synchronized List<Job> findActiveByApp(long appId) {
        return query("SELECT " + COLUMNS + " FROM automation_jobs WHERE is_active = 1 AND app_id = ? ORDER BY id",
                appId);
    }

    @Override
    public synchronized int countByApp(long appId) {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT COUNT(*) FROM automation_jobs WHERE app_id = ?")) {
            statement.setLong(1, appId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs for app " + appId, e);
        }
    }

    @Override
    public synchronized void recordRun(long jobId, Instant lastRun, Instant nextRun) {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "UPDATE automation_jobs SET last_run_ms = ?, next_run_ms = ? WHERE id = ?")) {
            setInstant(statement, 1, lastRun);
            setInstant(statement, 2, nextRun);
            statement.setLong(3, jobId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to record run of job " + jobId, e);
        }
    }

    @Override
    public synchronized void setActive(long jobId, boolean active) {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "UPDATE automation_jobs SET is_active = ? WHERE id = ?")) {
            statement.setInt(1, active ? 1 : 0);
            statement.setLong(2, jobId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to update job " + jobId, e);
        }
    }

    private List<Job> query(String sql, Object... params) {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = statement.executeQuery()) {
                List<Job> jobs = new ArrayList<>();
                while (rs.next()) {
                    mapRow(rs).ifPresent(jobs::add);
                }
                return jobs;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query jobs", e);
        }
    }

    private Optional<Job> mapRow(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        String action = rs.getString("action");
        Optional<ActionKind> kind = ActionKind.fromWireName(action);
        if (kind.isEmpty()) {
            log.warn("Skipping job {}: unknown action type '{}'", id, action);
            return Optional.empty();
        }
        ActionConfig config;
        try {
            config = ActionConfigs.parse(kind.get(), rs.getString("config_json"));
        } catch (JobValidationException e) {
            log.warn("Skipping job {}: {}", id, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(Job.builder()
                .id(id)
                .appId(rs.getLong("app_id"))
                .name(rs.getString("name"))
                .schedule(rs.getString("schedule"))
                .humanReadable(rs.getString("human_readable"))
                .config(config)
                .active(rs.getInt("is_active") == 1)
                .lastRun(getInstant(rs, "last_run_ms"))
                .nextRun(getInstant(rs, "next_run_ms"))
                .build());
    }

    private static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }
}
