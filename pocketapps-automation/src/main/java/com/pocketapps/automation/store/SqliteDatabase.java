package com.pocketapps.automation.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection source for the SQLite database file shared by the stores.
 */
@Slf4j
public final class SqliteDatabase {

    private static final int BUSY_TIMEOUT_MS = 5000;

    private final String jdbcUrl;

    public SqliteDatabase(Path dbPath) {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path absolute = dbPath.toAbsolutePath();
        try {
            Files.createDirectories(absolute.getParent());
        } catch (IOException e) {
            throw new StoreException("Cannot create database directory " + absolute.getParent(), e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + absolute;
        log.info("Using SQLite database {}", absolute);
    }

    Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS + ";");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    void executeDdl(String... statements) {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : statements) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema", e);
        }
    }
}
