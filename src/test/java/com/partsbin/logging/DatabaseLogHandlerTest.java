package com.partsbin.logging;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseLogHandlerTest {

    private static final String JDBC_URL = "jdbc:h2:mem:storage-logs;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";
    private static final String JDBC_USER = "sa";
    private static final String JDBC_PASS = "";

    @BeforeAll
    static void setUpDatabase() throws SQLException {
        try {
            Class.forName("org.h2.Driver");
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("H2 driver not found on classpath", e);
        }
        System.setProperty("storage.log.jdbc.url", JDBC_URL);
        System.setProperty("storage.log.jdbc.user", JDBC_USER);
        System.setProperty("storage.log.jdbc.pass", JDBC_PASS);
        System.setProperty("storage.log.jdbc.poolSize", "2");

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS storage_logs");
            statement.execute("""
                CREATE TABLE storage_logs (
                    logged_at   TIMESTAMP NOT NULL,
                    run_id      VARCHAR(64) NOT NULL,
                    level       VARCHAR(16) NOT NULL,
                    logger      VARCHAR(128),
                    message     TEXT,
                    details     TEXT,
                    thread_name VARCHAR(64),
                    host        VARCHAR(128),
                    thrown_type VARCHAR(256),
                    thrown_msg  TEXT
                )
                """);
        }
    }

    @AfterEach
    void clearTable() throws SQLException {
        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM storage_logs");
        }
    }

    @AfterAll
    static void tearDown() {
        System.clearProperty("storage.log.jdbc.url");
        System.clearProperty("storage.log.jdbc.user");
        System.clearProperty("storage.log.jdbc.pass");
        System.clearProperty("storage.log.jdbc.poolSize");
    }

    @Test
    void publishPersistsLogRecordWithRunId() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler("run-alloc-1");
        boolean closed = false;
        try {
            LogRecord record = new LogRecord(Level.INFO, "Allocated {0} drawer(s) for {1}");
            record.setLoggerName("com.partsbin");
            record.setParameters(new Object[]{3, "resistor"});

            handler.publish(record);

            handler.close();
            closed = true;

            try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
                 PreparedStatement statement = connection.prepareStatement(
                     "SELECT level, logger, message, details, thrown_type FROM storage_logs WHERE run_id = ?")) {
                statement.setString(1, "run-alloc-1");
                ResultSet resultSet = statement.executeQuery();
                assertTrue(resultSet.next(), "No log record persisted");
                assertEquals("INFO", resultSet.getString("level"));
                assertEquals("com.partsbin", resultSet.getString("logger"));
                assertEquals("Allocated 3 drawer(s) for resistor", resultSet.getString("message"));
                assertEquals("[3, resistor]", resultSet.getString("details"));
                assertNull(resultSet.getString("thrown_type"));
                assertFalse(resultSet.next());
            }
        } finally {
            if (!closed) {
                handler.close();
            }
        }
    }

    @Test
    void thrownDetailsAreStored() throws Exception {
        DatabaseLogHandler handler = new DatabaseLogHandler();
        LogRecord record = new LogRecord(Level.SEVERE, "Sync failed");
        record.setThrown(new IOException("inventory offline"));

        handler.publish(record);
        handler.close();

        try (Connection connection = DriverManager.getConnection(JDBC_URL, JDBC_USER, JDBC_PASS);
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT thrown_type, thrown_msg FROM storage_logs WHERE run_id = ?")) {
            statement.setString(1, handler.runId());
            ResultSet resultSet = statement.executeQuery();
            assertTrue(resultSet.next(), "No log record persisted");
            assertEquals("java.io.IOException", resultSet.getString("thrown_type"));
            assertEquals("inventory offline", resultSet.getString("thrown_msg"));
        }
    }

    @Test
    void missingUrlDisablesHandler() {
        String url = System.clearProperty("storage.log.jdbc.url");
        try {
            assertThrows(IllegalStateException.class, DatabaseLogHandler::new);
        } finally {
            System.setProperty("storage.log.jdbc.url", url);
        }
    }
}
