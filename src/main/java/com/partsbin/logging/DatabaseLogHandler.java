package com.partsbin.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Asynchronously writes JUL records to a central PostgreSQL table so allocation and picking runs
 * from several workstations can be audited in one place. Every record carries the id of the run
 * that produced it. Throws {@link IllegalStateException} when no JDBC URL is configured.
 */
public final class DatabaseLogHandler extends Handler {

    private static final String INSERT_SQL = """
        INSERT INTO storage_logs (
            logged_at,
            run_id,
            level,
            logger,
            message,
            details,
            thread_name,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> queue = new LinkedBlockingQueue<>(1024);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final String runId;
    private final Thread worker;

    private volatile boolean running = true;

    public DatabaseLogHandler() {
        this(UUID.randomUUID().toString());
    }

    public DatabaseLogHandler(String runId) {
        DbConfig config = DbConfig.load();
        if (!config.enabled()) {
            throw new IllegalStateException("no JDBC configuration provided");
        }
        this.runId = Objects.requireNonNull(runId, "runId");
        this.dataSource = createDataSource(config);
        this.hostName = resolveHostName();
        this.worker = new Thread(this::drainLoop, "storage-log-writer");
        this.worker.setDaemon(true);
        this.worker.start();
        setLevel(Level.ALL);
    }

    public String runId() {
        return runId;
    }

    private void drainLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord record = queue.poll(1, TimeUnit.SECONDS);
                if (record != null) {
                    writeRecord(record);
                }
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (SQLException | RuntimeException ex) {
                System.err.println("DatabaseLogHandler failure: " + ex.getMessage());
            }
        }

        // drain whatever is left after close()
        LogRecord record;
        while ((record = queue.poll()) != null) {
            try {
                writeRecord(record);
            } catch (SQLException | RuntimeException ex) {
                System.err.println("DatabaseLogHandler shutdown failure: " + ex.getMessage());
            }
        }
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!isLoggable(record) || !running) {
            return;
        }
        if (!queue.offer(record)) {
            queue.poll();
            queue.offer(record);
        }
    }

    @Override
    public void flush() {
        // records are persisted by the worker thread
    }

    @Override
    public void close() throws SecurityException {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeRecord(LogRecord record) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
            statement.setString(2, runId);
            statement.setString(3, record.getLevel().getName());
            statement.setString(4, record.getLoggerName());
            statement.setString(5, renderMessage(record));
            statement.setString(6, formatParameters(record));
            statement.setString(7, threadName(record));
            statement.setString(8, hostName);
            if (record.getThrown() != null) {
                statement.setString(9, record.getThrown().getClass().getName());
                statement.setString(10, record.getThrown().getMessage());
            } else {
                statement.setString(9, null);
                statement.setString(10, null);
            }
            statement.executeUpdate();
        }
    }

    private static String formatParameters(LogRecord record) {
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return null;
        }
        return Arrays.toString(params);
    }

    private static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        Object[] params = record.getParameters();
        if (message == null) {
            return "";
        }
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String threadName(LogRecord record) {
        int threadId = record.getThreadID();
        return threadId == 0 ? null : "thread-" + threadId;
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource createDataSource(DbConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.url());
        hikariConfig.setUsername(config.username());
        hikariConfig.setPassword(config.password());
        hikariConfig.setMaximumPoolSize(config.poolSize());
        hikariConfig.setPoolName("StorageLoggingPool");
        hikariConfig.setAutoCommit(true);
        hikariConfig.setConnectionTestQuery("SELECT 1");
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    private record DbConfig(String url, String username, String password, int poolSize, boolean enabled) {

        static DbConfig load() {
            Properties fileProps = loadFileProperties();
            String url = firstNonBlank(
                System.getProperty("storage.log.jdbc.url"),
                System.getenv("STORAGE_LOG_JDBC_URL"),
                fileProps.getProperty("jdbc.url")
            );
            String username = firstNonBlank(
                System.getProperty("storage.log.jdbc.user"),
                System.getenv("STORAGE_LOG_JDBC_USER"),
                fileProps.getProperty("jdbc.username")
            );
            String password = firstNonBlank(
                System.getProperty("storage.log.jdbc.pass"),
                System.getenv("STORAGE_LOG_JDBC_PASS"),
                fileProps.getProperty("jdbc.password")
            );
            int poolSize = parsePoolSize(
                firstNonBlank(
                    System.getProperty("storage.log.jdbc.poolSize"),
                    System.getenv("STORAGE_LOG_JDBC_POOL"),
                    fileProps.getProperty("jdbc.poolSize")
                )
            );
            boolean enabled = url != null && !url.isBlank();
            return new DbConfig(url, username, password, poolSize, enabled);
        }

        private static Properties loadFileProperties() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class
                .getClassLoader()
                .getResourceAsStream("logging-db.properties")) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                System.err.println("Ignoring unreadable logging-db.properties: " + ex.getMessage());
            }
            return props;
        }

        private static String firstNonBlank(String... values) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }

        private static int parsePoolSize(String raw) {
            try {
                return raw == null ? 2 : Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
