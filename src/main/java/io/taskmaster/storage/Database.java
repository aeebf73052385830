package io.taskmaster.storage;

import io.taskmaster.config.TaskMasterConfig;
import io.taskmaster.config.TaskMasterSettings;
import io.taskmaster.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.atomic.LongAdder;

/**
 * Single entry point to the embedded store. Readers run concurrently under WAL; writers
 * take the write lock up front and are retried with backoff while SQLite reports
 * BUSY or LOCKED. No other component opens connections on its own.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "taskmaster.schema.migration.v1";

    private final TaskMasterConfig config;
    private final String jdbcUrl;
    private final Properties readProperties;
    private final Properties writeProperties;
    private final long busyTimeoutMs;
    private final RetryPolicy writePolicy;
    private final RetryPolicy lifecyclePolicy;
    private final LongAdder committedWrites = new LongAdder();
    private final LongAdder lockRetries = new LongAdder();
    private final LongAdder lockTimeouts = new LongAdder();

    public Database(TaskMasterConfig config) {
        this(config, TaskMasterSettings.defaults());
    }

    public Database(TaskMasterConfig config, TaskMasterSettings settings) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = settings.dbBusyTimeoutMs();
        this.readProperties = connectionProperties(settings.dbBusyTimeoutMs(), false);
        this.writeProperties = connectionProperties(settings.dbBusyTimeoutMs(), true);
        this.writePolicy = new RetryPolicy(
                settings.dbWriteMaxAttempts(),
                settings.dbWriteBaseBackoffMs(),
                settings.dbWriteMaxBackoffMs()
        );
        this.lifecyclePolicy = new RetryPolicy(
                settings.lifecycleWriteMaxAttempts(),
                settings.dbWriteBaseBackoffMs(),
                settings.dbWriteMaxBackoffMs()
        );
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        applyVersionedMigrations();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, readProperties);
    }

    private Connection openWriteConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, writeProperties);
    }

    public RetryPolicy writePolicy() {
        return writePolicy;
    }

    public RetryPolicy lifecyclePolicy() {
        return lifecyclePolicy;
    }

    public <T> T read(String operation, SqlWork<T> work) {
        try (Connection c = openConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            if (isLockError(e)) {
                lockTimeouts.increment();
                throw PersistenceException.lockTimeout(operation, 1, e);
            }
            throw PersistenceException.fatal(operation, e);
        }
    }

    public <T> T write(String operation, SqlWork<T> work) {
        return write(operation, writePolicy, work);
    }

    /**
     * Runs {@code work} in one transaction. Only lock contention is retried; any other
     * failure is rethrown on the first attempt.
     */
    public <T> T write(String operation, RetryPolicy policy, SqlWork<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try (Connection c = openWriteConnection()) {
                c.setAutoCommit(false);
                try {
                    T out = work.run(c);
                    c.commit();
                    committedWrites.increment();
                    return out;
                } catch (SQLException | RuntimeException e) {
                    rollback(c, e);
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (SQLException e) {
                if (!isLockError(e)) {
                    throw PersistenceException.fatal(operation, e);
                }
                if (attempt >= policy.maxAttempts()) {
                    lockTimeouts.increment();
                    log.warn("Write '{}' gave up after {} attempts on a locked database", operation, attempt);
                    throw PersistenceException.lockTimeout(operation, attempt, e);
                }
                lockRetries.increment();
                long sleepMs = policy.backoffMs(attempt);
                log.debug("Write '{}' hit a lock (attempt {}), retrying in {} ms", operation, attempt, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw PersistenceException.fatal(operation + " (interrupted while waiting for lock)", ie);
                }
            }
        }
    }

    public WriteStats writeStats() {
        return new WriteStats(committedWrites.sum(), lockRetries.sum(), lockTimeouts.sum());
    }

    static boolean isLockError(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLiteException se) {
                SQLiteErrorCode code = se.getResultCode();
                if (code != null && (code.name().startsWith("SQLITE_BUSY") || code.name().startsWith("SQLITE_LOCKED"))) {
                    return true;
                }
            }
            if (t instanceof SQLException sql) {
                int primary = sql.getErrorCode() & 0xff;
                if (primary == 5 || primary == 6) {
                    return true;
                }
            }
            String msg = t.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("database is locked") || lower.contains("sqlite_busy")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException re) {
            cause.addSuppressed(re);
        }
    }

    private static Properties connectionProperties(long busyTimeoutMs, boolean immediate) {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, busyTimeoutMs));
        cfg.enforceForeignKeys(true);
        cfg.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        if (immediate) {
            cfg.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        }
        return cfg.toProperties();
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", Long.toString(Math.min(Integer.MAX_VALUE, busyTimeoutMs)));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    private void applyVersionedMigrations() {
        try (Connection conn = openWriteConnection()) {
            ensureSchemaMigrationsTable(conn);
            for (Migrations.MigrationStep step : Migrations.all()) {
                String checksum = checksum(step);
                AppliedState state = appliedState(conn, step.version());
                if (state != null && state.success()) {
                    if (!checksum.equals(state.checksum())) {
                        throw new IllegalStateException("Migration " + step.version()
                                + " was modified after it was applied (checksum " + state.checksum()
                                + " != " + checksum + ")");
                    }
                    continue;
                }
                applyMigration(conn, step, checksum);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL,
                        error TEXT
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private AppliedState appliedState(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT checksum,success FROM schema_migrations WHERE version=?")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new AppliedState(rs.getString("checksum"), rs.getInt("success") == 1);
            }
        }
    }

    private void applyMigration(Connection conn, Migrations.MigrationStep step, String checksum) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
            recordMigration(conn, step, checksum, true, null);
            conn.commit();
            log.info("Applied schema migration {}", step.version());
        } catch (SQLException e) {
            conn.rollback();
            conn.setAutoCommit(true);
            recordMigration(conn, step, checksum, false, e.getMessage());
            throw new IllegalStateException("Migration " + step.version() + " failed: " + e.getMessage(), e);
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private void recordMigration(Connection conn, Migrations.MigrationStep step, String checksum,
                                 boolean success, String error) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success,error) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.setInt(5, success ? 1 : 0);
            ps.setString(6, error);
            ps.executeUpdate();
        }
    }

    private String checksum(Migrations.MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Hashing.sha256Hex(sb.toString()).substring(0, 16);
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success,error
                FROM schema_migrations
                ORDER BY version ASC
                LIMIT ?
                """;
        return read("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new SchemaMigrationRow(
                                rs.getString("version"),
                                rs.getString("description"),
                                rs.getString("checksum"),
                                rs.getLong("applied_at_ms"),
                                rs.getInt("success") == 1,
                                rs.getString("error")
                        ));
                    }
                }
            }
            return out;
        });
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success,
            String error
    ) {
    }

    public record WriteStats(long committedWrites, long lockRetries, long lockTimeouts) {
    }

    private record AppliedState(String checksum, boolean success) {
    }
}
