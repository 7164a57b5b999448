package io.launchpad.storage;

import io.launchpad.config.LaunchPadConfig;
import io.launchpad.config.LaunchPadSettings;
import io.launchpad.exceptions.LaunchPadException;
import io.launchpad.exceptions.StoreAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Owns the SQLite file: directories, schema, pragmas and transactions.
 *
 * <p>Every connection starts its transactions with {@code BEGIN IMMEDIATE},
 * so a transaction holds the database write lock from its first statement.
 * That makes each {@link #inTransaction} call a single-writer section.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    static final List<String> TABLES = List.of("meta", "fireworks", "workflows", "mapping", "launches");

    private final LaunchPadConfig config;
    private final String jdbcUrl;
    private final int busyTimeoutMs;

    public Database(LaunchPadConfig config, LaunchPadSettings settings) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = settings.busyTimeoutMs();
    }

    public LaunchPadConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        inTransaction(conn -> {
            createSchema(conn);
            IdAllocator.seedCounters(conn);
            return null;
        });
        applyAndValidatePragmas();
        log.debug("Initialized store at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(busyTimeoutMs);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        return DriverManager.getConnection(jdbcUrl, sqlite.toProperties());
    }

    /**
     * Runs {@code work} in one transaction. Any exception rolls the whole unit
     * back; driver failures surface as {@link StoreAccessException}, store
     * failures are rethrown as they are.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            try {
                T out = work.apply(c);
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (LaunchPadException e) {
            throw e;
        } catch (SQLException e) {
            throw new StoreAccessException("Store transaction failed", e);
        }
    }

    /**
     * Drops every table and recreates the empty schema with all counters at 1.
     */
    public void reset() {
        inTransaction(conn -> {
            try (Statement st = conn.createStatement()) {
                for (String table : TABLES) {
                    st.execute("DROP TABLE IF EXISTS " + table);
                }
            }
            createSchema(conn);
            IdAllocator.seedCounters(conn);
            return null;
        });
        log.info("Store at {} was reset", config.dbFile());
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StoreAccessException("Failed to initialize directories under " + config.rootDir(), e);
        }
    }

    private static void createSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS meta (
                        name TEXT PRIMARY KEY,
                        value INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS fireworks (
                        fw_id INTEGER PRIMARY KEY,
                        state TEXT NOT NULL,
                        data TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS workflows (
                        wf_id INTEGER PRIMARY KEY,
                        data TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS mapping (
                        fw_id INTEGER PRIMARY KEY,
                        wf_id INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS launches (
                        launch_id INTEGER PRIMARY KEY,
                        fw_id INTEGER NOT NULL,
                        state TEXT NOT NULL,
                        last_ping_ms INTEGER NOT NULL,
                        data TEXT NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_fireworks_state ON fireworks(state, fw_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_mapping_wf ON mapping(wf_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_launches_fw ON launches(fw_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_launches_state_ping ON launches(state, last_ping_ms)");
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new StoreAccessException("Failed to apply SQLite pragmas", e);
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

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }
}
