package io.auditforge.storage;

import io.auditforge.config.AuditForgeConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

public final class Database {
    private static final int SCHEMA_VERSION = 1;
    private final AuditForgeConfig config;
    private final String jdbcUrl;

    public Database(AuditForgeConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.phasesRoot());
            Files.createDirectories(config.runDir());
            Files.createDirectories(config.historyRoot());
            Files.createDirectories(config.journalRoot());
            Files.createDirectories(config.workersRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS finding_events (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        finding_id TEXT NOT NULL,
                        run_id INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        severity TEXT NOT NULL,
                        prior_severity TEXT,
                        evolution_tag TEXT NOT NULL,
                        target_file TEXT,
                        title TEXT,
                        summary TEXT,
                        detail_path TEXT,
                        recorded_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_finding_events_id ON finding_events(finding_id, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_finding_events_run ON finding_events(run_id, seq)");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version INTEGER PRIMARY KEY,
                        description TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL
                    )
                    """);
            recordMigration(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize ledger schema", e);
        }
    }

    private void recordMigration(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR IGNORE INTO schema_migrations(version,description,applied_at_ms) VALUES(?,?,?)")) {
            ps.setInt(1, SCHEMA_VERSION);
            ps.setString(2, "finding_events append-only ledger");
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    public int schemaVersion() {
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(version),0) FROM schema_migrations")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read schema version", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=FULL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "2");
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
}
