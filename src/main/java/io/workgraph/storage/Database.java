package io.workgraph.storage;

import io.workgraph.config.WorkGraphConfig;
import io.workgraph.util.Hashing;
import org.sqlite.SQLiteConfig;

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

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "workgraph.schema.migration.v1";
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final List<MigrationStep> MIGRATIONS = List.of(
            new MigrationStep(
                    "20261001_001_dependency_type_index",
                    "Index dependency edges by type for cycle audits",
                    List.of("CREATE INDEX IF NOT EXISTS idx_dependencies_type ON dependencies(type, from_id)")
            ),
            new MigrationStep(
                    "20261001_002_labels_lookup",
                    "Index labels for label-filtered listings",
                    List.of("CREATE INDEX IF NOT EXISTS idx_labels_label ON labels(label, issue_id)")
            )
    );

    private final WorkGraphConfig config;
    private final String jdbcUrl;
    private final SQLiteConfig connectionConfig;

    public Database(WorkGraphConfig config, int busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.connectionConfig = new SQLiteConfig();
        this.connectionConfig.enforceForeignKeys(true);
        this.connectionConfig.setBusyTimeout(Math.max(0, busyTimeoutMs));
        // Writers take the lock at BEGIN so a read-then-write transaction never has to upgrade.
        this.connectionConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionConfig.toProperties());
    }

    /**
     * Maps a driver failure onto the store's exception classes: lock timeouts and busy
     * databases are transient, everything else is a hard failure.
     */
    static StoreException translate(String message, SQLException e) {
        int primary = e.getErrorCode() & 0xFF;
        if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
            return new StoreUnavailableException(message + " (database busy)", e);
        }
        return new StoreException(message, e);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS issues (
                        id TEXT PRIMARY KEY,
                        title TEXT NOT NULL CHECK (length(trim(title)) > 0),
                        description TEXT NOT NULL DEFAULT '',
                        issue_type TEXT NOT NULL DEFAULT 'task',
                        priority INTEGER NOT NULL DEFAULT 2 CHECK (priority BETWEEN 0 AND 4),
                        status TEXT NOT NULL CHECK (status IN ('open', 'in_progress', 'deferred', 'closed')),
                        assignee TEXT,
                        defer_until_ms INTEGER,
                        notes TEXT NOT NULL DEFAULT '',
                        close_reason TEXT,
                        verified TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        closed_at_ms INTEGER,
                        CHECK ((status = 'closed') = (closed_at_ms IS NOT NULL))
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS labels (
                        issue_id TEXT NOT NULL,
                        label TEXT NOT NULL CHECK (length(trim(label)) > 0),
                        PRIMARY KEY (issue_id, label),
                        FOREIGN KEY (issue_id) REFERENCES issues(id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS dependencies (
                        from_id TEXT NOT NULL,
                        to_id TEXT NOT NULL,
                        type TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        created_by TEXT NOT NULL DEFAULT '',
                        note TEXT,
                        PRIMARY KEY (from_id, to_id, type),
                        CHECK (from_id <> to_id),
                        FOREIGN KEY (from_id) REFERENCES issues(id) ON DELETE CASCADE,
                        FOREIGN KEY (to_id) REFERENCES issues(id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS events (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        issue_id TEXT NOT NULL,
                        event_type TEXT NOT NULL,
                        actor TEXT NOT NULL DEFAULT '',
                        old_value TEXT,
                        new_value TEXT,
                        comment TEXT,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY (issue_id) REFERENCES issues(id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS child_counters (
                        parent_id TEXT PRIMARY KEY,
                        last_child INTEGER NOT NULL,
                        FOREIGN KEY (parent_id) REFERENCES issues(id) ON DELETE CASCADE
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_issues_status_priority ON issues(status, priority, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_issues_assignee_status ON issues(assignee, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_dependencies_to ON dependencies(to_id, type)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_issue ON events(issue_id, id)");
        } catch (SQLException e) {
            throw translate("Failed to initialize SQLite schema", e);
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
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    /**
     * Applies each pending step in its own transaction. A step whose recorded checksum no
     * longer matches its SQL fails init rather than running against an unknown schema.
     */
    private void applyVersionedMigrations(Connection conn) throws SQLException {
        for (MigrationStep step : MIGRATIONS) {
            conn.setAutoCommit(false);
            try {
                String recorded = appliedChecksum(conn, step.version());
                if (recorded == null) {
                    applyMigration(conn, step);
                } else if (!recorded.equals(step.checksum())) {
                    throw new IllegalStateException("Schema migration " + step.version()
                            + " was changed after it was applied (checksum " + recorded + " != " + step.checksum() + ")");
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    private String appliedChecksum(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT checksum FROM schema_migrations WHERE version=? AND success=1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, step.checksum());
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
        String checksum() {
            return Hashing.sha256Hex(MIGRATION_SCHEMA_VERSION + "|" + version + "|" + description + "|"
                    + String.join(";", sql)).substring(0, 16);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw translate("Failed to apply SQLite pragmas", e);
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

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw translate("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
