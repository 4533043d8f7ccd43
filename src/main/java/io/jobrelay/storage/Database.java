package io.jobrelay.storage;

import io.jobrelay.config.JobRelayConfig;
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
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "jobrelay.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final JobRelayConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(JobRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setBusyTimeout(BUSY_TIMEOUT_MS);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.handlersRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        id TEXT PRIMARY KEY,
                        type TEXT NOT NULL,
                        status TEXT NOT NULL DEFAULT 'active',
                        schedule TEXT,
                        interval_minutes INTEGER,
                        next_run_at_ms INTEGER,
                        last_run_at_ms INTEGER,
                        run_count INTEGER NOT NULL DEFAULT 0,
                        last_result TEXT,
                        last_error TEXT,
                        claimed_by TEXT,
                        claimed_at_ms INTEGER,
                        claim_epoch INTEGER NOT NULL DEFAULT 0,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        max_retries INTEGER NOT NULL DEFAULT 3,
                        retry_delay_minutes INTEGER NOT NULL DEFAULT 5,
                        next_retry_at_ms INTEGER,
                        last_retry_error TEXT,
                        permanently_failed INTEGER NOT NULL DEFAULT 0,
                        permanent_failure_at_ms INTEGER,
                        permanent_failure_reason TEXT,
                        timeout_minutes INTEGER NOT NULL DEFAULT 60,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        CHECK ((claimed_by IS NULL) = (claimed_at_ms IS NULL)),
                        CHECK (permanently_failed = 0 OR claimed_by IS NULL)
                    )
                    """);
            ensureJobColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS worker_heartbeats (
                        worker_id TEXT PRIMARY KEY,
                        status TEXT NOT NULL DEFAULT 'healthy',
                        uptime_seconds INTEGER NOT NULL,
                        start_time_ms INTEGER NOT NULL,
                        total_jobs INTEGER NOT NULL DEFAULT 0,
                        running_jobs INTEGER NOT NULL DEFAULT 0,
                        registered_types TEXT,
                        worker_version TEXT,
                        heartbeat_interval_seconds INTEGER,
                        queue_check_interval_seconds INTEGER,
                        status_payload TEXT,
                        heartbeat_at_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS worker_heartbeat_history (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        worker_id TEXT NOT NULL,
                        status TEXT NOT NULL,
                        uptime_seconds INTEGER NOT NULL,
                        total_jobs INTEGER NOT NULL DEFAULT 0,
                        running_jobs INTEGER NOT NULL DEFAULT 0,
                        status_payload TEXT,
                        heartbeat_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_next_run ON jobs(next_run_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_next_retry ON jobs(next_retry_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_claimable ON jobs(status, permanently_failed, claimed_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_heartbeats_time ON worker_heartbeats(heartbeat_at_ms DESC)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_heartbeat_history_worker_time ON worker_heartbeat_history(worker_id, heartbeat_at_ms DESC)");
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureJobColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(jobs)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("description")) {
                st.execute("ALTER TABLE jobs ADD COLUMN description TEXT");
            }
            if (!columns.contains("config")) {
                st.execute("ALTER TABLE jobs ADD COLUMN config TEXT NOT NULL DEFAULT '{}'");
            }
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

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260106_001_jobs_type_and_owner_indexes",
                "Index jobs by type and claim owner",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_jobs_type ON jobs(type)",
                        "CREATE INDEX IF NOT EXISTS idx_jobs_claimed_by ON jobs(claimed_by)"
                )
        ));
        steps.add(new MigrationStep(
                "20260110_002_heartbeat_status_index",
                "Index worker heartbeats by health status",
                List.of("CREATE INDEX IF NOT EXISTS idx_heartbeats_status ON worker_heartbeats(status)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
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
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to apply SQLite pragmas", e);
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
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
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
            throw new StoreUnavailableException("Failed to list schema migrations", e);
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
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
