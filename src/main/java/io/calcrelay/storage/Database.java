package io.calcrelay.storage;

import io.calcrelay.config.CalcRelayConfig;
import io.calcrelay.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String BUSY_TIMEOUT_MS = "10000";
    private static final List<Migration> MIGRATIONS = List.of(
            new Migration("001", "Index processing rows by step",
                    List.of("CREATE INDEX IF NOT EXISTS idx_processing_step ON processing(step)")),
            new Migration("002", "Index calcjobs by label",
                    List.of("CREATE INDEX IF NOT EXISTS idx_calcjobs_label ON calcjobs(label)"))
    );

    private final CalcRelayConfig config;
    private final String jdbcUrl;

    public Database(CalcRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public CalcRelayConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        enableWriteAheadLog();
    }

    public boolean isInitialized() {
        return Files.isRegularFile(config.dbFile()) && Files.isDirectory(config.objectsDir());
    }

    /**
     * Every connection enforces foreign keys and waits on a locked database
     * instead of failing, since several drivers write concurrently.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.objectsDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS clients (
                        pk INTEGER PRIMARY KEY AUTOINCREMENT,
                        label TEXT NOT NULL UNIQUE,
                        client_url TEXT NOT NULL,
                        client_id TEXT NOT NULL DEFAULT '',
                        client_secret TEXT NOT NULL DEFAULT '',
                        token_uri TEXT NOT NULL DEFAULT '',
                        machine_name TEXT NOT NULL,
                        work_dir TEXT NOT NULL,
                        small_file_size_mb INTEGER NOT NULL DEFAULT 5,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS codes (
                        pk INTEGER PRIMARY KEY AUTOINCREMENT,
                        label TEXT NOT NULL UNIQUE,
                        client_pk INTEGER NOT NULL,
                        script TEXT NOT NULL,
                        upload_paths TEXT NOT NULL DEFAULT '{}',
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(client_pk) REFERENCES clients(pk) ON DELETE RESTRICT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS calcjobs (
                        pk INTEGER PRIMARY KEY AUTOINCREMENT,
                        label TEXT NOT NULL,
                        uuid TEXT NOT NULL UNIQUE,
                        code_pk INTEGER NOT NULL,
                        parameters TEXT NOT NULL DEFAULT '{}',
                        upload_paths TEXT NOT NULL DEFAULT '{}',
                        download_globs TEXT NOT NULL DEFAULT '[]',
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(code_pk, label),
                        FOREIGN KEY(code_pk) REFERENCES codes(pk) ON DELETE RESTRICT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS processing (
                        calcjob_pk INTEGER PRIMARY KEY,
                        state TEXT NOT NULL,
                        step TEXT NOT NULL,
                        job_id TEXT,
                        remote_state TEXT,
                        script_key TEXT,
                        exception TEXT,
                        failed_step TEXT,
                        retrieved_paths TEXT,
                        lease_owner TEXT,
                        lease_token TEXT,
                        lease_epoch INTEGER NOT NULL DEFAULT 0,
                        lease_expires_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(calcjob_pk) REFERENCES calcjobs(pk) ON DELETE RESTRICT,
                        CHECK (
                            (step = 'finished' AND state = 'finished')
                            OR (step = 'excepted' AND state = 'excepted')
                            OR (step NOT IN ('finished', 'excepted') AND state = 'playing')
                        )
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_codes_client ON codes(client_pk)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_calcjobs_code ON calcjobs(code_pk)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_processing_state_lease ON processing(state, lease_expires_at_ms)");
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
                        success INTEGER NOT NULL DEFAULT 1
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        Set<String> applied = appliedVersions(conn);
        for (Migration migration : MIGRATIONS) {
            if (!applied.contains(migration.version())) {
                apply(conn, migration);
            }
        }
    }

    private Set<String> appliedVersions(Connection conn) throws SQLException {
        Set<String> out = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT version FROM schema_migrations WHERE success=1")) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
        }
        return out;
    }

    private void apply(Connection conn, Migration migration) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement();
             PreparedStatement insert = conn.prepareStatement(
                     "INSERT INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            for (String sql : migration.statements()) {
                st.execute(sql);
            }
            insert.setString(1, migration.version());
            insert.setString(2, migration.description());
            insert.setString(3, Hashing.sha256Hex(String.join(";\n", migration.statements())));
            insert.setLong(4, System.currentTimeMillis());
            insert.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private void enableWriteAheadLog() {
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA journal_mode=WAL")) {
            String mode = rs.next() ? rs.getString(1) : null;
            if (!"wal".equalsIgnoreCase(mode)) {
                throw new IllegalStateException("SQLite refused WAL journal mode, got " + mode);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enable WAL journal mode", e);
        }
    }

    /**
     * Newest first.
     */
    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version DESC LIMIT ?")) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString(1), rs.getString(2), rs.getString(3), rs.getLong(4), rs.getInt(5) == 1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private record Migration(String version, String description, List<String> statements) {
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
