package io.calcrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Layout of a project directory: one SQLite file plus the content-addressed
 * object tree, audit log and optional settings override next to it.
 */
public final class CalcRelayConfig {
    public static final String DEFAULT_PROJECT_DIR = ".calcrelay_project";
    public static final int DEFAULT_CONCURRENCY = 4;
    public static final int DEFAULT_MAX_STEP_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_POLL_INITIAL_MS = 1_000L;
    public static final long DEFAULT_POLL_MAX_MS = 60_000L;
    public static final double DEFAULT_POLL_MULTIPLIER = 2.0d;
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_STATUS_CACHE_TTL_MS = 500L;
    public static final long DEFAULT_SELECTION_INTERVAL_MS = 2_000L;

    private final Path rootDir;

    public CalcRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static CalcRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_PROJECT_DIR)
                : Paths.get(root);
        return new CalcRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("calcrelay.db");
    }

    public Path objectsDir() {
        return rootDir.resolve("objects");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve("calcrelay-settings.json");
    }
}
