package io.jobrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class JobRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final long STALE_CLAIM_THRESHOLD_MS = 10L * 60L * 1000L;
    public static final long LIVENESS_WINDOW_MS = 5L * 60L * 1000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_RETRY_DELAY_MINUTES = 5;
    public static final int DEFAULT_TIMEOUT_MINUTES = 60;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 300_000L;
    public static final int DEFAULT_STORE_BACKOFF_MAX_MULTIPLIER = 16;
    public static final String DEFAULT_WORKER_VERSION = "3.0.0";
    public static final int MAX_ERROR_CHARS = 2_000;

    private final Path rootDir;

    public JobRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static JobRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new JobRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("jobrelay.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path handlersRoot() {
        return rootDir.resolve("handlers");
    }

    public Path scriptHandlersFile() {
        return handlersRoot().resolve("script-handlers.json");
    }

    public Path settingsFile() {
        return rootDir.resolve("jobrelay-settings.json");
    }
}
