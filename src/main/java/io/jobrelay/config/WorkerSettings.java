package io.jobrelay.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-process worker tuning, optionally overridden by {@code jobrelay-settings.json}.
 *
 * <p>The claim staleness threshold and the liveness window are not part of this record: they
 * are shared contracts between all workers and stay fixed in {@link JobRelayConfig}.
 */
public record WorkerSettings(
        long heartbeatIntervalMs,
        long pollIntervalMs,
        int storeBackoffMaxMultiplier,
        String workerVersion
) {
    public static WorkerSettings defaults() {
        return new WorkerSettings(
                JobRelayConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                JobRelayConfig.DEFAULT_POLL_INTERVAL_MS,
                JobRelayConfig.DEFAULT_STORE_BACKOFF_MAX_MULTIPLIER,
                JobRelayConfig.DEFAULT_WORKER_VERSION
        );
    }

    public static WorkerSettings fromFile(SettingsFile file, WorkerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long heartbeat = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 1_000L);
        long poll = sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 100L);
        int backoff = file.storeBackoffMaxMultiplier() == null || file.storeBackoffMaxMultiplier() < 1
                ? defaults.storeBackoffMaxMultiplier()
                : file.storeBackoffMaxMultiplier();
        String version = file.workerVersion() == null || file.workerVersion().isBlank()
                ? defaults.workerVersion()
                : file.workerVersion().trim();
        return new WorkerSettings(heartbeat, poll, backoff, version);
    }

    public List<String> diff(WorkerSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (heartbeatIntervalMs != other.heartbeatIntervalMs) changed.add("heartbeatIntervalMs");
        if (pollIntervalMs != other.pollIntervalMs) changed.add("pollIntervalMs");
        if (storeBackoffMaxMultiplier != other.storeBackoffMaxMultiplier) changed.add("storeBackoffMaxMultiplier");
        if (!workerVersion.equals(other.workerVersion)) changed.add("workerVersion");
        return changed;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    public record SettingsFile(
            Long heartbeatIntervalMs,
            Long pollIntervalMs,
            Integer storeBackoffMaxMultiplier,
            String workerVersion
    ) {
    }
}
