package io.jobrelay.scheduler;

import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.Heartbeat;
import io.jobrelay.model.Job;
import io.jobrelay.storage.HeartbeatRegistry;
import io.jobrelay.storage.JobStore;

import java.util.List;

/**
 * Read-only views over workers and jobs. Worker liveness and claim staleness use separate
 * thresholds: a claim is stale after ten minutes regardless of whether its worker still
 * heartbeats, and a worker is active for five minutes after its last heartbeat.
 */
public final class LivenessMonitor {
    public static final int DEFAULT_VIEW_LIMIT = 500;

    private final JobStore jobStore;
    private final HeartbeatRegistry heartbeats;
    private final long staleClaimThresholdMs;
    private final long livenessWindowMs;

    public LivenessMonitor(JobStore jobStore, HeartbeatRegistry heartbeats) {
        this(jobStore, heartbeats, JobRelayConfig.STALE_CLAIM_THRESHOLD_MS, JobRelayConfig.LIVENESS_WINDOW_MS);
    }

    public LivenessMonitor(JobStore jobStore, HeartbeatRegistry heartbeats, long staleClaimThresholdMs, long livenessWindowMs) {
        if (staleClaimThresholdMs <= 0 || livenessWindowMs <= 0) {
            throw new IllegalArgumentException("thresholds must be positive");
        }
        this.jobStore = jobStore;
        this.heartbeats = heartbeats;
        this.staleClaimThresholdMs = staleClaimThresholdMs;
        this.livenessWindowMs = livenessWindowMs;
    }

    public List<Heartbeat> activeWorkers(long nowMs) {
        return heartbeats.heartbeatsSince(nowMs - livenessWindowMs);
    }

    public boolean isActive(Heartbeat heartbeat, long nowMs) {
        return heartbeat != null && heartbeat.ageMs(nowMs) <= livenessWindowMs;
    }

    public List<Job> staleClaims(long nowMs) {
        return jobStore.staleClaims(nowMs - staleClaimThresholdMs, DEFAULT_VIEW_LIMIT);
    }

    public List<Job> pendingRetry(long nowMs) {
        return jobStore.pendingRetry(nowMs, DEFAULT_VIEW_LIMIT);
    }

    public List<Job> claimable(long nowMs) {
        return jobStore.claimable(nowMs, staleClaimThresholdMs, DEFAULT_VIEW_LIMIT);
    }

    public long staleClaimThresholdMs() {
        return staleClaimThresholdMs;
    }

    public long livenessWindowMs() {
        return livenessWindowMs;
    }
}
