package io.jobrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

public record Job(
        String id,
        String type,
        JobStatus status,
        String description,
        JsonNode config,
        Schedule schedule,
        Long nextRunAtMs,
        Long lastRunAtMs,
        int runCount,
        JsonNode lastResult,
        String lastError,
        String claimedBy,
        Long claimedAtMs,
        long claimEpoch,
        int retryCount,
        int maxRetries,
        int retryDelayMinutes,
        Long nextRetryAtMs,
        String lastRetryError,
        boolean permanentlyFailed,
        Long permanentFailureAtMs,
        String permanentFailureReason,
        int timeoutMinutes,
        long createdAtMs,
        long updatedAtMs
) {
    public JobState state() {
        return JobState.of(status, permanentlyFailed, claimedBy, claimedAtMs, nextRetryAtMs, schedule.oneShot(), runCount);
    }

    public boolean claimed() {
        return claimedBy != null && !claimedBy.isBlank();
    }

    public long claimAgeMs(long nowMs) {
        return claimedAtMs == null ? 0L : Math.max(0L, nowMs - claimedAtMs);
    }
}
