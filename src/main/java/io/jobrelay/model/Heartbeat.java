package io.jobrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record Heartbeat(
        String workerId,
        HealthStatus status,
        long uptimeSeconds,
        long startTimeMs,
        int totalJobs,
        int runningJobs,
        List<String> registeredTypes,
        String workerVersion,
        int heartbeatIntervalSeconds,
        int queueCheckIntervalSeconds,
        JsonNode statusPayload,
        long heartbeatAtMs
) {
    public Heartbeat {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker id cannot be empty");
        }
        status = status == null ? HealthStatus.HEALTHY : status;
        registeredTypes = registeredTypes == null ? List.of() : List.copyOf(registeredTypes);
    }

    public long ageMs(long nowMs) {
        return Math.max(0L, nowMs - heartbeatAtMs);
    }
}
