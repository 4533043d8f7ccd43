package io.jobrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

public record HeartbeatHistoryEntry(
        long id,
        String workerId,
        HealthStatus status,
        long uptimeSeconds,
        int totalJobs,
        int runningJobs,
        JsonNode statusPayload,
        long heartbeatAtMs
) {
}
