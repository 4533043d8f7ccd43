package io.jobrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Registration input for a job. Nullable numeric fields fall back to configured defaults.
 */
public record JobDefinition(
        String id,
        String type,
        String description,
        JsonNode config,
        String schedule,
        Integer intervalMinutes,
        Integer maxRetries,
        Integer retryDelayMinutes,
        Integer timeoutMinutes,
        Long nextRunAtMs
) {
    public JobDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("job id cannot be empty");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("job type cannot be empty: " + id);
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("max_retries cannot be negative: " + id);
        }
        if (retryDelayMinutes != null && retryDelayMinutes < 0) {
            throw new IllegalArgumentException("retry_delay_minutes cannot be negative: " + id);
        }
        if (timeoutMinutes != null && timeoutMinutes <= 0) {
            throw new IllegalArgumentException("timeout_minutes must be positive: " + id);
        }
    }

    public static JobDefinition of(String id, String type, JsonNode config, String schedule) {
        return new JobDefinition(id, type, null, config, schedule, null, null, null, null, null);
    }

    public Schedule parsedSchedule() {
        return Schedule.parse(schedule, intervalMinutes);
    }
}
