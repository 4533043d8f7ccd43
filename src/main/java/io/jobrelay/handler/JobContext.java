package io.jobrelay.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param attempt   1 for the first run after scheduling, 2 for the first retry, and so on
 * @param timeoutMs the job's run limit; the worker cancels the handler once it has passed
 */
public record JobContext(
        String jobId,
        String type,
        JsonNode config,
        int attempt,
        String workerId,
        long timeoutMs
) {
}
