package io.jobrelay.handler;

import com.fasterxml.jackson.databind.JsonNode;

public record JobResult(
        boolean success,
        JsonNode result,
        String error
) {
    public static JobResult ok(JsonNode result) {
        return new JobResult(true, result, null);
    }

    public static JobResult fail(String error) {
        return new JobResult(false, null, error);
    }
}
