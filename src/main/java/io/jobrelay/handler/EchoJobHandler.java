package io.jobrelay.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.util.Jsons;

import java.time.Instant;

public final class EchoJobHandler implements JobHandler {
    @Override
    public String type() {
        return "echo";
    }

    @Override
    public JobResult run(JobContext context) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("handler", "echo");
        out.put("timestamp", Instant.now().toString());
        out.put("jobId", context.jobId());
        out.put("attempt", context.attempt());
        out.put("workerId", context.workerId());
        out.set("received", context.config() == null ? Jsons.mapper().createObjectNode() : context.config());
        return JobResult.ok(out);
    }
}
