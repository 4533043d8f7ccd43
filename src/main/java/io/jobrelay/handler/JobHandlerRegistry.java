package io.jobrelay.handler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class JobHandlerRegistry {
    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    public void register(JobHandler handler) {
        if (handler.type() == null || handler.type().isBlank()) {
            throw new IllegalArgumentException("handler type cannot be empty");
        }
        handlers.put(handler.type(), handler);
    }

    public Optional<JobHandler> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(type));
    }

    public List<String> listTypes() {
        List<String> out = new ArrayList<>(handlers.keySet());
        Collections.sort(out);
        return out;
    }
}
