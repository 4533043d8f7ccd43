package io.jobrelay.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.security.SensitiveDataMasker;
import io.jobrelay.util.Hashing;
import io.jobrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row so that a
 * truncated or edited log is detectable with {@link #verifyChain()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another worker process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("job_id", event.jobId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(parse(line));
        }
        return out;
    }

    /**
     * Recomputes every row hash. Returns the index of the first row that does not match its
     * predecessor, or -1 when the whole chain holds.
     */
    public int verifyChain() {
        String expectedPrev = "";
        int index = 0;
        for (String line : readLines()) {
            JsonNode node = parse(line);
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return index;
            }
            Map<String, Object> withoutHash = Jsons.mapper().convertValue(node, Jsons.MAP_TYPE);
            withoutHash.remove("hash");
            if (!hash.equals(Hashing.sha256Hex(toCompactJson(withoutHash)))) {
                return index;
            }
            expectedPrev = hash;
            index++;
        }
        return -1;
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(lines.get(lines.size() - 1)).path("hash").asText("");
        } catch (JsonProcessingException e) {
            // corrupt tail line, chain restarts
            return "";
        }
    }

    private static JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit log line is not valid JSON", e);
        }
    }

    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), Jsons.MAP_TYPE);
    }

    private static String toCompactJson(Map<String, Object> row) {
        return Jsons.toCompactJson(row);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String jobId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result,
                                    String jobId, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, jobId, details == null ? Map.of() : details);
        }

        public static AuditEvent forJob(String action, String actor, String jobId, String result,
                                        Map<String, Object> details) {
            return of(action, actor, "job", result, jobId, details);
        }
    }
}
