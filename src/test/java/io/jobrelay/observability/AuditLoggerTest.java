package io.jobrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreHashChainedAcrossInstances() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditLogger.AuditEvent.forJob("job.claim", "w1", "job-a", "granted", Map.of("claim_epoch", 1)));
            first.log(AuditLogger.AuditEvent.forJob("job.release", "w1", "job-a", "rescheduled", Map.of()));

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(first.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("worker.stop", "w1", "worker", "ok", null, null));

            List<JsonNode> rows = reopened.tail(10);
            Assertions.assertEquals(3, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(0).path("hash").asText(), rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), rows.get(2).path("prev_hash").asText());
            Assertions.assertEquals(1, rows.get(0).path("details").path("claim_epoch").asInt());
            Assertions.assertEquals(-1, reopened.verifyChain());
            Assertions.assertEquals(1, reopened.tail(1).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            logger.log(AuditLogger.AuditEvent.forJob("job.register", "operator", "job-a", "created", Map.of()));
            logger.log(AuditLogger.AuditEvent.forJob("job.claim", "w1", "job-a", "granted", Map.of()));
            logger.log(AuditLogger.AuditEvent.forJob("job.claim", "w2", "job-a", "conflict", Map.of()));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("\"granted\"", "\"conflict\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            Assertions.assertEquals(1, new AuditLogger(file).verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sensitiveDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-audit-mask-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit.log"));
            logger.log(AuditLogger.AuditEvent.forJob("job.register", "operator", "job-a", "created",
                    Map.of("token", "plain", "type", "echo")));
            JsonNode row = logger.tail(1).get(0);
            Assertions.assertEquals("***", row.path("details").path("token").asText());
            Assertions.assertEquals("echo", row.path("details").path("type").asText());
            Assertions.assertEquals(-1, logger.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
