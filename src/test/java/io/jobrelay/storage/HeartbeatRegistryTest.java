package io.jobrelay.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.HealthStatus;
import io.jobrelay.model.Heartbeat;
import io.jobrelay.model.HeartbeatHistoryEntry;
import io.jobrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Stream;

final class HeartbeatRegistryTest {

    @Test
    void latestHeartbeatIsUpsertedAndHistoryIsAppended() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-heartbeat-");
        try {
            HeartbeatRegistry registry = openRegistry(root);
            long t0 = 1_700_000_000_000L;

            registry.record(heartbeat("w1", HealthStatus.HEALTHY, t0, 0));
            registry.record(heartbeat("w1", HealthStatus.DEGRADED, t0 + 60_000L, 4));

            Heartbeat latest = registry.get("w1").orElseThrow();
            Assertions.assertEquals(HealthStatus.DEGRADED, latest.status());
            Assertions.assertEquals(4, latest.totalJobs());
            Assertions.assertEquals(t0 + 60_000L, latest.heartbeatAtMs());
            Assertions.assertEquals(List.of("echo", "fail"), latest.registeredTypes());
            Assertions.assertEquals(4, latest.statusPayload().path("seen").asInt());

            List<HeartbeatHistoryEntry> history = registry.history("w1", 10);
            Assertions.assertEquals(2, history.size());
            Assertions.assertEquals(t0 + 60_000L, history.get(0).heartbeatAtMs());
            Assertions.assertEquals(HealthStatus.HEALTHY, history.get(1).status());
            Assertions.assertEquals(1, registry.history("w1", 1).size());
            Assertions.assertTrue(registry.get("w2").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void heartbeatsSinceReturnsRecentWorkersNewestFirst() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-heartbeat-since-");
        try {
            HeartbeatRegistry registry = openRegistry(root);
            long now = 1_700_000_000_000L;
            registry.record(heartbeat("old", HealthStatus.HEALTHY, now - 600_000L, 0));
            registry.record(heartbeat("edge", HealthStatus.HEALTHY, now - 300_000L, 0));
            registry.record(heartbeat("fresh", HealthStatus.HEALTHY, now - 1_000L, 0));

            List<Heartbeat> recent = registry.heartbeatsSince(now - 300_000L);
            Assertions.assertEquals(List.of("fresh", "edge"), recent.stream().map(Heartbeat::workerId).toList());
            Assertions.assertEquals(List.of("edge", "fresh", "old"),
                    registry.list().stream().map(Heartbeat::workerId).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedHistoryInsertRollsBackLatestRow() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-heartbeat-atomic-");
        try {
            Database db = new Database(JobRelayConfig.fromRoot(root.toString()));
            db.init();
            HeartbeatRegistry registry = new HeartbeatRegistry(db);
            long t0 = 1_700_000_000_000L;
            registry.record(heartbeat("w1", HealthStatus.HEALTHY, t0, 1));

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.execute("""
                        CREATE TRIGGER reject_history BEFORE INSERT ON worker_heartbeat_history
                        BEGIN SELECT RAISE(ABORT, 'history rejected'); END
                        """);
            }
            Assertions.assertThrows(StoreUnavailableException.class,
                    () -> registry.record(heartbeat("w1", HealthStatus.DEGRADED, t0 + 60_000L, 7)));

            Heartbeat latest = registry.get("w1").orElseThrow();
            Assertions.assertEquals(HealthStatus.HEALTHY, latest.status());
            Assertions.assertEquals(1, latest.totalJobs());
            Assertions.assertEquals(t0, latest.heartbeatAtMs());
            Assertions.assertEquals(1, registry.history("w1", 10).size());

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.execute("DROP TRIGGER reject_history");
            }
            registry.record(heartbeat("w1", HealthStatus.DEGRADED, t0 + 60_000L, 7));
            Assertions.assertEquals(7, registry.get("w1").orElseThrow().totalJobs());
            Assertions.assertEquals(2, registry.history("w1", 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    static Heartbeat heartbeat(String workerId, HealthStatus status, long atMs, int totalJobs) {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("seen", totalJobs);
        return new Heartbeat(
                workerId,
                status,
                30L,
                atMs - 30_000L,
                totalJobs,
                0,
                List.of("echo", "fail"),
                "test",
                60,
                300,
                payload,
                atMs
        );
    }

    private static HeartbeatRegistry openRegistry(Path root) {
        Database db = new Database(JobRelayConfig.fromRoot(root.toString()));
        db.init();
        return new HeartbeatRegistry(db);
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
