package io.jobrelay.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.Job;
import io.jobrelay.model.JobDefinition;
import io.jobrelay.model.JobState;
import io.jobrelay.model.JobStatus;
import io.jobrelay.observability.AuditLogger;
import io.jobrelay.storage.Database;
import io.jobrelay.storage.JobStore;
import io.jobrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class ClaimManagerTest {
    private static final long MINUTE = 60_000L;
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void recurringSuccessReschedulesByInterval() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-claim-recurring-");
        try {
            Fixture f = Fixture.open(root);
            f.store.register(JobDefinition.of("job-r", "echo", null, "hourly"), T0);

            Job claimed = f.claims.claimNext("w1", T0).orElseThrow();
            Assertions.assertEquals("job-r", claimed.id());
            Assertions.assertEquals(JobState.CLAIMED, claimed.state());

            ClaimManager.ReleaseResolution done = f.claims.reportSuccess(claimed, "w1", result("ok"), T0 + 1_000L);
            Assertions.assertEquals(ClaimManager.ReleaseOutcome.RESCHEDULED, done.outcome());
            Assertions.assertEquals(T0 + 1_000L + 60 * MINUTE, done.nextRunAtMs());

            Job after = f.store.get("job-r").orElseThrow();
            Assertions.assertEquals(JobState.SCHEDULED, after.state());
            Assertions.assertEquals(1, after.runCount());
            Assertions.assertEquals("ok", after.lastResult().path("status").asText());
            Assertions.assertEquals(T0 + 1_000L, after.lastRunAtMs());

            Assertions.assertTrue(f.claims.claimNext("w1", T0 + 30 * MINUTE).isEmpty());
            Assertions.assertTrue(f.claims.claimNext("w1", T0 + 1_000L + 60 * MINUTE).isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void oneShotSuccessCompletesAndIsNeverClaimedAgain() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-claim-once-");
        try {
            Fixture f = Fixture.open(root);
            f.store.register(JobDefinition.of("job-once", "echo", null, "once"), T0);

            Job claimed = f.claims.claimNext("w1", T0).orElseThrow();
            ClaimManager.ReleaseResolution done = f.claims.reportSuccess(claimed, "w1", result("ok"), T0 + 1L);
            Assertions.assertEquals(ClaimManager.ReleaseOutcome.COMPLETED, done.outcome());

            Job after = f.store.get("job-once").orElseThrow();
            Assertions.assertEquals(JobStatus.INACTIVE, after.status());
            Assertions.assertEquals(JobState.COMPLETED, after.state());
            Assertions.assertNull(after.nextRunAtMs());
            Assertions.assertTrue(f.claims.claimNext("w1", T0 + 365L * 24L * 60L * MINUTE).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresBackOffThenFailPermanentlyUntilReset() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-claim-retry-");
        try {
            Fixture f = Fixture.open(root);
            f.store.register(new JobDefinition("job-f", "fail", null, null, "hourly", null,
                    2, 5, null, null), T0);

            Job first = f.claims.claimNext("w1", T0).orElseThrow();
            ClaimManager.ReleaseResolution r1 = f.claims.reportFailure(first, "w1", "boom-1", T0);
            Assertions.assertEquals(ClaimManager.ReleaseOutcome.RETRY_SCHEDULED, r1.outcome());
            Assertions.assertEquals(1, r1.retryCount());
            Assertions.assertEquals(T0 + 10 * MINUTE, r1.nextRetryAtMs());

            Job pending = f.store.get("job-f").orElseThrow();
            Assertions.assertEquals(JobState.RETRY_PENDING, pending.state());
            Assertions.assertEquals("boom-1", pending.lastRetryError());
            Assertions.assertTrue(f.claims.claimNext("w1", T0 + 10 * MINUTE - 1L).isEmpty());

            Job second = f.claims.claimNext("w2", T0 + 10 * MINUTE).orElseThrow();
            Assertions.assertEquals(1, second.retryCount());
            ClaimManager.ReleaseResolution r2 = f.claims.reportFailure(second, "w2", "boom-2", T0 + 10 * MINUTE);
            Assertions.assertEquals(2, r2.retryCount());
            Assertions.assertEquals(T0 + 30 * MINUTE, r2.nextRetryAtMs());

            Job third = f.claims.claimNext("w1", T0 + 30 * MINUTE).orElseThrow();
            ClaimManager.ReleaseResolution r3 = f.claims.reportFailure(third, "w1", "boom-3", T0 + 30 * MINUTE);
            Assertions.assertEquals(ClaimManager.ReleaseOutcome.PERMANENTLY_FAILED, r3.outcome());

            Job failed = f.store.get("job-f").orElseThrow();
            Assertions.assertEquals(JobStatus.FAILED, failed.status());
            Assertions.assertEquals(JobState.PERMANENTLY_FAILED, failed.state());
            Assertions.assertEquals("boom-3", failed.permanentFailureReason());
            Assertions.assertNull(failed.nextRetryAtMs());
            Assertions.assertTrue(f.claims.claimNext("w1", T0 + 1_000 * MINUTE).isEmpty());
            Assertions.assertFalse(f.store.setStatus("job-f", JobStatus.ACTIVE, T0 + 31 * MINUTE));

            Assertions.assertTrue(f.store.resetPermanentFailure("job-f", T0 + 40 * MINUTE));
            Job reset = f.store.get("job-f").orElseThrow();
            Assertions.assertEquals(JobState.SCHEDULED, reset.state());
            Assertions.assertEquals(0, reset.retryCount());
            Assertions.assertTrue(f.claims.claimNext("w1", T0 + 40 * MINUTE).isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void successAfterRetryClearsRetryState() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-claim-recover-");
        try {
            Fixture f = Fixture.open(root);
            f.store.register(JobDefinition.of("job-flaky", "echo", null, "daily"), T0);

            Job first = f.claims.claimNext("w1", T0).orElseThrow();
            f.claims.reportFailure(first, "w1", "transient", T0);

            Job retry = f.claims.claimNext("w1", T0 + 10 * MINUTE).orElseThrow();
            ClaimManager.ReleaseResolution ok = f.claims.reportSuccess(retry, "w1", result("ok"), T0 + 11 * MINUTE);
            Assertions.assertEquals(ClaimManager.ReleaseOutcome.RESCHEDULED, ok.outcome());

            Job after = f.store.get("job-flaky").orElseThrow();
            Assertions.assertEquals(0, after.retryCount());
            Assertions.assertNull(after.nextRetryAtMs());
            Assertions.assertNull(after.lastRetryError());
            Assertions.assertNull(after.lastError());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseAfterTakeoverReportsStaleClaim() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-claim-fence-");
        try {
            Fixture f = Fixture.open(root);
            f.store.register(JobDefinition.of("job-slow", "echo", null, "hourly"), T0);

            Job mine = f.claims.claimNext("w1", T0).orElseThrow();
            long takeoverAt = T0 + JobRelayConfig.STALE_CLAIM_THRESHOLD_MS + 1L;
            ClaimManager.ClaimOutcome takeover = f.claims.claim("w2", "job-slow", takeoverAt);
            Assertions.assertTrue(takeover.claimed());

            ClaimManager.ReleaseResolution late = f.claims.reportFailure(mine, "w1", "too late", takeoverAt + 1L);
            Assertions.assertEquals(ClaimManager.ReleaseOutcome.STALE_CLAIM, late.outcome());
            Assertions.assertFalse(late.released());

            Job row = f.store.get("job-slow").orElseThrow();
            Assertions.assertEquals("w2", row.claimedBy());
            Assertions.assertEquals(0, row.retryCount());

            List<JsonNode> audit = f.audit.tail(20);
            Assertions.assertTrue(audit.stream().anyMatch(n ->
                    "job.release".equals(n.path("action").asText())
                            && "stale_claim".equals(n.path("result").asText())
                            && "w1".equals(n.path("actor").asText())));
            Assertions.assertEquals(-1, f.audit.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void conflictingClaimIsAuditedAndReturnsNoJob() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-claim-conflict-");
        try {
            Fixture f = Fixture.open(root);
            f.store.register(JobDefinition.of("job-c", "echo", null, "hourly"), T0);

            Assertions.assertTrue(f.claims.claim("w1", "job-c", T0).claimed());
            ClaimManager.ClaimOutcome lost = f.claims.claim("w2", "job-c", T0 + 1L);
            Assertions.assertFalse(lost.claimed());
            Assertions.assertNull(lost.job());
            Optional<Job> none = f.claims.claimNext("w2", T0 + 2L);
            Assertions.assertTrue(none.isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class, () -> f.claims.claimNext(" ", T0));
        } finally {
            deleteRecursively(root);
        }
    }

    private static JsonNode result(String status) {
        return Jsons.mapper().createObjectNode().put("status", status);
    }

    private static final class Fixture {
        final JobStore store;
        final AuditLogger audit;
        final ClaimManager claims;

        private Fixture(JobStore store, AuditLogger audit) {
            this.store = store;
            this.audit = audit;
            this.claims = new ClaimManager(store, audit);
        }

        static Fixture open(Path root) {
            JobRelayConfig config = JobRelayConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            return new Fixture(new JobStore(db), new AuditLogger(config.auditFile()));
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
