package io.jobrelay.runtime;

import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.JobState;
import io.jobrelay.model.JobStatus;
import io.jobrelay.scheduler.SchedulerLoop;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class JobRelayRuntimeTest {

    @Test
    void registersJobsFromFileIdempotentlyAndMasksConfig() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-runtime-register-");
        try {
            JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root.toString()));
            runtime.init();

            Path jobs = root.resolve("jobs.json");
            Files.writeString(jobs, """
                    {"jobs": [
                      {"id": "nightly-report", "type": "echo", "schedule": "daily",
                       "config": {"endpoint": "https://example.org", "password": "hunter2"}},
                      {"id": "cleanup", "type": "echo", "intervalMinutes": 15, "maxRetries": 0}
                    ]}
                    """, StandardCharsets.UTF_8);

            List<JobRelayRuntime.RegisterOutcome> first = runtime.registerFromFile(jobs);
            Assertions.assertEquals(2, first.size());
            Assertions.assertTrue(first.stream().allMatch(JobRelayRuntime.RegisterOutcome::created));
            List<JobRelayRuntime.RegisterOutcome> second = runtime.registerFromFile(jobs);
            Assertions.assertTrue(second.stream().noneMatch(JobRelayRuntime.RegisterOutcome::created));

            JobRelayRuntime.JobView report = runtime.job("nightly-report").orElseThrow();
            Assertions.assertEquals("daily", report.schedule());
            Assertions.assertEquals("***", report.config().path("password").asText());
            Assertions.assertEquals("https://example.org", report.config().path("endpoint").asText());
            Assertions.assertEquals(JobState.SCHEDULED, report.state());

            JobRelayRuntime.JobView cleanup = runtime.job("cleanup").orElseThrow();
            Assertions.assertEquals(15, cleanup.intervalMinutes());
            Assertions.assertEquals(0, cleanup.maxRetries());

            Assertions.assertEquals(2, runtime.jobs(JobStatus.ACTIVE, null, 10).size());
            Assertions.assertEquals(0, runtime.jobs(null, "report", 10).size());
            Assertions.assertTrue(runtime.job("missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void operatorActionsAreAppliedAndAudited() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-runtime-operator-");
        try {
            JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root.toString()));
            runtime.init();
            Path single = root.resolve("one.json");
            Files.writeString(single, "{\"id\": \"job-op\", \"type\": \"echo\", \"schedule\": \"hourly\"}",
                    StandardCharsets.UTF_8);
            runtime.registerFromFile(single);

            Assertions.assertTrue(runtime.deactivate("job-op").applied());
            Assertions.assertEquals(JobState.INACTIVE, runtime.job("job-op").orElseThrow().state());
            Assertions.assertTrue(runtime.claimable().isEmpty());
            Assertions.assertTrue(runtime.activate("job-op").applied());
            Assertions.assertEquals(1, runtime.claimable().size());

            JobRelayRuntime.OperatorOutcome reset = runtime.resetPermanentFailure("job-op");
            Assertions.assertFalse(reset.applied());
            Assertions.assertFalse(runtime.activate("missing").applied());

            Assertions.assertTrue(runtime.auditTail(20).stream().anyMatch(n ->
                    "job.deactivate".equals(n.path("action").asText()) && "ok".equals(n.path("result").asText())));
            JobRelayRuntime.AuditVerifyOutcome verify = runtime.auditVerify();
            Assertions.assertTrue(verify.intact());
            Assertions.assertFalse(verify.headHash().isBlank());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workerCycleFeedsStatsAndMetrics() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-runtime-stats-");
        try {
            JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root.toString()));
            runtime.init();
            Path jobs = root.resolve("jobs.json");
            Files.writeString(jobs, """
                    [
                      {"id": "ok-job", "type": "echo", "schedule": "hourly"},
                      {"id": "bad-job", "type": "fail", "schedule": "hourly"},
                      {"id": "foreign-job", "type": "mystery", "schedule": "hourly"}
                    ]
                    """, StandardCharsets.UTF_8);
            runtime.registerFromFile(jobs);

            SchedulerLoop loop = runtime.newSchedulerLoop("worker-stats");
            SchedulerLoop.PollOutcome out = loop.runOnce();
            Assertions.assertEquals(2, out.processed());

            JobRelayRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(3, stats.jobStatus().get("active"));
            Assertions.assertEquals(0, stats.claimedJobs());
            Assertions.assertEquals(1, stats.retryingJobs());
            Assertions.assertEquals(1, stats.activeWorkers());
            Assertions.assertEquals(1, stats.knownWorkers());
            Assertions.assertEquals(1, stats.workerHealth().get("healthy"));
            Assertions.assertEquals(List.of("echo", "fail"), runtime.handlerTypes());
            Assertions.assertEquals("worker-stats", runtime.activeWorkers().get(0).workerId());
            Assertions.assertEquals(1, runtime.heartbeatHistory("worker-stats", 10).size());

            String metrics = runtime.metricsText();
            Assertions.assertTrue(metrics.contains("jobrelay_jobs_total{status=\"active\"} 3"));
            Assertions.assertTrue(metrics.contains("jobrelay_jobs_retry_scheduled 1"));
            Assertions.assertTrue(metrics.contains("jobrelay_workers_active 1"));

            Assertions.assertEquals(2, runtime.schemaMigrations(10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileIsReloadedAndDefaultsRestored() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-runtime-settings-");
        try {
            JobRelayConfig config = JobRelayConfig.fromRoot(root.toString());
            JobRelayRuntime runtime = new JobRelayRuntime(config);
            runtime.init();
            Assertions.assertEquals(JobRelayConfig.DEFAULT_POLL_INTERVAL_MS, runtime.currentSettings().pollIntervalMs());

            Files.writeString(config.settingsFile(), "{\"pollIntervalMs\": 2000, \"storeBackoffMaxMultiplier\": 8}",
                    StandardCharsets.UTF_8);
            JobRelayRuntime.SettingsReloadOutcome reloaded = runtime.reloadSettings();
            Assertions.assertTrue(reloaded.changed());
            Assertions.assertTrue(reloaded.configExists());
            Assertions.assertEquals(List.of("pollIntervalMs", "storeBackoffMaxMultiplier"), reloaded.changedFields());
            Assertions.assertEquals(2_000L, runtime.currentSettings().pollIntervalMs());
            Assertions.assertEquals(8, runtime.newSchedulerLoop("w").settings().storeBackoffMaxMultiplier());

            Assertions.assertEquals("unchanged", runtime.maybeReloadSettings(60_000L).message());
            Assertions.assertEquals("skip_interval", runtime.maybeReloadSettings(60_000L).message());

            Files.delete(config.settingsFile());
            JobRelayRuntime.SettingsReloadOutcome restored = runtime.reloadSettings();
            Assertions.assertTrue(restored.changed());
            Assertions.assertFalse(restored.configExists());
            Assertions.assertEquals(JobRelayConfig.DEFAULT_POLL_INTERVAL_MS, runtime.currentSettings().pollIntervalMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void scriptHandlersAreLoadedFromHandlersDirectory() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-runtime-script-");
        try {
            JobRelayConfig config = JobRelayConfig.fromRoot(root.toString());
            Files.createDirectories(config.handlersRoot());
            Files.writeString(config.handlersRoot().resolve("upper.sh"), "tr a-z A-Z\n", StandardCharsets.UTF_8);
            Files.writeString(config.scriptHandlersFile(), """
                    {"handlers": [
                      {"type": "upper", "command": ["sh", "upper.sh"], "timeoutMs": 10000},
                      {"type": "", "command": ["true"]}
                    ]}
                    """, StandardCharsets.UTF_8);

            JobRelayRuntime runtime = new JobRelayRuntime(config);
            runtime.init();
            Assertions.assertEquals(List.of("echo", "fail", "upper"), runtime.handlerTypes());

            Path jobs = root.resolve("jobs.json");
            Files.writeString(jobs, "{\"id\": \"shout\", \"type\": \"upper\", \"schedule\": \"once\", \"config\": {\"msg\": \"hi\"}}",
                    StandardCharsets.UTF_8);
            runtime.registerFromFile(jobs);

            SchedulerLoop.PollOutcome out = runtime.newSchedulerLoop("worker-script").runOnce();
            Assertions.assertEquals(1, out.processed());
            Assertions.assertTrue(out.runs().get(0).success());

            JobRelayRuntime.JobView shout = runtime.job("shout").orElseThrow();
            Assertions.assertEquals(JobState.COMPLETED, shout.state());
            Assertions.assertEquals("HI", shout.lastResult().path("MSG").asText());
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
