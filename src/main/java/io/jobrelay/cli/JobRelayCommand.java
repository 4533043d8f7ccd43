package io.jobrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.config.WorkerSettings;
import io.jobrelay.model.JobDefinition;
import io.jobrelay.model.JobStatus;
import io.jobrelay.runtime.JobRelayRuntime;
import io.jobrelay.scheduler.SchedulerLoop;
import io.jobrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "jobrelay",
        mixinStandardHelpOptions = true,
        description = "Persisted job scheduler with multi-worker claims",
        subcommands = {
                JobRelayCommand.InitCommand.class,
                JobRelayCommand.RegisterCommand.class,
                JobRelayCommand.JobCommand.class,
                JobRelayCommand.JobsCommand.class,
                JobRelayCommand.ClaimableCommand.class,
                JobRelayCommand.PendingRetryCommand.class,
                JobRelayCommand.StaleClaimsCommand.class,
                JobRelayCommand.WorkersCommand.class,
                JobRelayCommand.HeartbeatsCommand.class,
                JobRelayCommand.WorkerCommand.class,
                JobRelayCommand.ActivateCommand.class,
                JobRelayCommand.DeactivateCommand.class,
                JobRelayCommand.ResetCommand.class,
                JobRelayCommand.HandlersCommand.class,
                JobRelayCommand.StatsCommand.class,
                JobRelayCommand.MetricsCommand.class,
                JobRelayCommand.ReloadSettingsCommand.class,
                JobRelayCommand.AuditTailCommand.class,
                JobRelayCommand.AuditVerifyCommand.class,
                JobRelayCommand.SchemaMigrationsCommand.class
        }
)
public final class JobRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = JobRelayConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | register | job | jobs | claimable | pending-retry | stale-claims | workers | heartbeats | worker | activate | deactivate | reset | handlers | stats | metrics | reload-settings | audit-tail | audit-verify | schema-migrations");
    }

    JobRelayRuntime runtime() {
        JobRelayRuntime runtime = new JobRelayRuntime(JobRelayConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            JobRelayRuntime runtime = parent.runtime();
            System.out.println("Initialized jobrelay at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "register", description = "Register jobs from a JSON file or from options")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--file"}, description = "Job JSON file: one job, an array, or {\"jobs\": [...]}")
        String file;

        @Option(names = {"--id"}, description = "Job id")
        String id;

        @Option(names = {"--type"}, description = "Job type (handler name)")
        String type;

        @Option(names = {"--schedule"}, description = "hourly|daily|weekly|<n>m|<n>h|<n>d|once")
        String schedule;

        @Option(names = {"--interval-minutes"}, description = "Fixed interval in minutes; overrides --schedule")
        Integer intervalMinutes;

        @Option(names = {"--config"}, description = "Job configuration as a JSON object")
        String configJson;

        @Option(names = {"--description"}, description = "Free-form description")
        String description;

        @Option(names = {"--max-retries"}, description = "Retries before permanent failure")
        Integer maxRetries;

        @Option(names = {"--retry-delay-minutes"}, description = "Base retry delay in minutes")
        Integer retryDelayMinutes;

        @Option(names = {"--timeout-minutes"}, description = "Execution budget in minutes")
        Integer timeoutMinutes;

        @Override
        public Integer call() {
            JobRelayRuntime runtime = parent.runtime();
            if (file != null && !file.isBlank()) {
                List<JobRelayRuntime.RegisterOutcome> out = runtime.registerFromFile(Path.of(file));
                System.out.println(Jsons.toJson(out));
                return 0;
            }
            if (id == null || type == null) {
                System.out.println("{\"error\":\"either --file or both --id and --type are required\"}");
                return 2;
            }
            JsonNode config = configJson == null || configJson.isBlank() ? null : Jsons.readTreeOrNull(configJson);
            JobDefinition definition = new JobDefinition(
                    id,
                    type,
                    description,
                    config,
                    schedule,
                    intervalMinutes,
                    maxRetries,
                    retryDelayMinutes,
                    timeoutMinutes,
                    null
            );
            System.out.println(Jsons.toJson(runtime.register(definition)));
            return 0;
        }
    }

    @Command(name = "job", description = "Show one job by id")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            JobRelayRuntime runtime = parent.runtime();
            Optional<JobRelayRuntime.JobView> job = runtime.job(jobId);
            if (job.isEmpty()) {
                System.out.println("{\"error\":\"job not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(job.get()));
            return 0;
        }
    }

    @Command(name = "jobs", description = "List jobs with optional filters")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: active|inactive|failed")
        String status;

        @Option(names = {"--type"}, description = "Filter by job type")
        String type;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            JobRelayRuntime runtime = parent.runtime();
            JobStatus filter = status == null || status.isBlank() ? null : JobStatus.fromString(status);
            System.out.println(Jsons.toJson(runtime.jobs(filter, type, limit)));
            return 0;
        }
    }

    @Command(name = "claimable", description = "Jobs a worker could claim: active, not failed, unclaimed or stale")
    static final class ClaimableCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().claimable()));
            return 0;
        }
    }

    @Command(name = "pending-retry", description = "Jobs whose retry time has passed")
    static final class PendingRetryCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().pendingRetry()));
            return 0;
        }
    }

    @Command(name = "stale-claims", description = "Claims older than the stale threshold")
    static final class StaleClaimsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().staleClaims()));
            return 0;
        }
    }

    @Command(name = "workers", description = "Workers with a recent heartbeat, most recent first")
    static final class WorkersCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--all"}, defaultValue = "false", description = "Include workers outside the liveness window")
        boolean all;

        @Override
        public Integer call() {
            JobRelayRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(all ? runtime.heartbeats() : runtime.activeWorkers()));
            return 0;
        }
    }

    @Command(name = "heartbeats", description = "Heartbeat history of one worker, newest first")
    static final class HeartbeatsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Worker id")
        String workerId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().heartbeatHistory(workerId, limit)));
            return 0;
        }
    }

    @Command(name = "worker", description = "Run the scheduler loop or a single poll cycle")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one poll cycle")
        boolean once;

        @Option(names = {"--worker-id"}, description = "Worker identity; defaults to worker-<pid>")
        String workerId;

        @Option(names = {"--interval-ms"}, defaultValue = "0",
                description = "Poll interval override in ms; 0 keeps the configured value")
        long intervalMs;

        @Option(names = {"--settings-reload-ms"}, defaultValue = "10000",
                description = "Check interval for hot-reloading jobrelay-settings.json")
        long settingsReloadMs;

        @Override
        public Integer call() throws Exception {
            JobRelayRuntime runtime = parent.runtime();
            String id = workerId == null || workerId.isBlank()
                    ? "worker-" + ProcessHandle.current().pid()
                    : workerId.trim();
            SchedulerLoop loop = runtime.newSchedulerLoop(id);
            loop.updateSettings(withInterval(runtime.currentSettings()));
            if (once) {
                System.out.println(Jsons.toJson(loop.runOnce()));
                return 0;
            }
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                loop.stop();
                try {
                    loop.awaitStop(15_000L);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "jobrelay-shutdown-hook"));
            loop.start();
            System.out.println(Jsons.toJson(new WorkerStarted(id, loop.settings(), runtime.handlerTypes())));
            while (loop.isRunning()) {
                JobRelayRuntime.SettingsReloadOutcome reload = runtime.maybeReloadSettings(settingsReloadMs);
                if (reload.changed()) {
                    loop.updateSettings(withInterval(reload.settings()));
                    System.out.println(Jsons.toJson(reload));
                }
                Thread.sleep(Math.max(1_000L, settingsReloadMs));
            }
            return 0;
        }

        private WorkerSettings withInterval(WorkerSettings settings) {
            if (intervalMs <= 0) {
                return settings;
            }
            return new WorkerSettings(
                    settings.heartbeatIntervalMs(),
                    intervalMs,
                    settings.storeBackoffMaxMultiplier(),
                    settings.workerVersion()
            );
        }
    }

    @Command(name = "activate", description = "Set a job back to active")
    static final class ActivateCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            JobRelayRuntime.OperatorOutcome out = parent.runtime().activate(jobId);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "deactivate", description = "Stop scheduling a job without deleting it")
    static final class DeactivateCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            JobRelayRuntime.OperatorOutcome out = parent.runtime().deactivate(jobId);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "reset", description = "Clear a permanent failure and make the job due now")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            JobRelayRuntime.OperatorOutcome out = parent.runtime().resetPermanentFailure(jobId);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "handlers", description = "List job types this process can run")
    static final class HandlersCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().handlerTypes()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Print job and worker counts as JSON")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().stats()));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            System.out.print(parent.runtime().metricsText());
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Reload jobrelay-settings.json and print the result")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().reloadSettings()));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Number of latest rows")
        int limit;

        @Override
        public Integer call() {
            for (JsonNode row : parent.runtime().auditTail(limit)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Override
        public Integer call() {
            JobRelayRuntime.AuditVerifyOutcome out = parent.runtime().auditVerify();
            System.out.println(Jsons.toJson(out));
            return out.intact() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        JobRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().schemaMigrations(limit)));
            return 0;
        }
    }

    record WorkerStarted(String workerId, WorkerSettings settings, List<String> handlerTypes) {
    }
}
