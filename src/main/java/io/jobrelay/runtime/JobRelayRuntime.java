package io.jobrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.config.WorkerSettings;
import io.jobrelay.handler.EchoJobHandler;
import io.jobrelay.handler.FailJobHandler;
import io.jobrelay.handler.JobHandler;
import io.jobrelay.handler.JobHandlerRegistry;
import io.jobrelay.handler.ScriptJobHandler;
import io.jobrelay.model.HealthStatus;
import io.jobrelay.model.Heartbeat;
import io.jobrelay.model.HeartbeatHistoryEntry;
import io.jobrelay.model.Job;
import io.jobrelay.model.JobDefinition;
import io.jobrelay.model.JobState;
import io.jobrelay.model.JobStatus;
import io.jobrelay.observability.AuditLogger;
import io.jobrelay.observability.PrometheusFormatter;
import io.jobrelay.scheduler.ClaimManager;
import io.jobrelay.scheduler.LivenessMonitor;
import io.jobrelay.scheduler.SchedulerLoop;
import io.jobrelay.security.SensitiveDataMasker;
import io.jobrelay.storage.Database;
import io.jobrelay.storage.HeartbeatRegistry;
import io.jobrelay.storage.JobStore;
import io.jobrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JobRelayRuntime {
    private final JobRelayConfig config;
    private final Database database;
    private final JobStore jobStore;
    private final HeartbeatRegistry heartbeatRegistry;
    private final JobHandlerRegistry handlerRegistry;
    private final AuditLogger auditLogger;
    private final ClaimManager claimManager;
    private final LivenessMonitor livenessMonitor;
    private volatile long settingsFileMtimeMs;
    private volatile long lastSettingsCheckMs;
    private volatile WorkerSettings workerSettings;

    public JobRelayRuntime(JobRelayConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.jobStore = new JobStore(database);
        this.heartbeatRegistry = new HeartbeatRegistry(database);
        this.handlerRegistry = new JobHandlerRegistry();
        this.auditLogger = new AuditLogger(config.auditFile());
        this.claimManager = new ClaimManager(jobStore, auditLogger);
        this.livenessMonitor = new LivenessMonitor(jobStore, heartbeatRegistry);
        this.settingsFileMtimeMs = Long.MIN_VALUE;
        this.lastSettingsCheckMs = 0L;
        this.workerSettings = WorkerSettings.defaults();
        registerDefaultHandlers();
    }

    public void init() {
        database.init();
        loadSettings(true);
        registerConfiguredScriptHandlers();
    }

    public JobRelayConfig config() {
        return config;
    }

    public JobHandlerRegistry handlers() {
        return handlerRegistry;
    }

    public ClaimManager claimManager() {
        return claimManager;
    }

    public LivenessMonitor livenessMonitor() {
        return livenessMonitor;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public WorkerSettings currentSettings() {
        return workerSettings;
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadSettings(true);
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = Instant.now().toEpochMilli();
        long interval = Math.max(1_000L, minIntervalMs);
        if ((nowMs - lastSettingsCheckMs) < interval) {
            return new SettingsReloadOutcome(
                    false,
                    settingsFileMtimeMs >= 0L,
                    config.settingsFile().toString(),
                    workerSettings,
                    "skip_interval",
                    List.of()
            );
        }
        lastSettingsCheckMs = nowMs;
        return loadSettings(false);
    }

    public RegisterOutcome register(JobDefinition definition) {
        boolean created = jobStore.register(definition, Instant.now().toEpochMilli());
        auditLogger.log(AuditLogger.AuditEvent.forJob(
                "job.register",
                "operator",
                definition.id(),
                created ? "created" : "exists",
                Map.of("type", definition.type())
        ));
        return new RegisterOutcome(definition.id(), definition.type(), created);
    }

    /**
     * Registers every job in a JSON file. The file holds one job object, an array of them, or an
     * object with a {@code jobs} array.
     */
    public List<RegisterOutcome> registerFromFile(Path file) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read job file: " + file, e);
        }
        JsonNode items = root != null && root.has("jobs") ? root.get("jobs") : root;
        List<JsonNode> nodes = new ArrayList<>();
        if (items != null && items.isArray()) {
            items.forEach(nodes::add);
        } else if (items != null && items.isObject()) {
            nodes.add(items);
        } else {
            throw new IllegalArgumentException("Job file must contain a job object or a jobs array: " + file);
        }
        List<RegisterOutcome> out = new ArrayList<>();
        for (JsonNode node : nodes) {
            JobSpec spec = Jsons.mapper().convertValue(node, JobSpec.class);
            out.add(register(spec.toDefinition()));
        }
        return out;
    }

    public Optional<JobView> job(String jobId) {
        long now = Instant.now().toEpochMilli();
        return jobStore.get(jobId).map(j -> JobView.of(j, now));
    }

    public List<JobView> jobs(JobStatus status, String type, int limit) {
        return views(jobStore.list(status, type, limit));
    }

    public List<JobView> claimable() {
        return views(livenessMonitor.claimable(Instant.now().toEpochMilli()));
    }

    public List<JobView> pendingRetry() {
        return views(livenessMonitor.pendingRetry(Instant.now().toEpochMilli()));
    }

    public List<JobView> staleClaims() {
        return views(livenessMonitor.staleClaims(Instant.now().toEpochMilli()));
    }

    public List<Heartbeat> activeWorkers() {
        return livenessMonitor.activeWorkers(Instant.now().toEpochMilli());
    }

    public List<Heartbeat> heartbeats() {
        return heartbeatRegistry.list();
    }

    public List<HeartbeatHistoryEntry> heartbeatHistory(String workerId, int limit) {
        return heartbeatRegistry.history(workerId, limit);
    }

    public OperatorOutcome activate(String jobId) {
        boolean applied = jobStore.setStatus(jobId, JobStatus.ACTIVE, Instant.now().toEpochMilli());
        return operatorOutcome("job.activate", jobId, applied,
                applied ? "Job activated" : "Job not found or permanently failed; use reset");
    }

    public OperatorOutcome deactivate(String jobId) {
        boolean applied = jobStore.setStatus(jobId, JobStatus.INACTIVE, Instant.now().toEpochMilli());
        return operatorOutcome("job.deactivate", jobId, applied,
                applied ? "Job deactivated" : "Job not found or permanently failed");
    }

    public OperatorOutcome resetPermanentFailure(String jobId) {
        boolean applied = jobStore.resetPermanentFailure(jobId, Instant.now().toEpochMilli());
        return operatorOutcome("job.reset", jobId, applied,
                applied ? "Permanent failure cleared; job is due now" : "Job not found or not permanently failed");
    }

    public List<String> handlerTypes() {
        return handlerRegistry.listTypes();
    }

    public SchedulerLoop newSchedulerLoop(String workerId) {
        return new SchedulerLoop(workerId, claimManager, heartbeatRegistry, handlerRegistry, auditLogger, workerSettings);
    }

    public StatsOutcome stats() {
        long nowMs = Instant.now().toEpochMilli();
        JobStore.JobCounts counts = jobStore.countByStatus();
        List<Heartbeat> active = livenessMonitor.activeWorkers(nowMs);
        Map<String, Integer> health = new LinkedHashMap<>();
        for (HealthStatus status : HealthStatus.values()) {
            health.put(status.dbValue(), 0);
        }
        for (Heartbeat hb : active) {
            health.merge(hb.status().dbValue(), 1, Integer::sum);
        }
        return new StatsOutcome(
                counts.byStatus(),
                counts.claimed(),
                counts.retrying(),
                livenessMonitor.claimable(nowMs).size(),
                livenessMonitor.pendingRetry(nowMs).size(),
                livenessMonitor.staleClaims(nowMs).size(),
                active.size(),
                heartbeatRegistry.list().size(),
                health,
                handlerRegistry.listTypes().size()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    public AuditVerifyOutcome auditVerify() {
        int broken = auditLogger.verifyChain();
        return new AuditVerifyOutcome(broken < 0, broken, auditLogger.currentHash());
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    private OperatorOutcome operatorOutcome(String action, String jobId, boolean applied, String message) {
        auditLogger.log(AuditLogger.AuditEvent.forJob(
                action,
                "operator",
                jobId,
                applied ? "ok" : "not_applied",
                Map.of()
        ));
        return new OperatorOutcome(jobId, action, applied, message);
    }

    private List<JobView> views(List<Job> jobs) {
        long now = Instant.now().toEpochMilli();
        List<JobView> out = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            out.add(JobView.of(job, now));
        }
        return out;
    }

    private void registerDefaultHandlers() {
        handlerRegistry.register(new EchoJobHandler());
        handlerRegistry.register(new FailJobHandler());
    }

    private void registerConfiguredScriptHandlers() {
        Path cfg = config.scriptHandlersFile();
        if (!Files.exists(cfg)) {
            return;
        }
        try {
            ScriptHandlerFile file = Jsons.mapper().readValue(cfg.toFile(), ScriptHandlerFile.class);
            if (file == null || file.handlers() == null || file.handlers().isEmpty()) {
                return;
            }
            int loaded = 0;
            int skipped = 0;
            for (ScriptHandlerSpec spec : file.handlers()) {
                if (spec == null || spec.type() == null || spec.type().isBlank()
                        || spec.command() == null || spec.command().isEmpty()) {
                    skipped++;
                    continue;
                }
                try {
                    long timeoutMs = spec.timeoutMs() == null ? 0L : spec.timeoutMs();
                    JobHandler handler = new ScriptJobHandler(spec.type(), resolveScriptCommand(spec.command()), timeoutMs);
                    handlerRegistry.register(handler);
                    loaded++;
                } catch (IllegalArgumentException e) {
                    skipped++;
                    auditLogger.log(AuditLogger.AuditEvent.of(
                            "handler.script.register",
                            "system",
                            "runtime/handlers",
                            "invalid_spec",
                            null,
                            Map.of("type", spec.type(), "error", String.valueOf(e.getMessage()))
                    ));
                }
            }
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "handler.script.load",
                    "system",
                    "runtime/handlers",
                    "ok",
                    null,
                    Map.of("config", cfg.toString(), "loaded", loaded, "skipped", skipped)
            ));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load script handler config: " + cfg, e);
        }
    }

    // Relative script paths are resolved against the handlers directory when that file exists.
    private List<String> resolveScriptCommand(List<String> rawCommand) {
        List<String> resolved = new ArrayList<>(rawCommand.size());
        for (String token : rawCommand) {
            if (token == null || token.isBlank()) {
                continue;
            }
            Path candidate = config.handlersRoot().resolve(token);
            if (!Path.of(token).isAbsolute() && Files.isRegularFile(candidate)) {
                resolved.add(candidate.toAbsolutePath().normalize().toString());
            } else {
                resolved.add(token);
            }
        }
        return resolved;
    }

    private SettingsReloadOutcome loadSettings(boolean force) {
        WorkerSettings defaults = WorkerSettings.defaults();
        Path cfg = config.settingsFile();
        long mtime = resolveFileMtimeMs(cfg);
        if (!force && mtime == settingsFileMtimeMs) {
            return new SettingsReloadOutcome(false, mtime >= 0L, cfg.toString(), workerSettings, "unchanged", List.of());
        }
        if (mtime < 0L) {
            WorkerSettings previous = workerSettings;
            workerSettings = defaults;
            settingsFileMtimeMs = -1L;
            List<String> changedFields = previous.diff(defaults);
            if (!changedFields.isEmpty()) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "runtime.settings.load",
                        "system",
                        "runtime/settings",
                        "ok_default",
                        null,
                        Map.of("config", cfg.toString(), "changed_fields", changedFields)
                ));
            }
            return new SettingsReloadOutcome(!changedFields.isEmpty(), false, cfg.toString(), defaults, "defaults", changedFields);
        }
        try {
            WorkerSettings.SettingsFile file = Jsons.mapper().readValue(cfg.toFile(), WorkerSettings.SettingsFile.class);
            WorkerSettings resolved = WorkerSettings.fromFile(file, defaults);
            WorkerSettings previous = workerSettings;
            workerSettings = resolved;
            settingsFileMtimeMs = mtime;
            List<String> changedFields = previous.diff(resolved);
            boolean changed = !changedFields.isEmpty();
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "runtime.settings.load",
                    "system",
                    "runtime/settings",
                    changed ? "reloaded" : "ok",
                    null,
                    Map.of(
                            "config", cfg.toString(),
                            "changed_fields", changedFields,
                            "config_mtime_ms", mtime
                    )
            ));
            return new SettingsReloadOutcome(changed, true, cfg.toString(), resolved,
                    changed ? "reloaded" : "unchanged_content", changedFields);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load worker settings: " + cfg, e);
        }
    }

    private long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings mtime: " + path, e);
        }
    }

    public record RegisterOutcome(String jobId, String type, boolean created) {
    }

    public record OperatorOutcome(String jobId, String action, boolean applied, String message) {
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            WorkerSettings settings,
            String message,
            List<String> changedFields
    ) {
    }

    public record AuditVerifyOutcome(boolean intact, int firstBrokenRow, String headHash) {
    }

    public record StatsOutcome(
            Map<String, Integer> jobStatus,
            int claimedJobs,
            int retryingJobs,
            int claimableJobs,
            int pendingRetryJobs,
            int staleClaims,
            int activeWorkers,
            int knownWorkers,
            Map<String, Integer> workerHealth,
            int handlerTypes
    ) {
    }

    /**
     * Operator-facing projection of a job. Configuration and last result are masked.
     */
    public record JobView(
            String id,
            String type,
            String status,
            JobState state,
            String description,
            JsonNode config,
            String schedule,
            Integer intervalMinutes,
            Long nextRunAtMs,
            Long lastRunAtMs,
            int runCount,
            JsonNode lastResult,
            String lastError,
            String claimedBy,
            Long claimedAtMs,
            long claimAgeMs,
            long claimEpoch,
            int retryCount,
            int maxRetries,
            int retryDelayMinutes,
            Long nextRetryAtMs,
            String lastRetryError,
            boolean permanentlyFailed,
            Long permanentFailureAtMs,
            String permanentFailureReason,
            int timeoutMinutes
    ) {
        public static JobView of(Job job, long nowMs) {
            return new JobView(
                    job.id(),
                    job.type(),
                    job.status().dbValue(),
                    job.state(),
                    job.description(),
                    SensitiveDataMasker.maskedConfig(job.config()),
                    job.schedule().descriptor(),
                    job.schedule().intervalColumn(),
                    job.nextRunAtMs(),
                    job.lastRunAtMs(),
                    job.runCount(),
                    job.lastResult() == null ? null : SensitiveDataMasker.masked(job.lastResult()),
                    SensitiveDataMasker.maskText(job.lastError()),
                    job.claimedBy(),
                    job.claimedAtMs(),
                    job.claimAgeMs(nowMs),
                    job.claimEpoch(),
                    job.retryCount(),
                    job.maxRetries(),
                    job.retryDelayMinutes(),
                    job.nextRetryAtMs(),
                    SensitiveDataMasker.maskText(job.lastRetryError()),
                    job.permanentlyFailed(),
                    job.permanentFailureAtMs(),
                    SensitiveDataMasker.maskText(job.permanentFailureReason()),
                    job.timeoutMinutes()
            );
        }
    }

    private record JobSpec(
            String id,
            String type,
            String description,
            JsonNode config,
            String schedule,
            Integer intervalMinutes,
            Integer maxRetries,
            Integer retryDelayMinutes,
            Integer timeoutMinutes
    ) {
        JobDefinition toDefinition() {
            return new JobDefinition(id, type, description, config, schedule, intervalMinutes,
                    maxRetries, retryDelayMinutes, timeoutMinutes, null);
        }
    }

    private record ScriptHandlerFile(List<ScriptHandlerSpec> handlers) {
    }

    private record ScriptHandlerSpec(String type, List<String> command, Long timeoutMs) {
    }
}
