package io.jobrelay.scheduler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.config.WorkerSettings;
import io.jobrelay.handler.JobContext;
import io.jobrelay.handler.JobHandler;
import io.jobrelay.handler.JobHandlerRegistry;
import io.jobrelay.handler.JobResult;
import io.jobrelay.model.HealthStatus;
import io.jobrelay.model.Heartbeat;
import io.jobrelay.model.Job;
import io.jobrelay.observability.AuditLogger;
import io.jobrelay.storage.HeartbeatRegistry;
import io.jobrelay.storage.StoreUnavailableException;
import io.jobrelay.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Polling loop of one worker process. Each cycle sends a heartbeat when one is due, then claims
 * and runs due jobs one at a time until none is left or the per-cycle cap is reached. A started
 * loop also heartbeats from its own timer task, so a long-running job does not silence the worker.
 *
 * <p>A {@link StoreUnavailableException} aborts the cycle. The delay before the next cycle then
 * doubles, up to {@link WorkerSettings#storeBackoffMaxMultiplier()} times the poll interval, and
 * resets after the first clean cycle. Handler failures never abort a cycle.
 */
public final class SchedulerLoop {
    public static final int DEFAULT_MAX_JOBS_PER_CYCLE = 100;

    private final String workerId;
    private final ClaimManager claimManager;
    private final HeartbeatRegistry heartbeats;
    private final JobHandlerRegistry handlers;
    private final AuditLogger auditLogger;
    private final LongSupplier clock;
    private final int maxJobsPerCycle;
    private final long startTimeMs;
    private final AtomicInteger totalJobs = new AtomicInteger();
    private final AtomicInteger runningJobs = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Object heartbeatLock = new Object();

    private volatile WorkerSettings settings;
    private volatile int backoffMultiplier = 1;
    private volatile int consecutiveStoreErrors;
    private volatile long storeErrorsTotal;
    private Long lastHeartbeatAtMs;
    private volatile ScheduledExecutorService timer;
    private ExecutorService handlerExecutor;

    public SchedulerLoop(String workerId,
                         ClaimManager claimManager,
                         HeartbeatRegistry heartbeats,
                         JobHandlerRegistry handlers,
                         AuditLogger auditLogger,
                         WorkerSettings settings) {
        this(workerId, claimManager, heartbeats, handlers, auditLogger, settings, System::currentTimeMillis, DEFAULT_MAX_JOBS_PER_CYCLE);
    }

    public SchedulerLoop(String workerId,
                         ClaimManager claimManager,
                         HeartbeatRegistry heartbeats,
                         JobHandlerRegistry handlers,
                         AuditLogger auditLogger,
                         WorkerSettings settings,
                         LongSupplier clock,
                         int maxJobsPerCycle) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker id cannot be empty");
        }
        this.workerId = workerId.trim();
        this.claimManager = claimManager;
        this.heartbeats = heartbeats;
        this.handlers = handlers;
        this.auditLogger = auditLogger;
        this.settings = settings == null ? WorkerSettings.defaults() : settings;
        this.clock = clock;
        this.maxJobsPerCycle = Math.max(1, maxJobsPerCycle);
        this.startTimeMs = clock.getAsLong();
    }

    public String workerId() {
        return workerId;
    }

    public void updateSettings(WorkerSettings next) {
        if (next != null) {
            this.settings = next;
        }
    }

    public WorkerSettings settings() {
        return settings;
    }

    public synchronized PollOutcome runOnce() {
        List<JobRun> runs = new ArrayList<>();
        boolean heartbeatSent = false;
        try {
            heartbeatSent = heartbeatIfDue(clock.getAsLong());
            while (runs.size() < maxJobsPerCycle) {
                long now = clock.getAsLong();
                heartbeatSent |= heartbeatIfDue(now);
                Optional<Job> claimed = claimManager.claimNext(workerId, now, handlers.listTypes());
                if (claimed.isEmpty()) {
                    break;
                }
                runs.add(execute(claimed.get()));
            }
            consecutiveStoreErrors = 0;
            backoffMultiplier = 1;
            return new PollOutcome(workerId, runs, heartbeatSent, false, null, nextDelayMs());
        } catch (StoreUnavailableException e) {
            consecutiveStoreErrors++;
            storeErrorsTotal++;
            backoffMultiplier = Math.min(settings.storeBackoffMaxMultiplier(), backoffMultiplier * 2);
            long delay = nextDelayMs();
            audit("worker.poll", "store_unavailable", null, Map.of(
                    "error", String.valueOf(e.getMessage()),
                    "consecutive_errors", consecutiveStoreErrors,
                    "next_delay_ms", delay
            ));
            return new PollOutcome(workerId, runs, heartbeatSent, true, e.getMessage(), delay);
        }
    }

    public long nextDelayMs() {
        return settings.pollIntervalMs() * backoffMultiplier;
    }

    public int backoffMultiplier() {
        return backoffMultiplier;
    }

    /**
     * Starts polling on a dedicated timer thread. The first cycle runs immediately.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // one thread for poll cycles, one for heartbeats while a cycle is busy running a job
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(2, r -> {
            Thread t = new Thread(r, "jobrelay-scheduler-" + workerId);
            t.setDaemon(false);
            return t;
        });
        // pending cycles are dropped on stop; only the running one completes
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        timer = executor;
        audit("worker.start", "ok", null, Map.of(
                "poll_interval_ms", settings.pollIntervalMs(),
                "heartbeat_interval_ms", settings.heartbeatIntervalMs(),
                "types", handlers.listTypes()
        ));
        timer.schedule(this::tick, 0L, TimeUnit.MILLISECONDS);
        timer.schedule(this::heartbeatTick, heartbeatCheckDelayMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops scheduling further cycles. A cycle in progress, including its running handler, is
     * allowed to finish.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledExecutorService t = timer;
        if (t != null) {
            t.shutdown();
        }
        audit("worker.stop", "ok", null, Map.of("total_jobs", totalJobs.get()));
    }

    public boolean awaitStop(long timeoutMs) throws InterruptedException {
        ScheduledExecutorService t = timer;
        boolean done = t == null || t.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
        ExecutorService h;
        synchronized (this) {
            h = handlerExecutor;
            handlerExecutor = null;
        }
        if (h != null) {
            h.shutdown();
        }
        return done;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int totalJobs() {
        return totalJobs.get();
    }

    public int runningJobs() {
        return runningJobs.get();
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            // keep the timer alive; the next cycle retries from scratch
            audit("worker.poll", "error", null, Map.of("error", String.valueOf(e.getMessage())));
        }
        if (running.get()) {
            try {
                timer.schedule(this::tick, nextDelayMs(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException ignored) {
                // stop() shut the timer down between the check and the schedule call
            }
        }
    }

    private void heartbeatTick() {
        if (!running.get()) {
            return;
        }
        try {
            heartbeatIfDue(clock.getAsLong());
        } catch (StoreUnavailableException e) {
            // the poll cycle owns store backoff; a missed heartbeat is retried next interval
            audit("worker.heartbeat", "store_unavailable", null, Map.of("error", String.valueOf(e.getMessage())));
        } catch (RuntimeException e) {
            audit("worker.heartbeat", "error", null, Map.of("error", String.valueOf(e.getMessage())));
        }
        if (running.get()) {
            try {
                timer.schedule(this::heartbeatTick, heartbeatCheckDelayMs(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException ignored) {
                // stop() shut the timer down between the check and the schedule call
            }
        }
    }

    // checking at half the interval keeps the gap between heartbeats under 1.5 intervals
    private long heartbeatCheckDelayMs() {
        return Math.max(50L, settings.heartbeatIntervalMs() / 2);
    }

    private JobRun execute(Job job) {
        int attempt = job.retryCount() + 1;
        JobContext context = new JobContext(job.id(), job.type(), job.config(), attempt, workerId,
                TimeUnit.MINUTES.toMillis(job.timeoutMinutes()));
        runningJobs.incrementAndGet();
        try {
            JobResult result = invoke(job, context);
            long now = clock.getAsLong();
            ClaimManager.ReleaseResolution resolution = result.success()
                    ? claimManager.reportSuccess(job, workerId, result.result(), now)
                    : claimManager.reportFailure(job, workerId, result.error(), now);
            totalJobs.incrementAndGet();
            return new JobRun(job.id(), job.type(), attempt, result.success(), result.error(), resolution.outcome());
        } finally {
            runningJobs.decrementAndGet();
        }
    }

    private JobResult invoke(Job job, JobContext context) {
        Optional<JobHandler> handler = handlers.find(job.type());
        if (handler.isEmpty()) {
            return JobResult.fail("no handler registered for job type: " + job.type());
        }
        Future<JobResult> future = handlerExecutor().submit(() -> handler.get().run(context));
        try {
            JobResult result = future.get(job.timeoutMinutes(), TimeUnit.MINUTES);
            return result == null ? JobResult.fail("handler returned no result") : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            discardHandlerExecutor();
            return JobResult.fail("job timed out after " + job.timeoutMinutes() + " minutes");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return JobResult.fail(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return JobResult.fail("worker interrupted while job was running");
        }
    }

    private synchronized ExecutorService handlerExecutor() {
        if (handlerExecutor == null) {
            handlerExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "jobrelay-handler-" + workerId);
                t.setDaemon(true);
                return t;
            });
        }
        return handlerExecutor;
    }

    // A handler that ignores interruption keeps its thread; later jobs get a fresh one.
    private synchronized void discardHandlerExecutor() {
        if (handlerExecutor != null) {
            handlerExecutor.shutdownNow();
            handlerExecutor = null;
        }
    }

    private boolean heartbeatIfDue(long nowMs) {
        synchronized (heartbeatLock) {
            WorkerSettings current = settings;
            if (lastHeartbeatAtMs != null && nowMs - lastHeartbeatAtMs < current.heartbeatIntervalMs()) {
                return false;
            }
            heartbeats.record(snapshot(nowMs, current));
            lastHeartbeatAtMs = nowMs;
            return true;
        }
    }

    private Heartbeat snapshot(long nowMs, WorkerSettings current) {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("consecutiveStoreErrors", consecutiveStoreErrors);
        payload.put("storeErrorsTotal", storeErrorsTotal);
        payload.put("backoffMultiplier", backoffMultiplier);
        return new Heartbeat(
                workerId,
                consecutiveStoreErrors > 0 ? HealthStatus.DEGRADED : HealthStatus.HEALTHY,
                Math.max(0L, (nowMs - startTimeMs) / 1000L),
                startTimeMs,
                totalJobs.get(),
                runningJobs.get(),
                handlers.listTypes(),
                current.workerVersion(),
                (int) (current.heartbeatIntervalMs() / 1000L),
                (int) (current.pollIntervalMs() / 1000L),
                payload,
                nowMs
        );
    }

    private void audit(String action, String result, String jobId, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, workerId, "worker", result, jobId, new LinkedHashMap<>(details)));
        } catch (RuntimeException e) {
            System.err.println("WARN audit write failed: " + e.getMessage());
        }
    }

    public record JobRun(
            String jobId,
            String type,
            int attempt,
            boolean success,
            String error,
            ClaimManager.ReleaseOutcome outcome
    ) {
    }

    public record PollOutcome(
            String workerId,
            List<JobRun> runs,
            boolean heartbeatSent,
            boolean storeUnavailable,
            String storeError,
            long nextDelayMs
    ) {
        public int processed() {
            return runs.size();
        }
    }
}
