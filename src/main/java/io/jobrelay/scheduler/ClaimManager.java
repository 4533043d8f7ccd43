package io.jobrelay.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.Job;
import io.jobrelay.observability.AuditLogger;
import io.jobrelay.storage.JobStore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Claims jobs for a worker and releases them with the run outcome.
 *
 * <p>A claim increments the job's claim epoch. Every release is fenced on the worker id and that
 * epoch, so a worker whose claim went stale and was taken over cannot overwrite the new owner's
 * row; it gets {@link ReleaseOutcome#STALE_CLAIM} instead.
 */
public final class ClaimManager {
    public static final int CANDIDATE_BATCH = 25;

    private final JobStore jobStore;
    private final AuditLogger auditLogger;
    private final long staleClaimThresholdMs;

    public ClaimManager(JobStore jobStore, AuditLogger auditLogger) {
        this(jobStore, auditLogger, JobRelayConfig.STALE_CLAIM_THRESHOLD_MS);
    }

    public ClaimManager(JobStore jobStore, AuditLogger auditLogger, long staleClaimThresholdMs) {
        this.jobStore = jobStore;
        this.auditLogger = auditLogger;
        this.staleClaimThresholdMs = staleClaimThresholdMs;
    }

    public ClaimOutcome claim(String workerId, String jobId, long nowMs) {
        requireWorker(workerId);
        JobStore.ClaimGrant grant = jobStore.tryClaim(jobId, workerId, nowMs, staleClaimThresholdMs);
        if (!grant.granted()) {
            audit("job.claim", workerId, jobId, "conflict", Map.of());
            return ClaimOutcome.conflict(jobId);
        }
        Job job = grant.job();
        audit("job.claim", workerId, jobId, "granted", Map.of(
                "claim_epoch", job.claimEpoch(),
                "retry_count", job.retryCount()
        ));
        return ClaimOutcome.claimed(job);
    }

    public Optional<Job> claimNext(String workerId, long nowMs) {
        return claimNext(workerId, nowMs, null);
    }

    /**
     * Claims the first due candidate, trying them in {@code next_run_at} order. Losing a race on
     * one candidate moves on to the next. {@code types} limits candidates to job types the worker
     * can run; {@code null} means any type.
     */
    public Optional<Job> claimNext(String workerId, long nowMs, Collection<String> types) {
        requireWorker(workerId);
        for (Job candidate : jobStore.claimCandidates(nowMs, staleClaimThresholdMs, types, CANDIDATE_BATCH)) {
            ClaimOutcome outcome = claim(workerId, candidate.id(), nowMs);
            if (outcome.claimed()) {
                return Optional.of(outcome.job());
            }
        }
        return Optional.empty();
    }

    public ReleaseResolution reportSuccess(Job claimed, String workerId, JsonNode result, long nowMs) {
        boolean oneShot = claimed.schedule().oneShot();
        Long nextRunAtMs = claimed.schedule().nextRunAfter(nowMs);
        boolean released = jobStore.releaseSuccess(
                claimed.id(), workerId, claimed.claimEpoch(), result, nextRunAtMs, oneShot, nowMs);
        if (!released) {
            return staleRelease(claimed, workerId, "success");
        }
        ReleaseResolution resolution = oneShot
                ? ReleaseResolution.completed()
                : ReleaseResolution.rescheduled(nextRunAtMs);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("claim_epoch", claimed.claimEpoch());
        details.put("next_run_at_ms", nextRunAtMs);
        audit("job.release", workerId, claimed.id(), resolution.outcome().name().toLowerCase(Locale.ROOT), details);
        return resolution;
    }

    public ReleaseResolution reportFailure(Job claimed, String workerId, String error, long nowMs) {
        RetryScheduler.RetryDecision decision = RetryScheduler.decide(
                claimed.retryCount(), claimed.maxRetries(), claimed.retryDelayMinutes(), error, nowMs);
        boolean released;
        if (decision.permanent()) {
            released = jobStore.releaseAsPermanentFailure(
                    claimed.id(), workerId, claimed.claimEpoch(), decision.error(), nowMs);
        } else {
            released = jobStore.releaseForRetry(
                    claimed.id(), workerId, claimed.claimEpoch(), decision.error(),
                    decision.retryCount(), decision.nextRetryAtMs(), nowMs);
        }
        if (!released) {
            return staleRelease(claimed, workerId, "failure");
        }
        ReleaseResolution resolution = decision.permanent()
                ? ReleaseResolution.permanentlyFailed(decision.retryCount())
                : ReleaseResolution.retryScheduled(decision.retryCount(), decision.nextRetryAtMs());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("claim_epoch", claimed.claimEpoch());
        details.put("retry_count", decision.retryCount());
        details.put("next_retry_at_ms", decision.nextRetryAtMs());
        details.put("error", decision.error());
        audit("job.release", workerId, claimed.id(), resolution.outcome().name().toLowerCase(Locale.ROOT), details);
        return resolution;
    }

    private ReleaseResolution staleRelease(Job claimed, String workerId, String attempted) {
        audit("job.release", workerId, claimed.id(), "stale_claim", Map.of(
                "claim_epoch", claimed.claimEpoch(),
                "attempted", attempted
        ));
        return ReleaseResolution.staleClaim();
    }

    private void audit(String action, String workerId, String jobId, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        // the claim or release is already committed; a lost audit row must not strand the job
        try {
            auditLogger.log(AuditLogger.AuditEvent.forJob(action, workerId, jobId, result, details));
        } catch (RuntimeException e) {
            System.err.println("WARN audit write failed for " + action + " " + jobId + ": " + e.getMessage());
        }
    }

    private static void requireWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker id cannot be empty");
        }
    }

    public record ClaimOutcome(boolean claimed, String jobId, Job job) {
        public static ClaimOutcome claimed(Job job) {
            return new ClaimOutcome(true, job.id(), job);
        }

        public static ClaimOutcome conflict(String jobId) {
            return new ClaimOutcome(false, jobId, null);
        }
    }

    public enum ReleaseOutcome {
        RESCHEDULED,
        COMPLETED,
        RETRY_SCHEDULED,
        PERMANENTLY_FAILED,
        STALE_CLAIM
    }

    public record ReleaseResolution(ReleaseOutcome outcome, int retryCount, Long nextRunAtMs, Long nextRetryAtMs) {
        public static ReleaseResolution rescheduled(Long nextRunAtMs) {
            return new ReleaseResolution(ReleaseOutcome.RESCHEDULED, 0, nextRunAtMs, null);
        }

        public static ReleaseResolution completed() {
            return new ReleaseResolution(ReleaseOutcome.COMPLETED, 0, null, null);
        }

        public static ReleaseResolution retryScheduled(int retryCount, Long nextRetryAtMs) {
            return new ReleaseResolution(ReleaseOutcome.RETRY_SCHEDULED, retryCount, null, nextRetryAtMs);
        }

        public static ReleaseResolution permanentlyFailed(int retryCount) {
            return new ReleaseResolution(ReleaseOutcome.PERMANENTLY_FAILED, retryCount, null, null);
        }

        public static ReleaseResolution staleClaim() {
            return new ReleaseResolution(ReleaseOutcome.STALE_CLAIM, 0, null, null);
        }

        public boolean released() {
            return outcome != ReleaseOutcome.STALE_CLAIM;
        }
    }
}
