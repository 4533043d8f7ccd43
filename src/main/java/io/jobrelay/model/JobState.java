package io.jobrelay.model;

/**
 * Scheduling state of a job, derived from the flat store columns.
 */
public enum JobState {
    SCHEDULED,
    CLAIMED,
    RETRY_PENDING,
    COMPLETED,
    INACTIVE,
    PERMANENTLY_FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == PERMANENTLY_FAILED;
    }

    /**
     * Resolves the state of a stored row, rejecting column combinations that the claim protocol
     * never produces.
     */
    public static JobState of(JobStatus status,
                              boolean permanentlyFailed,
                              String claimedBy,
                              Long claimedAtMs,
                              Long nextRetryAtMs,
                              boolean oneShot,
                              int runCount) {
        boolean hasOwner = claimedBy != null && !claimedBy.isBlank();
        boolean hasClaimTime = claimedAtMs != null;
        if (hasOwner != hasClaimTime) {
            throw new IllegalStateException("claimed_by and claimed_at must be set together");
        }
        if (permanentlyFailed) {
            if (hasOwner) {
                throw new IllegalStateException("permanently failed job cannot hold a claim");
            }
            return PERMANENTLY_FAILED;
        }
        if (status == JobStatus.FAILED) {
            throw new IllegalStateException("failed status without permanent failure flag");
        }
        if (status == JobStatus.INACTIVE) {
            if (hasOwner) {
                // deactivated while a worker was running it; the release will still land
                return CLAIMED;
            }
            return oneShot && runCount > 0 ? COMPLETED : INACTIVE;
        }
        if (hasOwner) {
            return CLAIMED;
        }
        return nextRetryAtMs != null ? RETRY_PENDING : SCHEDULED;
    }
}
