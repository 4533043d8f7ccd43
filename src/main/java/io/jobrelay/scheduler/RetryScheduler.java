package io.jobrelay.scheduler;

import io.jobrelay.config.JobRelayConfig;

/**
 * Decides what happens to a job after a failed run. Stateless; the decision is applied by
 * {@link ClaimManager} in the same conditional write that releases the claim.
 *
 * <p>Backoff doubles per attempt from the job's base delay: with a five minute delay the first
 * three retries wait 10, 20 and 40 minutes.
 */
public final class RetryScheduler {
    private static final long MINUTE_MS = 60_000L;
    // 2^30 minutes is already two thousand years; larger products saturate at Long.MAX_VALUE.
    private static final int MAX_BACKOFF_EXPONENT = 30;

    private RetryScheduler() {
    }

    public static RetryDecision decide(int retryCount, int maxRetries, int retryDelayMinutes, String error, long nowMs) {
        String reason = truncateError(error);
        if (retryCount < maxRetries) {
            int nextCount = retryCount + 1;
            return RetryDecision.retry(nextCount, saturatedAdd(nowMs, backoffMs(retryDelayMinutes, nextCount)), reason);
        }
        return RetryDecision.permanent(retryCount, reason);
    }

    public static long backoffMs(int retryDelayMinutes, int attempt) {
        int exponent = Math.min(Math.max(0, attempt), MAX_BACKOFF_EXPONENT);
        try {
            return Math.multiplyExact(Math.max(0, retryDelayMinutes) * MINUTE_MS, 1L << exponent);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    public static String truncateError(String error) {
        String value = error == null || error.isBlank() ? "unknown error" : error;
        if (value.length() <= JobRelayConfig.MAX_ERROR_CHARS) {
            return value;
        }
        return value.substring(0, JobRelayConfig.MAX_ERROR_CHARS);
    }

    public record RetryDecision(boolean permanent, int retryCount, Long nextRetryAtMs, String error) {
        public static RetryDecision retry(int retryCount, long nextRetryAtMs, String error) {
            return new RetryDecision(false, retryCount, nextRetryAtMs, error);
        }

        public static RetryDecision permanent(int retryCount, String error) {
            return new RetryDecision(true, retryCount, null, error);
        }
    }
}
