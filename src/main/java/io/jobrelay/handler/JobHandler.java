package io.jobrelay.handler;

/**
 * Executes one run of a job type. A run may be repeated after a stale claim is taken over, so
 * implementations must tolerate running twice for the same scheduled occurrence.
 */
public interface JobHandler {
    String type();

    JobResult run(JobContext context) throws Exception;
}
