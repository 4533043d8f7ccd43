package io.jobrelay.handler;

public final class FailJobHandler implements JobHandler {
    @Override
    public String type() {
        return "fail";
    }

    @Override
    public JobResult run(JobContext context) {
        return JobResult.fail("intentional failure from fail handler");
    }
}
