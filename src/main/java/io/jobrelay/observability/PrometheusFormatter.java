package io.jobrelay.observability;

import io.jobrelay.runtime.JobRelayRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(JobRelayRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "jobrelay_jobs_total", "Jobs grouped by status", "status", stats.jobStatus());
        appendGauge(sb, "jobrelay_jobs_claimed", "Jobs currently held by a worker claim", stats.claimedJobs());
        appendGauge(sb, "jobrelay_jobs_retry_scheduled", "Jobs with a scheduled retry", stats.retryingJobs());
        appendGauge(sb, "jobrelay_jobs_claimable", "Jobs a worker could claim now, ignoring due time", stats.claimableJobs());
        appendGauge(sb, "jobrelay_jobs_pending_retry", "Jobs whose retry time has passed", stats.pendingRetryJobs());
        appendGauge(sb, "jobrelay_stale_claims", "Claims older than the stale threshold", stats.staleClaims());
        appendGauge(sb, "jobrelay_workers_active", "Workers with a heartbeat inside the liveness window", stats.activeWorkers());
        appendGauge(sb, "jobrelay_workers_known", "Workers that ever recorded a heartbeat", stats.knownWorkers());
        appendMapGauge(sb, "jobrelay_workers_by_health", "Active workers grouped by reported health", "health", stats.workerHealth());
        appendGauge(sb, "jobrelay_handler_types", "Job types with a registered handler in this process", stats.handlerTypes());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        sb.append(metric).append(' ').append(value).append('\n');
    }

    static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
