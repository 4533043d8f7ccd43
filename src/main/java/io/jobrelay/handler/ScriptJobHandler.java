package io.jobrelay.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per job run. The job configuration is written to stdin as JSON; a
 * zero exit code is a success and stdout becomes the stored result (parsed as JSON when it is
 * JSON, otherwise wrapped as {@code {"output": "..."}}).
 *
 * <p>Combined stdout and stderr go to a temporary file rather than a pipe, so a chatty script never
 * blocks on a full pipe buffer. Without its own timeout the handler is bounded by the job's
 * {@link JobContext#timeoutMs()}; with one, by whichever limit is shorter.
 */
public final class ScriptJobHandler implements JobHandler {
    private static final int MAX_OUTPUT_IN_ERROR = 512;
    static final long FALLBACK_TIMEOUT_MS = 60_000L;

    private final String type;
    private final List<String> command;
    private final long timeoutMs;

    /**
     * @param timeoutMs per-run limit in milliseconds; zero or less defers to the job's timeout
     */
    public ScriptJobHandler(String type, List<String> command, long timeoutMs) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("script handler type cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script handler command cannot be empty: " + type);
        }
        this.type = type.trim();
        this.command = List.copyOf(command);
        this.timeoutMs = timeoutMs <= 0 ? 0L : Math.max(1_000L, timeoutMs);
    }

    @Override
    public String type() {
        return type;
    }

    public List<String> command() {
        return command;
    }

    long effectiveTimeoutMs(JobContext context) {
        long jobLimit = context.timeoutMs();
        if (timeoutMs <= 0) {
            return jobLimit > 0 ? jobLimit : FALLBACK_TIMEOUT_MS;
        }
        return jobLimit > 0 ? Math.min(timeoutMs, jobLimit) : timeoutMs;
    }

    @Override
    public JobResult run(JobContext context) {
        long limitMs = effectiveTimeoutMs(context);
        Path output;
        try {
            output = Files.createTempFile("jobrelay-script-", ".out");
        } catch (IOException e) {
            return JobResult.fail("script output file failed: " + e.getMessage());
        }
        try {
            return runWithOutput(context, output, limitMs);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                System.err.println("WARN failed to delete script output " + output + ": " + e.getMessage());
            }
        }
    }

    private JobResult runWithOutput(JobContext context, Path output, long limitMs) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(output.toFile());
        pb.environment().put("JOBRELAY_JOB_ID", context.jobId());
        pb.environment().put("JOBRELAY_ATTEMPT", Integer.toString(context.attempt()));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return JobResult.fail("script spawn failed: " + e.getMessage());
        }

        try {
            String stdin = context.config() == null ? "{}" : Jsons.toCompactJson(context.config());
            process.getOutputStream().write(stdin.getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(limitMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return JobResult.fail("script timeout after " + Duration.ofMillis(limitMs));
            }

            String combined = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return JobResult.ok(toResult(combined.strip()));
            }
            return JobResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return JobResult.fail("script interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return JobResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private static JsonNode toResult(String output) {
        if (output.startsWith("{") || output.startsWith("[")) {
            try {
                return Jsons.mapper().readTree(output);
            } catch (JsonProcessingException ignored) {
                // plain text that happens to start with a bracket
            }
        }
        ObjectNode wrapped = Jsons.mapper().createObjectNode();
        wrapped.put("output", output);
        return wrapped;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_OUTPUT_IN_ERROR) {
            return normalized;
        }
        return normalized.substring(0, MAX_OUTPUT_IN_ERROR) + "...";
    }
}
