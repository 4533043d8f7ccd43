package io.jobrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class JobRelayCommandTest {

    @Test
    void registerRunOnceAndInspect() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-cli-");
        try {
            String dir = root.toString();
            Assertions.assertEquals(0, run("--root", dir, "init").code());

            Result registered = run("--root", dir, "register", "--id", "cli-job", "--type", "echo",
                    "--schedule", "hourly", "--config", "{\"note\":\"hello\"}", "--max-retries", "1");
            Assertions.assertEquals(0, registered.code());
            JsonNode reg = Jsons.mapper().readTree(registered.out());
            Assertions.assertTrue(reg.path("created").asBoolean());

            Result once = run("--root", dir, "worker", "--once", "--worker-id", "cli-worker");
            Assertions.assertEquals(0, once.code());
            JsonNode poll = Jsons.mapper().readTree(once.out());
            Assertions.assertEquals("cli-worker", poll.path("workerId").asText());
            Assertions.assertEquals(1, poll.path("runs").size());
            Assertions.assertEquals("RESCHEDULED", poll.path("runs").get(0).path("outcome").asText());

            Result job = run("--root", dir, "job", "cli-job");
            Assertions.assertEquals(0, job.code());
            JsonNode view = Jsons.mapper().readTree(job.out());
            Assertions.assertEquals(1, view.path("runCount").asInt());
            Assertions.assertEquals("hello", view.path("lastResult").path("received").path("note").asText());
            Assertions.assertEquals(1, view.path("maxRetries").asInt());

            JsonNode workers = Jsons.mapper().readTree(run("--root", dir, "workers").out());
            Assertions.assertEquals("cli-worker", workers.get(0).path("workerId").asText());

            Result metrics = run("--root", dir, "metrics");
            Assertions.assertTrue(metrics.out().contains("jobrelay_jobs_total{status=\"active\"} 1"));

            Assertions.assertEquals(0, run("--root", dir, "audit-verify").code());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingJobAndIncompleteRegistrationFail() throws Exception {
        Path root = Files.createTempDirectory("jobrelay-test-cli-errors-");
        try {
            String dir = root.toString();
            Result missing = run("--root", dir, "job", "nope");
            Assertions.assertEquals(1, missing.code());
            Assertions.assertTrue(missing.out().contains("job not found"));

            Assertions.assertEquals(2, run("--root", dir, "register", "--id", "only-id").code());
            Assertions.assertEquals(1, run("--root", dir, "reset", "nope").code());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new JobRelayCommand()).execute(args);
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int code, String out) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
