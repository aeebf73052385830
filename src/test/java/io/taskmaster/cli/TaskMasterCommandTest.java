package io.taskmaster.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskmaster.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskMasterCommandTest {

    @Test
    void paramPairsOverrideJsonParams() {
        Map<String, String> pairs = new LinkedHashMap<>();
        pairs.put("max_files", "10");
        Map<String, Object> merged = TaskMasterCommand.params("{\"max_files\":5,\"recursive\":false}", pairs);
        assertEquals("10", merged.get("max_files"));
        assertEquals(false, merged.get("recursive"));
        assertTrue(TaskMasterCommand.params(null, null).isEmpty());
    }

    @Test
    void runIndexesADirectoryAndQueriesSeeTheResult() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-cli-data-");
        Path docs = Files.createTempDirectory("taskmaster-test-cli-docs-");
        try {
            Files.writeString(docs.resolve("a.txt"), "same", StandardCharsets.UTF_8);
            Files.writeString(docs.resolve("b.txt"), "same", StandardCharsets.UTF_8);
            String root = dataDir.toString();

            Result init = execute("--root", root, "init");
            assertEquals(0, init.exitCode());
            assertTrue(init.out().contains("Initialized TaskMaster"));

            Result run = execute("--root", root, "run", "--job", "index", "--path", docs.toString());
            assertEquals(0, run.exitCode());
            JsonNode runJson = run.json();
            assertEquals("COMPLETED", runJson.path("status").asText());
            String runId = runJson.path("runId").asText();

            JsonNode events = execute("--root", root, "events", runId, "--type", "TM_RUN_COMPLETED").json();
            assertEquals(1, events.path("count").asInt());

            JsonNode files = execute("--root", root, "files", "--status", "active").json();
            assertEquals(2, files.path("count").asInt());
            long secondId = files.path("items").get(1).path("id").asLong();

            JsonNode duplicates = execute("--root", root, "duplicates", Long.toString(secondId)).json();
            assertEquals(files.path("items").get(0).path("id").asLong(),
                    duplicates.path("duplicateOf").path("canonicalFileId").asLong());

            JsonNode stats = execute("--root", root, "stats").json();
            assertEquals(1, stats.path("runsByStatus").path("COMPLETED").asInt());

            assertEquals(1, execute("--root", root, "cancel", runId).exitCode());
            assertEquals(1, execute("--root", root, "run-show", "run_missing").exitCode());
        } finally {
            deleteRecursively(dataDir);
            deleteRecursively(docs);
        }
    }

    @Test
    void invalidSubmissionsReportAnErrorObject() throws Exception {
        Path dataDir = Files.createTempDirectory("taskmaster-test-cli-errors-");
        try {
            String root = dataDir.toString();
            Result unknownJob = execute("--root", root, "submit", "--job", "compress");
            assertEquals(1, unknownJob.exitCode());
            assertTrue(unknownJob.json().path("error").asText().contains("Unsupported job type"));

            Result noRoot = execute("--root", root, "schedule-upsert", "--name", "n", "--job", "index", "--spec", "@daily");
            assertEquals(1, noRoot.exitCode());

            Result submitted = execute("--root", root, "submit", "--job", "refresh", "--param", "stale_after_hours=2");
            assertEquals(0, submitted.exitCode());
            assertEquals("QUEUED", submitted.json().path("status").asText());
            assertEquals(1, execute("--root", root, "runs", "--status", "queued").json().path("count").asInt());
        } finally {
            deleteRecursively(dataDir);
        }
    }

    private static Result execute(String... args) throws IOException {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int code;
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            code = new CommandLine(new TaskMasterCommand()).execute(args);
        } finally {
            System.setOut(original);
        }
        return new Result(code, buffer.toString(StandardCharsets.UTF_8));
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

    private record Result(int exitCode, String out) {
        JsonNode json() throws IOException {
            return Jsons.mapper().readTree(out);
        }
    }
}
