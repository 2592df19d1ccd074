package io.coordmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordmesh.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoordMeshCommandTest {
    @Test
    void initShouldCreateDatabaseUnderRoot() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-cli-init-");
        try {
            Result result = run(root, "init");
            assertEquals(0, result.exitCode());
            assertTrue(result.json().path("initialized").asBoolean());
            assertEquals("default", result.json().path("namespace").asText());
            assertTrue(Files.exists(root.resolve("coordmesh.db")));

            Result scoped = run(root, "--namespace", "Team A", "init");
            assertEquals("team-a", scoped.json().path("namespace").asText());
            assertTrue(Files.exists(root.resolve("namespaces").resolve("team-a").resolve("coordmesh.db")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deniedAcquireShouldExitWithFailure() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-cli-lock-");
        try {
            Result granted = run(root, "acquire-lock", "--key", "src/app.py", "--holder", "agent-a", "--ttl-ms", "60000");
            assertEquals(0, granted.exitCode());
            assertEquals("granted", granted.json().path("outcome").asText());

            Result denied = run(root, "acquire-lock", "--key", "src/app.py", "--holder", "agent-b");
            assertEquals(1, denied.exitCode());
            assertEquals("locked_by_other", denied.json().path("reason").asText());
            assertEquals("agent-a", denied.json().path("lock").path("holderId").asText());

            Result locks = run(root, "check-locks", "--key", "src/app.py,src/other.py");
            assertEquals(1, locks.json().size());

            assertEquals(0, run(root, "release-lock", "--key", "src/app.py", "--holder", "agent-a").exitCode());
            assertEquals(0, run(root, "check-locks").json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void taskLifecycleShouldRunAcrossInvocations() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-cli-task-");
        try {
            Result submitted = run(root, "submit-task", "--type", "review", "--priority", "2", "--input", "{\"pr\":7}");
            assertEquals(0, submitted.exitCode());
            String taskId = submitted.json().path("taskId").asText();

            Result claimed = run(root, "claim-task", "--agent", "agent-r", "--type", "review");
            assertEquals(0, claimed.exitCode());
            assertEquals(taskId, claimed.json().path("task").path("taskId").asText());

            Result completed = run(root, "complete-task", "--task", taskId, "--agent", "agent-r", "--result", "approved");
            assertEquals(0, completed.exitCode());
            assertEquals("COMPLETED", run(root, "get-task", "--task", taskId).json().path("status").asText());

            Result missing = run(root, "get-task", "--task", "task-missing");
            assertEquals(1, missing.exitCode());
            assertFalse(missing.json().path("found").asBoolean(true));
            assertEquals("task_not_found", missing.json().path("reason").asText());

            Result empty = run(root, "claim-task", "--agent", "agent-r");
            assertEquals(1, empty.exitCode());
            assertFalse(empty.json().path("claimed").asBoolean(true));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unsafeOperationShouldExitWithFailure() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-cli-guardrail-");
        try {
            Result unsafe = run(root, "check-guardrails", "--text", "git push origin main --force", "--trust-level", "1");
            assertEquals(1, unsafe.exitCode());
            assertFalse(unsafe.json().path("safe").asBoolean(true));
            assertEquals("git_force_push", unsafe.json().path("violations").get(0).path("patternName").asText());

            Result safe = run(root, "check-guardrails", "--text", "git status", "--trust-level", "1");
            assertEquals(0, safe.exitCode());

            Result violations = run(root, "violations", "--blocked-only");
            assertEquals(1, violations.json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void policyDenialShouldBeReportedWhenEnforced() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-cli-policy-");
        try {
            assertEquals(0, run(root, "init").exitCode());
            Files.writeString(root.resolve("coordmesh-settings.json"), "{\"policyEnforcement\":true}");
            assertEquals(0, run(root, "assign-profile", "--agent", "agent-r", "--profile", "web-reviewer").exitCode());

            Result denied = run(root, "acquire-lock", "--key", "src/app.py", "--holder", "agent-r");
            assertEquals(1, denied.exitCode());
            assertFalse(denied.json().path("success").asBoolean(true));
            assertEquals("policy_denied", denied.json().path("reason").asText());
            assertEquals("acquire_lock", denied.json().path("action").asText());
            assertEquals("native", denied.json().path("decision").path("engine").asText());

            Result profile = run(root, "get-profile", "--agent", "agent-r");
            assertEquals(1, profile.json().path("trustLevel").asInt());

            Result audit = run(root, "query-audit", "--operation", "acquire_lock", "--success", "false");
            assertEquals("policy_denied", audit.json().get(0).path("errorMessage").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void handoffAndMemoryShouldSurviveAcrossInvocations() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-cli-continuity-");
        try {
            Result written = run(root, "write-handoff", "--agent", "agent-a", "--summary", "Split the lexer",
                    "--next-step", "add tests;wire errors", "--file", "src/lexer.py,src/parser.py");
            assertEquals(0, written.exitCode());
            assertTrue(written.json().path("written").asBoolean());

            Result handoff = run(root, "read-handoff", "--for-agent", "agent-a");
            assertEquals(1, handoff.json().size());
            assertEquals("Split the lexer", handoff.json().get(0).path("summary").asText());
            assertEquals(2, handoff.json().get(0).path("nextSteps").size());

            Result missing = run(root, "write-handoff", "--agent", "agent-a");
            assertEquals(1, missing.exitCode());
            assertEquals("summary_required", missing.json().path("reason").asText());

            Result stored = run(root, "remember", "--agent", "agent-a", "--event-type", "decision",
                    "--summary", "Keep the hand-written lexer", "--tag", "parser,lexer");
            assertEquals(0, stored.exitCode());
            assertEquals("created", stored.json().path("action").asText());
            Result again = run(root, "remember", "--agent", "agent-a", "--event-type", "decision",
                    "--summary", "Keep the hand-written lexer");
            assertEquals("deduplicated", again.json().path("action").asText());

            Result recalled = run(root, "recall", "--tag", "lexer");
            assertEquals(1, recalled.json().size());
            assertEquals(stored.json().path("memoryId").asText(),
                    recalled.json().get(0).path("memory").path("memoryId").asText());
            assertEquals(0, run(root, "recall", "--tag", "unrelated").json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) throws IOException {
        StringWriter buffer = new StringWriter();
        CommandLine cmd = new CommandLine(new CoordMeshCommand());
        cmd.setOut(new PrintWriter(buffer, true));
        List<String> argv = new ArrayList<>();
        argv.add("--root");
        argv.add(root.toString());
        argv.addAll(List.of(args));
        int exitCode = cmd.execute(argv.toArray(new String[0]));
        return new Result(exitCode, Jsons.mapper().readTree(buffer.toString()));
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

    private record Result(int exitCode, JsonNode json) {
    }
}
