package io.coordmesh.guardrail;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.GuardrailStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class GuardrailEngineTest {

    @Test
    void blockingMatchIsUnsafeAndRecorded() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-guardrail-block-");
        try {
            Database db = newDatabase(root);
            GuardrailStore store = new GuardrailStore(db);
            GuardrailEngine engine = new GuardrailEngine(store);

            GuardrailVerdict verdict = engine.check(new GuardrailEngine.GuardrailRequest(
                    "cleanup: rm -rf build/ && git reset --hard",
                    1,
                    List.of(),
                    "agent-a",
                    Map.of("api_token", "abc", "ticket", "OPS-12")
            ));

            Assertions.assertFalse(verdict.safe());
            Assertions.assertEquals(GuardrailEngine.SOURCE_STORE, verdict.source());
            List<String> names = verdict.violations().stream().map(GuardrailVerdict.Violation::patternName).toList();
            Assertions.assertTrue(names.contains("rm_rf"));
            Assertions.assertTrue(names.contains("git_reset_hard"));
            Assertions.assertTrue(verdict.violations().stream().allMatch(GuardrailVerdict.Violation::blocked));

            List<GuardrailStore.ViolationRow> rows = store.listViolations("agent-a", true, 10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals(1, rows.get(0).trustLevel());
            Assertions.assertTrue(rows.get(0).contextJson().contains("***"));
            Assertions.assertFalse(rows.get(0).contextJson().contains("abc"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void warnSeverityReportsWithoutBlocking() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-guardrail-warn-");
        try {
            Database db = newDatabase(root);
            GuardrailEngine engine = new GuardrailEngine(new GuardrailStore(db));

            GuardrailVerdict verdict = engine.check(new GuardrailEngine.GuardrailRequest(
                    "update settings", 1, List.of("config/.env.local"), "agent-a", Map.of()));

            Assertions.assertTrue(verdict.safe());
            Assertions.assertEquals(1, verdict.violations().size());
            Assertions.assertEquals("env_file_modify", verdict.violations().get(0).patternName());
            Assertions.assertEquals("warn", verdict.violations().get(0).severity());
            Assertions.assertFalse(verdict.violations().get(0).blocked());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void trustAtOrAboveThresholdBypassesPattern() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-guardrail-bypass-");
        try {
            Database db = newDatabase(root);
            GuardrailStore store = new GuardrailStore(db);
            GuardrailEngine engine = new GuardrailEngine(store);

            GuardrailVerdict trusted = engine.check("git push origin main --force", 3);
            Assertions.assertTrue(trusted.safe());
            Assertions.assertTrue(trusted.violations().isEmpty());
            Assertions.assertEquals(List.of("git_force_push"), trusted.bypassed());

            GuardrailVerdict untrusted = engine.check("DROP TABLE users;", 3);
            Assertions.assertFalse(untrusted.safe());

            List<GuardrailStore.ViolationRow> rows = store.listViolations(null, false, 10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertTrue(rows.stream().anyMatch(r -> r.bypassed() && !r.blocked()));
            Assertions.assertEquals(1, store.listViolations(null, true, 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanTextIsSafe() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-guardrail-clean-");
        try {
            GuardrailEngine engine = new GuardrailEngine(new GuardrailStore(newDatabase(root)));
            GuardrailVerdict verdict = engine.check("git commit -m 'fix tests'", 0);
            Assertions.assertTrue(verdict.safe());
            Assertions.assertTrue(verdict.violations().isEmpty());
            Assertions.assertTrue(verdict.bypassed().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableStoreFallsBackToBaseline() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-guardrail-baseline-");
        try {
            Path notADirectory = Files.writeString(root.resolve("plain-file"), "x");
            GuardrailEngine engine = new GuardrailEngine(new GuardrailStore(
                    new Database(CoordMeshConfig.fromRoot(notADirectory.toString()))));

            GuardrailVerdict verdict = engine.check("terraform apply -auto-approve", 2);

            Assertions.assertFalse(verdict.safe());
            Assertions.assertEquals(GuardrailEngine.SOURCE_BASELINE, verdict.source());
            Assertions.assertEquals("deploy_command", verdict.violations().get(0).patternName());
            Assertions.assertEquals(GuardrailEngine.SOURCE_BASELINE, engine.activeSource());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidStoredPatternIsSkipped() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-guardrail-invalid-");
        try {
            Database db = newDatabase(root);
            GuardrailStore store = new GuardrailStore(db);
            store.upsertPattern(new GuardrailStore.PatternRow(
                    "broken", "custom", "([unclosed", "block", 4, "Broken regex", true), 1L);
            store.upsertPattern(new GuardrailStore.PatternRow(
                    "odd_severity", "custom", "shutdown\\s+-h", "panic", 4, "Unknown severity", true), 1L);
            store.upsertPattern(new GuardrailStore.PatternRow(
                    "chmod_world", "file", "chmod\\s+777", "block", 4, "World-writable permissions", true), 1L);

            GuardrailEngine engine = new GuardrailEngine(store);
            List<String> active = engine.activePatterns().stream().map(GuardrailPattern::name).toList();

            Assertions.assertFalse(active.contains("broken"));
            Assertions.assertFalse(active.contains("odd_severity"));
            Assertions.assertTrue(active.contains("chmod_world"));
            Assertions.assertEquals(16, active.size());
            Assertions.assertFalse(engine.check("chmod 777 /srv", 3).safe());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cachedPatternsRefreshAfterInvalidate() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-guardrail-cache-");
        try {
            Database db = newDatabase(root);
            GuardrailStore store = new GuardrailStore(db);
            GuardrailEngine engine = new GuardrailEngine(store);
            Assertions.assertTrue(engine.check("make clean-all", 0).safe());

            store.upsertPattern(new GuardrailStore.PatternRow(
                    "clean_all", "custom", "make\\s+clean-all", "block", 4, "Wipes caches", true), 1L);
            Assertions.assertTrue(engine.check("make clean-all", 0).safe());

            engine.invalidate();
            Assertions.assertFalse(engine.check("make clean-all", 0).safe());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database newDatabase(Path root) {
        Database db = new Database(CoordMeshConfig.fromRoot(root.toString()));
        db.init();
        return db;
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
