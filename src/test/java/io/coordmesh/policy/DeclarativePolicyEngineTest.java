package io.coordmesh.policy;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.model.AgentProfile;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.PolicyRuleStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class DeclarativePolicyEngineTest {

    @Test
    void matchingForbidOverridesHigherPrecedencePermit() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-forbid-");
        try {
            Database db = newDatabase(root);
            PolicyRuleStore store = new PolicyRuleStore(db);
            store.upsert(new PolicyRuleStore.RuleRow("rule_protect-prod", "protect-prod", "forbid",
                    List.of("acquire_lock"), "prod/*", null, null, 90, "No locks on production config", true), 1L);
            DeclarativePolicyEngine engine = new DeclarativePolicyEngine(store, db.config().policyRulesFile());

            PolicyDecision prod = engine.evaluate(request(4, "acquire_lock", "prod/db.yaml"));
            Assertions.assertFalse(prod.allowed());
            Assertions.assertEquals("rule_protect-prod", prod.matchedPolicyId());
            Assertions.assertEquals("forbid: protect-prod", prod.reason());

            PolicyDecision dev = engine.evaluate(request(4, "acquire_lock", "dev/db.yaml"));
            Assertions.assertTrue(dev.allowed());
            Assertions.assertEquals("rule_write-operations", dev.matchedPolicyId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownActionIsDeniedByDefault() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-default-deny-");
        try {
            Database db = newDatabase(root);
            DeclarativePolicyEngine engine = new DeclarativePolicyEngine(new PolicyRuleStore(db), db.config().policyRulesFile());

            PolicyDecision decision = engine.evaluate(request(4, "launch_rockets", null));
            Assertions.assertFalse(decision.allowed());
            Assertions.assertEquals("default_deny", decision.reason());
            Assertions.assertNull(decision.matchedPolicyId());
            Assertions.assertEquals("store", engine.activeSource());
            Assertions.assertEquals(9, engine.activeRules().size());
            Assertions.assertEquals("rule_suspended-agents", engine.activeRules().get(0).id());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rulesFileReplacesStoredRules() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-file-");
        try {
            Database db = newDatabase(root);
            Files.writeString(db.config().policyRulesFile(), """
                    {
                      "rules": [
                        {"name": "everyone-reads", "effect": "permit", "actions": ["check_locks"], "priority": 5},
                        {"id": "no-deploy", "effect": "FORBID", "actions": ["*"], "resourcePattern": "deploy/*",
                         "priority": 1, "comment": "ignored"}
                      ]
                    }
                    """);
            DeclarativePolicyEngine engine = new DeclarativePolicyEngine(new PolicyRuleStore(db), db.config().policyRulesFile());

            Assertions.assertEquals(db.config().policyRulesFile().toString(), engine.activeSource());
            Assertions.assertEquals(List.of("no-deploy", "everyone-reads"),
                    engine.activeRules().stream().map(PolicyRule::id).toList());

            Assertions.assertTrue(engine.evaluate(request(0, "check_locks", "src/a")).allowed());
            Assertions.assertFalse(engine.evaluate(request(0, "check_locks", "deploy/a")).allowed());
            Assertions.assertFalse(engine.evaluate(request(4, "acquire_lock", "src/a")).allowed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableRulesFileDenies() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-bad-file-");
        try {
            Database db = newDatabase(root);
            Files.writeString(db.config().policyRulesFile(), "{ not json");
            DeclarativePolicyEngine engine = new DeclarativePolicyEngine(new PolicyRuleStore(db), db.config().policyRulesFile());

            PolicyDecision decision = engine.evaluate(request(4, "check_locks", null));
            Assertions.assertFalse(decision.allowed());
            Assertions.assertTrue(decision.reason().startsWith("policy_evaluation_error"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storeChangesApplyAfterInvalidate() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-invalidate-");
        try {
            Database db = newDatabase(root);
            PolicyRuleStore store = new PolicyRuleStore(db);
            DeclarativePolicyEngine engine = new DeclarativePolicyEngine(store, db.config().policyRulesFile());
            Assertions.assertTrue(engine.evaluate(request(1, "check_locks", null)).allowed());

            store.upsert(new PolicyRuleStore.RuleRow("rule_read-operations", "read-operations", "permit",
                    List.of("check_locks"), null, 2, null, 10, "Reads need trust 2", true), 2L);
            Assertions.assertTrue(engine.evaluate(request(1, "check_locks", null)).allowed());

            engine.invalidate();
            Assertions.assertFalse(engine.evaluate(request(1, "check_locks", null)).allowed());
        } finally {
            deleteRecursively(root);
        }
    }

    private static PolicyRequest request(int trust, String action, String resource) {
        Principal principal = new Principal("agent-d", "cli_agent", trust, AgentProfile.synthetic("cli_agent", trust));
        return new PolicyRequest(principal, action, resource, Map.of());
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
