package io.coordmesh.policy;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.model.AgentProfile;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.NetworkPolicyStore;
import io.coordmesh.storage.PolicyRuleStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Both engines must return the same {@code allowed} for every catalog action, network domain and trust level under
 * the seeded rule set.
 */
final class PolicyEngineContractTest {
    private static final List<String> DOMAINS = List.of(
            "github.com",
            "api.github.com",
            "raw.github.com",
            "registry.npmjs.org",
            "pypi.org",
            "files.pythonhosted.org",
            "evilgithub.com",
            "example.com"
    );

    @Test
    void nativeAndDeclarativeAgreeOnEveryCatalogAction() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-contract-");
        try {
            Database db = new Database(CoordMeshConfig.fromRoot(root.toString()));
            db.init();
            PolicyEngine nativeEngine = new NativePolicyEngine(new NetworkAccessEvaluator(new NetworkPolicyStore(db)));
            PolicyEngine declarative = new DeclarativePolicyEngine(new PolicyRuleStore(db), db.config().policyRulesFile());

            List<String> actions = new ArrayList<>();
            actions.addAll(ActionCatalog.READ_ACTIONS);
            actions.addAll(ActionCatalog.WRITE_ACTIONS);
            actions.addAll(ActionCatalog.ADMIN_ACTIONS);

            List<String> mismatches = new ArrayList<>();
            int cases = 0;
            for (int trust = CoordMeshConfig.MIN_TRUST_LEVEL; trust <= CoordMeshConfig.MAX_TRUST_LEVEL; trust++) {
                for (String action : actions) {
                    cases++;
                    compare(nativeEngine, declarative, request(trust, action, "src/Main.java"), mismatches);
                }
                for (String domain : DOMAINS) {
                    cases++;
                    compare(nativeEngine, declarative, request(trust, ActionCatalog.NETWORK_ACCESS, domain), mismatches);
                }
            }

            Assertions.assertEquals(5 * (actions.size() + DOMAINS.size()), cases);
            Assertions.assertTrue(mismatches.isEmpty(), "engines disagree: " + mismatches);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expectedTiersHoldUnderBothEngines() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-tiers-");
        try {
            Database db = new Database(CoordMeshConfig.fromRoot(root.toString()));
            db.init();
            List<PolicyEngine> engines = List.of(
                    new NativePolicyEngine(new NetworkAccessEvaluator(new NetworkPolicyStore(db))),
                    new DeclarativePolicyEngine(new PolicyRuleStore(db), db.config().policyRulesFile())
            );
            for (PolicyEngine engine : engines) {
                Assertions.assertFalse(engine.evaluate(request(0, "check_locks", null)).allowed(), engine.name());
                Assertions.assertTrue(engine.evaluate(request(1, "check_locks", null)).allowed(), engine.name());
                Assertions.assertFalse(engine.evaluate(request(1, "acquire_lock", "a")).allowed(), engine.name());
                Assertions.assertTrue(engine.evaluate(request(2, "acquire_lock", "a")).allowed(), engine.name());
                Assertions.assertFalse(engine.evaluate(request(2, "cleanup_agents", null)).allowed(), engine.name());
                Assertions.assertTrue(engine.evaluate(request(3, "cleanup_agents", null)).allowed(), engine.name());
                Assertions.assertTrue(engine.evaluate(request(1, "network_access", "pypi.org")).allowed(), engine.name());
                Assertions.assertFalse(engine.evaluate(request(4, "network_access", "example.com")).allowed(), engine.name());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static void compare(PolicyEngine a, PolicyEngine b, PolicyRequest request, List<String> mismatches) {
        PolicyDecision left = a.evaluate(request);
        PolicyDecision right = b.evaluate(request);
        if (left.allowed() != right.allowed()) {
            mismatches.add(request.action() + "@" + request.resource() + " trust=" + request.effectiveTrustLevel()
                    + " " + a.name() + "=" + left.reason() + " " + b.name() + "=" + right.reason());
        }
    }

    private static PolicyRequest request(int trust, String action, String resource) {
        Principal principal = new Principal("agent-contract", "cli_agent", trust,
                AgentProfile.synthetic("cli_agent", trust));
        return new PolicyRequest(principal, action, resource, Map.of(PolicyRequest.CONTEXT_TRUST_LEVEL, trust));
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
