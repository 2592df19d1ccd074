package io.coordmesh.policy;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.model.AgentProfile;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.NetworkPolicyStore;
import io.coordmesh.storage.ProfileStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class NativePolicyEngineTest {

    @Test
    void contextTrustLevelOverridesProfile() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-native-trust-");
        try {
            NativePolicyEngine engine = newEngine(root);
            Principal principal = new Principal("agent-a", "cli_agent", 3, AgentProfile.synthetic("cli_agent", 3));

            Assertions.assertTrue(engine.evaluate(new PolicyRequest(principal, "acquire_lock", "a", Map.of())).allowed());
            PolicyDecision suspended = engine.evaluate(new PolicyRequest(
                    principal, "acquire_lock", "a", Map.of(PolicyRequest.CONTEXT_TRUST_LEVEL, "0")));
            Assertions.assertFalse(suspended.allowed());
            Assertions.assertTrue(suspended.reason().startsWith("agent_suspended"));
            Assertions.assertEquals(PolicyEngine.NATIVE, suspended.engine());

            Assertions.assertThrows(IllegalArgumentException.class, () -> engine.evaluate(new PolicyRequest(
                    principal, "acquire_lock", "a", Map.of(PolicyRequest.CONTEXT_TRUST_LEVEL, "high"))));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void actionsOutsideCatalogUseProfileLists() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-native-profile-");
        try {
            Database db = newDatabase(root);
            NativePolicyEngine engine = new NativePolicyEngine(new NetworkAccessEvaluator(new NetworkPolicyStore(db)));
            AgentProfile reviewer = new ProfileStore(db).findByName("web-reviewer").orElseThrow();
            Principal principal = new Principal("agent-r", "web_agent", reviewer.trustLevel(), reviewer);

            PolicyDecision allowed = engine.evaluate(new PolicyRequest(principal, "get_my_profile", null, Map.of()));
            Assertions.assertTrue(allowed.allowed());
            Assertions.assertEquals("prf_web-reviewer", allowed.matchedPolicyId());

            PolicyDecision notListed = engine.evaluate(new PolicyRequest(principal, "heartbeat", null, Map.of()));
            Assertions.assertFalse(notListed.allowed());
            Assertions.assertTrue(notListed.reason().contains("operation_not_in_allowlist"));

            AgentProfile limited = new AgentProfile("prf_limited", "limited", "cli_agent", 2, List.of(),
                    List.of("deploy"), 5, 300, 1000, Map.of(), true, ProfileStore.SOURCE_ASSIGNMENT);
            Principal limitedPrincipal = new Principal("agent-l", "cli_agent", 2, limited);
            Assertions.assertTrue(engine.evaluate(new PolicyRequest(limitedPrincipal, "deploy", null, Map.of()))
                    .reason().contains("operation_blocked"));
            Assertions.assertTrue(engine.evaluate(new PolicyRequest(limitedPrincipal, "edit_files", null,
                    Map.of(PolicyRequest.CONTEXT_FILES_MODIFIED, 5))).reason().contains("resource_limit_exceeded"));
            Assertions.assertTrue(engine.evaluate(new PolicyRequest(limitedPrincipal, "edit_files", null,
                    Map.of(PolicyRequest.CONTEXT_FILES_MODIFIED, 4))).allowed());

            Principal unprofiled = new Principal("agent-u", null, 2, AgentProfile.synthetic(null, 2));
            Assertions.assertTrue(engine.evaluate(new PolicyRequest(unprofiled, "anything", null, Map.of())).allowed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void networkAccessDelegatesToDomainPolicies() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-policy-native-network-");
        try {
            NativePolicyEngine engine = newEngine(root);
            Principal principal = new Principal("agent-n", "cli_agent", 2, AgentProfile.synthetic("cli_agent", 2));

            PolicyDecision github = engine.evaluate(new PolicyRequest(principal, "network_access", "API.GitHub.com", Map.of()));
            Assertions.assertTrue(github.allowed());
            Assertions.assertEquals("net_github_api", github.matchedPolicyId());

            PolicyDecision other = engine.evaluate(new PolicyRequest(principal, "network_access", "example.org", Map.of()));
            Assertions.assertFalse(other.allowed());
            Assertions.assertEquals(NetworkAccessEvaluator.NO_MATCHING_POLICY, other.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database newDatabase(Path root) {
        Database db = new Database(CoordMeshConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }

    private static NativePolicyEngine newEngine(Path root) {
        return new NativePolicyEngine(new NetworkAccessEvaluator(new NetworkPolicyStore(newDatabase(root))));
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
