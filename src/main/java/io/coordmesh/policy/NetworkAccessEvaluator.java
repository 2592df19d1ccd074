package io.coordmesh.policy;

import io.coordmesh.storage.NetworkPolicyStore;
import io.coordmesh.util.WildcardPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Default-deny domain access check. The first enabled policy that matches decides: the profile's own policies
 * before global ones, lower priority numbers first. Every check is written to the access log.
 */
public final class NetworkAccessEvaluator {
    private static final Logger log = LoggerFactory.getLogger(NetworkAccessEvaluator.class);
    public static final String NO_MATCHING_POLICY = "no_matching_policy";

    private final NetworkPolicyStore store;
    private final Clock clock;

    public NetworkAccessEvaluator(NetworkPolicyStore store) {
        this(store, Clock.systemUTC());
    }

    public NetworkAccessEvaluator(NetworkPolicyStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public NetworkDecision check(String agentId, String profileId, String domain) {
        String normalized = normalizeDomain(domain);
        if (normalized.isEmpty()) {
            return new NetworkDecision(false, normalized, "missing_domain", null, null);
        }
        NetworkDecision decision = new NetworkDecision(false, normalized, NO_MATCHING_POLICY, null, null);
        List<NetworkPolicyStore.NetworkPolicyRow> policies = store.listApplicable(profileId);
        for (NetworkPolicyStore.NetworkPolicyRow policy : policies) {
            if (WildcardPatterns.matches(policy.domainPattern(), normalized)) {
                boolean allowed = "allow".equalsIgnoreCase(policy.action());
                decision = new NetworkDecision(
                        allowed,
                        normalized,
                        policy.action().toLowerCase(Locale.ROOT),
                        policy.policyId(),
                        policy.domainPattern()
                );
                break;
            }
        }
        store.logAccess(agentId, normalized, decision.allowed(), decision.policyId(), decision.reason(), clock.millis());
        if (!decision.allowed()) {
            log.debug("Network access denied agent={} domain={} reason={}", agentId, normalized, decision.reason());
        }
        return decision;
    }

    static String normalizeDomain(String raw) {
        if (raw == null) {
            return "";
        }
        String d = raw.trim().toLowerCase(Locale.ROOT);
        if (d.endsWith(".")) {
            d = d.substring(0, d.length() - 1);
        }
        return d;
    }

    public record NetworkDecision(boolean allowed, String domain, String reason, String policyId, String domainPattern) {
    }
}
