package io.coordmesh.policy;

import io.coordmesh.model.AgentProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hard-coded trust tiers over the action catalog. Actions outside the catalog fall back to the caller's profile:
 * its blocked list, its allow list and its file modification limit.
 */
public final class NativePolicyEngine implements PolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(NativePolicyEngine.class);

    private final NetworkAccessEvaluator networkAccess;

    public NativePolicyEngine(NetworkAccessEvaluator networkAccess) {
        this.networkAccess = networkAccess;
    }

    @Override
    public String name() {
        return NATIVE;
    }

    @Override
    public PolicyDecision evaluate(PolicyRequest request) {
        String action = request.action();
        int trust = request.effectiveTrustLevel();
        if (trust <= 0) {
            return PolicyDecision.deny(NATIVE, "agent_suspended: trust_level=" + trust);
        }
        if (ActionCatalog.READ_ACTIONS.contains(action)) {
            return PolicyDecision.allow(NATIVE, "read_permitted");
        }
        if (ActionCatalog.WRITE_ACTIONS.contains(action)) {
            return trust >= ActionCatalog.WRITE_MIN_TRUST
                    ? PolicyDecision.allow(NATIVE, "write_permitted: trust_level=" + trust)
                    : PolicyDecision.deny(NATIVE, "write_denied: trust_level=" + trust + " < " + ActionCatalog.WRITE_MIN_TRUST);
        }
        if (ActionCatalog.ADMIN_ACTIONS.contains(action)) {
            return trust >= ActionCatalog.ADMIN_MIN_TRUST
                    ? PolicyDecision.allow(NATIVE, "admin_permitted: trust_level=" + trust)
                    : PolicyDecision.deny(NATIVE, "admin_denied: trust_level=" + trust + " < " + ActionCatalog.ADMIN_MIN_TRUST);
        }
        if (ActionCatalog.NETWORK_ACCESS.equals(action)) {
            return evaluateNetwork(request);
        }
        try {
            return evaluateProfile(request.principal().profile(), action, request);
        } catch (RuntimeException e) {
            log.warn("Profile check failed for action={}: {}", action, e.getMessage());
            return PolicyDecision.deny(NATIVE, "unknown_operation: " + action);
        }
    }

    private PolicyDecision evaluateNetwork(PolicyRequest request) {
        AgentProfile profile = request.principal().profile();
        try {
            NetworkAccessEvaluator.NetworkDecision d = networkAccess.check(
                    request.principal().agentId(),
                    profile == null ? null : profile.profileId(),
                    request.resource()
            );
            return d.allowed()
                    ? PolicyDecision.allow(NATIVE, d.reason(), d.policyId())
                    : PolicyDecision.deny(NATIVE, d.reason(), d.policyId());
        } catch (RuntimeException e) {
            log.warn("Network policy evaluation failed for domain={}: {}", request.resource(), e.getMessage());
            return PolicyDecision.deny(NATIVE, "network_error: " + e.getMessage());
        }
    }

    private PolicyDecision evaluateProfile(AgentProfile profile, String action, PolicyRequest request) {
        if (profile == null) {
            throw new IllegalStateException("No profile resolved for " + request.principal().agentId());
        }
        if (profile.synthetic()) {
            return PolicyDecision.allow(NATIVE, "profile_permitted: no_profile_default_allow");
        }
        if (profile.blockedOperations().contains(action)) {
            return PolicyDecision.deny(NATIVE, "profile_denied: operation_blocked: " + action, profile.profileId());
        }
        if (!profile.allowedOperations().isEmpty() && !profile.allowedOperations().contains(action)) {
            return PolicyDecision.deny(NATIVE, "profile_denied: operation_not_in_allowlist: " + action, profile.profileId());
        }
        Object filesModified = request.context().get(PolicyRequest.CONTEXT_FILES_MODIFIED);
        if (filesModified instanceof Number
                && ((Number) filesModified).intValue() >= profile.maxFileModifications()) {
            return PolicyDecision.deny(NATIVE, "profile_denied: resource_limit_exceeded: max_file_modifications="
                    + profile.maxFileModifications(), profile.profileId());
        }
        return PolicyDecision.allow(NATIVE, "profile_permitted: " + action, profile.profileId());
    }
}
