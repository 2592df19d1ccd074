package io.coordmesh.policy;

/**
 * @param matchedPolicyId the rule or network policy that decided, null for built-in decisions
 * @param engine          name of the engine that produced the decision
 */
public record PolicyDecision(boolean allowed, String reason, String matchedPolicyId, String engine) {
    public static PolicyDecision allow(String engine, String reason) {
        return new PolicyDecision(true, reason, null, engine);
    }

    public static PolicyDecision allow(String engine, String reason, String matchedPolicyId) {
        return new PolicyDecision(true, reason, matchedPolicyId, engine);
    }

    public static PolicyDecision deny(String engine, String reason) {
        return new PolicyDecision(false, reason, null, engine);
    }

    public static PolicyDecision deny(String engine, String reason, String matchedPolicyId) {
        return new PolicyDecision(false, reason, matchedPolicyId, engine);
    }
}
