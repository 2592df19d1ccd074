package io.coordmesh.policy;

/**
 * Thrown when policy enforcement is on and the active engine denies an operation.
 */
public final class PolicyDeniedException extends RuntimeException {
    private final String action;
    private final PolicyDecision decision;

    public PolicyDeniedException(String action, PolicyDecision decision) {
        super("Policy denied " + action + ": " + decision.reason());
        this.action = action;
        this.decision = decision;
    }

    public String action() {
        return action;
    }

    public PolicyDecision decision() {
        return decision;
    }
}
