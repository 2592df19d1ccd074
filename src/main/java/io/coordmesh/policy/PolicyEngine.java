package io.coordmesh.policy;

/**
 * Trust-based authorization. Implementations must agree on {@code allowed} for the seeded default rule set.
 */
public interface PolicyEngine {
    String NATIVE = "native";
    String DECLARATIVE = "declarative";

    String name();

    PolicyDecision evaluate(PolicyRequest request);

    /**
     * Drops cached rules so the next evaluation reloads them.
     */
    default void invalidate() {
    }
}
