package io.coordmesh.policy;

import io.coordmesh.model.AgentProfile;

/**
 * The caller as seen by the authorization layer. Identity is asserted, never verified.
 */
public record Principal(String agentId, String agentType, int trustLevel, AgentProfile profile) {
}
