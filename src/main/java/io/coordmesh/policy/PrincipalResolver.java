package io.coordmesh.policy;

import io.coordmesh.model.AgentProfile;
import io.coordmesh.storage.ProfileStore;
import io.coordmesh.storage.SessionStore;

/**
 * Resolves an agent id to its profile and trust level. The agent type comes from the caller or, when absent,
 * from the agent's most recent session.
 */
public final class PrincipalResolver {
    private final ProfileStore profileStore;
    private final SessionStore sessionStore;

    public PrincipalResolver(ProfileStore profileStore, SessionStore sessionStore) {
        this.profileStore = profileStore;
        this.sessionStore = sessionStore;
    }

    public Principal resolve(String agentId, String agentType) {
        String type = agentType;
        if ((type == null || type.isBlank()) && agentId != null && !agentId.isBlank()) {
            type = sessionStore.findLatestForAgent(agentId)
                    .map(SessionStore.SessionRow::agentType)
                    .filter(t -> !t.isBlank())
                    .orElse(null);
        }
        AgentProfile profile = profileStore.resolve(agentId, type);
        return new Principal(agentId, type, profile.trustLevel(), profile);
    }
}
