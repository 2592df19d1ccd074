package io.coordmesh.policy;

import java.util.Set;

public final class ActionCatalog {
    public static final String NETWORK_ACCESS = "network_access";

    public static final Set<String> READ_ACTIONS = Set.of(
            "check_locks", "get_work", "recall", "discover_agents", "read_handoff", "query_audit", "check_guardrails"
    );
    public static final Set<String> WRITE_ACTIONS = Set.of(
            "acquire_lock", "release_lock", "complete_work", "submit_work", "remember", "write_handoff"
    );
    public static final Set<String> ADMIN_ACTIONS = Set.of(
            "force_push", "delete_branch", "cleanup_agents"
    );

    public static final int WRITE_MIN_TRUST = 2;
    public static final int ADMIN_MIN_TRUST = 3;

    private ActionCatalog() {
    }
}
