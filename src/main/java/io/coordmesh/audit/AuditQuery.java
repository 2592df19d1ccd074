package io.coordmesh.audit;

import io.coordmesh.config.CoordMeshConfig;

/**
 * Filters for {@link AuditTrail#query(AuditQuery)}; null fields are not applied.
 */
public record AuditQuery(String agentId, String operation, Long sinceMs, Long untilMs, Boolean success, int limit) {
    public AuditQuery {
        if (limit <= 0) {
            limit = CoordMeshConfig.DEFAULT_AUDIT_QUERY_LIMIT;
        }
    }

    public static AuditQuery recent(int limit) {
        return new AuditQuery(null, null, null, null, null, limit);
    }

    public static AuditQuery forAgent(String agentId, int limit) {
        return new AuditQuery(agentId, null, null, null, null, limit);
    }

    public static AuditQuery forOperation(String operation, int limit) {
        return new AuditQuery(null, operation, null, null, null, limit);
    }
}
