package io.coordmesh.audit;

import java.util.Map;

/**
 * An operation to be appended to the audit trail. Parameters and result are masked before storage.
 */
public record AuditEntry(
        String agentId,
        String agentType,
        String operation,
        Map<String, Object> parameters,
        Map<String, Object> result,
        Long durationMs,
        Boolean success,
        String errorMessage
) {
    public AuditEntry {
        parameters = parameters == null ? Map.of() : parameters;
        result = result == null ? Map.of() : result;
    }

    public static AuditEntry of(String agentId, String operation, Map<String, Object> parameters,
                                Map<String, Object> result, boolean success) {
        return new AuditEntry(agentId, null, operation, parameters, result, null, success, null);
    }
}
