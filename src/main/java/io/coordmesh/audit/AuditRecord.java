package io.coordmesh.audit;

import com.fasterxml.jackson.databind.JsonNode;

public record AuditRecord(
        String id,
        String agentId,
        String agentType,
        String operation,
        JsonNode parameters,
        JsonNode result,
        Long durationMs,
        Boolean success,
        String errorMessage,
        long createdAtMs
) {
}
