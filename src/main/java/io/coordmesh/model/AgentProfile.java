package io.coordmesh.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trust and limits attached to an agent, either through an explicit assignment or as the default for its type.
 *
 * @param source {@code assignment}, {@code default} or {@code synthetic} when no stored profile matched
 */
public record AgentProfile(
        String profileId,
        String name,
        String agentType,
        int trustLevel,
        List<String> allowedOperations,
        List<String> blockedOperations,
        int maxFileModifications,
        int maxExecutionTimeSeconds,
        int maxApiCallsPerHour,
        Map<String, Object> networkOverrides,
        boolean enabled,
        String source
) {
    public static final int DEFAULT_MAX_FILE_MODIFICATIONS = 50;
    public static final int DEFAULT_MAX_EXECUTION_TIME_SECONDS = 300;
    public static final int DEFAULT_MAX_API_CALLS_PER_HOUR = 1_000;
    public static final String SOURCE_SYNTHETIC = "synthetic";

    public AgentProfile {
        allowedOperations = allowedOperations == null ? List.of() : List.copyOf(allowedOperations);
        blockedOperations = blockedOperations == null ? List.of() : List.copyOf(blockedOperations);
        networkOverrides = networkOverrides == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(networkOverrides));
    }

    public static AgentProfile synthetic(String agentType, int trustLevel) {
        return new AgentProfile(
                null,
                "default",
                agentType,
                trustLevel,
                List.of(),
                List.of(),
                DEFAULT_MAX_FILE_MODIFICATIONS,
                DEFAULT_MAX_EXECUTION_TIME_SECONDS,
                DEFAULT_MAX_API_CALLS_PER_HOUR,
                Map.of(),
                true,
                SOURCE_SYNTHETIC
        );
    }

    public boolean synthetic() {
        return SOURCE_SYNTHETIC.equals(source);
    }
}
