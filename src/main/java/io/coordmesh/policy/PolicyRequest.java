package io.coordmesh.policy;

import java.util.Map;

public record PolicyRequest(Principal principal, String action, String resource, Map<String, Object> context) {
    public static final String CONTEXT_TRUST_LEVEL = "trust_level";
    public static final String CONTEXT_FILES_MODIFIED = "files_modified";

    public PolicyRequest {
        context = context == null ? Map.of() : context;
    }

    /**
     * An explicit {@code trust_level} in the context overrides the profile's.
     */
    public int effectiveTrustLevel() {
        Object raw = context.get(CONTEXT_TRUST_LEVEL);
        if (raw instanceof Number) {
            return ((Number) raw).intValue();
        }
        if (raw instanceof String && !((String) raw).isBlank()) {
            try {
                return Integer.parseInt(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("trust_level must be an integer: " + raw, e);
            }
        }
        return principal.trustLevel();
    }
}
