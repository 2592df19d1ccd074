package io.coordmesh.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.coordmesh.util.WildcardPatterns;

import java.util.List;
import java.util.Locale;

/**
 * One declarative rule. Missing trust bounds and a missing resource pattern match everything.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyRule(
        String id,
        String name,
        String effect,
        List<String> actions,
        String resourcePattern,
        Integer minTrust,
        Integer maxTrust,
        Integer priority,
        String description,
        Boolean enabled
) {
    public static final String PERMIT = "permit";
    public static final String FORBID = "forbid";
    public static final int DEFAULT_PRIORITY = 50;

    public PolicyRule {
        effect = effect == null ? PERMIT : effect.trim().toLowerCase(Locale.ROOT);
        if (!PERMIT.equals(effect) && !FORBID.equals(effect)) {
            throw new IllegalArgumentException("Policy rule effect must be permit or forbid: " + effect);
        }
        actions = actions == null || actions.isEmpty() ? List.of("*") : List.copyOf(actions);
        priority = priority == null ? DEFAULT_PRIORITY : priority;
        enabled = enabled == null ? Boolean.TRUE : enabled;
        if (id == null || id.isBlank()) {
            id = name;
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Policy rule needs an id or a name");
        }
        if (name == null) {
            name = id;
        }
    }

    public boolean forbid() {
        return FORBID.equals(effect);
    }

    public boolean matches(String action, String resource, int trustLevel) {
        if (!enabled) {
            return false;
        }
        if (!actions.contains("*") && !actions.contains(action)) {
            return false;
        }
        if (minTrust != null && trustLevel < minTrust) {
            return false;
        }
        if (maxTrust != null && trustLevel > maxTrust) {
            return false;
        }
        return resourcePattern == null || resourcePattern.isBlank()
                || WildcardPatterns.matches(resourcePattern, resource);
    }
}
