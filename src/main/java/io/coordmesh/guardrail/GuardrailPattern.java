package io.coordmesh.guardrail;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.coordmesh.model.GuardrailSeverity;

import java.util.regex.Pattern;

/**
 * A compiled destructive-operation pattern.
 *
 * @param minTrustToBypass callers at or above this trust level pass the pattern without a violation
 */
public record GuardrailPattern(
        String name,
        String category,
        String regex,
        GuardrailSeverity severity,
        int minTrustToBypass,
        String description,
        @JsonIgnore Pattern compiled
) {
    public static GuardrailPattern of(String name, String category, String regex, GuardrailSeverity severity,
                                      int minTrustToBypass, String description) {
        return new GuardrailPattern(name, category, regex, severity, minTrustToBypass, description,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }
}
