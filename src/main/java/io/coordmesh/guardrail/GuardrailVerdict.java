package io.coordmesh.guardrail;

import java.util.List;

/**
 * @param safe       false when any violation carries block severity
 * @param violations matches the caller's trust level did not clear
 * @param bypassed   names of patterns that matched but were cleared by trust level
 * @param source     {@code store} or {@code baseline}
 */
public record GuardrailVerdict(
        boolean safe,
        List<Violation> violations,
        List<String> bypassed,
        String source
) {
    public GuardrailVerdict {
        violations = violations == null ? List.of() : List.copyOf(violations);
        bypassed = bypassed == null ? List.of() : List.copyOf(bypassed);
    }

    public record Violation(
            String patternName,
            String category,
            String severity,
            String matchedText,
            boolean blocked,
            int minTrustToBypass,
            String description
    ) {
    }
}
