package io.coordmesh.model;

import java.util.Locale;

public enum GuardrailSeverity {
    BLOCK,
    WARN,
    LOG;

    public static GuardrailSeverity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLOCK;
        }
        for (GuardrailSeverity value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown guardrail severity: " + raw);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
