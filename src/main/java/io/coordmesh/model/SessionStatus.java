package io.coordmesh.model;

import java.util.Locale;

public enum SessionStatus {
    ACTIVE,
    IDLE,
    DISCONNECTED;

    public static SessionStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Session status must not be blank");
        }
        return SessionStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
