package io.coordmesh.model;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    CLAIMED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status must not be blank");
        }
        return TaskStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
