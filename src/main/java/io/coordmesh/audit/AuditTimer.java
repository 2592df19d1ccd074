package io.coordmesh.audit;

import java.time.Clock;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Times one operation and appends its audit entry to the sink on close. The outcome recorded is the last one reported.
 */
public final class AuditTimer implements AutoCloseable {
    private final Consumer<AuditEntry> sink;
    private final Clock clock;
    private final String agentId;
    private final String agentType;
    private final String operation;
    private final Map<String, Object> parameters;
    private final long startedAtMs;
    private Map<String, Object> result;
    private Boolean success;
    private String errorMessage;
    private boolean closed;

    public AuditTimer(Consumer<AuditEntry> sink, Clock clock, String agentId, String agentType, String operation,
                      Map<String, Object> parameters) {
        this.sink = sink;
        this.clock = clock;
        this.agentId = agentId;
        this.agentType = agentType;
        this.operation = operation;
        this.parameters = parameters;
        this.startedAtMs = clock.millis();
        this.result = Map.of();
    }

    public void succeed(Map<String, Object> result) {
        this.result = result;
        this.success = Boolean.TRUE;
        this.errorMessage = null;
    }

    public void fail(String errorMessage, Map<String, Object> result) {
        this.result = result;
        this.success = Boolean.FALSE;
        this.errorMessage = errorMessage;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        long duration = Math.max(0L, clock.millis() - startedAtMs);
        sink.accept(new AuditEntry(agentId, agentType, operation, parameters, result, duration, success, errorMessage));
    }
}
