package io.coordmesh.handoff;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.storage.HandoffStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Session continuity: an agent writes a structured handoff when it stops, the next session reads the latest ones.
 * Handoffs are never edited once written.
 */
public final class HandoffService {
    private static final Logger log = LoggerFactory.getLogger(HandoffService.class);
    public static final String REASON_MISSING_AGENT = "missing_agent_id";
    public static final String REASON_SUMMARY_REQUIRED = "summary_required";

    private final HandoffStore store;
    private final Clock clock;

    public HandoffService(HandoffStore store) {
        this(store, Clock.systemUTC());
    }

    public HandoffService(HandoffStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public WriteOutcome write(WriteRequest request) {
        if (request.agentId() == null || request.agentId().isBlank()) {
            return new WriteOutcome(false, null, REASON_MISSING_AGENT);
        }
        if (request.summary() == null || request.summary().isBlank()) {
            return new WriteOutcome(false, null, REASON_SUMMARY_REQUIRED);
        }
        HandoffStore.HandoffRow row = store.insert(new HandoffStore.HandoffRow(
                "hnd_" + UUID.randomUUID(),
                request.agentId().trim(),
                request.sessionId() == null || request.sessionId().isBlank() ? null : request.sessionId().trim(),
                request.summary().trim(),
                items(request.completedWork()),
                items(request.inProgress()),
                items(request.decisions()),
                items(request.nextSteps()),
                items(request.relevantFiles()),
                clock.millis()
        ));
        log.info("Handoff written: id={} agent={} next_steps={}", row.handoffId(), row.agentId(), row.nextSteps().size());
        return new WriteOutcome(true, row, null);
    }

    /**
     * @param agentId null reads the latest handoffs of every agent
     * @param limit   null reads only the latest one
     */
    public List<HandoffStore.HandoffRow> read(String agentId, Integer limit) {
        int safeLimit = limit == null
                ? CoordMeshConfig.DEFAULT_HANDOFF_READ_LIMIT
                : Math.min(CoordMeshConfig.MAX_HANDOFF_READ_LIMIT, Math.max(1, limit));
        return store.recent(agentId, safeLimit);
    }

    private static List<String> items(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String item : raw) {
            if (item != null && !item.isBlank()) {
                out.add(item.trim());
            }
        }
        return List.copyOf(out);
    }

    public record WriteRequest(
            String agentId,
            String sessionId,
            String summary,
            List<String> completedWork,
            List<String> inProgress,
            List<String> decisions,
            List<String> nextSteps,
            List<String> relevantFiles
    ) {
    }

    public record WriteOutcome(boolean written, HandoffStore.HandoffRow handoff, String reason) {
    }
}
