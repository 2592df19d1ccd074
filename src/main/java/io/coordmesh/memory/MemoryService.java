package io.coordmesh.memory;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.storage.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Episodic memory shared across sessions. Storing the same event twice within the dedup window returns the first
 * memory. Recall ranks by relevance decayed exponentially with age.
 */
public final class MemoryService {
    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);
    private static final double DAY_MS = 24d * 60d * 60d * 1000d;

    public static final String CREATED = "created";
    public static final String DEDUPLICATED = "deduplicated";
    public static final String DEFAULT_EVENT_TYPE = "discovery";
    public static final Set<String> EVENT_TYPES = Set.of("error", "success", "decision", "discovery", "optimization");
    public static final Set<String> OUTCOMES = Set.of("positive", "negative", "neutral");

    public static final String REASON_MISSING_AGENT = "missing_agent_id";
    public static final String REASON_SUMMARY_REQUIRED = "summary_required";
    public static final String REASON_INVALID_EVENT_TYPE = "invalid_event_type";
    public static final String REASON_INVALID_OUTCOME = "invalid_outcome";
    public static final String REASON_INVALID_RELEVANCE = "invalid_relevance";

    private final MemoryStore store;
    private final Clock clock;

    public MemoryService(MemoryStore store) {
        this(store, Clock.systemUTC());
    }

    public MemoryService(MemoryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public RememberOutcome remember(RememberRequest request) {
        String reason = validate(request);
        if (reason != null) {
            return new RememberOutcome(false, null, null, reason);
        }
        String eventType = eventTypeOf(request.eventType());
        long nowMs = clock.millis();
        MemoryStore.StoreResult result = store.store(new MemoryStore.MemoryRow(
                "mem_" + UUID.randomUUID(),
                request.agentId().trim(),
                request.sessionId() == null || request.sessionId().isBlank() ? null : request.sessionId().trim(),
                eventType,
                request.summary().trim(),
                request.details() == null ? Map.of() : request.details(),
                request.outcome() == null ? null : request.outcome().trim().toLowerCase(Locale.ROOT),
                request.lessons() == null ? List.of() : request.lessons(),
                request.tags() == null ? List.of() : request.tags(),
                request.relevance() == null ? 1.0d : request.relevance(),
                nowMs
        ), nowMs - CoordMeshConfig.MEMORY_DEDUP_WINDOW_MS);
        String action = result.created() ? CREATED : DEDUPLICATED;
        log.debug("Memory {}: id={} agent={} type={}", action, result.memoryId(), request.agentId(), eventType);
        return new RememberOutcome(true, result.memoryId(), action, null);
    }

    /**
     * Highest decayed relevance first, newer first on ties. The minimum relevance applies to the stored score.
     */
    public List<RecalledMemory> recall(RecallQuery query) {
        long nowMs = clock.millis();
        int limit = query.limit() == null
                ? CoordMeshConfig.DEFAULT_RECALL_LIMIT
                : Math.min(CoordMeshConfig.MAX_RECALL_LIMIT, Math.max(1, query.limit()));
        String eventType = query.eventType() == null || query.eventType().isBlank()
                ? null
                : query.eventType().trim().toLowerCase(Locale.ROOT);
        double minRelevance = query.minRelevance() == null ? 0.0d : query.minRelevance();
        List<RecalledMemory> ranked = new ArrayList<>();
        for (MemoryStore.MemoryRow row : store.find(query.agentId(), eventType, query.tags(), minRelevance)) {
            ranked.add(new RecalledMemory(row, decayed(row.relevanceScore(), row.createdAtMs(), nowMs)));
        }
        ranked.sort(Comparator.comparingDouble(RecalledMemory::decayedRelevance).reversed()
                .thenComparing(Comparator.comparingLong((RecalledMemory m) -> m.memory().createdAtMs()).reversed()));
        return ranked.size() <= limit ? ranked : List.copyOf(ranked.subList(0, limit));
    }

    static double decayed(double score, long createdAtMs, long nowMs) {
        double ageDays = Math.max(0L, nowMs - createdAtMs) / DAY_MS;
        return score * Math.exp(-CoordMeshConfig.MEMORY_DECAY_PER_DAY * ageDays);
    }

    private static String validate(RememberRequest request) {
        if (request.agentId() == null || request.agentId().isBlank()) {
            return REASON_MISSING_AGENT;
        }
        if (request.summary() == null || request.summary().isBlank()) {
            return REASON_SUMMARY_REQUIRED;
        }
        if (!EVENT_TYPES.contains(eventTypeOf(request.eventType()))) {
            return REASON_INVALID_EVENT_TYPE;
        }
        if (request.outcome() != null && !OUTCOMES.contains(request.outcome().trim().toLowerCase(Locale.ROOT))) {
            return REASON_INVALID_OUTCOME;
        }
        Double relevance = request.relevance();
        if (relevance != null && (relevance.isNaN() || relevance < 0.0d || relevance > 1.0d)) {
            return REASON_INVALID_RELEVANCE;
        }
        return null;
    }

    private static String eventTypeOf(String raw) {
        return raw == null || raw.isBlank() ? DEFAULT_EVENT_TYPE : raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @param relevance initial score in [0, 1]; null means 1.0
     */
    public record RememberRequest(
            String agentId,
            String sessionId,
            String eventType,
            String summary,
            Map<String, Object> details,
            String outcome,
            List<String> lessons,
            List<String> tags,
            Double relevance
    ) {
    }

    /**
     * @param action {@link #CREATED} or {@link #DEDUPLICATED} when stored
     */
    public record RememberOutcome(boolean stored, String memoryId, String action, String reason) {
    }

    public record RecallQuery(
            String agentId,
            List<String> tags,
            String eventType,
            Double minRelevance,
            Integer limit
    ) {
    }

    public record RecalledMemory(MemoryStore.MemoryRow memory, double decayedRelevance) {
    }
}
