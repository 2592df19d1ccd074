package io.coordmesh.guardrail;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.model.GuardrailSeverity;
import io.coordmesh.security.SensitiveDataMasker;
import io.coordmesh.storage.GuardrailStore;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Deterministic destructive-operation detector. Patterns come from the store through a TTL cache; when the store
 * cannot be read the embedded baseline is used and the store is retried after a shorter interval.
 */
public final class GuardrailEngine {
    private static final Logger log = LoggerFactory.getLogger(GuardrailEngine.class);
    public static final String SOURCE_STORE = "store";
    public static final String SOURCE_BASELINE = "baseline";

    private final GuardrailStore store;
    private final Clock clock;
    private final Object loadLock;
    private volatile long cacheTtlMs;
    private volatile long fallbackRetryMs;
    private volatile PatternCache cache;

    public GuardrailEngine(GuardrailStore store) {
        this(store, Clock.systemUTC());
    }

    public GuardrailEngine(GuardrailStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.loadLock = new Object();
        this.cacheTtlMs = CoordMeshConfig.DEFAULT_GUARDRAIL_CACHE_TTL_MS;
        this.fallbackRetryMs = CoordMeshConfig.DEFAULT_GUARDRAIL_FALLBACK_TTL_MS;
        this.cache = null;
    }

    public void applySettings(long cacheTtlMs) {
        this.cacheTtlMs = Math.max(0L, cacheTtlMs);
        this.fallbackRetryMs = Math.min(CoordMeshConfig.DEFAULT_GUARDRAIL_FALLBACK_TTL_MS, this.cacheTtlMs);
    }

    public void invalidate() {
        cache = null;
    }

    public GuardrailVerdict check(String operationText, int trustLevel) {
        return check(new GuardrailRequest(operationText, trustLevel, List.of(), null, Map.of()));
    }

    public GuardrailVerdict check(GuardrailRequest request) {
        PatternCache patterns = patterns();
        String text = scanText(request);
        long nowMs = clock.millis();
        List<GuardrailVerdict.Violation> violations = new ArrayList<>();
        List<String> bypassed = new ArrayList<>();
        List<GuardrailStore.ViolationRecord> records = new ArrayList<>();
        boolean safe = true;
        for (GuardrailPattern pattern : patterns.patterns()) {
            Matcher m = pattern.compiled().matcher(text);
            if (!m.find()) {
                continue;
            }
            String matched = m.group();
            boolean clearedByTrust = request.trustLevel() >= pattern.minTrustToBypass();
            boolean blocked = !clearedByTrust && pattern.severity() == GuardrailSeverity.BLOCK;
            if (clearedByTrust) {
                bypassed.add(pattern.name());
            } else {
                violations.add(new GuardrailVerdict.Violation(
                        pattern.name(),
                        pattern.category(),
                        pattern.severity().wireName(),
                        truncate(matched, GuardrailStore.MAX_MATCHED_TEXT_CHARS),
                        blocked,
                        pattern.minTrustToBypass(),
                        pattern.description()
                ));
            }
            if (blocked) {
                safe = false;
            }
            records.add(new GuardrailStore.ViolationRecord(
                    request.agentId(),
                    pattern.name(),
                    pattern.category(),
                    pattern.severity().wireName(),
                    text,
                    matched,
                    blocked,
                    clearedByTrust,
                    request.trustLevel(),
                    Jsons.toCompactJson(SensitiveDataMasker.maskedMap(request.context())),
                    nowMs
            ));
        }
        persist(records);
        if (!safe) {
            log.info("Guardrail blocked operation for agent={} patterns={}", request.agentId(), violationNames(violations));
        }
        return new GuardrailVerdict(safe, violations, bypassed, patterns.source());
    }

    public List<GuardrailPattern> activePatterns() {
        return patterns().patterns();
    }

    public String activeSource() {
        return patterns().source();
    }

    private PatternCache patterns() {
        long nowMs = clock.millis();
        PatternCache current = cache;
        if (current != null && !current.expired(nowMs)) {
            return current;
        }
        synchronized (loadLock) {
            current = cache;
            if (current != null && !current.expired(nowMs)) {
                return current;
            }
            PatternCache loaded = load(nowMs);
            cache = loaded;
            return loaded;
        }
    }

    private PatternCache load(long nowMs) {
        List<GuardrailStore.PatternRow> rows;
        try {
            rows = store.listPatterns(true);
        } catch (RuntimeException e) {
            log.warn("Guardrail pattern store unavailable, using embedded baseline: {}", e.getMessage());
            return new PatternCache(GuardrailBaseline.patterns(), SOURCE_BASELINE, nowMs + fallbackRetryMs);
        }
        List<GuardrailPattern> compiled = new ArrayList<>(rows.size());
        for (GuardrailStore.PatternRow row : rows) {
            try {
                compiled.add(GuardrailPattern.of(
                        row.name(),
                        row.category(),
                        row.regex(),
                        GuardrailSeverity.fromString(row.severity()),
                        row.minTrustToBypass(),
                        row.description()
                ));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping guardrail pattern {}: {}", row.name(), e.getMessage());
            }
        }
        log.debug("Loaded {} guardrail patterns from store", compiled.size());
        return new PatternCache(List.copyOf(compiled), SOURCE_STORE, nowMs + cacheTtlMs);
    }

    private void persist(List<GuardrailStore.ViolationRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        try {
            store.recordViolations(records);
        } catch (RuntimeException e) {
            log.warn("Failed to record {} guardrail matches: {}", records.size(), e.getMessage());
        }
    }

    private static String scanText(GuardrailRequest request) {
        StringBuilder sb = new StringBuilder(request.operationText() == null ? "" : request.operationText());
        for (String path : request.filePaths()) {
            if (path != null && !path.isBlank()) {
                sb.append('\n').append(path);
            }
        }
        return sb.toString();
    }

    private static List<String> violationNames(List<GuardrailVerdict.Violation> violations) {
        List<String> out = new ArrayList<>(violations.size());
        for (GuardrailVerdict.Violation v : violations) {
            out.add(v.patternName());
        }
        return out;
    }

    private static String truncate(String value, int maxChars) {
        return value.length() <= maxChars ? value : value.substring(0, maxChars);
    }

    public record GuardrailRequest(
            String operationText,
            int trustLevel,
            List<String> filePaths,
            String agentId,
            Map<String, Object> context
    ) {
        public GuardrailRequest {
            filePaths = filePaths == null ? List.of() : List.copyOf(filePaths);
            context = context == null ? Map.of() : context;
        }
    }

    private record PatternCache(List<GuardrailPattern> patterns, String source, long expiresAtMs) {
        boolean expired(long nowMs) {
            return nowMs >= expiresAtMs;
        }
    }
}
