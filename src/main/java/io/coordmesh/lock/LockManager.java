package io.coordmesh.lock;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.storage.LockStore;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Leased mutual exclusion over arbitrary resource keys. Expiry is lazy: expired leases are purged on acquire and are
 * invisible to reads.
 */
public final class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    public static final String GRANTED = "granted";
    public static final String REFRESHED = "refreshed";
    public static final String DENIED = "denied";
    public static final String REASON_LOCKED_BY_OTHER = "locked_by_other";
    public static final String REASON_NOT_OWNER = "lock_not_found_or_not_owner";
    public static final String REASON_NOT_HELD = "lock_not_held";
    public static final String REASON_INVALID_TTL = "invalid_ttl";
    public static final String REASON_MISSING_HOLDER = "missing_holder";
    public static final String REASON_MISSING_RESOURCE = "missing_resource_key";

    private final LockStore store;
    private final Clock clock;
    private volatile long defaultTtlMs;

    public LockManager(LockStore store) {
        this(store, Clock.systemUTC());
    }

    public LockManager(LockStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.defaultTtlMs = CoordMeshConfig.DEFAULT_LOCK_TTL_MS;
    }

    public void applySettings(long defaultTtlMs) {
        this.defaultTtlMs = Math.min(CoordMeshConfig.MAX_LOCK_TTL_MS, Math.max(1L, defaultTtlMs));
    }

    public long defaultTtlMs() {
        return defaultTtlMs;
    }

    public AcquireOutcome acquire(AcquireRequest request) {
        String invalid = validate(request.resourceKey(), request.holderId(), request.ttlMs());
        if (invalid != null) {
            return AcquireOutcome.rejected(request.resourceKey(), invalid);
        }
        long ttl = request.ttlMs() == null ? defaultTtlMs : request.ttlMs();
        LockStore.LockGrant grant = store.acquire(new LockStore.LockRequest(
                request.resourceKey().trim(),
                request.holderId().trim(),
                request.holderType(),
                request.sessionId(),
                request.reason(),
                Jsons.toCompactJson(request.metadata() == null ? Map.of() : request.metadata()),
                ttl
        ), clock.millis());
        if (grant.expiredPurged() > 0) {
            log.debug("Purged {} expired locks", grant.expiredPurged());
        }
        switch (grant.outcome()) {
            case GRANTED:
                log.info("Lock acquired: key={} holder={} expires={}",
                        grant.lock().resourceKey(), grant.lock().holderId(), grant.lock().expiresAtMs());
                return new AcquireOutcome(true, GRANTED, grant.lock().resourceKey(), null, grant.lock());
            case REFRESHED:
                log.debug("Lock refreshed: key={} holder={} expires={}",
                        grant.lock().resourceKey(), grant.lock().holderId(), grant.lock().expiresAtMs());
                return new AcquireOutcome(true, REFRESHED, grant.lock().resourceKey(), null, grant.lock());
            default:
                log.debug("Lock denied: key={} requester={} holder={}",
                        grant.lock().resourceKey(), request.holderId(), grant.lock().holderId());
                return new AcquireOutcome(false, DENIED, grant.lock().resourceKey(), REASON_LOCKED_BY_OTHER, grant.lock());
        }
    }

    /**
     * Pushes the expiry of a lock the caller already holds. Never creates a lock.
     */
    public AcquireOutcome extend(String resourceKey, String holderId, Long ttlMs) {
        String invalid = validate(resourceKey, holderId, ttlMs);
        if (invalid != null) {
            return AcquireOutcome.rejected(resourceKey, invalid);
        }
        long ttl = ttlMs == null ? defaultTtlMs : ttlMs;
        Optional<LockStore.LockRow> row = store.extend(resourceKey.trim(), holderId.trim(), ttl, clock.millis());
        if (row.isEmpty()) {
            return new AcquireOutcome(false, DENIED, resourceKey, REASON_NOT_HELD,
                    store.findLive(resourceKey.trim(), clock.millis()).orElse(null));
        }
        return new AcquireOutcome(true, REFRESHED, resourceKey, null, row.get());
    }

    public ReleaseOutcome release(String resourceKey, String holderId) {
        if (resourceKey == null || resourceKey.isBlank()) {
            return new ReleaseOutcome(false, resourceKey, REASON_MISSING_RESOURCE);
        }
        if (holderId == null || holderId.isBlank()) {
            return new ReleaseOutcome(false, resourceKey, REASON_MISSING_HOLDER);
        }
        boolean released = store.release(resourceKey.trim(), holderId.trim());
        if (!released) {
            return new ReleaseOutcome(false, resourceKey, REASON_NOT_OWNER);
        }
        log.info("Lock released: key={} holder={}", resourceKey, holderId);
        return new ReleaseOutcome(true, resourceKey, null);
    }

    public List<LockStore.LockRow> checkLocks(List<String> resourceKeys, String holderId) {
        return store.listLive(resourceKeys, holderId, clock.millis());
    }

    public Optional<LockStore.LockRow> isLocked(String resourceKey) {
        return store.findLive(resourceKey, clock.millis());
    }

    /**
     * Releases every lock held by an agent, expired or not.
     */
    public int cleanupForAgent(String holderId) {
        int released = store.releaseAllHeldBy(holderId);
        if (released > 0) {
            log.info("Released {} locks held by {}", released, holderId);
        }
        return released;
    }

    private static String validate(String resourceKey, String holderId, Long ttlMs) {
        if (resourceKey == null || resourceKey.isBlank()) {
            return REASON_MISSING_RESOURCE;
        }
        if (holderId == null || holderId.isBlank()) {
            return REASON_MISSING_HOLDER;
        }
        if (ttlMs != null && (ttlMs <= 0L || ttlMs > CoordMeshConfig.MAX_LOCK_TTL_MS)) {
            return REASON_INVALID_TTL;
        }
        return null;
    }

    public record AcquireRequest(
            String resourceKey,
            String holderId,
            String holderType,
            String sessionId,
            String reason,
            Map<String, Object> metadata,
            Long ttlMs
    ) {
        public static AcquireRequest of(String resourceKey, String holderId, Long ttlMs) {
            return new AcquireRequest(resourceKey, holderId, null, null, null, Map.of(), ttlMs);
        }
    }

    /**
     * @param outcome {@code granted}, {@code refreshed} or {@code denied}
     * @param lock    the caller's lock when acquired; the current holder's lock when denied by another holder
     */
    public record AcquireOutcome(
            boolean acquired,
            String outcome,
            String resourceKey,
            String reason,
            LockStore.LockRow lock
    ) {
        static AcquireOutcome rejected(String resourceKey, String reason) {
            return new AcquireOutcome(false, DENIED, resourceKey, reason, null);
        }
    }

    public record ReleaseOutcome(boolean released, String resourceKey, String reason) {
    }
}
