package io.coordmesh.liveness;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.lock.LockManager;
import io.coordmesh.model.SessionStatus;
import io.coordmesh.storage.SessionStore;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Session registry with heartbeat-based liveness. Reaping disconnects stale sessions and releases the locks of
 * agents left without any live session.
 */
public final class LivenessMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);
    public static final String REASON_SESSION_NOT_FOUND = "session_not_found";
    public static final String REASON_MISSING_AGENT = "missing_agent_id";
    public static final String REASON_INVALID_STATUS = "invalid_status";

    private final SessionStore sessions;
    private final LockManager locks;
    private final Clock clock;
    private final Object reaperLock;
    private volatile long staleThresholdMs;
    private ScheduledExecutorService reaper;

    public LivenessMonitor(SessionStore sessions, LockManager locks) {
        this(sessions, locks, Clock.systemUTC());
    }

    public LivenessMonitor(SessionStore sessions, LockManager locks, Clock clock) {
        this.sessions = sessions;
        this.locks = locks;
        this.clock = clock;
        this.reaperLock = new Object();
        this.staleThresholdMs = CoordMeshConfig.DEFAULT_STALE_SESSION_THRESHOLD_MS;
    }

    public void applySettings(long staleThresholdMs) {
        this.staleThresholdMs = Math.max(1L, staleThresholdMs);
    }

    public RegisterOutcome register(RegisterRequest request) {
        if (request.agentId() == null || request.agentId().isBlank()) {
            return new RegisterOutcome(false, null, REASON_MISSING_AGENT);
        }
        String agentId = request.agentId().trim();
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? agentId + "-" + UUID.randomUUID()
                : request.sessionId().trim();
        SessionStore.SessionRow row = sessions.register(new SessionStore.SessionRegistration(
                sessionId,
                agentId,
                request.agentType(),
                request.capabilities(),
                request.currentTask(),
                Jsons.toCompactJson(request.metadata() == null ? Map.of() : request.metadata()),
                clock.millis()
        ));
        log.info("Session registered: session={} agent={} type={}", sessionId, agentId, request.agentType());
        return new RegisterOutcome(true, row, null);
    }

    public RegisterOutcome heartbeat(String sessionId, String currentTask) {
        Optional<SessionStore.SessionRow> row = sessions.heartbeat(sessionId, currentTask, clock.millis());
        return row.map(r -> new RegisterOutcome(true, r, null))
                .orElseGet(() -> new RegisterOutcome(false, null, REASON_SESSION_NOT_FOUND));
    }

    /**
     * Agents may move themselves between active and idle; disconnection only happens through reaping.
     */
    public RegisterOutcome setStatus(String sessionId, SessionStatus status) {
        if (status == null || status == SessionStatus.DISCONNECTED) {
            return new RegisterOutcome(false, null, REASON_INVALID_STATUS);
        }
        Optional<SessionStore.SessionRow> row = sessions.setStatus(sessionId, status, clock.millis());
        return row.map(r -> new RegisterOutcome(true, r, null))
                .orElseGet(() -> new RegisterOutcome(false, null, REASON_SESSION_NOT_FOUND));
    }

    public Optional<SessionStore.SessionRow> getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    public List<SessionStore.SessionRow> discover(String capability, SessionStatus status, int limit) {
        return sessions.discover(capability, status, limit);
    }

    public ReapOutcome reap() {
        return reap(staleThresholdMs);
    }

    /**
     * Disconnects sessions whose heartbeat is older than the threshold, then releases the locks of every agent left
     * without a live session. Agents whose cleanup failed on an earlier pass are picked up again here.
     */
    public ReapOutcome reap(long thresholdMs) {
        long nowMs = clock.millis();
        long threshold = Math.max(0L, thresholdMs);
        List<SessionStore.StaleAgent> stale = sessions.disconnectStale(nowMs - threshold, nowMs);
        Set<String> candidates = new LinkedHashSet<>();
        for (SessionStore.StaleAgent agent : stale) {
            if (!agent.hasLiveSession()) {
                candidates.add(agent.agentId());
            }
        }
        candidates.addAll(sessions.orphanedLockHolders());
        List<String> cleaned = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int released = 0;
        for (String agentId : candidates) {
            try {
                released += locks.cleanupForAgent(agentId);
                cleaned.add(agentId);
            } catch (RuntimeException e) {
                log.warn("Lock cleanup failed for {}; retrying on next reap", agentId, e);
                failed.add(agentId);
            }
        }
        if (!stale.isEmpty() || released > 0 || !failed.isEmpty()) {
            log.info("Reaped stale sessions: agents_disconnected={} agents_cleaned={} locks_released={} failed={}",
                    stale.size(), cleaned.size(), released, failed.size());
        }
        return new ReapOutcome(cleaned.size(), released, cleaned, failed, threshold);
    }

    /**
     * Starts a background reaper; a non-positive interval leaves it stopped. Restarting replaces the schedule.
     */
    public void startReaper(long intervalMs, Consumer<ReapOutcome> listener) {
        synchronized (reaperLock) {
            stopReaper();
            if (intervalMs <= 0L) {
                return;
            }
            reaper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "coordmesh-reaper");
                t.setDaemon(true);
                return t;
            });
            reaper.scheduleWithFixedDelay(() -> {
                try {
                    ReapOutcome outcome = reap();
                    if (listener != null) {
                        listener.accept(outcome);
                    }
                } catch (RuntimeException e) {
                    log.warn("Background reap failed: {}", e.getMessage());
                }
            }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Background reaper started: interval_ms={}", intervalMs);
        }
    }

    public boolean reaperRunning() {
        synchronized (reaperLock) {
            return reaper != null && !reaper.isShutdown();
        }
    }

    @Override
    public void close() {
        synchronized (reaperLock) {
            stopReaper();
        }
    }

    private void stopReaper() {
        if (reaper == null) {
            return;
        }
        reaper.shutdownNow();
        try {
            reaper.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        reaper = null;
    }

    public record RegisterRequest(
            String agentId,
            String agentType,
            String sessionId,
            List<String> capabilities,
            String currentTask,
            Map<String, Object> metadata
    ) {
    }

    public record RegisterOutcome(boolean ok, SessionStore.SessionRow session, String reason) {
    }

    /**
     * @param failedAgents agents whose locks could not be released this pass
     */
    public record ReapOutcome(
            int agentsCleaned,
            int locksReleased,
            List<String> cleanedAgents,
            List<String> failedAgents,
            long thresholdMs
    ) {
    }
}
