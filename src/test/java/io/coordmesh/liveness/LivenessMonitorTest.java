package io.coordmesh.liveness;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.lock.LockManager;
import io.coordmesh.model.SessionStatus;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.LockStore;
import io.coordmesh.storage.SessionStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class LivenessMonitorTest {
    private static final long MINUTE_MS = 60_000L;
    private static final long DAY_MS = 24L * 60L * MINUTE_MS;

    @Test
    void reapReleasesLocksOnlyForAgentsWithoutLiveSessions() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-liveness-reap-");
        try {
            Database db = newDatabase(root);
            SteppingClock clock = new SteppingClock(Instant.parse("2026-10-16T09:00:00Z"));
            LockManager locks = new LockManager(new LockStore(db), clock);
            SessionStore sessions = new SessionStore(db);
            LivenessMonitor monitor = new LivenessMonitor(sessions, locks, clock);

            monitor.register(register("agent-a", "a1", List.of("python")));
            monitor.register(register("agent-b", "b1", List.of("java")));
            monitor.register(register("agent-c", "c1", List.of()));
            monitor.register(register("agent-c", "c2", List.of()));
            locks.acquire(LockManager.AcquireRequest.of("x", "agent-a", DAY_MS));
            locks.acquire(LockManager.AcquireRequest.of("y", "agent-b", DAY_MS));
            locks.acquire(LockManager.AcquireRequest.of("z", "agent-c", DAY_MS));

            clock.advance(10 * MINUTE_MS);
            Assertions.assertTrue(monitor.heartbeat("b1", "reviewing").ok());
            Assertions.assertTrue(monitor.heartbeat("c2", null).ok());
            clock.advance(6 * MINUTE_MS);

            LivenessMonitor.ReapOutcome outcome = monitor.reap(15 * MINUTE_MS);

            Assertions.assertEquals(List.of("agent-a"), outcome.cleanedAgents());
            Assertions.assertEquals(1, outcome.agentsCleaned());
            Assertions.assertEquals(1, outcome.locksReleased());
            Assertions.assertTrue(locks.isLocked("x").isEmpty());
            Assertions.assertEquals("agent-b", locks.isLocked("y").orElseThrow().holderId());
            Assertions.assertEquals("agent-c", locks.isLocked("z").orElseThrow().holderId());
            Assertions.assertEquals(SessionStatus.DISCONNECTED, monitor.getSession("a1").orElseThrow().status());
            Assertions.assertEquals(SessionStatus.DISCONNECTED, monitor.getSession("c1").orElseThrow().status());
            Assertions.assertEquals(SessionStatus.ACTIVE, monitor.getSession("c2").orElseThrow().status());
            Assertions.assertEquals("reviewing", monitor.getSession("b1").orElseThrow().currentTask());

            Assertions.assertEquals(0, monitor.reap(15 * MINUTE_MS).agentsCleaned());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedLockCleanupIsRetriedOnTheNextReap() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-liveness-retry-");
        try {
            Database db = newDatabase(root);
            SteppingClock clock = new SteppingClock(Instant.parse("2026-10-16T09:00:00Z"));
            LockManager locks = new LockManager(new LockStore(db), clock);
            LivenessMonitor monitor = new LivenessMonitor(new SessionStore(db), locks, clock);

            monitor.register(register("agent-x", "x1", List.of()));
            monitor.register(register("agent-y", "y1", List.of()));
            locks.acquire(LockManager.AcquireRequest.of("stuck", "agent-x", DAY_MS));
            locks.acquire(LockManager.AcquireRequest.of("free", "agent-y", DAY_MS));
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.execute("""
                        CREATE TRIGGER pin_agent_x BEFORE DELETE ON locks
                        WHEN OLD.holder_id='agent-x'
                        BEGIN SELECT RAISE(ABORT, 'lock row pinned'); END
                        """);
            }

            clock.advance(20 * MINUTE_MS);
            LivenessMonitor.ReapOutcome first = monitor.reap(15 * MINUTE_MS);
            Assertions.assertEquals(List.of("agent-y"), first.cleanedAgents());
            Assertions.assertEquals(List.of("agent-x"), first.failedAgents());
            Assertions.assertTrue(locks.isLocked("free").isEmpty());
            Assertions.assertEquals("agent-x", locks.isLocked("stuck").orElseThrow().holderId());
            Assertions.assertEquals(SessionStatus.DISCONNECTED, monitor.getSession("x1").orElseThrow().status());

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.execute("DROP TRIGGER pin_agent_x");
            }
            LivenessMonitor.ReapOutcome second = monitor.reap(15 * MINUTE_MS);
            Assertions.assertEquals(List.of("agent-x"), second.cleanedAgents());
            Assertions.assertTrue(second.failedAgents().isEmpty());
            Assertions.assertEquals(1, second.locksReleased());
            Assertions.assertTrue(locks.isLocked("stuck").isEmpty());

            Assertions.assertEquals(0, monitor.reap(15 * MINUTE_MS).agentsCleaned());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void locksOfAlreadyDisconnectedAgentsAreReleased() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-liveness-orphan-");
        try {
            Database db = newDatabase(root);
            SteppingClock clock = new SteppingClock(Instant.parse("2026-10-16T09:00:00Z"));
            LockManager locks = new LockManager(new LockStore(db), clock);
            SessionStore sessions = new SessionStore(db);
            LivenessMonitor monitor = new LivenessMonitor(sessions, locks, clock);

            monitor.register(register("agent-a", "a1", List.of()));
            locks.acquire(LockManager.AcquireRequest.of("orphan", "agent-a", DAY_MS));
            locks.acquire(LockManager.AcquireRequest.of("sessionless", "agent-z", DAY_MS));
            clock.advance(20 * MINUTE_MS);
            sessions.disconnectStale(clock.millis(), clock.millis());
            Assertions.assertEquals("agent-a", locks.isLocked("orphan").orElseThrow().holderId());

            LivenessMonitor.ReapOutcome outcome = monitor.reap(15 * MINUTE_MS);
            Assertions.assertEquals(List.of("agent-a"), outcome.cleanedAgents());
            Assertions.assertTrue(locks.isLocked("orphan").isEmpty());
            Assertions.assertEquals("agent-z", locks.isLocked("sessionless").orElseThrow().holderId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void discoveryFiltersByCapabilityAndHidesDisconnected() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-liveness-discover-");
        try {
            Database db = newDatabase(root);
            SteppingClock clock = new SteppingClock(Instant.parse("2026-10-16T09:00:00Z"));
            LivenessMonitor monitor = new LivenessMonitor(new SessionStore(db), new LockManager(new LockStore(db), clock), clock);
            monitor.register(register("agent-a", "a1", List.of("python", "review")));
            clock.advance(MINUTE_MS);
            monitor.register(register("agent-b", "b1", List.of("python", " python ")));
            monitor.register(register("agent-c", "c1", List.of("go")));
            Assertions.assertTrue(monitor.setStatus("c1", SessionStatus.IDLE).ok());

            List<SessionStore.SessionRow> python = monitor.discover("python", null, 10);
            Assertions.assertEquals(List.of("b1", "a1"), python.stream().map(SessionStore.SessionRow::sessionId).toList());
            Assertions.assertEquals(List.of("python"), python.get(0).capabilities());

            Assertions.assertEquals(1, monitor.discover(null, SessionStatus.IDLE, 10).size());

            clock.advance(30 * MINUTE_MS);
            monitor.heartbeat("b1", null);
            monitor.reap(15 * MINUTE_MS);
            Assertions.assertEquals(List.of("b1"),
                    monitor.discover(null, null, 10).stream().map(SessionStore.SessionRow::sessionId).toList());
            Assertions.assertEquals(2, monitor.discover(null, SessionStatus.DISCONNECTED, 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusChangesAreLimitedToActiveAndIdle() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-liveness-status-");
        try {
            Database db = newDatabase(root);
            LivenessMonitor monitor = new LivenessMonitor(new SessionStore(db), new LockManager(new LockStore(db)));

            Assertions.assertEquals(LivenessMonitor.REASON_MISSING_AGENT,
                    monitor.register(register(" ", null, List.of())).reason());
            LivenessMonitor.RegisterOutcome generated = monitor.register(register("agent-a", null, List.of()));
            Assertions.assertTrue(generated.session().sessionId().startsWith("agent-a-"));

            Assertions.assertEquals(LivenessMonitor.REASON_INVALID_STATUS,
                    monitor.setStatus(generated.session().sessionId(), SessionStatus.DISCONNECTED).reason());
            Assertions.assertEquals(LivenessMonitor.REASON_SESSION_NOT_FOUND,
                    monitor.setStatus("nope", SessionStatus.IDLE).reason());
            Assertions.assertEquals(LivenessMonitor.REASON_SESSION_NOT_FOUND,
                    monitor.heartbeat("nope", null).reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void backgroundReaperRunsUntilStopped() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-liveness-reaper-");
        try {
            Database db = newDatabase(root);
            LivenessMonitor monitor = new LivenessMonitor(new SessionStore(db), new LockManager(new LockStore(db)));
            CountDownLatch ran = new CountDownLatch(2);
            try {
                monitor.startReaper(20L, outcome -> ran.countDown());
                Assertions.assertTrue(monitor.reaperRunning());
                Assertions.assertTrue(ran.await(10, TimeUnit.SECONDS));

                monitor.startReaper(0L, null);
                Assertions.assertFalse(monitor.reaperRunning());
            } finally {
                monitor.close();
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static LivenessMonitor.RegisterRequest register(String agentId, String sessionId, List<String> capabilities) {
        return new LivenessMonitor.RegisterRequest(agentId, "cli_agent", sessionId, capabilities, null, Map.of());
    }

    private static Database newDatabase(Path root) {
        Database db = new Database(CoordMeshConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class SteppingClock extends Clock {
        private volatile Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(long millis) {
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
