package io.coordmesh.storage;

import io.coordmesh.model.SessionStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

public final class SessionStore {
    private static final String SESSION_COLUMNS =
            "s.session_id,s.agent_id,s.agent_type,s.status,s.current_task,s.metadata,s.started_at_ms,s.last_heartbeat_ms,s.updated_at_ms";

    private final Database database;

    public SessionStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts or refreshes a session and replaces its capability set. A re-registration keeps the original start time.
     */
    public SessionRow register(SessionRegistration r) {
        String upsert = """
                INSERT INTO agent_sessions(session_id,agent_id,agent_type,status,current_task,metadata,started_at_ms,last_heartbeat_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                ON CONFLICT(session_id) DO UPDATE SET
                    agent_id=excluded.agent_id,
                    agent_type=excluded.agent_type,
                    status=excluded.status,
                    current_task=excluded.current_task,
                    metadata=excluded.metadata,
                    last_heartbeat_ms=excluded.last_heartbeat_ms,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(upsert);
                 PreparedStatement clear = c.prepareStatement("DELETE FROM session_capabilities WHERE session_id=?");
                 PreparedStatement cap = c.prepareStatement(
                         "INSERT OR IGNORE INTO session_capabilities(session_id,capability) VALUES(?,?)")) {
                ps.setString(1, r.sessionId());
                ps.setString(2, r.agentId());
                ps.setString(3, r.agentType() == null ? "" : r.agentType());
                ps.setString(4, SessionStatus.ACTIVE.name());
                ps.setString(5, r.currentTask());
                ps.setString(6, r.metadataJson() == null ? "{}" : r.metadataJson());
                ps.setLong(7, r.nowMs());
                ps.setLong(8, r.nowMs());
                ps.setLong(9, r.nowMs());
                ps.executeUpdate();

                clear.setString(1, r.sessionId());
                clear.executeUpdate();
                for (String capability : normalize(r.capabilities())) {
                    cap.setString(1, r.sessionId());
                    cap.setString(2, capability);
                    cap.addBatch();
                }
                cap.executeBatch();
                SessionRow row = readSession(c, r.sessionId()).orElseThrow();
                c.commit();
                return row;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to register session: " + r.sessionId(), e);
        }
    }

    public Optional<SessionRow> heartbeat(String sessionId, String currentTask, long nowMs) {
        String sql = """
                UPDATE agent_sessions
                SET last_heartbeat_ms=?, updated_at_ms=?, status=?, current_task=COALESCE(?, current_task)
                WHERE session_id=?
                """;
        return updateAndRead(sessionId, sql, ps -> {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setString(3, SessionStatus.ACTIVE.name());
            ps.setString(4, currentTask);
            ps.setString(5, sessionId);
        });
    }

    public Optional<SessionRow> setStatus(String sessionId, SessionStatus status, long nowMs) {
        String sql = "UPDATE agent_sessions SET status=?, updated_at_ms=? WHERE session_id=?";
        return updateAndRead(sessionId, sql, ps -> {
            ps.setString(1, status.name());
            ps.setLong(2, nowMs);
            ps.setString(3, sessionId);
        });
    }

    public Optional<SessionRow> get(String sessionId) {
        try (Connection c = database.openConnection()) {
            return readSession(c, sessionId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read session: " + sessionId, e);
        }
    }

    public Optional<SessionRow> findLatestForAgent(String agentId) {
        String sql = "SELECT " + SESSION_COLUMNS
                + " FROM agent_sessions s WHERE s.agent_id=? ORDER BY s.last_heartbeat_ms DESC, s.session_id LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            String sessionId;
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                sessionId = rs.getString("session_id");
            }
            return readSession(c, sessionId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read latest session for agent: " + agentId, e);
        }
    }

    /**
     * Newest heartbeat first. Without an explicit status, disconnected sessions are hidden.
     */
    public List<SessionRow> discover(String capability, SessionStatus status, int limit) {
        String cap = SqlSupport.blankToNull(capability);
        StringBuilder sql = new StringBuilder("SELECT " + SESSION_COLUMNS + " FROM agent_sessions s WHERE ");
        sql.append(status == null ? "s.status<>?" : "s.status=?");
        if (cap != null) {
            sql.append(" AND EXISTS (SELECT 1 FROM session_capabilities sc WHERE sc.session_id=s.session_id AND sc.capability=?)");
        }
        sql.append(" ORDER BY s.last_heartbeat_ms DESC, s.session_id LIMIT ?");
        List<SessionRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            ps.setString(idx++, status == null ? SessionStatus.DISCONNECTED.name() : status.name());
            if (cap != null) {
                ps.setString(idx++, cap);
            }
            ps.setInt(idx, Math.max(1, limit));
            List<SessionRow> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapSession(rs, List.of()));
                }
            }
            for (SessionRow row : rows) {
                out.add(row.withCapabilities(readCapabilities(c, row.sessionId())));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to discover sessions", e);
        }
    }

    /**
     * Marks active or idle sessions whose heartbeat is at or before {@code cutoffMs} as disconnected.
     *
     * @return the agents whose sessions were disconnected, with whether each agent still has another live session
     */
    public List<StaleAgent> disconnectStale(long cutoffMs, long nowMs) {
        String select = """
                SELECT DISTINCT agent_id FROM agent_sessions
                WHERE status IN (?,?) AND last_heartbeat_ms<=?
                ORDER BY agent_id
                """;
        String update = """
                UPDATE agent_sessions SET status=?, updated_at_ms=?
                WHERE status IN (?,?) AND last_heartbeat_ms<=?
                """;
        String live = "SELECT COUNT(1) FROM agent_sessions WHERE agent_id=? AND status IN (?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSelect = c.prepareStatement(select);
                 PreparedStatement psUpdate = c.prepareStatement(update);
                 PreparedStatement psLive = c.prepareStatement(live)) {
                psSelect.setString(1, SessionStatus.ACTIVE.name());
                psSelect.setString(2, SessionStatus.IDLE.name());
                psSelect.setLong(3, cutoffMs);
                List<String> agents = new ArrayList<>();
                try (ResultSet rs = psSelect.executeQuery()) {
                    while (rs.next()) {
                        agents.add(rs.getString(1));
                    }
                }
                psUpdate.setString(1, SessionStatus.DISCONNECTED.name());
                psUpdate.setLong(2, nowMs);
                psUpdate.setString(3, SessionStatus.ACTIVE.name());
                psUpdate.setString(4, SessionStatus.IDLE.name());
                psUpdate.setLong(5, cutoffMs);
                psUpdate.executeUpdate();

                List<StaleAgent> out = new ArrayList<>();
                for (String agent : agents) {
                    psLive.setString(1, agent);
                    psLive.setString(2, SessionStatus.ACTIVE.name());
                    psLive.setString(3, SessionStatus.IDLE.name());
                    try (ResultSet rs = psLive.executeQuery()) {
                        out.add(new StaleAgent(agent, rs.next() && rs.getInt(1) > 0));
                    }
                }
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to disconnect stale sessions", e);
        }
    }

    /**
     * Lock holders that registered at least one session and have none left active or idle. A reap whose lock
     * cleanup failed leaves such agents behind.
     */
    public List<String> orphanedLockHolders() {
        String sql = """
                SELECT DISTINCT l.holder_id FROM locks l
                WHERE EXISTS (SELECT 1 FROM agent_sessions s WHERE s.agent_id=l.holder_id)
                  AND NOT EXISTS (
                      SELECT 1 FROM agent_sessions s WHERE s.agent_id=l.holder_id AND s.status IN (?,?)
                  )
                ORDER BY l.holder_id
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, SessionStatus.ACTIVE.name());
            ps.setString(2, SessionStatus.IDLE.name());
            List<String> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list orphaned lock holders", e);
        }
    }

    private Optional<SessionRow> updateAndRead(String sessionId, String sql, SqlSupport.Binder binder) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                binder.bind(ps);
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                Optional<SessionRow> row = readSession(c, sessionId);
                c.commit();
                return row;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to update session: " + sessionId, e);
        }
    }

    private Optional<SessionRow> readSession(Connection c, String sessionId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + SESSION_COLUMNS + " FROM agent_sessions s WHERE s.session_id=?")) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapSession(rs, readCapabilities(c, sessionId)));
            }
        }
    }

    private List<String> readCapabilities(Connection c, String sessionId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT capability FROM session_capabilities WHERE session_id=? ORDER BY capability")) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    private SessionRow mapSession(ResultSet rs, List<String> capabilities) throws SQLException {
        return new SessionRow(
                rs.getString("session_id"),
                rs.getString("agent_id"),
                rs.getString("agent_type"),
                SessionStatus.fromString(rs.getString("status")),
                capabilities,
                rs.getString("current_task"),
                rs.getString("metadata"),
                rs.getLong("started_at_ms"),
                rs.getLong("last_heartbeat_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static List<String> normalize(List<String> capabilities) {
        if (capabilities == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String capability : capabilities) {
            if (capability != null && !capability.isBlank()) {
                out.add(capability.trim());
            }
        }
        return List.copyOf(out);
    }

    public record SessionRegistration(
            String sessionId,
            String agentId,
            String agentType,
            List<String> capabilities,
            String currentTask,
            String metadataJson,
            long nowMs
    ) {
    }

    public record SessionRow(
            String sessionId,
            String agentId,
            String agentType,
            SessionStatus status,
            List<String> capabilities,
            String currentTask,
            String metadataJson,
            long startedAtMs,
            long lastHeartbeatMs,
            long updatedAtMs
    ) {
        SessionRow withCapabilities(List<String> values) {
            return new SessionRow(sessionId, agentId, agentType, status, List.copyOf(values), currentTask,
                    metadataJson, startedAtMs, lastHeartbeatMs, updatedAtMs);
        }
    }

    public record StaleAgent(String agentId, boolean hasLiveSession) {
    }
}
