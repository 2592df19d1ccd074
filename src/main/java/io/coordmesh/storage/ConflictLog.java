package io.coordmesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records contention on locks and tasks: denied acquisitions, lost claim races and stale completions.
 */
public final class ConflictLog {
    public static final String LOCK_DENIED = "lock_denied";
    public static final String CLAIM_RACE = "claim_race";
    public static final String STALE_COMPLETE = "stale_complete";

    private final Database database;

    public ConflictLog(Database database) {
        this.database = database;
    }

    void record(Connection c, String eventType, String resource, String actor, String expected, String actual, long nowMs)
            throws SQLException {
        String sql = """
                INSERT INTO coordination_conflicts(event_type,resource,actor,expected,actual,occurred_at_ms)
                VALUES(?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, eventType);
            ps.setString(2, resource);
            ps.setString(3, actor);
            ps.setString(4, expected);
            ps.setString(5, actual);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        }
    }

    public List<Conflict> list(String eventType, long sinceMs, int limit) {
        String type = SqlSupport.blankToNull(eventType);
        String sql = "SELECT id,event_type,resource,actor,expected,actual,occurred_at_ms FROM coordination_conflicts "
                + "WHERE occurred_at_ms>=?" + (type == null ? "" : " AND event_type=?")
                + " ORDER BY occurred_at_ms DESC, id DESC LIMIT ?";
        List<Conflict> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            ps.setLong(idx++, Math.max(0L, sinceMs));
            if (type != null) {
                ps.setString(idx++, type);
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Conflict(
                            rs.getLong("id"),
                            rs.getString("event_type"),
                            rs.getString("resource"),
                            rs.getString("actor"),
                            rs.getString("expected"),
                            rs.getString("actual"),
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list coordination conflicts", e);
        }
    }

    public Map<String, Integer> countByType(long sinceMs) {
        String sql = "SELECT event_type, COUNT(1) AS c FROM coordination_conflicts WHERE occurred_at_ms>=? GROUP BY event_type";
        Map<String, Integer> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, Math.max(0L, sinceMs));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString(1), rs.getInt(2));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count coordination conflicts", e);
        }
    }

    public record Conflict(
            long id,
            String eventType,
            String resource,
            String actor,
            String expected,
            String actual,
            long occurredAtMs
    ) {
    }
}
