package io.coordmesh.storage;

import io.coordmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Episodic memories with their tag sets.
 */
public final class MemoryStore {
    private static final String MEMORY_COLUMNS = """
            m.memory_id,m.agent_id,m.session_id,m.event_type,m.summary,m.details,m.outcome,m.lessons,m.relevance_score,m.created_at_ms
            """;

    private final Database database;

    public MemoryStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts the memory unless the same agent stored the same event type and summary after {@code dedupSinceMs};
     * in that case the earlier memory's id is returned. Check and insert share one write transaction.
     */
    public StoreResult store(MemoryRow row, long dedupSinceMs) {
        String existing = """
                SELECT memory_id FROM memory_episodic
                WHERE agent_id=? AND event_type=? AND summary=? AND created_at_ms>?
                ORDER BY created_at_ms DESC LIMIT 1
                """;
        String insert = """
                INSERT INTO memory_episodic(memory_id,agent_id,session_id,event_type,summary,details,outcome,lessons,relevance_score,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psExisting = c.prepareStatement(existing);
                 PreparedStatement psInsert = c.prepareStatement(insert);
                 PreparedStatement psTag = c.prepareStatement(
                         "INSERT OR IGNORE INTO memory_tags(memory_id,tag) VALUES(?,?)")) {
                psExisting.setString(1, row.agentId());
                psExisting.setString(2, row.eventType());
                psExisting.setString(3, row.summary());
                psExisting.setLong(4, dedupSinceMs);
                try (ResultSet rs = psExisting.executeQuery()) {
                    if (rs.next()) {
                        String memoryId = rs.getString(1);
                        c.commit();
                        return new StoreResult(memoryId, false);
                    }
                }

                psInsert.setString(1, row.memoryId());
                psInsert.setString(2, row.agentId());
                psInsert.setString(3, row.sessionId());
                psInsert.setString(4, row.eventType());
                psInsert.setString(5, row.summary());
                psInsert.setString(6, Jsons.toCompactJson(row.details() == null ? Map.of() : row.details()));
                psInsert.setString(7, row.outcome());
                psInsert.setString(8, Jsons.toCompactJson(row.lessons() == null ? List.of() : row.lessons()));
                psInsert.setDouble(9, row.relevanceScore());
                psInsert.setLong(10, row.createdAtMs());
                psInsert.executeUpdate();
                for (String tag : normalizeTags(row.tags())) {
                    psTag.setString(1, row.memoryId());
                    psTag.setString(2, tag);
                    psTag.addBatch();
                }
                psTag.executeBatch();
                c.commit();
                return new StoreResult(row.memoryId(), true);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to store memory for agent: " + row.agentId(), e);
        }
    }

    /**
     * Memories passing every given filter, newest first. Tags match when the memory carries any of them.
     */
    public List<MemoryRow> find(String agentId, String eventType, List<String> tags, double minRelevance) {
        String agent = SqlSupport.blankToNull(agentId);
        String type = SqlSupport.blankToNull(eventType);
        List<String> anyTags = normalizeTags(tags);
        StringBuilder sql = new StringBuilder("SELECT " + MEMORY_COLUMNS + " FROM memory_episodic m WHERE m.relevance_score>=?");
        if (agent != null) {
            sql.append(" AND m.agent_id=?");
        }
        if (type != null) {
            sql.append(" AND m.event_type=?");
        }
        if (!anyTags.isEmpty()) {
            sql.append(" AND EXISTS (SELECT 1 FROM memory_tags t WHERE t.memory_id=m.memory_id AND t.tag IN (")
                    .append(SqlSupport.placeholders(anyTags.size())).append("))");
        }
        sql.append(" ORDER BY m.created_at_ms DESC, m.rowid DESC");
        List<MemoryRow> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql.toString());
             PreparedStatement psTags = c.prepareStatement("SELECT tag FROM memory_tags WHERE memory_id=? ORDER BY tag")) {
            int idx = 1;
            ps.setDouble(idx++, minRelevance);
            if (agent != null) {
                ps.setString(idx++, agent);
            }
            if (type != null) {
                ps.setString(idx++, type);
            }
            for (String tag : anyTags) {
                ps.setString(idx++, tag);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapMemory(rs, readTags(psTags, rs.getString("memory_id"))));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to recall memories", e);
        }
    }

    private List<String> readTags(PreparedStatement ps, String memoryId) throws SQLException {
        ps.setString(1, memoryId);
        List<String> tags = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tags.add(rs.getString(1));
            }
        }
        return tags;
    }

    private MemoryRow mapMemory(ResultSet rs, List<String> tags) throws SQLException {
        return new MemoryRow(
                rs.getString("memory_id"),
                rs.getString("agent_id"),
                rs.getString("session_id"),
                rs.getString("event_type"),
                rs.getString("summary"),
                Jsons.readObjectMap(rs.getString("details")),
                rs.getString("outcome"),
                Jsons.readStringList(rs.getString("lessons")),
                List.copyOf(tags),
                rs.getDouble("relevance_score"),
                rs.getLong("created_at_ms")
        );
    }

    static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                out.add(tag.trim());
            }
        }
        return List.copyOf(out);
    }

    public record MemoryRow(
            String memoryId,
            String agentId,
            String sessionId,
            String eventType,
            String summary,
            Map<String, Object> details,
            String outcome,
            List<String> lessons,
            List<String> tags,
            double relevanceScore,
            long createdAtMs
    ) {
    }

    /**
     * @param created false when an earlier memory absorbed this one
     */
    public record StoreResult(String memoryId, boolean created) {
    }
}
