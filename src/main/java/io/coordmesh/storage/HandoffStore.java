package io.coordmesh.storage;

import io.coordmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Handoff documents agents leave at the end of a session for whoever picks the work up next.
 */
public final class HandoffStore {
    private static final String HANDOFF_COLUMNS = """
            handoff_id,agent_id,session_id,summary,completed_work,in_progress,decisions,next_steps,relevant_files,created_at_ms
            """;

    private final Database database;

    public HandoffStore(Database database) {
        this.database = database;
    }

    public HandoffRow insert(HandoffRow row) {
        String sql = "INSERT INTO handoff_documents(" + HANDOFF_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, row.handoffId());
            ps.setString(2, row.agentId());
            ps.setString(3, row.sessionId());
            ps.setString(4, row.summary());
            ps.setString(5, Jsons.toCompactJson(row.completedWork()));
            ps.setString(6, Jsons.toCompactJson(row.inProgress()));
            ps.setString(7, Jsons.toCompactJson(row.decisions()));
            ps.setString(8, Jsons.toCompactJson(row.nextSteps()));
            ps.setString(9, Jsons.toCompactJson(row.relevantFiles()));
            ps.setLong(10, row.createdAtMs());
            ps.executeUpdate();
            return row;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write handoff for agent: " + row.agentId(), e);
        }
    }

    /**
     * Newest first; a null agent reads across all agents.
     */
    public List<HandoffRow> recent(String agentId, int limit) {
        String agent = SqlSupport.blankToNull(agentId);
        StringBuilder sql = new StringBuilder("SELECT " + HANDOFF_COLUMNS + " FROM handoff_documents");
        if (agent != null) {
            sql.append(" WHERE agent_id=?");
        }
        sql.append(" ORDER BY created_at_ms DESC, rowid DESC LIMIT ?");
        List<HandoffRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            if (agent != null) {
                ps.setString(idx++, agent);
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapHandoff(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read handoffs", e);
        }
    }

    private HandoffRow mapHandoff(ResultSet rs) throws SQLException {
        return new HandoffRow(
                rs.getString("handoff_id"),
                rs.getString("agent_id"),
                rs.getString("session_id"),
                rs.getString("summary"),
                Jsons.readStringList(rs.getString("completed_work")),
                Jsons.readStringList(rs.getString("in_progress")),
                Jsons.readStringList(rs.getString("decisions")),
                Jsons.readStringList(rs.getString("next_steps")),
                Jsons.readStringList(rs.getString("relevant_files")),
                rs.getLong("created_at_ms")
        );
    }

    public record HandoffRow(
            String handoffId,
            String agentId,
            String sessionId,
            String summary,
            List<String> completedWork,
            List<String> inProgress,
            List<String> decisions,
            List<String> nextSteps,
            List<String> relevantFiles,
            long createdAtMs
    ) {
    }
}
