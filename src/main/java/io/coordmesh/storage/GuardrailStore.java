package io.coordmesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class GuardrailStore {
    public static final int MAX_OPERATION_TEXT_CHARS = 500;
    public static final int MAX_MATCHED_TEXT_CHARS = 200;

    private final Database database;

    public GuardrailStore(Database database) {
        this.database = database;
    }

    public List<PatternRow> listPatterns(boolean enabledOnly) {
        String sql = "SELECT name,category,pattern,severity,min_trust_level,description,enabled FROM guardrail_patterns"
                + (enabledOnly ? " WHERE enabled=1" : "")
                + " ORDER BY category, name";
        List<PatternRow> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new PatternRow(
                        rs.getString("name"),
                        rs.getString("category"),
                        rs.getString("pattern"),
                        rs.getString("severity"),
                        rs.getInt("min_trust_level"),
                        rs.getString("description"),
                        rs.getInt("enabled") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load guardrail patterns", e);
        }
    }

    public void upsertPattern(PatternRow p, long nowMs) {
        String sql = """
                INSERT INTO guardrail_patterns(name,category,pattern,severity,min_trust_level,description,enabled,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                ON CONFLICT(name) DO UPDATE SET
                    category=excluded.category,
                    pattern=excluded.pattern,
                    severity=excluded.severity,
                    min_trust_level=excluded.min_trust_level,
                    description=excluded.description,
                    enabled=excluded.enabled,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, p.name());
            ps.setString(2, p.category());
            ps.setString(3, p.regex());
            ps.setString(4, p.severity());
            ps.setInt(5, p.minTrustToBypass());
            ps.setString(6, p.description());
            ps.setInt(7, p.enabled() ? 1 : 0);
            ps.setLong(8, nowMs);
            ps.setLong(9, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert guardrail pattern: " + p.name(), e);
        }
    }

    public int recordViolations(List<ViolationRecord> violations) {
        if (violations == null || violations.isEmpty()) {
            return 0;
        }
        String sql = """
                INSERT INTO guardrail_violations(agent_id,pattern_name,category,severity,operation_text,matched_text,
                                                 blocked,bypassed,trust_level,context,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (ViolationRecord v : violations) {
                    ps.setString(1, v.agentId() == null ? "" : v.agentId());
                    ps.setString(2, v.patternName());
                    ps.setString(3, v.category());
                    ps.setString(4, v.severity());
                    ps.setString(5, nonNull(SqlSupport.truncate(v.operationText(), MAX_OPERATION_TEXT_CHARS)));
                    ps.setString(6, nonNull(SqlSupport.truncate(v.matchedText(), MAX_MATCHED_TEXT_CHARS)));
                    ps.setInt(7, v.blocked() ? 1 : 0);
                    ps.setInt(8, v.bypassed() ? 1 : 0);
                    ps.setInt(9, v.trustLevel());
                    ps.setString(10, v.contextJson() == null ? "{}" : v.contextJson());
                    ps.setLong(11, v.createdAtMs());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
                return violations.size();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to record guardrail violations", e);
        }
    }

    public List<ViolationRow> listViolations(String agentId, boolean blockedOnly, int limit) {
        String agent = SqlSupport.blankToNull(agentId);
        StringBuilder sql = new StringBuilder("""
                SELECT id,agent_id,pattern_name,category,severity,operation_text,matched_text,blocked,bypassed,
                       trust_level,context,created_at_ms
                FROM guardrail_violations WHERE 1=1
                """);
        if (agent != null) {
            sql.append(" AND agent_id=?");
        }
        if (blockedOnly) {
            sql.append(" AND blocked=1");
        }
        sql.append(" ORDER BY created_at_ms DESC, id DESC LIMIT ?");
        List<ViolationRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            if (agent != null) {
                ps.setString(idx++, agent);
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ViolationRow(
                            rs.getLong("id"),
                            rs.getString("agent_id"),
                            rs.getString("pattern_name"),
                            rs.getString("category"),
                            rs.getString("severity"),
                            rs.getString("operation_text"),
                            rs.getString("matched_text"),
                            rs.getInt("blocked") == 1,
                            rs.getInt("bypassed") == 1,
                            rs.getInt("trust_level"),
                            rs.getString("context"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list guardrail violations", e);
        }
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }

    public record PatternRow(
            String name,
            String category,
            String regex,
            String severity,
            int minTrustToBypass,
            String description,
            boolean enabled
    ) {
    }

    public record ViolationRecord(
            String agentId,
            String patternName,
            String category,
            String severity,
            String operationText,
            String matchedText,
            boolean blocked,
            boolean bypassed,
            int trustLevel,
            String contextJson,
            long createdAtMs
    ) {
    }

    public record ViolationRow(
            long id,
            String agentId,
            String patternName,
            String category,
            String severity,
            String operationText,
            String matchedText,
            boolean blocked,
            boolean bypassed,
            int trustLevel,
            String contextJson,
            long createdAtMs
    ) {
    }
}
