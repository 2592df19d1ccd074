package io.coordmesh.storage;

import io.coordmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class PolicyRuleStore {
    private static final String RULE_COLUMNS =
            "rule_id,name,effect,actions,resource_pattern,min_trust,max_trust,priority,description,enabled";

    private final Database database;

    public PolicyRuleStore(Database database) {
        this.database = database;
    }

    public List<RuleRow> list(boolean enabledOnly) {
        String sql = "SELECT " + RULE_COLUMNS + " FROM policy_rules"
                + (enabledOnly ? " WHERE enabled=1" : "")
                + " ORDER BY priority ASC, rule_id ASC";
        List<RuleRow> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new RuleRow(
                        rs.getString("rule_id"),
                        rs.getString("name"),
                        rs.getString("effect"),
                        Jsons.readStringList(rs.getString("actions")),
                        rs.getString("resource_pattern"),
                        SqlSupport.getNullableInt(rs, "min_trust"),
                        SqlSupport.getNullableInt(rs, "max_trust"),
                        rs.getInt("priority"),
                        rs.getString("description"),
                        rs.getInt("enabled") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load policy rules", e);
        }
    }

    public void upsert(RuleRow rule, long nowMs) {
        String sql = """
                INSERT INTO policy_rules(rule_id,name,effect,actions,resource_pattern,min_trust,max_trust,priority,
                                         description,enabled,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(rule_id) DO UPDATE SET
                    name=excluded.name,
                    effect=excluded.effect,
                    actions=excluded.actions,
                    resource_pattern=excluded.resource_pattern,
                    min_trust=excluded.min_trust,
                    max_trust=excluded.max_trust,
                    priority=excluded.priority,
                    description=excluded.description,
                    enabled=excluded.enabled,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, rule.ruleId());
            ps.setString(2, rule.name());
            ps.setString(3, rule.effect());
            ps.setString(4, Jsons.toCompactJson(rule.actions()));
            ps.setString(5, rule.resourcePattern());
            SqlSupport.setNullableInt(ps, 6, rule.minTrust());
            SqlSupport.setNullableInt(ps, 7, rule.maxTrust());
            ps.setInt(8, rule.priority());
            ps.setString(9, rule.description());
            ps.setInt(10, rule.enabled() ? 1 : 0);
            ps.setLong(11, nowMs);
            ps.setLong(12, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert policy rule: " + rule.ruleId(), e);
        }
    }

    public record RuleRow(
            String ruleId,
            String name,
            String effect,
            List<String> actions,
            String resourcePattern,
            Integer minTrust,
            Integer maxTrust,
            int priority,
            String description,
            boolean enabled
    ) {
    }
}
