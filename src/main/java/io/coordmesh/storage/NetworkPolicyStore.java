package io.coordmesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class NetworkPolicyStore {
    private final Database database;

    public NetworkPolicyStore(Database database) {
        this.database = database;
    }

    /**
     * Enabled policies that apply to a profile: the profile's own first, then global ones, each by priority.
     */
    public List<NetworkPolicyRow> listApplicable(String profileId) {
        String sql = """
                SELECT policy_id,profile_id,domain_pattern,action,priority,description,enabled
                FROM network_policies
                WHERE enabled=1 AND (profile_id IS NULL OR profile_id=?)
                ORDER BY CASE WHEN profile_id IS NULL THEN 1 ELSE 0 END, priority ASC, policy_id ASC
                """;
        List<NetworkPolicyRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, profileId == null ? "" : profileId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load network policies", e);
        }
    }

    public List<NetworkPolicyRow> listAll() {
        String sql = """
                SELECT policy_id,profile_id,domain_pattern,action,priority,description,enabled
                FROM network_policies
                ORDER BY priority ASC, policy_id ASC
                """;
        List<NetworkPolicyRow> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list network policies", e);
        }
    }

    public void upsert(NetworkPolicyRow policy, long nowMs) {
        String sql = """
                INSERT INTO network_policies(policy_id,profile_id,domain_pattern,action,priority,description,enabled,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(policy_id) DO UPDATE SET
                    profile_id=excluded.profile_id,
                    domain_pattern=excluded.domain_pattern,
                    action=excluded.action,
                    priority=excluded.priority,
                    description=excluded.description,
                    enabled=excluded.enabled
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, policy.policyId());
            ps.setString(2, policy.profileId());
            ps.setString(3, policy.domainPattern());
            ps.setString(4, policy.action());
            ps.setInt(5, policy.priority());
            ps.setString(6, policy.description());
            ps.setInt(7, policy.enabled() ? 1 : 0);
            ps.setLong(8, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert network policy: " + policy.policyId(), e);
        }
    }

    public void logAccess(String agentId, String domain, boolean allowed, String policyId, String reason, long nowMs) {
        String sql = """
                INSERT INTO network_access_log(agent_id,domain,allowed,policy_id,reason,created_at_ms)
                VALUES(?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId == null ? "" : agentId);
            ps.setString(2, domain);
            ps.setInt(3, allowed ? 1 : 0);
            ps.setString(4, policyId);
            ps.setString(5, reason);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to log network access for: " + domain, e);
        }
    }

    public List<AccessLogRow> listAccessLog(String agentId, int limit) {
        String agent = SqlSupport.blankToNull(agentId);
        String sql = "SELECT id,agent_id,domain,allowed,policy_id,reason,created_at_ms FROM network_access_log"
                + (agent == null ? "" : " WHERE agent_id=?")
                + " ORDER BY created_at_ms DESC, id DESC LIMIT ?";
        List<AccessLogRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (agent != null) {
                ps.setString(idx++, agent);
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AccessLogRow(
                            rs.getLong("id"),
                            rs.getString("agent_id"),
                            rs.getString("domain"),
                            rs.getInt("allowed") == 1,
                            rs.getString("policy_id"),
                            rs.getString("reason"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list network access log", e);
        }
    }

    private NetworkPolicyRow map(ResultSet rs) throws SQLException {
        return new NetworkPolicyRow(
                rs.getString("policy_id"),
                rs.getString("profile_id"),
                rs.getString("domain_pattern"),
                rs.getString("action"),
                rs.getInt("priority"),
                rs.getString("description"),
                rs.getInt("enabled") == 1
        );
    }

    /**
     * @param profileId null for a global policy
     * @param action    {@code allow} or {@code deny}
     */
    public record NetworkPolicyRow(
            String policyId,
            String profileId,
            String domainPattern,
            String action,
            int priority,
            String description,
            boolean enabled
    ) {
    }

    public record AccessLogRow(
            long id,
            String agentId,
            String domain,
            boolean allowed,
            String policyId,
            String reason,
            long createdAtMs
    ) {
    }
}
