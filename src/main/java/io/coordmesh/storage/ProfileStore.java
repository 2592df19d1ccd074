package io.coordmesh.storage;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.model.AgentProfile;
import io.coordmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Agent profiles and the explicit agent-to-profile assignments.
 */
public final class ProfileStore {
    public static final String SOURCE_ASSIGNMENT = "assignment";
    public static final String SOURCE_DEFAULT = "default";

    private static final String PROFILE_COLUMNS = """
            p.profile_id,p.name,p.agent_type,p.trust_level,p.allowed_operations,p.blocked_operations,
            p.max_file_modifications,p.max_execution_time_seconds,p.max_api_calls_per_hour,p.network_overrides,p.enabled
            """;

    private final Database database;

    public ProfileStore(Database database) {
        this.database = database;
    }

    /**
     * Assignment first, then the oldest enabled profile for the agent type, then a synthetic default.
     */
    public AgentProfile resolve(String agentId, String agentType) {
        String byAssignment = "SELECT " + PROFILE_COLUMNS + """
                 FROM agent_profile_assignments a
                JOIN agent_profiles p ON p.profile_id=a.profile_id
                WHERE a.agent_id=? AND p.enabled=1
                """;
        String byType = "SELECT " + PROFILE_COLUMNS + """
                 FROM agent_profiles p
                WHERE p.agent_type=? AND p.enabled=1
                ORDER BY p.created_at_ms ASC, p.profile_id ASC LIMIT 1
                """;
        try (Connection c = database.openConnection()) {
            if (agentId != null && !agentId.isBlank()) {
                Optional<AgentProfile> assigned = queryOne(c, byAssignment, agentId, SOURCE_ASSIGNMENT);
                if (assigned.isPresent()) {
                    return assigned.get();
                }
            }
            if (agentType != null && !agentType.isBlank()) {
                Optional<AgentProfile> byDefault = queryOne(c, byType, agentType, SOURCE_DEFAULT);
                if (byDefault.isPresent()) {
                    return byDefault.get();
                }
            }
            return AgentProfile.synthetic(agentType, CoordMeshConfig.DEFAULT_TRUST_LEVEL);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve profile for agent: " + agentId, e);
        }
    }

    public Optional<AgentProfile> findByName(String name) {
        String sql = "SELECT " + PROFILE_COLUMNS + " FROM agent_profiles p WHERE p.name=?";
        try (Connection c = database.openConnection()) {
            return queryOne(c, sql, name, SOURCE_DEFAULT);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read profile: " + name, e);
        }
    }

    public List<AgentProfile> list() {
        String sql = "SELECT " + PROFILE_COLUMNS + " FROM agent_profiles p ORDER BY p.agent_type, p.name";
        List<AgentProfile> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapProfile(rs, SOURCE_DEFAULT));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list profiles", e);
        }
    }

    /**
     * @return false when no profile with that name exists
     */
    public boolean assign(String agentId, String profileName, String assignedBy, long nowMs) {
        String sql = """
                INSERT INTO agent_profile_assignments(agent_id,profile_id,assigned_by,assigned_at_ms)
                SELECT ?,profile_id,?,? FROM agent_profiles WHERE name=?
                ON CONFLICT(agent_id) DO UPDATE SET
                    profile_id=excluded.profile_id,
                    assigned_by=excluded.assigned_by,
                    assigned_at_ms=excluded.assigned_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            ps.setString(2, assignedBy);
            ps.setLong(3, nowMs);
            ps.setString(4, profileName);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to assign profile " + profileName + " to " + agentId, e);
        }
    }

    public boolean unassign(String agentId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM agent_profile_assignments WHERE agent_id=?")) {
            ps.setString(1, agentId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove profile assignment: " + agentId, e);
        }
    }

    public void upsert(AgentProfile profile, String description, long nowMs) {
        String sql = """
                INSERT INTO agent_profiles(profile_id,name,description,agent_type,trust_level,allowed_operations,
                                           blocked_operations,max_file_modifications,max_execution_time_seconds,
                                           max_api_calls_per_hour,network_overrides,enabled,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(profile_id) DO UPDATE SET
                    name=excluded.name,
                    description=excluded.description,
                    agent_type=excluded.agent_type,
                    trust_level=excluded.trust_level,
                    allowed_operations=excluded.allowed_operations,
                    blocked_operations=excluded.blocked_operations,
                    max_file_modifications=excluded.max_file_modifications,
                    max_execution_time_seconds=excluded.max_execution_time_seconds,
                    max_api_calls_per_hour=excluded.max_api_calls_per_hour,
                    network_overrides=excluded.network_overrides,
                    enabled=excluded.enabled,
                    updated_at_ms=excluded.updated_at_ms
                """;
        String profileId = profile.profileId() == null ? "prf_" + profile.name() : profile.profileId();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, profileId);
            ps.setString(2, profile.name());
            ps.setString(3, description);
            ps.setString(4, profile.agentType());
            ps.setInt(5, profile.trustLevel());
            ps.setString(6, Jsons.toCompactJson(profile.allowedOperations()));
            ps.setString(7, Jsons.toCompactJson(profile.blockedOperations()));
            ps.setInt(8, profile.maxFileModifications());
            ps.setInt(9, profile.maxExecutionTimeSeconds());
            ps.setInt(10, profile.maxApiCallsPerHour());
            ps.setString(11, Jsons.toCompactJson(profile.networkOverrides()));
            ps.setInt(12, profile.enabled() ? 1 : 0);
            ps.setLong(13, nowMs);
            ps.setLong(14, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert profile: " + profile.name(), e);
        }
    }

    private Optional<AgentProfile> queryOne(Connection c, String sql, String param, String source) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProfile(rs, source)) : Optional.empty();
            }
        }
    }

    private AgentProfile mapProfile(ResultSet rs, String source) throws SQLException {
        return new AgentProfile(
                rs.getString("profile_id"),
                rs.getString("name"),
                rs.getString("agent_type"),
                rs.getInt("trust_level"),
                Jsons.readStringList(rs.getString("allowed_operations")),
                Jsons.readStringList(rs.getString("blocked_operations")),
                rs.getInt("max_file_modifications"),
                rs.getInt("max_execution_time_seconds"),
                rs.getInt("max_api_calls_per_hour"),
                Jsons.readObjectMap(rs.getString("network_overrides")),
                rs.getInt("enabled") == 1,
                source
        );
    }
}
