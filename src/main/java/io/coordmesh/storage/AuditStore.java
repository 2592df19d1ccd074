package io.coordmesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only access to {@code audit_log}. Rows can only leave the table through {@link #retentionSweep(long, long)},
 * which opens a retention grant that the delete trigger honours for the length of one transaction.
 */
public final class AuditStore {
    private static final String AUDIT_COLUMNS =
            "entry_id,agent_id,agent_type,operation,parameters,result,duration_ms,success,error_message,created_at_ms";

    private final Database database;

    public AuditStore(Database database) {
        this.database = database;
    }

    public int insertBatch(List<AuditRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        String sql = "INSERT INTO audit_log(" + AUDIT_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (AuditRow row : rows) {
                    ps.setString(1, row.entryId());
                    ps.setString(2, row.agentId() == null ? "" : row.agentId());
                    ps.setString(3, row.agentType());
                    ps.setString(4, row.operation());
                    ps.setString(5, row.parametersJson() == null ? "{}" : row.parametersJson());
                    ps.setString(6, row.resultJson() == null ? "{}" : row.resultJson());
                    SqlSupport.setNullableLong(ps, 7, row.durationMs());
                    if (row.success() == null) {
                        ps.setNull(8, Types.INTEGER);
                    } else {
                        ps.setInt(8, row.success() ? 1 : 0);
                    }
                    ps.setString(9, row.errorMessage());
                    ps.setLong(10, row.createdAtMs());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
                return rows.size();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to append audit entries", e);
        }
    }

    /**
     * Newest first.
     */
    public List<AuditRow> query(Filter filter) {
        String agent = SqlSupport.blankToNull(filter.agentId());
        String operation = SqlSupport.blankToNull(filter.operation());
        StringBuilder sql = new StringBuilder("SELECT " + AUDIT_COLUMNS + " FROM audit_log WHERE 1=1");
        if (agent != null) {
            sql.append(" AND agent_id=?");
        }
        if (operation != null) {
            sql.append(" AND operation=?");
        }
        if (filter.sinceMs() != null) {
            sql.append(" AND created_at_ms>=?");
        }
        if (filter.untilMs() != null) {
            sql.append(" AND created_at_ms<=?");
        }
        if (filter.success() != null) {
            sql.append(" AND success=?");
        }
        sql.append(" ORDER BY created_at_ms DESC, rowid DESC LIMIT ?");
        List<AuditRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            if (agent != null) {
                ps.setString(idx++, agent);
            }
            if (operation != null) {
                ps.setString(idx++, operation);
            }
            if (filter.sinceMs() != null) {
                ps.setLong(idx++, filter.sinceMs());
            }
            if (filter.untilMs() != null) {
                ps.setLong(idx++, filter.untilMs());
            }
            if (filter.success() != null) {
                ps.setInt(idx++, filter.success() ? 1 : 0);
            }
            ps.setInt(idx, Math.max(1, filter.limit()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Integer success = SqlSupport.getNullableInt(rs, "success");
                    out.add(new AuditRow(
                            rs.getString("entry_id"),
                            rs.getString("agent_id"),
                            rs.getString("agent_type"),
                            rs.getString("operation"),
                            rs.getString("parameters"),
                            rs.getString("result"),
                            SqlSupport.getNullableLong(rs, "duration_ms"),
                            success == null ? null : success == 1,
                            rs.getString("error_message"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query audit log", e);
        }
    }

    public long count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM audit_log");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count audit entries", e);
        }
    }

    /**
     * Deletes entries created strictly before {@code cutoffMs}. The grant row never outlives the transaction.
     */
    public int retentionSweep(long cutoffMs, long nowMs) {
        String grantId = "ret_" + UUID.randomUUID();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement grant = c.prepareStatement(
                    "INSERT INTO audit_retention_grants(grant_id,cutoff_ms,created_at_ms) VALUES(?,?,?)");
                 PreparedStatement delete = c.prepareStatement("DELETE FROM audit_log WHERE created_at_ms<?");
                 PreparedStatement revoke = c.prepareStatement("DELETE FROM audit_retention_grants WHERE grant_id=?")) {
                grant.setString(1, grantId);
                grant.setLong(2, cutoffMs);
                grant.setLong(3, nowMs);
                grant.executeUpdate();

                delete.setLong(1, cutoffMs);
                int deleted = delete.executeUpdate();

                revoke.setString(1, grantId);
                revoke.executeUpdate();
                c.commit();
                return deleted;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed audit retention sweep", e);
        }
    }

    public record AuditRow(
            String entryId,
            String agentId,
            String agentType,
            String operation,
            String parametersJson,
            String resultJson,
            Long durationMs,
            Boolean success,
            String errorMessage,
            long createdAtMs
    ) {
    }

    public record Filter(String agentId, String operation, Long sinceMs, Long untilMs, Boolean success, int limit) {
    }
}
