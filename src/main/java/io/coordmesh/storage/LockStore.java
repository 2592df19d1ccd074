package io.coordmesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class LockStore {
    private static final int MAX_ACQUIRE_ROUNDS = 8;
    private static final String LOCK_COLUMNS =
            "resource_key,holder_id,holder_type,session_id,reason,metadata,acquired_at_ms,expires_at_ms,updated_at_ms";

    private final Database database;
    private final ConflictLog conflictLog;

    public LockStore(Database database) {
        this.database = database;
        this.conflictLog = new ConflictLog(database);
    }

    /**
     * Purges expired leases, then tries insert-if-absent; on conflict, refreshes when the caller already
     * holds the key and otherwise reports the current holder. Each step is a conditional write.
     */
    public LockGrant acquire(LockRequest request, long nowMs) {
        String purge = "DELETE FROM locks WHERE expires_at_ms<=?";
        String insert = "INSERT INTO locks(" + LOCK_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?) ON CONFLICT(resource_key) DO NOTHING";
        String refresh = """
                UPDATE locks
                SET expires_at_ms=?, updated_at_ms=?, holder_type=?,
                    session_id=COALESCE(?, session_id), reason=COALESCE(?, reason), metadata=?
                WHERE resource_key=? AND holder_id=?
                """;
        long expiresAt = expiryOf(nowMs, request.ttlMs());
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psPurge = c.prepareStatement(purge);
                 PreparedStatement psInsert = c.prepareStatement(insert);
                 PreparedStatement psRefresh = c.prepareStatement(refresh)) {
                psPurge.setLong(1, nowMs);
                int purged = psPurge.executeUpdate();
                for (int round = 0; round < MAX_ACQUIRE_ROUNDS; round++) {
                    psInsert.setString(1, request.resourceKey());
                    psInsert.setString(2, request.holderId());
                    psInsert.setString(3, request.holderType() == null ? "" : request.holderType());
                    psInsert.setString(4, request.sessionId());
                    psInsert.setString(5, request.reason());
                    psInsert.setString(6, request.metadataJson() == null ? "{}" : request.metadataJson());
                    psInsert.setLong(7, nowMs);
                    psInsert.setLong(8, expiresAt);
                    psInsert.setLong(9, nowMs);
                    if (psInsert.executeUpdate() == 1) {
                        LockRow row = readLock(c, request.resourceKey()).orElseThrow();
                        c.commit();
                        return LockGrant.granted(row, purged);
                    }

                    psRefresh.setLong(1, expiresAt);
                    psRefresh.setLong(2, nowMs);
                    psRefresh.setString(3, request.holderType() == null ? "" : request.holderType());
                    psRefresh.setString(4, request.sessionId());
                    psRefresh.setString(5, request.reason());
                    psRefresh.setString(6, request.metadataJson() == null ? "{}" : request.metadataJson());
                    psRefresh.setString(7, request.resourceKey());
                    psRefresh.setString(8, request.holderId());
                    if (psRefresh.executeUpdate() == 1) {
                        LockRow row = readLock(c, request.resourceKey()).orElseThrow();
                        c.commit();
                        return LockGrant.refreshed(row, purged);
                    }

                    Optional<LockRow> holder = readLock(c, request.resourceKey());
                    if (holder.isPresent()) {
                        conflictLog.record(
                                c,
                                ConflictLog.LOCK_DENIED,
                                request.resourceKey(),
                                request.holderId(),
                                "absent",
                                holder.get().holderId(),
                                nowMs
                        );
                        c.commit();
                        return LockGrant.denied(holder.get(), purged);
                    }
                    // Holder vanished between the two conditional writes; try the insert again.
                }
                throw new IllegalStateException("Lock acquisition did not settle: " + request.resourceKey());
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to acquire lock: " + request.resourceKey(), e);
        }
    }

    /**
     * Extends a live lease held by {@code holderId}. Returns the refreshed row, or empty when the caller does not hold it.
     */
    public Optional<LockRow> extend(String resourceKey, String holderId, long ttlMs, long nowMs) {
        String sql = "UPDATE locks SET expires_at_ms=?, updated_at_ms=? WHERE resource_key=? AND holder_id=? AND expires_at_ms>?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setLong(1, expiryOf(nowMs, ttlMs));
                ps.setLong(2, nowMs);
                ps.setString(3, resourceKey);
                ps.setString(4, holderId);
                ps.setLong(5, nowMs);
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                Optional<LockRow> row = readLock(c, resourceKey);
                c.commit();
                return row;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to extend lock: " + resourceKey, e);
        }
    }

    public boolean release(String resourceKey, String holderId) {
        String sql = "DELETE FROM locks WHERE resource_key=? AND holder_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, resourceKey);
            ps.setString(2, holderId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lock: " + resourceKey, e);
        }
    }

    public int releaseAllHeldBy(String holderId) {
        String sql = "DELETE FROM locks WHERE holder_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, holderId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release locks held by: " + holderId, e);
        }
    }

    public int purgeExpired(long nowMs) {
        String sql = "DELETE FROM locks WHERE expires_at_ms<=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge expired locks", e);
        }
    }

    /**
     * Live locks only, newest first, optionally narrowed to a set of keys and a holder.
     */
    public List<LockRow> listLive(List<String> resourceKeys, String holderId, long nowMs) {
        List<String> keys = resourceKeys == null ? List.of() : resourceKeys;
        String holder = SqlSupport.blankToNull(holderId);
        StringBuilder sql = new StringBuilder("SELECT " + LOCK_COLUMNS + " FROM locks WHERE expires_at_ms>?");
        if (!keys.isEmpty()) {
            sql.append(" AND resource_key IN (").append(SqlSupport.placeholders(keys.size())).append(')');
        }
        if (holder != null) {
            sql.append(" AND holder_id=?");
        }
        sql.append(" ORDER BY acquired_at_ms DESC, resource_key");
        List<LockRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            ps.setLong(idx++, nowMs);
            for (String key : keys) {
                ps.setString(idx++, key);
            }
            if (holder != null) {
                ps.setString(idx, holder);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapLock(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list locks", e);
        }
    }

    public Optional<LockRow> findLive(String resourceKey, long nowMs) {
        List<LockRow> rows = listLive(List.of(resourceKey), null, nowMs);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public ConflictLog conflictLog() {
        return conflictLog;
    }

    private Optional<LockRow> readLock(Connection c, String resourceKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + LOCK_COLUMNS + " FROM locks WHERE resource_key=?")) {
            ps.setString(1, resourceKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapLock(rs)) : Optional.empty();
            }
        }
    }

    private LockRow mapLock(ResultSet rs) throws SQLException {
        return new LockRow(
                rs.getString("resource_key"),
                rs.getString("holder_id"),
                rs.getString("holder_type"),
                rs.getString("session_id"),
                rs.getString("reason"),
                rs.getString("metadata"),
                rs.getLong("acquired_at_ms"),
                rs.getLong("expires_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    /**
     * Saturates at {@link Long#MAX_VALUE} so an oversized lease never wraps into the past.
     */
    static long expiryOf(long nowMs, long ttlMs) {
        if (ttlMs > 0L && nowMs > Long.MAX_VALUE - ttlMs) {
            return Long.MAX_VALUE;
        }
        return nowMs + ttlMs;
    }

    public record LockRequest(
            String resourceKey,
            String holderId,
            String holderType,
            String sessionId,
            String reason,
            String metadataJson,
            long ttlMs
    ) {
    }

    public record LockRow(
            String resourceKey,
            String holderId,
            String holderType,
            String sessionId,
            String reason,
            String metadataJson,
            long acquiredAtMs,
            long expiresAtMs,
            long updatedAtMs
    ) {
    }

    public enum LockOutcome { GRANTED, REFRESHED, DENIED }

    /**
     * @param lock the caller's lock when granted or refreshed, the current holder's lock when denied
     */
    public record LockGrant(LockOutcome outcome, LockRow lock, int expiredPurged) {
        public static LockGrant granted(LockRow lock, int expiredPurged) {
            return new LockGrant(LockOutcome.GRANTED, lock, expiredPurged);
        }

        public static LockGrant refreshed(LockRow lock, int expiredPurged) {
            return new LockGrant(LockOutcome.REFRESHED, lock, expiredPurged);
        }

        public static LockGrant denied(LockRow holder, int expiredPurged) {
            return new LockGrant(LockOutcome.DENIED, holder, expiredPurged);
        }

        public boolean acquired() {
            return outcome != LockOutcome.DENIED;
        }
    }
}
