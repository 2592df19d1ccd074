package io.coordmesh.storage;

import io.coordmesh.model.TaskStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TaskQueueStore {
    private static final String TASK_COLUMNS = """
            task_id,task_type,description,input_payload,priority,status,claimed_by,claimed_at_ms,attempt_count,
            max_attempts,result_payload,error_message,deadline_ms,submitted_by,resubmitted_from,created_at_ms,
            updated_at_ms,completed_at_ms
            """;

    private final Database database;
    private final ConflictLog conflictLog;

    public TaskQueueStore(Database database) {
        this.database = database;
        this.conflictLog = new ConflictLog(database);
    }

    public SubmitResult submit(TaskSubmission s) {
        List<String> dependencies = distinct(s.dependencyIds());
        if (dependencies.contains(s.taskId())) {
            return SubmitResult.rejected("self_dependency", List.of(s.taskId()));
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                List<String> missing = missingTasks(c, dependencies);
                if (!missing.isEmpty()) {
                    c.rollback();
                    return SubmitResult.rejected("unknown_dependency", missing);
                }
                insertTask(c, s);
                insertDependencies(c, s.taskId(), dependencies, s.nowMs());
                c.commit();
                return SubmitResult.accepted(s.taskId());
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to submit task", e);
        }
    }

    /**
     * Claims the most urgent eligible task. SQLite has no SKIP LOCKED, so the pick is a compare-and-swap on
     * {@code status=PENDING}; a lost race is recorded and the selection repeated.
     */
    public ClaimResult claim(String requester, List<String> acceptedTypes, long nowMs, int maxRounds) {
        List<String> types = distinct(acceptedTypes);
        StringBuilder select = new StringBuilder("""
                SELECT t.task_id FROM tasks t
                WHERE t.status=?
                  AND NOT EXISTS (
                      SELECT 1 FROM task_dependencies d
                      JOIN tasks dep ON dep.task_id=d.depends_on_task_id
                      WHERE d.task_id=t.task_id AND dep.status<>?
                  )
                """);
        if (!types.isEmpty()) {
            select.append(" AND t.task_type IN (").append(SqlSupport.placeholders(types.size())).append(')');
        }
        select.append(" ORDER BY t.priority ASC, t.created_at_ms ASC, t.rowid ASC LIMIT 1");
        String cas = """
                UPDATE tasks
                SET status=?, claimed_by=?, claimed_at_ms=?, attempt_count=attempt_count+1, updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        int races = 0;
        int rounds = Math.max(1, maxRounds);
        try (Connection c = database.openConnection()) {
            for (int round = 0; round < rounds; round++) {
                c.setAutoCommit(false);
                try (PreparedStatement psSelect = c.prepareStatement(select.toString());
                     PreparedStatement psCas = c.prepareStatement(cas)) {
                    int idx = 1;
                    psSelect.setString(idx++, TaskStatus.PENDING.name());
                    psSelect.setString(idx++, TaskStatus.COMPLETED.name());
                    for (String type : types) {
                        psSelect.setString(idx++, type);
                    }
                    String candidate;
                    try (ResultSet rs = psSelect.executeQuery()) {
                        candidate = rs.next() ? rs.getString("task_id") : null;
                    }
                    if (candidate == null) {
                        c.commit();
                        return ClaimResult.empty(races);
                    }
                    psCas.setString(1, TaskStatus.CLAIMED.name());
                    psCas.setString(2, requester);
                    psCas.setLong(3, nowMs);
                    psCas.setLong(4, nowMs);
                    psCas.setString(5, candidate);
                    psCas.setString(6, TaskStatus.PENDING.name());
                    if (psCas.executeUpdate() == 1) {
                        TaskRow row = readTask(c, candidate).orElseThrow();
                        c.commit();
                        return ClaimResult.claimed(row, races);
                    }
                    races++;
                    conflictLog.record(c, ConflictLog.CLAIM_RACE, candidate, requester,
                            TaskStatus.PENDING.name(), readStatus(c, candidate), nowMs);
                    c.commit();
                } catch (Exception e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            }
            return ClaimResult.empty(races);
        } catch (Exception e) {
            throw new RuntimeException("Failed to claim task for: " + requester, e);
        }
    }

    public CompleteOutcome complete(String taskId, String claimant, boolean success, String resultPayload,
                                    String errorMessage, long nowMs) {
        String sql = """
                UPDATE tasks
                SET status=?, result_payload=?, error_message=?, completed_at_ms=?, updated_at_ms=?
                WHERE task_id=? AND claimed_by=? AND status=?
                """;
        TaskStatus target = success ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, target.name());
                ps.setString(2, resultPayload);
                ps.setString(3, errorMessage);
                ps.setLong(4, nowMs);
                ps.setLong(5, nowMs);
                ps.setString(6, taskId);
                ps.setString(7, claimant);
                ps.setString(8, TaskStatus.CLAIMED.name());
                if (ps.executeUpdate() == 0) {
                    String actual = readStatus(c, taskId);
                    if (actual != null) {
                        conflictLog.record(c, ConflictLog.STALE_COMPLETE, taskId, claimant,
                                TaskStatus.CLAIMED.name() + ":" + claimant,
                                actual + ":" + readClaimant(c, taskId), nowMs);
                    }
                    c.commit();
                    return CompleteOutcome.NOT_CLAIMED_BY_AGENT;
                }
                c.commit();
                return success ? CompleteOutcome.COMPLETED : CompleteOutcome.FAILED;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to complete task: " + taskId, e);
        }
    }

    public CancelResult cancel(String taskId, String reason, long nowMs) {
        String sql = """
                UPDATE tasks
                SET status=?, error_message=?, completed_at_ms=?, updated_at_ms=?
                WHERE task_id=? AND status IN (?,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, TaskStatus.CANCELLED.name());
                ps.setString(2, reason == null || reason.isBlank() ? "cancelled" : reason);
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.setString(5, taskId);
                ps.setString(6, TaskStatus.PENDING.name());
                ps.setString(7, TaskStatus.CLAIMED.name());
                if (ps.executeUpdate() == 1) {
                    c.commit();
                    return new CancelResult(taskId, true, "cancelled");
                }
                String actual = readStatus(c, taskId);
                c.commit();
                return new CancelResult(taskId, false, actual == null ? "task_not_found" : "terminal_state:" + actual);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to cancel task: " + taskId, e);
        }
    }

    /**
     * Copies a failed task into a fresh pending task. Attempts carry over, so the chain stops at max attempts;
     * a failed task can be replaced at most once. Pending dependents of the failed task are repointed at the
     * replacement, so they become claimable once it completes.
     */
    public ResubmitResult resubmit(String sourceTaskId, String newTaskId, String requestedBy, long nowMs) {
        String insert = """
                INSERT INTO tasks(task_id,task_type,description,input_payload,priority,status,attempt_count,max_attempts,
                                  deadline_ms,submitted_by,resubmitted_from,created_at_ms,updated_at_ms)
                SELECT ?,task_type,description,input_payload,priority,?,attempt_count,max_attempts,
                       deadline_ms,?,task_id,?,?
                FROM tasks src
                WHERE src.task_id=? AND src.status=? AND src.attempt_count<src.max_attempts
                  AND NOT EXISTS (SELECT 1 FROM tasks r WHERE r.resubmitted_from=src.task_id)
                """;
        String copyDeps = """
                INSERT INTO task_dependencies(task_id,depends_on_task_id,created_at_ms)
                SELECT ?,depends_on_task_id,? FROM task_dependencies WHERE task_id=?
                """;
        String repoint = """
                UPDATE task_dependencies SET depends_on_task_id=?
                WHERE depends_on_task_id=?
                  AND task_id IN (SELECT task_id FROM tasks WHERE status=?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psInsert = c.prepareStatement(insert);
                 PreparedStatement psDeps = c.prepareStatement(copyDeps);
                 PreparedStatement psRepoint = c.prepareStatement(repoint)) {
                psInsert.setString(1, newTaskId);
                psInsert.setString(2, TaskStatus.PENDING.name());
                psInsert.setString(3, requestedBy == null ? "" : requestedBy);
                psInsert.setLong(4, nowMs);
                psInsert.setLong(5, nowMs);
                psInsert.setString(6, sourceTaskId);
                psInsert.setString(7, TaskStatus.FAILED.name());
                if (psInsert.executeUpdate() == 0) {
                    ResubmitResult refused = explainResubmitRefusal(c, sourceTaskId);
                    c.commit();
                    return refused;
                }
                psDeps.setString(1, newTaskId);
                psDeps.setLong(2, nowMs);
                psDeps.setString(3, sourceTaskId);
                psDeps.executeUpdate();
                psRepoint.setString(1, newTaskId);
                psRepoint.setString(2, sourceTaskId);
                psRepoint.setString(3, TaskStatus.PENDING.name());
                psRepoint.executeUpdate();
                TaskRow row = readTask(c, newTaskId).orElseThrow();
                c.commit();
                return ResubmitResult.accepted(row);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to resubmit task: " + sourceTaskId, e);
        }
    }

    public Optional<TaskRow> getTask(String taskId) {
        try (Connection c = database.openConnection()) {
            return readTask(c, taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task: " + taskId, e);
        }
    }

    public List<TaskRow> listPending(List<String> taskTypes, int limit) {
        List<String> types = distinct(taskTypes);
        StringBuilder sql = new StringBuilder("SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=?");
        if (!types.isEmpty()) {
            sql.append(" AND task_type IN (").append(SqlSupport.placeholders(types.size())).append(')');
        }
        sql.append(" ORDER BY priority ASC, created_at_ms ASC, rowid ASC LIMIT ?");
        return queryTasks(sql.toString(), ps -> {
            int idx = 1;
            ps.setString(idx++, TaskStatus.PENDING.name());
            for (String type : types) {
                ps.setString(idx++, type);
            }
            ps.setInt(idx, Math.max(1, limit));
        });
    }

    public List<TaskRow> listByClaimant(String claimant, List<TaskStatus> statuses, int limit) {
        List<TaskStatus> filter = statuses == null ? List.of() : statuses;
        StringBuilder sql = new StringBuilder("SELECT " + TASK_COLUMNS + " FROM tasks WHERE claimed_by=?");
        if (!filter.isEmpty()) {
            sql.append(" AND status IN (").append(SqlSupport.placeholders(filter.size())).append(')');
        }
        sql.append(" ORDER BY claimed_at_ms DESC LIMIT ?");
        return queryTasks(sql.toString(), ps -> {
            int idx = 1;
            ps.setString(idx++, claimant);
            for (TaskStatus status : filter) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
        });
    }

    public Map<String, Integer> countByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(1) FROM tasks GROUP BY status ORDER BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getInt(2));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status", e);
        }
    }

    public ConflictLog conflictLog() {
        return conflictLog;
    }

    private ResubmitResult explainResubmitRefusal(Connection c, String sourceTaskId) throws SQLException {
        Optional<TaskRow> source = readTask(c, sourceTaskId);
        if (source.isEmpty()) {
            return ResubmitResult.refused("task_not_found", null);
        }
        TaskRow row = source.get();
        if (!TaskStatus.FAILED.name().equals(row.status())) {
            return ResubmitResult.refused("task_not_failed", null);
        }
        if (row.attemptCount() >= row.maxAttempts()) {
            return ResubmitResult.refused("max_attempts_exhausted", null);
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT task_id FROM tasks WHERE resubmitted_from=? LIMIT 1")) {
            ps.setString(1, sourceTaskId);
            try (ResultSet rs = ps.executeQuery()) {
                return ResubmitResult.refused("already_resubmitted", rs.next() ? rs.getString(1) : null);
            }
        }
    }

    private void insertTask(Connection c, TaskSubmission s) throws SQLException {
        String sql = """
                INSERT INTO tasks(task_id,task_type,description,input_payload,priority,status,attempt_count,max_attempts,
                                  deadline_ms,submitted_by,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,0,?,?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, s.taskId());
            ps.setString(2, s.taskType());
            ps.setString(3, s.description() == null ? "" : s.description());
            ps.setString(4, s.inputPayload());
            ps.setInt(5, s.priority());
            ps.setString(6, TaskStatus.PENDING.name());
            ps.setInt(7, s.maxAttempts());
            SqlSupport.setNullableLong(ps, 8, s.deadlineMs());
            ps.setString(9, s.submittedBy() == null ? "" : s.submittedBy());
            ps.setLong(10, s.nowMs());
            ps.setLong(11, s.nowMs());
            ps.executeUpdate();
        }
    }

    private void insertDependencies(Connection c, String taskId, List<String> dependencies, long nowMs) throws SQLException {
        if (dependencies.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO task_dependencies(task_id,depends_on_task_id,created_at_ms) VALUES(?,?,?)")) {
            for (String dependency : dependencies) {
                ps.setString(1, taskId);
                ps.setString(2, dependency);
                ps.setLong(3, nowMs);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private List<String> missingTasks(Connection c, List<String> taskIds) throws SQLException {
        if (taskIds.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> missing = new LinkedHashSet<>(taskIds);
        String sql = "SELECT task_id FROM tasks WHERE task_id IN (" + SqlSupport.placeholders(taskIds.size()) + ")";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < taskIds.size(); i++) {
                ps.setString(i + 1, taskIds.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    missing.remove(rs.getString(1));
                }
            }
        }
        return List.copyOf(missing);
    }

    private List<TaskRow> queryTasks(String sql, SqlSupport.Binder binder) {
        List<TaskRow> rows = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapTask(rs, List.of()));
                }
            }
            List<TaskRow> out = new ArrayList<>(rows.size());
            for (TaskRow row : rows) {
                out.add(row.withDependencies(readDependencies(c, row.taskId())));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    private Optional<TaskRow> readTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                TaskRow row = mapTask(rs, List.of());
                return Optional.of(row.withDependencies(readDependencies(c, taskId)));
            }
        }
    }

    private List<String> readDependencies(Connection c, String taskId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT depends_on_task_id FROM task_dependencies WHERE task_id=? ORDER BY created_at_ms, depends_on_task_id")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    private String readStatus(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT status FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private String readClaimant(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT claimed_by FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private TaskRow mapTask(ResultSet rs, List<String> dependencies) throws SQLException {
        return new TaskRow(
                rs.getString("task_id"),
                rs.getString("task_type"),
                rs.getString("description"),
                rs.getString("input_payload"),
                rs.getInt("priority"),
                rs.getString("status"),
                rs.getString("claimed_by"),
                SqlSupport.getNullableLong(rs, "claimed_at_ms"),
                rs.getInt("attempt_count"),
                rs.getInt("max_attempts"),
                rs.getString("result_payload"),
                rs.getString("error_message"),
                SqlSupport.getNullableLong(rs, "deadline_ms"),
                rs.getString("submitted_by"),
                rs.getString("resubmitted_from"),
                dependencies,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                SqlSupport.getNullableLong(rs, "completed_at_ms")
        );
    }

    private static List<String> distinct(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return List.copyOf(out);
    }

    public record TaskSubmission(
            String taskId,
            String taskType,
            String description,
            String inputPayload,
            int priority,
            List<String> dependencyIds,
            int maxAttempts,
            Long deadlineMs,
            String submittedBy,
            long nowMs
    ) {
    }

    public record SubmitResult(String taskId, boolean submitted, String reason, List<String> offendingTaskIds) {
        public static SubmitResult accepted(String taskId) {
            return new SubmitResult(taskId, true, null, List.of());
        }

        public static SubmitResult rejected(String reason, List<String> offendingTaskIds) {
            return new SubmitResult(null, false, reason, offendingTaskIds);
        }
    }

    public record TaskRow(
            String taskId,
            String taskType,
            String description,
            String inputPayload,
            int priority,
            String status,
            String claimedBy,
            Long claimedAtMs,
            int attemptCount,
            int maxAttempts,
            String resultPayload,
            String errorMessage,
            Long deadlineMs,
            String submittedBy,
            String resubmittedFrom,
            List<String> dependencyIds,
            long createdAtMs,
            long updatedAtMs,
            Long completedAtMs
    ) {
        TaskRow withDependencies(List<String> dependencies) {
            return new TaskRow(taskId, taskType, description, inputPayload, priority, status, claimedBy, claimedAtMs,
                    attemptCount, maxAttempts, resultPayload, errorMessage, deadlineMs, submittedBy, resubmittedFrom,
                    List.copyOf(dependencies), createdAtMs, updatedAtMs, completedAtMs);
        }
    }

    public record ClaimResult(TaskRow task, int racesLost) {
        public static ClaimResult claimed(TaskRow task, int racesLost) {
            return new ClaimResult(task, racesLost);
        }

        public static ClaimResult empty(int racesLost) {
            return new ClaimResult(null, racesLost);
        }

        public boolean claimed() {
            return task != null;
        }
    }

    public enum CompleteOutcome { COMPLETED, FAILED, NOT_CLAIMED_BY_AGENT }

    public record CancelResult(String taskId, boolean cancelled, String message) {
    }

    public record ResubmitResult(TaskRow task, String reason, String existingTaskId) {
        public static ResubmitResult accepted(TaskRow task) {
            return new ResubmitResult(task, null, null);
        }

        public static ResubmitResult refused(String reason, String existingTaskId) {
            return new ResubmitResult(null, reason, existingTaskId);
        }

        public boolean resubmitted() {
            return task != null;
        }
    }
}
