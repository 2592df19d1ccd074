package io.coordmesh.queue;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.guardrail.GuardrailEngine;
import io.coordmesh.guardrail.GuardrailVerdict;
import io.coordmesh.model.TaskStatus;
import io.coordmesh.policy.PrincipalResolver;
import io.coordmesh.storage.TaskQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Dependency-aware priority queue. Claims are exclusive; completion is accepted only from the current claimant and,
 * on success, only when the result passes the guardrail check at the claimant's trust level. Failed tasks are
 * terminal; {@link #resubmit(String, String)} is the only way back into the queue.
 */
public final class WorkQueue {
    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);

    public static final String REASON_NO_TASKS = "no_tasks_available";
    public static final String REASON_NOT_CLAIMANT = "task_not_found_or_not_claimed_by_agent";
    public static final String REASON_GUARDRAIL = "guardrail_violation";
    public static final String REASON_MISSING_TYPE = "missing_task_type";
    public static final String REASON_INVALID_PRIORITY = "invalid_priority";
    public static final String REASON_INVALID_MAX_ATTEMPTS = "invalid_max_attempts";
    public static final String REASON_MISSING_REQUESTER = "missing_requester";

    private final TaskQueueStore store;
    private final GuardrailEngine guardrails;
    private final PrincipalResolver principals;
    private final Clock clock;
    private volatile Settings settings;

    public WorkQueue(TaskQueueStore store, GuardrailEngine guardrails, PrincipalResolver principals) {
        this(store, guardrails, principals, Clock.systemUTC());
    }

    public WorkQueue(TaskQueueStore store, GuardrailEngine guardrails, PrincipalResolver principals, Clock clock) {
        this.store = store;
        this.guardrails = guardrails;
        this.principals = principals;
        this.clock = clock;
        this.settings = Settings.defaults();
    }

    public void applySettings(Settings settings) {
        this.settings = settings;
    }

    public SubmitOutcome submit(SubmitRequest request) {
        Settings s = settings;
        if (request.taskType() == null || request.taskType().isBlank()) {
            return SubmitOutcome.rejected(REASON_MISSING_TYPE, List.of());
        }
        int priority = request.priority() == null ? s.defaultPriority() : request.priority();
        if (priority < CoordMeshConfig.MIN_TASK_PRIORITY || priority > CoordMeshConfig.MAX_TASK_PRIORITY) {
            return SubmitOutcome.rejected(REASON_INVALID_PRIORITY, List.of());
        }
        int maxAttempts = request.maxAttempts() == null ? s.defaultMaxAttempts() : request.maxAttempts();
        if (maxAttempts < 1) {
            return SubmitOutcome.rejected(REASON_INVALID_MAX_ATTEMPTS, List.of());
        }
        String taskId = "tsk_" + UUID.randomUUID();
        TaskQueueStore.SubmitResult result = store.submit(new TaskQueueStore.TaskSubmission(
                taskId,
                request.taskType().trim(),
                request.description(),
                request.inputPayload(),
                priority,
                request.dependencyIds() == null ? List.of() : request.dependencyIds(),
                maxAttempts,
                request.deadlineMs(),
                request.submittedBy(),
                clock.millis()
        ));
        if (!result.submitted()) {
            log.debug("Task submission rejected: type={} reason={} offending={}",
                    request.taskType(), result.reason(), result.offendingTaskIds());
            return SubmitOutcome.rejected(result.reason(), result.offendingTaskIds());
        }
        log.info("Task submitted: id={} type={} priority={}", taskId, request.taskType(), priority);
        return new SubmitOutcome(true, taskId, null, List.of());
    }

    public ClaimOutcome claim(String requester, List<String> acceptedTypes) {
        if (requester == null || requester.isBlank()) {
            return new ClaimOutcome(false, null, REASON_MISSING_REQUESTER, 0);
        }
        TaskQueueStore.ClaimResult result = store.claim(requester.trim(), acceptedTypes, clock.millis(),
                settings.claimMaxRetries());
        if (!result.claimed()) {
            return new ClaimOutcome(false, null, REASON_NO_TASKS, result.racesLost());
        }
        log.info("Task claimed: id={} by={} attempt={}", result.task().taskId(), result.task().claimedBy(),
                result.task().attemptCount());
        return new ClaimOutcome(true, result.task(), null, result.racesLost());
    }

    public CompleteOutcome complete(CompleteRequest request) {
        String claimant = request.claimant() == null ? null : request.claimant().trim();
        Optional<TaskQueueStore.TaskRow> task = request.taskId() == null || claimant == null
                ? Optional.empty()
                : store.getTask(request.taskId());
        if (task.isEmpty()
                || !TaskStatus.CLAIMED.name().equals(task.get().status())
                || !claimant.equals(task.get().claimedBy())) {
            return new CompleteOutcome(false, request.taskId(), null, REASON_NOT_CLAIMANT, null);
        }
        GuardrailVerdict verdict = null;
        if (request.success()) {
            int trust = request.trustLevel() != null
                    ? request.trustLevel()
                    : principals.resolve(claimant, null).trustLevel();
            verdict = guardrails.check(new GuardrailEngine.GuardrailRequest(
                    request.resultPayload(),
                    trust,
                    request.filePaths(),
                    claimant,
                    Map.of("task_id", request.taskId(), "operation", "complete_task")
            ));
            if (!verdict.safe()) {
                log.info("Task completion rejected by guardrails: id={} claimant={}", request.taskId(), claimant);
                return new CompleteOutcome(false, request.taskId(), TaskStatus.CLAIMED.name(), REASON_GUARDRAIL, verdict);
            }
        }
        TaskQueueStore.CompleteOutcome outcome = store.complete(
                request.taskId(),
                claimant,
                request.success(),
                request.success() ? request.resultPayload() : null,
                request.success() ? null : request.errorMessage(),
                clock.millis()
        );
        if (outcome == TaskQueueStore.CompleteOutcome.NOT_CLAIMED_BY_AGENT) {
            return new CompleteOutcome(false, request.taskId(), null, REASON_NOT_CLAIMANT, verdict);
        }
        String status = outcome == TaskQueueStore.CompleteOutcome.COMPLETED
                ? TaskStatus.COMPLETED.name()
                : TaskStatus.FAILED.name();
        log.info("Task finished: id={} status={}", request.taskId(), status);
        return new CompleteOutcome(true, request.taskId(), status, null, verdict);
    }

    public TaskQueueStore.CancelResult cancel(String taskId, String reason) {
        TaskQueueStore.CancelResult result = store.cancel(taskId, reason, clock.millis());
        if (result.cancelled()) {
            log.info("Task cancelled: id={} reason={}", taskId, reason);
        }
        return result;
    }

    public TaskQueueStore.ResubmitResult resubmit(String taskId, String requestedBy) {
        TaskQueueStore.ResubmitResult result = store.resubmit(taskId, "tsk_" + UUID.randomUUID(), requestedBy,
                clock.millis());
        if (result.resubmitted()) {
            log.info("Task resubmitted: source={} new={} attempts={}/{}",
                    taskId, result.task().taskId(), result.task().attemptCount(), result.task().maxAttempts());
        }
        return result;
    }

    public Optional<TaskQueueStore.TaskRow> getTask(String taskId) {
        return store.getTask(taskId);
    }

    public List<TaskQueueStore.TaskRow> listPending(List<String> taskTypes, int limit) {
        return store.listPending(taskTypes, limit);
    }

    public List<TaskQueueStore.TaskRow> listClaimedBy(String agentId, List<TaskStatus> statuses, int limit) {
        return store.listByClaimant(agentId == null ? null : agentId.trim(), statuses, limit);
    }

    public Map<String, Integer> countByStatus() {
        return store.countByStatus();
    }

    public record Settings(int defaultPriority, int defaultMaxAttempts, int claimMaxRetries) {
        public static Settings defaults() {
            return new Settings(
                    CoordMeshConfig.DEFAULT_TASK_PRIORITY,
                    CoordMeshConfig.DEFAULT_MAX_ATTEMPTS,
                    CoordMeshConfig.DEFAULT_CLAIM_MAX_RETRIES
            );
        }
    }

    public record SubmitRequest(
            String taskType,
            String description,
            String inputPayload,
            Integer priority,
            List<String> dependencyIds,
            Long deadlineMs,
            Integer maxAttempts,
            String submittedBy
    ) {
        public static SubmitRequest of(String taskType, Integer priority, List<String> dependencyIds) {
            return new SubmitRequest(taskType, "", null, priority, dependencyIds, null, null, null);
        }
    }

    public record CompleteRequest(
            String taskId,
            String claimant,
            boolean success,
            String resultPayload,
            String errorMessage,
            Integer trustLevel,
            List<String> filePaths
    ) {
        public CompleteRequest {
            filePaths = filePaths == null ? List.of() : filePaths;
        }

        public static CompleteRequest succeeded(String taskId, String claimant, String resultPayload) {
            return new CompleteRequest(taskId, claimant, true, resultPayload, null, null, List.of());
        }

        public static CompleteRequest failed(String taskId, String claimant, String errorMessage) {
            return new CompleteRequest(taskId, claimant, false, null, errorMessage, null, List.of());
        }
    }

    public record SubmitOutcome(boolean submitted, String taskId, String reason, List<String> offendingTaskIds) {
        static SubmitOutcome rejected(String reason, List<String> offendingTaskIds) {
            return new SubmitOutcome(false, null, reason, offendingTaskIds);
        }
    }

    public record ClaimOutcome(boolean claimed, TaskQueueStore.TaskRow task, String reason, int racesLost) {
    }

    /**
     * @param status    the task's status after the call, null when the caller is not the claimant
     * @param guardrail the verdict on the result payload when one was checked
     */
    public record CompleteOutcome(
            boolean accepted,
            String taskId,
            String status,
            String reason,
            GuardrailVerdict guardrail
    ) {
    }
}
