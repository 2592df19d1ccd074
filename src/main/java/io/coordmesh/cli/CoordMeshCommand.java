package io.coordmesh.cli;

import io.coordmesh.audit.AuditQuery;
import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.handoff.HandoffService;
import io.coordmesh.liveness.LivenessMonitor;
import io.coordmesh.lock.LockManager;
import io.coordmesh.memory.MemoryService;
import io.coordmesh.model.SessionStatus;
import io.coordmesh.model.TaskStatus;
import io.coordmesh.policy.PolicyDeniedException;
import io.coordmesh.queue.WorkQueue;
import io.coordmesh.runtime.CoordinationRuntime;
import io.coordmesh.storage.TaskQueueStore;
import io.coordmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

@Command(
        name = "coordmesh",
        mixinStandardHelpOptions = true,
        description = "Agent coordination engine CLI",
        subcommands = {
                CoordMeshCommand.InitCommand.class,
                CoordMeshCommand.AcquireLockCommand.class,
                CoordMeshCommand.ExtendLockCommand.class,
                CoordMeshCommand.ReleaseLockCommand.class,
                CoordMeshCommand.CheckLocksCommand.class,
                CoordMeshCommand.SubmitTaskCommand.class,
                CoordMeshCommand.ClaimTaskCommand.class,
                CoordMeshCommand.CompleteTaskCommand.class,
                CoordMeshCommand.GetTaskCommand.class,
                CoordMeshCommand.ListPendingCommand.class,
                CoordMeshCommand.MyTasksCommand.class,
                CoordMeshCommand.CancelTaskCommand.class,
                CoordMeshCommand.ResubmitTaskCommand.class,
                CoordMeshCommand.CheckGuardrailsCommand.class,
                CoordMeshCommand.ViolationsCommand.class,
                CoordMeshCommand.PatternsCommand.class,
                CoordMeshCommand.CheckPolicyCommand.class,
                CoordMeshCommand.CheckNetworkCommand.class,
                CoordMeshCommand.GetProfileCommand.class,
                CoordMeshCommand.AssignProfileCommand.class,
                CoordMeshCommand.ProfilesCommand.class,
                CoordMeshCommand.RegisterSessionCommand.class,
                CoordMeshCommand.HeartbeatCommand.class,
                CoordMeshCommand.SetStatusCommand.class,
                CoordMeshCommand.DiscoverAgentsCommand.class,
                CoordMeshCommand.ReapDeadAgentsCommand.class,
                CoordMeshCommand.WriteHandoffCommand.class,
                CoordMeshCommand.ReadHandoffCommand.class,
                CoordMeshCommand.RememberCommand.class,
                CoordMeshCommand.RecallCommand.class,
                CoordMeshCommand.QueryAuditCommand.class,
                CoordMeshCommand.AuditRetentionCommand.class,
                CoordMeshCommand.ConflictsCommand.class,
                CoordMeshCommand.ReloadSettingsCommand.class,
                CoordMeshCommand.StatsCommand.class,
                CoordMeshCommand.SchemaMigrationsCommand.class
        }
)
public final class CoordMeshCommand implements Runnable {
    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        out().println("Use subcommands: init | acquire-lock | extend-lock | release-lock | check-locks | submit-task"
                + " | claim-task | complete-task | get-task | list-pending | my-tasks | cancel-task | resubmit-task"
                + " | check-guardrails | violations | patterns | check-policy | check-network | get-profile"
                + " | assign-profile | profiles | register-session | heartbeat | set-status | discover-agents"
                + " | reap-dead-agents | write-handoff | read-handoff | remember | recall | query-audit | audit-retention | conflicts | reload-settings | stats"
                + " | schema-migrations");
        out().flush();
    }

    CoordinationRuntime runtime() {
        return new CoordinationRuntime(CoordMeshConfig.fromRoot(root, namespace));
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    /**
     * Runs one operation against a fresh runtime, prints its result document and maps failure to exit code 1.
     */
    <T> int execute(Function<CoordinationRuntime, T> operation, Predicate<T> succeeded) {
        try (CoordinationRuntime runtime = runtime()) {
            runtime.init();
            T result;
            try {
                result = operation.apply(runtime);
            } catch (PolicyDeniedException e) {
                Map<String, Object> denial = new LinkedHashMap<>();
                denial.put("success", false);
                denial.put("reason", "policy_denied");
                denial.put("action", e.action());
                denial.put("decision", e.decision());
                print(denial);
                return 1;
            }
            print(result);
            return succeeded.test(result) ? 0 : 1;
        }
    }

    void print(Object document) {
        out().println(Jsons.toJson(document));
        out().flush();
    }

    static String readText(String inline, String file) {
        if (file == null || file.isBlank()) {
            return inline;
        }
        try {
            return Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read file: " + file, e);
        }
    }

    static List<TaskStatus> parseStatuses(List<String> raw) {
        List<TaskStatus> out = new ArrayList<>();
        if (raw != null) {
            for (String s : raw) {
                out.add(TaskStatus.fromString(s));
            }
        }
        return out;
    }

    static Map<String, Object> notFound(String key, String value, String reason) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("found", false);
        out.put(key, value);
        out.put("reason", reason);
        return out;
    }

    @Command(name = "init", description = "Initialize the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            return parent.execute(rt -> {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("initialized", true);
                out.put("root", rt.config().rootDir().toString());
                out.put("namespace", rt.config().namespace());
                out.put("db", rt.config().dbFile().toString());
                return out;
            }, out -> true);
        }
    }

    @Command(name = "acquire-lock", description = "Acquire or refresh a leased lock on a resource key")
    static final class AcquireLockCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--key"}, required = true, description = "Resource key, e.g. a file path")
        String key;

        @Option(names = {"--holder"}, required = true, description = "Holder agent id")
        String holder;

        @Option(names = {"--holder-type"}, description = "Holder agent type")
        String holderType;

        @Option(names = {"--session"}, description = "Holder session id")
        String session;

        @Option(names = {"--reason"}, description = "Why the lock is taken")
        String reason;

        @Option(names = {"--ttl-ms"}, description = "Lease length; defaults to the configured lock TTL")
        Long ttlMs;

        @Override
        public Integer call() {
            LockManager.AcquireRequest request = new LockManager.AcquireRequest(
                    key, holder, holderType, session, reason, Map.of(), ttlMs);
            return parent.execute(rt -> rt.acquireLock(request), LockManager.AcquireOutcome::acquired);
        }
    }

    @Command(name = "extend-lock", description = "Extend a lock the holder already owns")
    static final class ExtendLockCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--key"}, required = true, description = "Resource key")
        String key;

        @Option(names = {"--holder"}, required = true, description = "Holder agent id")
        String holder;

        @Option(names = {"--ttl-ms"}, description = "New lease length from now")
        Long ttlMs;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.extendLock(key, holder, ttlMs), LockManager.AcquireOutcome::acquired);
        }
    }

    @Command(name = "release-lock", description = "Release a lock held by the caller")
    static final class ReleaseLockCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--key"}, required = true, description = "Resource key")
        String key;

        @Option(names = {"--holder"}, required = true, description = "Holder agent id")
        String holder;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.releaseLock(key, holder), LockManager.ReleaseOutcome::released);
        }
    }

    @Command(name = "check-locks", description = "List live locks")
    static final class CheckLocksCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--key"}, split = ",", description = "Restrict to these resource keys")
        List<String> keys;

        @Option(names = {"--holder"}, description = "Restrict to one holder")
        String holder;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.checkLocks(agent, keys, holder), out -> true);
        }
    }

    @Command(name = "submit-task", description = "Submit a task to the work queue")
    static final class SubmitTaskCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--type"}, required = true, description = "Task type")
        String type;

        @Option(names = {"--description"}, defaultValue = "", description = "Task description")
        String description;

        @Option(names = {"--input"}, description = "Input payload")
        String input;

        @Option(names = {"--input-file"}, description = "Read the input payload from a file")
        String inputFile;

        @Option(names = {"--priority"}, description = "1 (highest) to 10 (lowest)")
        Integer priority;

        @Option(names = {"--depends-on"}, split = ",", description = "Task ids that must complete first")
        List<String> dependsOn;

        @Option(names = {"--deadline-ms"}, description = "Advisory deadline, epoch millis")
        Long deadlineMs;

        @Option(names = {"--max-attempts"}, description = "Attempts allowed across resubmissions")
        Integer maxAttempts;

        @Option(names = {"--submitted-by"}, description = "Submitting agent id")
        String submittedBy;

        @Override
        public Integer call() {
            WorkQueue.SubmitRequest request = new WorkQueue.SubmitRequest(
                    type,
                    description,
                    readText(input, inputFile),
                    priority,
                    dependsOn == null ? List.of() : dependsOn,
                    deadlineMs,
                    maxAttempts,
                    submittedBy
            );
            return parent.execute(rt -> rt.submitTask(request), WorkQueue.SubmitOutcome::submitted);
        }
    }

    @Command(name = "claim-task", description = "Claim the next eligible task")
    static final class ClaimTaskCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Requesting agent id")
        String agent;

        @Option(names = {"--type"}, split = ",", description = "Accepted task types")
        List<String> types;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.claimTask(agent, types), WorkQueue.ClaimOutcome::claimed);
        }
    }

    @Command(name = "complete-task", description = "Complete or fail a claimed task")
    static final class CompleteTaskCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--agent"}, required = true, description = "Claimant agent id")
        String agent;

        @Option(names = {"--failed"}, description = "Report failure instead of success")
        boolean failed;

        @Option(names = {"--result"}, description = "Result payload")
        String result;

        @Option(names = {"--result-file"}, description = "Read the result payload from a file")
        String resultFile;

        @Option(names = {"--error"}, description = "Error message for a failed task")
        String error;

        @Option(names = {"--trust-level"}, description = "Trust level for the guardrail check")
        Integer trustLevel;

        @Option(names = {"--file"}, split = ",", description = "Files the result touches")
        List<String> files;

        @Override
        public Integer call() {
            WorkQueue.CompleteRequest request = new WorkQueue.CompleteRequest(
                    taskId,
                    agent,
                    !failed,
                    readText(result, resultFile),
                    error,
                    trustLevel,
                    files
            );
            return parent.execute(rt -> rt.completeTask(request), WorkQueue.CompleteOutcome::accepted);
        }
    }

    @Command(name = "get-task", description = "Show one task")
    static final class GetTaskCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            return parent.execute(rt -> {
                Optional<TaskQueueStore.TaskRow> task = rt.getTask(agent, taskId);
                return task.<Object>map(t -> t).orElseGet(() -> notFound("task_id", taskId, "task_not_found"));
            }, out -> out instanceof TaskQueueStore.TaskRow);
        }
    }

    @Command(name = "list-pending", description = "List pending tasks in claim order")
    static final class ListPendingCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--type"}, split = ",", description = "Restrict to these task types")
        List<String> types;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.listPending(agent, types, limit), out -> true);
        }
    }

    @Command(name = "my-tasks", description = "List tasks claimed by an agent")
    static final class MyTasksCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Claimant agent id")
        String agent;

        @Option(names = {"--status"}, split = ",", description = "Restrict to these statuses")
        List<String> statuses;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            List<TaskStatus> parsed = parseStatuses(statuses);
            return parent.execute(rt -> rt.myTasks(agent, parsed, limit), out -> true);
        }
    }

    @Command(name = "cancel-task", description = "Cancel a pending or claimed task")
    static final class CancelTaskCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--reason"}, defaultValue = "cancelled_by_operator", description = "Cancellation reason")
        String reason;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.cancelTask(agent, taskId, reason), TaskQueueStore.CancelResult::cancelled);
        }
    }

    @Command(name = "resubmit-task", description = "Queue a new attempt of a failed task")
    static final class ResubmitTaskCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Failed task id")
        String taskId;

        @Option(names = {"--agent"}, description = "Requesting agent id")
        String agent;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.resubmitTask(agent, taskId), TaskQueueStore.ResubmitResult::resubmitted);
        }
    }

    @Command(name = "check-guardrails", description = "Check operation text against destructive-operation patterns")
    static final class CheckGuardrailsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--text"}, description = "Operation text")
        String text;

        @Option(names = {"--text-file"}, description = "Read the operation text from a file")
        String textFile;

        @Option(names = {"--trust-level"}, description = "Trust level; defaults to the agent's profile")
        Integer trustLevel;

        @Option(names = {"--file"}, split = ",", description = "File paths touched by the operation")
        List<String> files;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            String operationText = readText(text, textFile);
            return parent.execute(rt -> rt.checkGuardrails(agent, operationText, trustLevel, files),
                    verdict -> verdict.safe());
        }
    }

    @Command(name = "violations", description = "List recorded guardrail matches")
    static final class ViolationsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, description = "Restrict to one agent")
        String agent;

        @Option(names = {"--blocked-only"}, description = "Only matches that blocked the operation")
        boolean blockedOnly;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.violations(agent, blockedOnly, limit), out -> true);
        }
    }

    @Command(name = "patterns", description = "List the active guardrail patterns")
    static final class PatternsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            return parent.execute(CoordinationRuntime::guardrailPatterns, out -> true);
        }
    }

    @Command(name = "check-policy", description = "Evaluate an action with the active policy engine")
    static final class CheckPolicyCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--agent-type"}, description = "Agent type; defaults to the latest session's")
        String agentType;

        @Option(names = {"--action"}, required = true, description = "Action name")
        String action;

        @Option(names = {"--resource"}, description = "Resource, e.g. a domain for network_access")
        String resource;

        @Option(names = {"--context"}, description = "Context as a JSON object")
        String contextJson;

        @Override
        public Integer call() {
            Map<String, Object> context = contextJson == null || contextJson.isBlank()
                    ? Map.of()
                    : Jsons.readObjectMap(contextJson);
            return parent.execute(rt -> rt.checkPolicy(agent, agentType, action, resource, context),
                    decision -> decision.allowed());
        }
    }

    @Command(name = "check-network", description = "Check whether an agent may reach a domain")
    static final class CheckNetworkCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--agent-type"}, description = "Agent type")
        String agentType;

        @Option(names = {"--domain"}, required = true, description = "Domain or URL")
        String domain;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.checkNetwork(agent, agentType, domain), decision -> decision.allowed());
        }
    }

    @Command(name = "get-profile", description = "Resolve an agent's profile and trust level")
    static final class GetProfileCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--agent-type"}, description = "Agent type")
        String agentType;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.getProfile(agent, agentType), out -> true);
        }
    }

    @Command(name = "assign-profile", description = "Assign a named profile to an agent")
    static final class AssignProfileCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--profile"}, required = true, description = "Profile name")
        String profile;

        @Option(names = {"--assigned-by"}, defaultValue = "operator", description = "Who makes the assignment")
        String assignedBy;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.assignProfile(agent, profile, assignedBy),
                    CoordinationRuntime.AssignOutcome::assigned);
        }
    }

    @Command(name = "profiles", description = "List stored profiles")
    static final class ProfilesCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            return parent.execute(CoordinationRuntime::listProfiles, out -> true);
        }
    }

    @Command(name = "register-session", description = "Register or re-register an agent session")
    static final class RegisterSessionCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--agent-type"}, description = "Agent type")
        String agentType;

        @Option(names = {"--session"}, description = "Session id; generated when absent")
        String session;

        @Option(names = {"--capability"}, split = ",", description = "Advertised capabilities")
        List<String> capabilities;

        @Option(names = {"--current-task"}, description = "Task the agent is working on")
        String currentTask;

        @Option(names = {"--metadata"}, description = "Metadata as a JSON object")
        String metadataJson;

        @Override
        public Integer call() {
            Map<String, Object> metadata = metadataJson == null || metadataJson.isBlank()
                    ? Map.of()
                    : Jsons.readObjectMap(metadataJson);
            LivenessMonitor.RegisterRequest request = new LivenessMonitor.RegisterRequest(
                    agent, agentType, session, capabilities == null ? List.of() : capabilities, currentTask, metadata);
            return parent.execute(rt -> rt.registerSession(request), LivenessMonitor.RegisterOutcome::ok);
        }
    }

    @Command(name = "heartbeat", description = "Refresh a session's heartbeat")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--session"}, required = true, description = "Session id")
        String session;

        @Option(names = {"--current-task"}, description = "Task the agent is working on")
        String currentTask;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.heartbeat(session, currentTask), LivenessMonitor.RegisterOutcome::ok);
        }
    }

    @Command(name = "set-status", description = "Move a session between active and idle")
    static final class SetStatusCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--session"}, required = true, description = "Session id")
        String session;

        @Option(names = {"--status"}, required = true, description = "active|idle")
        String status;

        @Override
        public Integer call() {
            SessionStatus parsed = SessionStatus.fromString(status);
            return parent.execute(rt -> rt.setSessionStatus(session, parsed), LivenessMonitor.RegisterOutcome::ok);
        }
    }

    @Command(name = "discover-agents", description = "List live sessions, optionally by capability")
    static final class DiscoverAgentsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--capability"}, description = "Required capability")
        String capability;

        @Option(names = {"--status"}, description = "active|idle|disconnected")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            SessionStatus parsed = status == null ? null : SessionStatus.fromString(status);
            return parent.execute(rt -> rt.discoverAgents(agent, capability, parsed, limit), out -> true);
        }
    }

    @Command(name = "reap-dead-agents", description = "Disconnect stale sessions and release their locks")
    static final class ReapDeadAgentsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--threshold-minutes"}, description = "Staleness threshold; defaults to the configured one")
        Long thresholdMinutes;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            Long thresholdMs = thresholdMinutes == null ? null : TimeUnit.MINUTES.toMillis(thresholdMinutes);
            return parent.execute(rt -> rt.reapDeadAgents(agent, thresholdMs), out -> true);
        }
    }

    @Command(name = "write-handoff", description = "Leave a handoff document for the next session")
    static final class WriteHandoffCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Writing agent id")
        String agent;

        @Option(names = {"--session"}, description = "Session the handoff closes")
        String session;

        @Option(names = {"--summary"}, description = "What happened in the session")
        String summary;

        @Option(names = {"--summary-file"}, description = "Read the summary from a file")
        String summaryFile;

        @Option(names = {"--completed"}, split = ";", description = "Completed work items, ';'-separated")
        List<String> completed;

        @Option(names = {"--in-progress"}, split = ";", description = "Unfinished work items")
        List<String> inProgress;

        @Option(names = {"--decision"}, split = ";", description = "Decisions taken")
        List<String> decisions;

        @Option(names = {"--next-step"}, split = ";", description = "Suggested next steps")
        List<String> nextSteps;

        @Option(names = {"--file"}, split = ",", description = "Relevant file paths")
        List<String> files;

        @Override
        public Integer call() {
            HandoffService.WriteRequest request = new HandoffService.WriteRequest(
                    agent,
                    session,
                    readText(summary, summaryFile),
                    completed,
                    inProgress,
                    decisions,
                    nextSteps,
                    files
            );
            return parent.execute(rt -> rt.writeHandoff(request), HandoffService.WriteOutcome::written);
        }
    }

    @Command(name = "read-handoff", description = "Read the latest handoff documents")
    static final class ReadHandoffCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--for-agent"}, description = "Only handoffs written by this agent")
        String forAgent;

        @Option(names = {"--limit"}, description = "Max handoffs; defaults to the latest one")
        Integer limit;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.readHandoffs(agent, forAgent, limit), out -> true);
        }
    }

    @Command(name = "remember", description = "Store an episodic memory")
    static final class RememberCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--session"}, description = "Session id")
        String session;

        @Option(names = {"--event-type"}, description = "error|success|decision|discovery|optimization")
        String eventType;

        @Option(names = {"--summary"}, required = true, description = "What happened")
        String summary;

        @Option(names = {"--details"}, description = "Details as a JSON object")
        String detailsJson;

        @Option(names = {"--outcome"}, description = "positive|negative|neutral")
        String outcome;

        @Option(names = {"--lesson"}, split = ";", description = "Lessons learned, ';'-separated")
        List<String> lessons;

        @Option(names = {"--tag"}, split = ",", description = "Tags used for recall")
        List<String> tags;

        @Option(names = {"--relevance"}, description = "Initial relevance between 0 and 1")
        Double relevance;

        @Override
        public Integer call() {
            Map<String, Object> details = detailsJson == null || detailsJson.isBlank()
                    ? Map.of()
                    : Jsons.readObjectMap(detailsJson);
            MemoryService.RememberRequest request = new MemoryService.RememberRequest(
                    agent, session, eventType, summary, details, outcome, lessons, tags, relevance);
            return parent.execute(rt -> rt.remember(request), MemoryService.RememberOutcome::stored);
        }
    }

    @Command(name = "recall", description = "Recall memories ranked by decayed relevance")
    static final class RecallCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--for-agent"}, description = "Only memories stored by this agent")
        String forAgent;

        @Option(names = {"--tag"}, split = ",", description = "Match memories carrying any of these tags")
        List<String> tags;

        @Option(names = {"--event-type"}, description = "Event type filter")
        String eventType;

        @Option(names = {"--min-relevance"}, description = "Minimum stored relevance")
        Double minRelevance;

        @Option(names = {"--limit"}, description = "Max memories")
        Integer limit;

        @Option(names = {"--agent"}, description = "Calling agent id")
        String agent;

        @Override
        public Integer call() {
            MemoryService.RecallQuery query = new MemoryService.RecallQuery(forAgent, tags, eventType, minRelevance, limit);
            return parent.execute(rt -> rt.recall(agent, query), out -> true);
        }
    }

    @Command(name = "query-audit", description = "Query audit entries, newest first")
    static final class QueryAuditCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, description = "Restrict to one agent")
        String agent;

        @Option(names = {"--operation"}, description = "Restrict to one operation")
        String operation;

        @Option(names = {"--since-ms"}, description = "Lower bound, epoch millis")
        Long sinceMs;

        @Option(names = {"--until-ms"}, description = "Upper bound, epoch millis")
        Long untilMs;

        @Option(names = {"--success"}, arity = "1", description = "true|false")
        Boolean success;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            AuditQuery query = new AuditQuery(agent, operation, sinceMs, untilMs, success, limit);
            return parent.execute(rt -> rt.queryAudit(null, query), out -> true);
        }
    }

    @Command(name = "audit-retention", description = "Delete audit entries older than the retention horizon")
    static final class AuditRetentionCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--days"}, description = "Retention horizon; defaults to the configured one")
        Integer days;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.auditRetention(days), out -> true);
        }
    }

    @Command(name = "conflicts", description = "Show recorded lock and claim conflicts")
    static final class ConflictsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--type"}, description = "lock_denied|claim_race|stale_complete")
        String type;

        @Option(names = {"--since-hours"}, defaultValue = "24", description = "Look-back window")
        long sinceHours;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            return parent.execute(rt -> {
                long sinceMs = System.currentTimeMillis() - TimeUnit.HOURS.toMillis(Math.max(0L, sinceHours));
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("counts", rt.conflictCounts(sinceMs));
                out.put("conflicts", rt.conflicts(type, sinceMs, limit));
                return out;
            }, out -> true);
        }
    }

    @Command(name = "reload-settings", description = "Force reload coordmesh-settings.json and print effective values")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            return parent.execute(CoordinationRuntime::reloadSettings, out -> true);
        }
    }

    @Command(name = "stats", description = "Show queue, lock and audit counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            return parent.execute(CoordinationRuntime::stats, out -> true);
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            return parent.execute(rt -> rt.schemaMigrations(limit), out -> true);
        }
    }
}
