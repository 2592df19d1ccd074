package io.coordmesh.runtime;

import io.coordmesh.audit.AuditEntry;
import io.coordmesh.audit.AuditQuery;
import io.coordmesh.audit.AuditRecord;
import io.coordmesh.audit.AuditTimer;
import io.coordmesh.audit.AuditTrail;
import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.guardrail.GuardrailEngine;
import io.coordmesh.guardrail.GuardrailPattern;
import io.coordmesh.guardrail.GuardrailVerdict;
import io.coordmesh.handoff.HandoffService;
import io.coordmesh.liveness.LivenessMonitor;
import io.coordmesh.lock.LockManager;
import io.coordmesh.memory.MemoryService;
import io.coordmesh.model.AgentProfile;
import io.coordmesh.model.SessionStatus;
import io.coordmesh.model.TaskStatus;
import io.coordmesh.policy.DeclarativePolicyEngine;
import io.coordmesh.policy.NativePolicyEngine;
import io.coordmesh.policy.NetworkAccessEvaluator;
import io.coordmesh.policy.PolicyDecision;
import io.coordmesh.policy.PolicyDeniedException;
import io.coordmesh.policy.PolicyEngine;
import io.coordmesh.policy.PolicyRequest;
import io.coordmesh.policy.Principal;
import io.coordmesh.policy.PrincipalResolver;
import io.coordmesh.queue.WorkQueue;
import io.coordmesh.storage.AuditStore;
import io.coordmesh.storage.ConflictLog;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.GuardrailStore;
import io.coordmesh.storage.HandoffStore;
import io.coordmesh.storage.LockStore;
import io.coordmesh.storage.MemoryStore;
import io.coordmesh.storage.NetworkPolicyStore;
import io.coordmesh.storage.PolicyRuleStore;
import io.coordmesh.storage.ProfileStore;
import io.coordmesh.storage.SessionStore;
import io.coordmesh.storage.TaskQueueStore;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wires the coordination services over one database and exposes every operation as an audited call.
 * When policy enforcement is on, gated operations are first evaluated by the active policy engine and a denial
 * surfaces as {@link PolicyDeniedException}.
 */
public final class CoordinationRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CoordinationRuntime.class);
    private static final String SYSTEM_ACTOR = "system";
    private static final long CLOSE_FLUSH_TIMEOUT_MS = 5_000L;

    private final CoordMeshConfig config;
    private final Clock clock;
    private final Database database;
    private final LockStore lockStore;
    private final TaskQueueStore taskStore;
    private final SessionStore sessionStore;
    private final GuardrailStore guardrailStore;
    private final ProfileStore profileStore;
    private final NetworkPolicyStore networkPolicyStore;
    private final AuditStore auditStore;
    private final LockManager lockManager;
    private final GuardrailEngine guardrails;
    private final PrincipalResolver principals;
    private final WorkQueue workQueue;
    private final NetworkAccessEvaluator networkAccess;
    private final NativePolicyEngine nativeEngine;
    private final DeclarativePolicyEngine declarativeEngine;
    private final LivenessMonitor liveness;
    private final HandoffService handoffs;
    private final MemoryService memory;
    private volatile AuditTrail auditTrail;
    private volatile long runtimeSettingsFileMtimeMs;
    private volatile long lastRuntimeSettingsCheckMs;
    private volatile RuntimeSettings runtimeSettings;

    public CoordinationRuntime(CoordMeshConfig config) {
        this(config, Clock.systemUTC());
    }

    public CoordinationRuntime(CoordMeshConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.database = new Database(config);
        this.lockStore = new LockStore(database);
        this.taskStore = new TaskQueueStore(database);
        this.sessionStore = new SessionStore(database);
        this.guardrailStore = new GuardrailStore(database);
        this.profileStore = new ProfileStore(database);
        this.networkPolicyStore = new NetworkPolicyStore(database);
        this.auditStore = new AuditStore(database);
        this.lockManager = new LockManager(lockStore, clock);
        this.guardrails = new GuardrailEngine(guardrailStore, clock);
        this.principals = new PrincipalResolver(profileStore, sessionStore);
        this.workQueue = new WorkQueue(taskStore, guardrails, principals, clock);
        this.networkAccess = new NetworkAccessEvaluator(networkPolicyStore, clock);
        this.nativeEngine = new NativePolicyEngine(networkAccess);
        this.declarativeEngine = new DeclarativePolicyEngine(new PolicyRuleStore(database), config.policyRulesFile(),
                clock);
        this.liveness = new LivenessMonitor(sessionStore, lockManager, clock);
        this.handoffs = new HandoffService(new HandoffStore(database), clock);
        this.memory = new MemoryService(new MemoryStore(database), clock);
        this.runtimeSettingsFileMtimeMs = Long.MIN_VALUE;
        this.lastRuntimeSettingsCheckMs = 0L;
        this.runtimeSettings = RuntimeSettings.defaults();
    }

    public void init() {
        database.init();
        RuntimeSettings initial = readSettingsFile(config.settingsFile());
        this.auditTrail = new AuditTrail(auditStore, initial.auditAsync(), initial.auditQueueCapacity(),
                initial.auditOfferTimeoutMs(), clock);
        loadRuntimeSettings(true);
        log.info("Coordination runtime ready: root={} namespace={} policy_engine={}",
                config.rootDir(), config.namespace(), runtimeSettings.policyEngine());
    }

    public CoordMeshConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public AuditTrail auditTrail() {
        return auditTrail;
    }

    public PolicyEngine activePolicyEngine() {
        return PolicyEngine.DECLARATIVE.equals(runtimeSettings.policyEngine()) ? declarativeEngine : nativeEngine;
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadRuntimeSettings(true);
    }

    public RuntimeSettingsView currentSettings() {
        return runtimeSettings.toView();
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = clock.millis();
        long interval = Math.max(1_000L, minIntervalMs);
        if ((nowMs - lastRuntimeSettingsCheckMs) < interval) {
            return new SettingsReloadOutcome(
                    false,
                    runtimeSettingsFileMtimeMs >= 0L,
                    config.settingsFile().toString(),
                    runtimeSettings.toView(),
                    "skip_interval",
                    nowMs,
                    List.of()
            );
        }
        lastRuntimeSettingsCheckMs = nowMs;
        return loadRuntimeSettings(false);
    }

    // Locks

    public LockManager.AcquireOutcome acquireLock(LockManager.AcquireRequest request) {
        return call(request.holderId(), request.holderType(), "acquire_lock",
                doc("resource_key", request.resourceKey(), "ttl_ms", request.ttlMs(), "reason", request.reason(),
                        "session_id", request.sessionId()),
                "acquire_lock", request.resourceKey(),
                () -> lockManager.acquire(request),
                out -> new AuditNote(out.acquired(), out.reason(),
                        doc("outcome", out.outcome(), "holder_id", out.lock() == null ? null : out.lock().holderId(),
                                "expires_at_ms", out.lock() == null ? null : out.lock().expiresAtMs())));
    }

    public LockManager.AcquireOutcome extendLock(String resourceKey, String holderId, Long ttlMs) {
        return call(holderId, null, "extend_lock",
                doc("resource_key", resourceKey, "ttl_ms", ttlMs),
                "acquire_lock", resourceKey,
                () -> lockManager.extend(resourceKey, holderId, ttlMs),
                out -> new AuditNote(out.acquired(), out.reason(),
                        doc("outcome", out.outcome(),
                                "expires_at_ms", out.lock() == null ? null : out.lock().expiresAtMs())));
    }

    public LockManager.ReleaseOutcome releaseLock(String resourceKey, String holderId) {
        return call(holderId, null, "release_lock",
                doc("resource_key", resourceKey),
                "release_lock", resourceKey,
                () -> lockManager.release(resourceKey, holderId),
                out -> new AuditNote(out.released(), out.reason(), doc("released", out.released())));
    }

    public List<LockStore.LockRow> checkLocks(String agentId, List<String> resourceKeys, String holderId) {
        return call(agentId, null, "check_locks",
                doc("resource_keys", resourceKeys, "holder_id", holderId),
                "check_locks", null,
                () -> lockManager.checkLocks(resourceKeys, holderId),
                out -> new AuditNote(true, null, doc("count", out.size())));
    }

    // Work queue

    public WorkQueue.SubmitOutcome submitTask(WorkQueue.SubmitRequest request) {
        return call(request.submittedBy(), null, "submit_task",
                doc("task_type", request.taskType(), "priority", request.priority(),
                        "dependency_ids", request.dependencyIds(), "deadline_ms", request.deadlineMs()),
                "submit_work", request.taskType(),
                () -> workQueue.submit(request),
                out -> new AuditNote(out.submitted(), out.reason(),
                        doc("task_id", out.taskId(), "offending_task_ids", out.offendingTaskIds())));
    }

    public WorkQueue.ClaimOutcome claimTask(String requester, List<String> acceptedTypes) {
        return call(requester, null, "claim_task",
                doc("accepted_types", acceptedTypes),
                "get_work", null,
                () -> workQueue.claim(requester, acceptedTypes),
                out -> new AuditNote(out.claimed(), out.reason(),
                        doc("task_id", out.task() == null ? null : out.task().taskId(),
                                "races_lost", out.racesLost())));
    }

    public WorkQueue.CompleteOutcome completeTask(WorkQueue.CompleteRequest request) {
        return call(request.claimant(), null, "complete_task",
                doc("task_id", request.taskId(), "success", request.success(), "file_paths", request.filePaths(),
                        "error_message", request.errorMessage()),
                "complete_work", request.taskId(),
                () -> workQueue.complete(request),
                out -> new AuditNote(out.accepted(), out.reason(),
                        doc("status", out.status(),
                                "guardrail_safe", out.guardrail() == null ? null : out.guardrail().safe())));
    }

    public Optional<TaskQueueStore.TaskRow> getTask(String agentId, String taskId) {
        return call(agentId, null, "get_task",
                doc("task_id", taskId),
                "get_work", taskId,
                () -> workQueue.getTask(taskId),
                out -> new AuditNote(out.isPresent(), out.isPresent() ? null : "task_not_found",
                        doc("status", out.map(TaskQueueStore.TaskRow::status).orElse(null))));
    }

    public List<TaskQueueStore.TaskRow> listPending(String agentId, List<String> taskTypes, int limit) {
        return call(agentId, null, "list_pending",
                doc("task_types", taskTypes, "limit", limit),
                "get_work", null,
                () -> workQueue.listPending(taskTypes, limit),
                out -> new AuditNote(true, null, doc("count", out.size())));
    }

    public List<TaskQueueStore.TaskRow> myTasks(String agentId, List<TaskStatus> statuses, int limit) {
        return call(agentId, null, "my_tasks",
                doc("statuses", statuses, "limit", limit),
                "get_work", null,
                () -> workQueue.listClaimedBy(agentId, statuses, limit),
                out -> new AuditNote(true, null, doc("count", out.size())));
    }

    public TaskQueueStore.CancelResult cancelTask(String agentId, String taskId, String reason) {
        return call(agentId, null, "cancel_task",
                doc("task_id", taskId, "reason", reason),
                "submit_work", taskId,
                () -> workQueue.cancel(taskId, reason),
                out -> new AuditNote(out.cancelled(), out.cancelled() ? null : out.message(),
                        doc("message", out.message())));
    }

    public TaskQueueStore.ResubmitResult resubmitTask(String agentId, String taskId) {
        return call(agentId, null, "resubmit_task",
                doc("task_id", taskId),
                "submit_work", taskId,
                () -> workQueue.resubmit(taskId, agentId),
                out -> new AuditNote(out.resubmitted(), out.reason(),
                        doc("new_task_id", out.task() == null ? null : out.task().taskId(),
                                "existing_task_id", out.existingTaskId())));
    }

    public Map<String, Integer> taskCounts() {
        return workQueue.countByStatus();
    }

    // Guardrails

    /**
     * @param trustLevel explicit trust level; null resolves the agent's profile
     */
    public GuardrailVerdict checkGuardrails(String agentId, String operationText, Integer trustLevel,
                                            List<String> filePaths) {
        return call(agentId, null, "check_guardrails",
                doc("operation_text", operationText, "trust_level", trustLevel, "file_paths", filePaths),
                "check_guardrails", null,
                () -> {
                    int trust = trustLevel != null ? trustLevel : principals.resolve(agentId, null).trustLevel();
                    return guardrails.check(new GuardrailEngine.GuardrailRequest(
                            operationText, trust, filePaths, agentId, Map.of("operation", "check_guardrails")));
                },
                out -> new AuditNote(true, null,
                        doc("safe", out.safe(), "violations", out.violations().size(), "source", out.source())));
    }

    public List<GuardrailStore.ViolationRow> violations(String agentId, boolean blockedOnly, int limit) {
        return guardrailStore.listViolations(agentId, blockedOnly, limit);
    }

    public List<GuardrailPattern> guardrailPatterns() {
        return guardrails.activePatterns();
    }

    // Policy

    /**
     * Evaluates an action with the active engine. Every decision is audited as {@code policy_decision}.
     */
    public PolicyDecision checkPolicy(String agentId, String agentType, String action, String resource,
                                      Map<String, Object> context) {
        Principal principal = principals.resolve(agentId, agentType);
        return evaluatePolicy(principal, action, resource, context);
    }

    public NetworkAccessEvaluator.NetworkDecision checkNetwork(String agentId, String agentType, String domain) {
        return call(agentId, agentType, "check_network",
                doc("domain", domain),
                null, null,
                () -> {
                    Principal principal = principals.resolve(agentId, agentType);
                    return networkAccess.check(agentId, principal.profile().profileId(), domain);
                },
                out -> new AuditNote(out.allowed(), out.allowed() ? null : out.reason(),
                        doc("reason", out.reason(), "policy_id", out.policyId())));
    }

    public Principal getProfile(String agentId, String agentType) {
        return principals.resolve(agentId, agentType);
    }

    public List<AgentProfile> listProfiles() {
        return profileStore.list();
    }

    public AssignOutcome assignProfile(String agentId, String profileName, String assignedBy) {
        return call(assignedBy == null ? SYSTEM_ACTOR : assignedBy, null, "assign_profile",
                doc("agent_id", agentId, "profile_name", profileName),
                null, null,
                () -> {
                    if (agentId == null || agentId.isBlank()) {
                        return new AssignOutcome(false, agentId, profileName, LivenessMonitor.REASON_MISSING_AGENT);
                    }
                    boolean ok = profileStore.assign(agentId, profileName, assignedBy, clock.millis());
                    return new AssignOutcome(ok, agentId, profileName, ok ? null : "profile_not_found");
                },
                out -> new AuditNote(out.assigned(), out.reason(), doc("assigned", out.assigned())));
    }

    public boolean unassignProfile(String agentId) {
        return profileStore.unassign(agentId);
    }

    // Liveness

    public LivenessMonitor.RegisterOutcome registerSession(LivenessMonitor.RegisterRequest request) {
        return call(request.agentId(), request.agentType(), "register_session",
                doc("session_id", request.sessionId(), "capabilities", request.capabilities(),
                        "current_task", request.currentTask()),
                null, null,
                () -> liveness.register(request),
                out -> new AuditNote(out.ok(), out.reason(),
                        doc("session_id", out.session() == null ? null : out.session().sessionId())));
    }

    public LivenessMonitor.RegisterOutcome heartbeat(String sessionId, String currentTask) {
        Optional<SessionStore.SessionRow> known = liveness.getSession(sessionId);
        String agentId = known.map(SessionStore.SessionRow::agentId).orElse(null);
        return call(agentId, null, "heartbeat",
                doc("session_id", sessionId, "current_task", currentTask),
                null, null,
                () -> liveness.heartbeat(sessionId, currentTask),
                out -> new AuditNote(out.ok(), out.reason(), doc("status", out.ok() ? out.session().status() : null)));
    }

    public LivenessMonitor.RegisterOutcome setSessionStatus(String sessionId, SessionStatus status) {
        return call(null, null, "set_session_status",
                doc("session_id", sessionId, "status", status),
                null, null,
                () -> liveness.setStatus(sessionId, status),
                out -> new AuditNote(out.ok(), out.reason(), doc("status", status)));
    }

    public Optional<SessionStore.SessionRow> getSession(String sessionId) {
        return liveness.getSession(sessionId);
    }

    public List<SessionStore.SessionRow> discoverAgents(String agentId, String capability, SessionStatus status,
                                                        int limit) {
        return call(agentId, null, "discover_agents",
                doc("capability", capability, "status", status, "limit", limit),
                "discover_agents", capability,
                () -> liveness.discover(capability, status, limit),
                out -> new AuditNote(true, null, doc("count", out.size())));
    }

    /**
     * @param thresholdMs staleness threshold; null uses the configured one
     */
    public LivenessMonitor.ReapOutcome reapDeadAgents(String agentId, Long thresholdMs) {
        String actor = agentId == null ? SYSTEM_ACTOR : agentId;
        return call(actor, null, "reap_dead_agents",
                doc("threshold_ms", thresholdMs),
                agentId == null ? null : "cleanup_agents", null,
                () -> thresholdMs == null ? liveness.reap() : liveness.reap(thresholdMs),
                out -> new AuditNote(true, null,
                        doc("agents_cleaned", out.agentsCleaned(), "locks_released", out.locksReleased(),
                                "cleaned_agents", out.cleanedAgents(), "failed_agents", out.failedAgents())));
    }

    public boolean reaperRunning() {
        return liveness.reaperRunning();
    }

    // Handoffs and memory

    public HandoffService.WriteOutcome writeHandoff(HandoffService.WriteRequest request) {
        return call(request.agentId(), null, "write_handoff",
                doc("session_id", request.sessionId(), "summary", request.summary(),
                        "next_steps", request.nextSteps() == null ? 0 : request.nextSteps().size()),
                "write_handoff", request.sessionId(),
                () -> handoffs.write(request),
                out -> new AuditNote(out.written(), out.reason(),
                        doc("handoff_id", out.handoff() == null ? null : out.handoff().handoffId())));
    }

    /**
     * @param forAgent whose handoffs to read; null reads across agents
     */
    public List<HandoffStore.HandoffRow> readHandoffs(String agentId, String forAgent, Integer limit) {
        return call(agentId, null, "read_handoff",
                doc("for_agent", forAgent, "limit", limit),
                "read_handoff", forAgent,
                () -> handoffs.read(forAgent, limit),
                out -> new AuditNote(true, null, doc("count", out.size())));
    }

    public MemoryService.RememberOutcome remember(MemoryService.RememberRequest request) {
        return call(request.agentId(), null, "remember",
                doc("event_type", request.eventType(), "summary", request.summary(), "outcome", request.outcome(),
                        "tags", request.tags()),
                "remember", request.eventType(),
                () -> memory.remember(request),
                out -> new AuditNote(out.stored(), out.reason(),
                        doc("memory_id", out.memoryId(), "action", out.action())));
    }

    public List<MemoryService.RecalledMemory> recall(String agentId, MemoryService.RecallQuery query) {
        return call(agentId, null, "recall",
                doc("for_agent", query.agentId(), "tags", query.tags(), "event_type", query.eventType(),
                        "min_relevance", query.minRelevance(), "limit", query.limit()),
                "recall", query.eventType(),
                () -> memory.recall(query),
                out -> new AuditNote(true, null, doc("count", out.size())));
    }

    // Audit and diagnostics

    public List<AuditRecord> queryAudit(String agentId, AuditQuery query) {
        if (agentId != null) {
            gate(agentId, "query_audit", query.agentId());
        }
        return auditTrail.query(query);
    }

    public boolean flushAudit(long timeoutMs) {
        return auditTrail.flush(timeoutMs);
    }

    /**
     * @param days retention horizon; null uses the configured one
     */
    public AuditTrail.RetentionOutcome auditRetention(Integer days) {
        int horizon = days == null ? runtimeSettings.auditRetentionDays() : days;
        AuditTrail.RetentionOutcome out = auditTrail.retentionSweep(horizon);
        auditTrail.append(new AuditEntry(SYSTEM_ACTOR, null, "audit_retention",
                doc("days", out.days()), doc("deleted", out.deleted(), "cutoff_ms", out.cutoffMs()),
                null, true, null));
        return out;
    }

    public List<ConflictLog.Conflict> conflicts(String eventType, long sinceMs, int limit) {
        return lockStore.conflictLog().list(eventType, sinceMs, limit);
    }

    public Map<String, Integer> conflictCounts(long sinceMs) {
        return lockStore.conflictLog().countByType(sinceMs);
    }

    public List<NetworkPolicyStore.AccessLogRow> networkAccessLog(String agentId, int limit) {
        return networkPolicyStore.listAccessLog(agentId, limit);
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public RuntimeStats stats() {
        return new RuntimeStats(
                config.namespace(),
                workQueue.countByStatus(),
                lockManager.checkLocks(List.of(), null).size(),
                auditTrail.stats(),
                activePolicyEngine().name(),
                runtimeSettings.policyEnforcement(),
                guardrails.activeSource(),
                liveness.reaperRunning()
        );
    }

    @Override
    public void close() {
        liveness.close();
        AuditTrail trail = auditTrail;
        if (trail != null) {
            if (!trail.flush(CLOSE_FLUSH_TIMEOUT_MS)) {
                log.warn("Audit trail did not drain within {} ms on close", CLOSE_FLUSH_TIMEOUT_MS);
            }
            trail.close();
        }
    }

    private <T> T call(String agentId, String agentType, String operation, Map<String, Object> parameters,
                       String policyAction, String policyResource, Supplier<T> body, Function<T, AuditNote> note) {
        try (AuditTimer timer = new AuditTimer(this::appendAudit, clock, agentId, agentType, operation, parameters)) {
            try {
                if (policyAction != null) {
                    gate(agentId, policyAction, policyResource);
                }
                T out = body.get();
                AuditNote n = note.apply(out);
                if (n.success()) {
                    timer.succeed(n.result());
                } else {
                    timer.fail(n.error(), n.result());
                }
                return out;
            } catch (PolicyDeniedException e) {
                timer.fail("policy_denied", doc("reason", e.decision().reason(), "engine", e.decision().engine()));
                throw e;
            } catch (RuntimeException e) {
                timer.fail(e.getMessage(), Map.of());
                throw e;
            }
        }
    }

    private void gate(String agentId, String action, String resource) {
        if (!runtimeSettings.policyEnforcement()) {
            return;
        }
        PolicyDecision decision = evaluatePolicy(principals.resolve(agentId, null), action, resource, Map.of());
        if (!decision.allowed()) {
            throw new PolicyDeniedException(action, decision);
        }
    }

    private PolicyDecision evaluatePolicy(Principal principal, String action, String resource,
                                          Map<String, Object> context) {
        PolicyEngine engine = activePolicyEngine();
        long startedAtMs = clock.millis();
        PolicyDecision decision = engine.evaluate(new PolicyRequest(principal, action, resource, context));
        auditTrail.append(new AuditEntry(
                principal.agentId(),
                principal.agentType(),
                "policy_decision",
                doc("action", action, "resource", resource, "trust_level", principal.trustLevel(),
                        "profile", principal.profile().name()),
                doc("allowed", decision.allowed(), "reason", decision.reason(),
                        "matched_policy_id", decision.matchedPolicyId(), "engine", decision.engine()),
                Math.max(0L, clock.millis() - startedAtMs),
                decision.allowed(),
                decision.allowed() ? null : decision.reason()
        ));
        if (!decision.allowed()) {
            log.debug("Policy denied: agent={} action={} resource={} reason={}",
                    principal.agentId(), action, resource, decision.reason());
        }
        return decision;
    }

    private SettingsReloadOutcome loadRuntimeSettings(boolean force) {
        Path cfg = config.settingsFile();
        long checkedAtMs = clock.millis();
        long mtime = resolveFileMtimeMs(cfg);
        if (!force && mtime == runtimeSettingsFileMtimeMs) {
            return new SettingsReloadOutcome(
                    false,
                    mtime >= 0L,
                    cfg.toString(),
                    runtimeSettings.toView(),
                    "unchanged",
                    checkedAtMs,
                    List.of()
            );
        }
        RuntimeSettings previous = runtimeSettings;
        RuntimeSettings resolved = readSettingsFile(cfg);
        runtimeSettings = resolved;
        runtimeSettingsFileMtimeMs = mtime;
        applySettings(resolved, previous);
        boolean changed = !resolved.equals(previous);
        List<String> changedFields = changed ? diffSettingFields(previous, resolved) : List.of();
        if (mtime < 0L) {
            if (changed) {
                auditSettingsLoad("ok_default", doc("config", cfg.toString(), "source", "defaults",
                        "changed", true, "changed_count", changedFields.size(), "changed_fields", changedFields));
                log.info("Runtime settings reset to defaults: changed={}", changedFields);
            }
            return new SettingsReloadOutcome(changed, false, cfg.toString(), resolved.toView(), "defaults",
                    checkedAtMs, changedFields);
        }
        auditSettingsLoad(changed ? "reloaded" : "ok", doc("config", cfg.toString(), "changed", changed,
                "changed_count", changedFields.size(), "changed_fields", changedFields, "config_mtime_ms", mtime));
        if (changed) {
            log.info("Runtime settings reloaded: changed={}", changedFields);
        }
        return new SettingsReloadOutcome(
                changed,
                true,
                cfg.toString(),
                resolved.toView(),
                changed ? "reloaded" : "unchanged_content",
                checkedAtMs,
                changedFields
        );
    }

    private void auditSettingsLoad(String result, Map<String, Object> details) {
        auditTrail.append(new AuditEntry(SYSTEM_ACTOR, null, "runtime.settings.load",
                details, doc("result", result), null, true, null));
    }

    private RuntimeSettings readSettingsFile(Path cfg) {
        RuntimeSettings defaults = RuntimeSettings.defaults();
        if (!Files.exists(cfg)) {
            return defaults;
        }
        try {
            RuntimeSettingsFile file = Jsons.mapper().readValue(cfg.toFile(), RuntimeSettingsFile.class);
            return RuntimeSettings.fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load runtime settings: " + cfg, e);
        }
    }

    private void applySettings(RuntimeSettings settings, RuntimeSettings previous) {
        lockManager.applySettings(settings.defaultLockTtlMs());
        workQueue.applySettings(new WorkQueue.Settings(
                settings.defaultTaskPriority(),
                settings.defaultMaxAttempts(),
                settings.claimMaxRetries()
        ));
        guardrails.applySettings(settings.guardrailCacheTtlMs());
        declarativeEngine.applySettings(settings.policyCacheTtlMs());
        liveness.applySettings(settings.staleSessionThresholdMs());
        AuditTrail trail = auditTrail;
        if (trail != null) {
            if (trail.async() != settings.auditAsync() || trail.capacity() != settings.auditQueueCapacity()) {
                replaceAuditTrail(trail, settings);
            } else {
                trail.applySettings(settings.auditOfferTimeoutMs());
            }
        }
        if (previous.reapIntervalMs() != settings.reapIntervalMs() || !liveness.reaperRunning()) {
            liveness.startReaper(settings.reapIntervalMs(), this::auditBackgroundReap);
        }
    }

    /**
     * Swaps in a trail built for the new mode and capacity, then drains and closes the old one. Entries still
     * landing on the old trail after it closes are counted as dropped there.
     */
    private void replaceAuditTrail(AuditTrail old, RuntimeSettings settings) {
        auditTrail = new AuditTrail(auditStore, settings.auditAsync(), settings.auditQueueCapacity(),
                settings.auditOfferTimeoutMs(), clock);
        if (!old.flush(CLOSE_FLUSH_TIMEOUT_MS)) {
            log.warn("Previous audit trail did not drain within {} ms", CLOSE_FLUSH_TIMEOUT_MS);
        }
        old.close();
        log.info("Audit trail rebuilt: async={} queue_capacity={}", settings.auditAsync(), settings.auditQueueCapacity());
    }

    private void appendAudit(AuditEntry entry) {
        auditTrail.append(entry);
    }

    private void auditBackgroundReap(LivenessMonitor.ReapOutcome out) {
        if (out.agentsCleaned() == 0 && out.locksReleased() == 0 && out.failedAgents().isEmpty()) {
            return;
        }
        auditTrail.append(new AuditEntry(SYSTEM_ACTOR, null, "reap_dead_agents",
                doc("threshold_ms", out.thresholdMs(), "background", true),
                doc("agents_cleaned", out.agentsCleaned(), "locks_released", out.locksReleased(),
                        "cleaned_agents", out.cleanedAgents(), "failed_agents", out.failedAgents()),
                null, out.failedAgents().isEmpty(), null));
    }

    private long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings mtime: " + path, e);
        }
    }

    private static List<String> diffSettingFields(RuntimeSettings before, RuntimeSettings after) {
        if (before == null || after == null) {
            return List.of();
        }
        List<String> changed = new ArrayList<>();
        if (before.defaultLockTtlMs() != after.defaultLockTtlMs()) changed.add("defaultLockTtlMs");
        if (before.staleSessionThresholdMs() != after.staleSessionThresholdMs()) changed.add("staleSessionThresholdMs");
        if (before.defaultTaskPriority() != after.defaultTaskPriority()) changed.add("defaultTaskPriority");
        if (before.defaultMaxAttempts() != after.defaultMaxAttempts()) changed.add("defaultMaxAttempts");
        if (before.guardrailCacheTtlMs() != after.guardrailCacheTtlMs()) changed.add("guardrailCacheTtlMs");
        if (before.policyCacheTtlMs() != after.policyCacheTtlMs()) changed.add("policyCacheTtlMs");
        if (!before.policyEngine().equals(after.policyEngine())) changed.add("policyEngine");
        if (before.policyEnforcement() != after.policyEnforcement()) changed.add("policyEnforcement");
        if (before.auditAsync() != after.auditAsync()) changed.add("auditAsync");
        if (before.auditQueueCapacity() != after.auditQueueCapacity()) changed.add("auditQueueCapacity");
        if (before.auditOfferTimeoutMs() != after.auditOfferTimeoutMs()) changed.add("auditOfferTimeoutMs");
        if (before.auditRetentionDays() != after.auditRetentionDays()) changed.add("auditRetentionDays");
        if (before.reapIntervalMs() != after.reapIntervalMs()) changed.add("reapIntervalMs");
        if (before.claimMaxRetries() != after.claimMaxRetries()) changed.add("claimMaxRetries");
        return changed;
    }

    /**
     * Builds an insertion-ordered map from alternating keys and values; null values are kept.
     */
    private static Map<String, Object> doc(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return out;
    }

    private record AuditNote(boolean success, String error, Map<String, Object> result) {
    }

    public record AssignOutcome(boolean assigned, String agentId, String profileName, String reason) {
    }

    public record RuntimeStats(
            String namespace,
            Map<String, Integer> tasksByStatus,
            int liveLocks,
            AuditTrail.Stats audit,
            String policyEngine,
            boolean policyEnforcement,
            String guardrailSource,
            boolean reaperRunning
    ) {
    }

    public record RuntimeSettingsView(
            long defaultLockTtlMs,
            long staleSessionThresholdMs,
            int defaultTaskPriority,
            int defaultMaxAttempts,
            long guardrailCacheTtlMs,
            long policyCacheTtlMs,
            String policyEngine,
            boolean policyEnforcement,
            boolean auditAsync,
            int auditQueueCapacity,
            long auditOfferTimeoutMs,
            int auditRetentionDays,
            long reapIntervalMs,
            int claimMaxRetries
    ) {
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            RuntimeSettingsView settings,
            String message,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }

    private record RuntimeSettingsFile(
            Long defaultLockTtlMs,
            Long staleSessionThresholdMs,
            Integer defaultTaskPriority,
            Integer defaultMaxAttempts,
            Long guardrailCacheTtlMs,
            Long policyCacheTtlMs,
            String policyEngine,
            Boolean policyEnforcement,
            Boolean auditAsync,
            Integer auditQueueCapacity,
            Long auditOfferTimeoutMs,
            Integer auditRetentionDays,
            Long reapIntervalMs,
            Integer claimMaxRetries
    ) {
    }

    private record RuntimeSettings(
            long defaultLockTtlMs,
            long staleSessionThresholdMs,
            int defaultTaskPriority,
            int defaultMaxAttempts,
            long guardrailCacheTtlMs,
            long policyCacheTtlMs,
            String policyEngine,
            boolean policyEnforcement,
            boolean auditAsync,
            int auditQueueCapacity,
            long auditOfferTimeoutMs,
            int auditRetentionDays,
            long reapIntervalMs,
            int claimMaxRetries
    ) {
        static RuntimeSettings defaults() {
            return new RuntimeSettings(
                    CoordMeshConfig.DEFAULT_LOCK_TTL_MS,
                    CoordMeshConfig.DEFAULT_STALE_SESSION_THRESHOLD_MS,
                    CoordMeshConfig.DEFAULT_TASK_PRIORITY,
                    CoordMeshConfig.DEFAULT_MAX_ATTEMPTS,
                    CoordMeshConfig.DEFAULT_GUARDRAIL_CACHE_TTL_MS,
                    CoordMeshConfig.DEFAULT_POLICY_CACHE_TTL_MS,
                    PolicyEngine.NATIVE,
                    false,
                    true,
                    CoordMeshConfig.DEFAULT_AUDIT_QUEUE_CAPACITY,
                    CoordMeshConfig.DEFAULT_AUDIT_OFFER_TIMEOUT_MS,
                    CoordMeshConfig.DEFAULT_AUDIT_RETENTION_DAYS,
                    0L,
                    CoordMeshConfig.DEFAULT_CLAIM_MAX_RETRIES
            );
        }

        static RuntimeSettings fromFile(RuntimeSettingsFile file, RuntimeSettings defaults) {
            if (file == null) {
                return defaults;
            }
            int priority = sanitizeInt(file.defaultTaskPriority(), defaults.defaultTaskPriority(),
                    CoordMeshConfig.MIN_TASK_PRIORITY);
            if (priority > CoordMeshConfig.MAX_TASK_PRIORITY) {
                priority = CoordMeshConfig.MAX_TASK_PRIORITY;
            }
            return new RuntimeSettings(
                    sanitizeLong(file.defaultLockTtlMs(), defaults.defaultLockTtlMs(), 1_000L),
                    sanitizeLong(file.staleSessionThresholdMs(), defaults.staleSessionThresholdMs(), 1_000L),
                    priority,
                    sanitizeInt(file.defaultMaxAttempts(), defaults.defaultMaxAttempts(), 1),
                    sanitizeLong(file.guardrailCacheTtlMs(), defaults.guardrailCacheTtlMs(), 0L),
                    sanitizeLong(file.policyCacheTtlMs(), defaults.policyCacheTtlMs(), 0L),
                    sanitizeEngine(file.policyEngine(), defaults.policyEngine()),
                    sanitizeBoolean(file.policyEnforcement(), defaults.policyEnforcement()),
                    sanitizeBoolean(file.auditAsync(), defaults.auditAsync()),
                    sanitizeInt(file.auditQueueCapacity(), defaults.auditQueueCapacity(), 16),
                    sanitizeLong(file.auditOfferTimeoutMs(), defaults.auditOfferTimeoutMs(), 0L),
                    sanitizeInt(file.auditRetentionDays(), defaults.auditRetentionDays(), 1),
                    sanitizeLong(file.reapIntervalMs(), defaults.reapIntervalMs(), 0L),
                    sanitizeInt(file.claimMaxRetries(), defaults.claimMaxRetries(), 1)
            );
        }

        RuntimeSettingsView toView() {
            return new RuntimeSettingsView(
                    defaultLockTtlMs,
                    staleSessionThresholdMs,
                    defaultTaskPriority,
                    defaultMaxAttempts,
                    guardrailCacheTtlMs,
                    policyCacheTtlMs,
                    policyEngine,
                    policyEnforcement,
                    auditAsync,
                    auditQueueCapacity,
                    auditOfferTimeoutMs,
                    auditRetentionDays,
                    reapIntervalMs,
                    claimMaxRetries
            );
        }

        private static int sanitizeInt(Integer raw, int fallback, int min) {
            if (raw == null) {
                return fallback;
            }
            return Math.max(min, raw);
        }

        private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
            if (raw == null) {
                return fallback;
            }
            return raw;
        }

        private static long sanitizeLong(Long raw, long fallback, long min) {
            if (raw == null) {
                return fallback;
            }
            return Math.max(min, raw);
        }

        private static String sanitizeEngine(String raw, String fallback) {
            if (raw == null || raw.isBlank()) {
                return fallback;
            }
            String engine = raw.trim().toLowerCase(Locale.ROOT);
            if (!PolicyEngine.NATIVE.equals(engine) && !PolicyEngine.DECLARATIVE.equals(engine)) {
                log.warn("Unknown policy engine '{}' in settings, keeping {}", raw, fallback);
                return fallback;
            }
            return engine;
        }
    }
}
