package io.coordmesh.queue;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.guardrail.GuardrailEngine;
import io.coordmesh.model.TaskStatus;
import io.coordmesh.policy.PrincipalResolver;
import io.coordmesh.storage.ConflictLog;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.GuardrailStore;
import io.coordmesh.storage.ProfileStore;
import io.coordmesh.storage.SessionStore;
import io.coordmesh.storage.TaskQueueStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class WorkQueueTest {

    @Test
    void claimsFollowPriorityThenSubmissionOrder() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-priority-");
        try {
            WorkQueue queue = newQueue(root);
            String low = queue.submit(WorkQueue.SubmitRequest.of("build", 8, List.of())).taskId();
            String urgentFirst = queue.submit(WorkQueue.SubmitRequest.of("build", 1, List.of())).taskId();
            String urgentSecond = queue.submit(WorkQueue.SubmitRequest.of("build", 1, List.of())).taskId();
            queue.submit(WorkQueue.SubmitRequest.of("review", 1, List.of()));

            Assertions.assertEquals(urgentFirst, queue.claim("worker-1", List.of("build")).task().taskId());
            Assertions.assertEquals(urgentSecond, queue.claim("worker-1", List.of("build")).task().taskId());
            Assertions.assertEquals(low, queue.claim("worker-1", List.of("build")).task().taskId());

            WorkQueue.ClaimOutcome none = queue.claim("worker-1", List.of("build"));
            Assertions.assertFalse(none.claimed());
            Assertions.assertEquals(WorkQueue.REASON_NO_TASKS, none.reason());
            Assertions.assertEquals("review", queue.claim("worker-1", List.of()).task().taskType());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void dependentTaskWaitsUntilEveryDependencyCompletes() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-deps-");
        try {
            WorkQueue queue = newQueue(root);
            String schema = queue.submit(WorkQueue.SubmitRequest.of("migrate", 5, List.of())).taskId();
            String backfill = queue.submit(WorkQueue.SubmitRequest.of("backfill", 1, List.of(schema))).taskId();

            WorkQueue.ClaimOutcome first = queue.claim("worker-1", List.of());
            Assertions.assertEquals(schema, first.task().taskId());
            Assertions.assertFalse(queue.claim("worker-2", List.of()).claimed());

            Assertions.assertTrue(queue.complete(WorkQueue.CompleteRequest.succeeded(schema, "worker-1", "ok")).accepted());

            WorkQueue.ClaimOutcome second = queue.claim("worker-2", List.of());
            Assertions.assertTrue(second.claimed());
            Assertions.assertEquals(backfill, second.task().taskId());
            Assertions.assertEquals(List.of(schema), second.task().dependencyIds());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void submitRejectsUnknownDependenciesAndInvalidInput() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-submit-");
        try {
            WorkQueue queue = newQueue(root);

            WorkQueue.SubmitOutcome unknown = queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of("tsk_missing")));
            Assertions.assertFalse(unknown.submitted());
            Assertions.assertEquals("unknown_dependency", unknown.reason());
            Assertions.assertEquals(List.of("tsk_missing"), unknown.offendingTaskIds());

            Assertions.assertEquals(WorkQueue.REASON_INVALID_PRIORITY,
                    queue.submit(WorkQueue.SubmitRequest.of("build", 11, List.of())).reason());
            Assertions.assertEquals(WorkQueue.REASON_MISSING_TYPE,
                    queue.submit(WorkQueue.SubmitRequest.of(" ", 5, List.of())).reason());
            Assertions.assertEquals(WorkQueue.REASON_INVALID_MAX_ATTEMPTS,
                    queue.submit(new WorkQueue.SubmitRequest("build", "", null, 5, List.of(), null, 0, "lead")).reason());
            Assertions.assertTrue(queue.countByStatus().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void payloadsSurviveStorageUnchanged() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-payload-");
        try {
            WorkQueue queue = newQueue(root);
            String input = "{\"files\":[\"src/a.py\",\"ü ✓\"],\"note\":\"tab\\tquote\\\"\"}\n";
            String result = "{ \"summary\" : \"done\",\n  \"lines\": 42 }";
            String taskId = queue.submit(new WorkQueue.SubmitRequest(
                    "refactor", "split module", input, 3, List.of(), null, null, "lead")).taskId();

            TaskQueueStore.TaskRow claimed = queue.claim("worker-1", List.of("refactor")).task();
            Assertions.assertEquals(input, claimed.inputPayload());
            Assertions.assertEquals("split module", claimed.description());
            Assertions.assertEquals("lead", claimed.submittedBy());

            queue.complete(WorkQueue.CompleteRequest.succeeded(taskId, "worker-1", result));
            TaskQueueStore.TaskRow done = queue.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED.name(), done.status());
            Assertions.assertEquals(result, done.resultPayload());
            Assertions.assertNotNull(done.completedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimsHandOutEachTaskOnce() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            WorkQueue queue = newQueue(root);
            for (int i = 0; i < 4; i++) {
                queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of()));
            }
            CountDownLatch start = new CountDownLatch(1);
            List<Future<WorkQueue.ClaimOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                String worker = "worker-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return queue.claim(worker, List.of("build"));
                }));
            }
            start.countDown();

            Set<String> claimedIds = new HashSet<>();
            int empty = 0;
            for (Future<WorkQueue.ClaimOutcome> f : futures) {
                WorkQueue.ClaimOutcome out = f.get(30, TimeUnit.SECONDS);
                if (out.claimed()) {
                    Assertions.assertTrue(claimedIds.add(out.task().taskId()), "task handed out twice");
                } else {
                    empty++;
                }
            }
            Assertions.assertEquals(4, claimedIds.size());
            Assertions.assertEquals(2, empty);
            Assertions.assertEquals(4, queue.countByStatus().get(TaskStatus.CLAIMED.name()));
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimsOnOneTaskHaveExactlyOneWinner() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-single-");
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            WorkQueue queue = newQueue(root);
            String taskId = queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of())).taskId();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<WorkQueue.ClaimOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String worker = "worker-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return queue.claim(worker, List.of());
                }));
            }
            start.countDown();

            List<String> winners = new ArrayList<>();
            for (Future<WorkQueue.ClaimOutcome> f : futures) {
                WorkQueue.ClaimOutcome out = f.get(30, TimeUnit.SECONDS);
                if (out.claimed()) {
                    Assertions.assertEquals(taskId, out.task().taskId());
                    winners.add(out.task().claimedBy());
                } else {
                    Assertions.assertEquals(WorkQueue.REASON_NO_TASKS, out.reason());
                }
            }
            Assertions.assertEquals(1, winners.size());
            TaskQueueStore.TaskRow stored = queue.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.CLAIMED.name(), stored.status());
            Assertions.assertEquals(winners.get(0), stored.claimedBy());
            Assertions.assertEquals(1, stored.attemptCount());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void claimantIdIsComparedTrimmed() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-trim-");
        try {
            WorkQueue queue = newQueue(root);
            String taskId = queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of())).taskId();
            Assertions.assertEquals("worker-1", queue.claim("  worker-1 ", List.of()).task().claimedBy());

            Assertions.assertEquals(1, queue.listClaimedBy(" worker-1", List.of(), 10).size());
            WorkQueue.CompleteOutcome done = queue.complete(WorkQueue.CompleteRequest.succeeded(taskId, " worker-1  ", "ok"));
            Assertions.assertTrue(done.accepted());
            Assertions.assertEquals(TaskStatus.COMPLETED.name(), queue.getTask(taskId).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void onlyTheClaimantMayComplete() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-claimant-");
        try {
            Database db = newDatabase(root);
            TaskQueueStore store = new TaskQueueStore(db);
            WorkQueue queue = newQueue(db, store);
            String taskId = queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of())).taskId();
            queue.claim("worker-1", List.of());

            WorkQueue.CompleteOutcome wrong = queue.complete(WorkQueue.CompleteRequest.succeeded(taskId, "worker-2", "ok"));
            Assertions.assertFalse(wrong.accepted());
            Assertions.assertEquals(WorkQueue.REASON_NOT_CLAIMANT, wrong.reason());
            Assertions.assertEquals(TaskStatus.CLAIMED.name(), queue.getTask(taskId).orElseThrow().status());

            WorkQueue.CompleteOutcome missing = queue.complete(WorkQueue.CompleteRequest.succeeded("tsk_nope", "worker-1", "ok"));
            Assertions.assertEquals(WorkQueue.REASON_NOT_CLAIMANT, missing.reason());

            Assertions.assertEquals(TaskQueueStore.CompleteOutcome.NOT_CLAIMED_BY_AGENT,
                    store.complete(taskId, "worker-2", true, "ok", null, 1L));
            Assertions.assertEquals(1, store.conflictLog().list(ConflictLog.STALE_COMPLETE, 0L, 10).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void destructiveResultIsRejectedAndTaskStaysClaimed() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-guardrail-");
        try {
            WorkQueue queue = newQueue(root);
            String taskId = queue.submit(WorkQueue.SubmitRequest.of("release", 5, List.of())).taskId();
            queue.claim("worker-1", List.of());

            WorkQueue.CompleteOutcome rejected = queue.complete(new WorkQueue.CompleteRequest(
                    taskId, "worker-1", true, "ran git push origin main --force", null, 2, List.of()));
            Assertions.assertFalse(rejected.accepted());
            Assertions.assertEquals(WorkQueue.REASON_GUARDRAIL, rejected.reason());
            Assertions.assertEquals(TaskStatus.CLAIMED.name(), rejected.status());
            Assertions.assertFalse(rejected.guardrail().safe());
            Assertions.assertEquals("git_force_push", rejected.guardrail().violations().get(0).patternName());
            Assertions.assertEquals(TaskStatus.CLAIMED.name(), queue.getTask(taskId).orElseThrow().status());

            WorkQueue.CompleteOutcome trusted = queue.complete(new WorkQueue.CompleteRequest(
                    taskId, "worker-1", true, "ran git push origin main --force", null, 3, List.of()));
            Assertions.assertTrue(trusted.accepted());
            Assertions.assertEquals(TaskStatus.COMPLETED.name(), trusted.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedTaskStaysFailedUntilResubmitted() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-failed-");
        try {
            WorkQueue queue = newQueue(root);
            String taskId = queue.submit(new WorkQueue.SubmitRequest(
                    "test", "flaky suite", "{}", 4, List.of(), null, 2, "lead")).taskId();
            queue.claim("worker-1", List.of());

            WorkQueue.CompleteOutcome failed = queue.complete(
                    WorkQueue.CompleteRequest.failed(taskId, "worker-1", "timeout"));
            Assertions.assertTrue(failed.accepted());
            Assertions.assertEquals(TaskStatus.FAILED.name(), failed.status());
            Assertions.assertNull(failed.guardrail());
            Assertions.assertFalse(queue.claim("worker-2", List.of()).claimed());

            TaskQueueStore.ResubmitResult again = queue.resubmit(taskId, "lead");
            Assertions.assertTrue(again.resubmitted());
            Assertions.assertEquals(taskId, again.task().resubmittedFrom());
            Assertions.assertEquals(1, again.task().attemptCount());
            Assertions.assertEquals(TaskStatus.PENDING.name(), again.task().status());
            Assertions.assertEquals("{}", again.task().inputPayload());

            TaskQueueStore.ResubmitResult duplicate = queue.resubmit(taskId, "lead");
            Assertions.assertFalse(duplicate.resubmitted());
            Assertions.assertEquals("already_resubmitted", duplicate.reason());
            Assertions.assertEquals(again.task().taskId(), duplicate.existingTaskId());

            String retryId = again.task().taskId();
            Assertions.assertEquals(2, queue.claim("worker-2", List.of()).task().attemptCount());
            queue.complete(WorkQueue.CompleteRequest.failed(retryId, "worker-2", "timeout again"));

            TaskQueueStore.ResubmitResult exhausted = queue.resubmit(retryId, "lead");
            Assertions.assertFalse(exhausted.resubmitted());
            Assertions.assertEquals("max_attempts_exhausted", exhausted.reason());
            Assertions.assertEquals(TaskStatus.FAILED.name(), queue.getTask(taskId).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resubmittedDependencyUnblocksItsDependents() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-replace-");
        try {
            WorkQueue queue = newQueue(root);
            String migrate = queue.submit(WorkQueue.SubmitRequest.of("migrate", 1, List.of())).taskId();
            String backfill = queue.submit(WorkQueue.SubmitRequest.of("backfill", 5, List.of(migrate))).taskId();
            queue.claim("worker-1", List.of("migrate"));
            queue.complete(WorkQueue.CompleteRequest.failed(migrate, "worker-1", "lock timeout"));
            Assertions.assertFalse(queue.claim("worker-2", List.of("backfill")).claimed());

            String replacement = queue.resubmit(migrate, "lead").task().taskId();
            Assertions.assertEquals(List.of(replacement), queue.getTask(backfill).orElseThrow().dependencyIds());
            Assertions.assertFalse(queue.claim("worker-2", List.of("backfill")).claimed());

            Assertions.assertEquals(replacement, queue.claim("worker-1", List.of("migrate")).task().taskId());
            queue.complete(WorkQueue.CompleteRequest.failed(replacement, "worker-1", "lock timeout again"));
            String third = queue.resubmit(replacement, "lead").task().taskId();
            Assertions.assertEquals(List.of(third), queue.getTask(backfill).orElseThrow().dependencyIds());

            Assertions.assertEquals(third, queue.claim("worker-1", List.of("migrate")).task().taskId());
            Assertions.assertTrue(queue.complete(WorkQueue.CompleteRequest.succeeded(third, "worker-1", "ok")).accepted());

            WorkQueue.ClaimOutcome unblocked = queue.claim("worker-2", List.of("backfill"));
            Assertions.assertTrue(unblocked.claimed());
            Assertions.assertEquals(backfill, unblocked.task().taskId());
            Assertions.assertEquals(TaskStatus.FAILED.name(), queue.getTask(migrate).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelOnlyAffectsOpenTasks() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-cancel-");
        try {
            WorkQueue queue = newQueue(root);
            String pending = queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of())).taskId();
            String done = queue.submit(WorkQueue.SubmitRequest.of("lint", 5, List.of())).taskId();
            queue.claim("worker-1", List.of("lint"));
            queue.complete(WorkQueue.CompleteRequest.succeeded(done, "worker-1", "clean"));

            TaskQueueStore.CancelResult cancelled = queue.cancel(pending, "superseded");
            Assertions.assertTrue(cancelled.cancelled());
            TaskQueueStore.TaskRow row = queue.getTask(pending).orElseThrow();
            Assertions.assertEquals(TaskStatus.CANCELLED.name(), row.status());
            Assertions.assertEquals("superseded", row.errorMessage());

            TaskQueueStore.CancelResult terminal = queue.cancel(done, null);
            Assertions.assertFalse(terminal.cancelled());
            Assertions.assertEquals("terminal_state:COMPLETED", terminal.message());
            Assertions.assertEquals("task_not_found", queue.cancel("tsk_nope", null).message());
            Assertions.assertEquals("task_not_failed", queue.resubmit(pending, "lead").reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void myTasksFiltersByClaimantAndStatus() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-queue-mine-");
        try {
            WorkQueue queue = newQueue(root);
            String a = queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of())).taskId();
            queue.submit(WorkQueue.SubmitRequest.of("build", 5, List.of()));
            queue.claim("worker-1", List.of());
            queue.claim("worker-2", List.of());
            queue.complete(WorkQueue.CompleteRequest.succeeded(a, "worker-1", "ok"));

            Assertions.assertEquals(1, queue.listClaimedBy("worker-1", List.of(), 10).size());
            Assertions.assertEquals(1, queue.listClaimedBy("worker-1", List.of(TaskStatus.COMPLETED), 10).size());
            Assertions.assertTrue(queue.listClaimedBy("worker-1", List.of(TaskStatus.CLAIMED), 10).isEmpty());
            Assertions.assertTrue(queue.listPending(List.of(), 10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database newDatabase(Path root) {
        Database db = new Database(CoordMeshConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }

    private static WorkQueue newQueue(Path root) {
        Database db = newDatabase(root);
        return newQueue(db, new TaskQueueStore(db));
    }

    private static WorkQueue newQueue(Database db, TaskQueueStore store) {
        return new WorkQueue(
                store,
                new GuardrailEngine(new GuardrailStore(db)),
                new PrincipalResolver(new ProfileStore(db), new SessionStore(db))
        );
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
