package io.coordmesh.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.coordmesh.security.SensitiveDataMasker;
import io.coordmesh.storage.AuditStore;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only operation log. In async mode entries go to a bounded queue drained in batches by one writer thread;
 * a producer that finds the queue full waits up to the offer timeout, after which the entry is dropped and counted.
 * In sync mode the caller's thread writes. Write failures are logged and counted, never thrown to the caller.
 */
public final class AuditTrail implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);
    private static final int MAX_BATCH = 256;
    private static final long POLL_INTERVAL_MS = 100L;

    private final AuditStore store;
    private final Clock clock;
    private final boolean async;
    private final int capacity;
    private final BlockingQueue<AuditStore.AuditRow> queue;
    private final ExecutorService writer;
    private final AtomicLong accepted;
    private final AtomicLong written;
    private final AtomicLong dropped;
    private final AtomicLong failed;
    private final AtomicLong pending;
    private volatile long offerTimeoutMs;
    private volatile boolean running;

    public AuditTrail(AuditStore store, boolean async, int queueCapacity, long offerTimeoutMs) {
        this(store, async, queueCapacity, offerTimeoutMs, Clock.systemUTC());
    }

    public AuditTrail(AuditStore store, boolean async, int queueCapacity, long offerTimeoutMs, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.async = async;
        this.capacity = Math.max(1, queueCapacity);
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.accepted = new AtomicLong(0L);
        this.written = new AtomicLong(0L);
        this.dropped = new AtomicLong(0L);
        this.failed = new AtomicLong(0L);
        this.pending = new AtomicLong(0L);
        this.offerTimeoutMs = Math.max(0L, offerTimeoutMs);
        this.running = true;
        if (async) {
            this.writer = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "coordmesh-audit-writer");
                t.setDaemon(true);
                return t;
            });
            this.writer.submit(this::drainLoop);
        } else {
            this.writer = null;
        }
    }

    public static AuditTrail synchronous(AuditStore store) {
        return new AuditTrail(store, false, 1, 0L);
    }

    public void applySettings(long offerTimeoutMs) {
        this.offerTimeoutMs = Math.max(0L, offerTimeoutMs);
    }

    public boolean async() {
        return async;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return false when the entry was dropped because the queue stayed full or the trail is closed
     */
    public boolean append(AuditEntry entry) {
        AuditStore.AuditRow row = toRow(entry);
        if (!async) {
            writeBatch(List.of(row));
            accepted.incrementAndGet();
            return true;
        }
        if (!running) {
            drop(row, "closed");
            return false;
        }
        pending.incrementAndGet();
        boolean offered;
        try {
            offered = queue.offer(row, offerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            offered = false;
        }
        if (!offered) {
            pending.decrementAndGet();
            drop(row, "queue_full");
            return false;
        }
        accepted.incrementAndGet();
        return true;
    }

    public AuditTimer time(String agentId, String agentType, String operation, Map<String, Object> parameters) {
        return new AuditTimer(this::append, clock, agentId, agentType, operation, parameters);
    }

    /**
     * Waits until every accepted entry has been written or the timeout passes.
     *
     * @return true when nothing is left in flight
     */
    public boolean flush(long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        while (pending.get() > 0L) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public List<AuditRecord> query(AuditQuery q) {
        List<AuditStore.AuditRow> rows = store.query(new AuditStore.Filter(
                q.agentId(), q.operation(), q.sinceMs(), q.untilMs(), q.success(), q.limit()));
        List<AuditRecord> out = new ArrayList<>(rows.size());
        for (AuditStore.AuditRow row : rows) {
            out.add(new AuditRecord(
                    row.entryId(),
                    row.agentId(),
                    row.agentType(),
                    row.operation(),
                    readTree(row.parametersJson()),
                    readTree(row.resultJson()),
                    row.durationMs(),
                    row.success(),
                    row.errorMessage(),
                    row.createdAtMs()
            ));
        }
        return out;
    }

    /**
     * Deletes entries older than {@code days}. This is the only removal path the store accepts.
     */
    public RetentionOutcome retentionSweep(int days) {
        int safeDays = Math.max(1, days);
        long nowMs = clock.millis();
        long cutoffMs = nowMs - TimeUnit.DAYS.toMillis(safeDays);
        int deleted = store.retentionSweep(cutoffMs, nowMs);
        if (deleted > 0) {
            log.info("Audit retention removed {} entries older than {} days", deleted, safeDays);
        }
        return new RetentionOutcome(safeDays, cutoffMs, deleted);
    }

    public Stats stats() {
        return new Stats(async, queue.size(), queue.remainingCapacity(), accepted.get(), written.get(),
                dropped.get(), failed.get());
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        if (writer == null) {
            return;
        }
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        List<AuditStore.AuditRow> rest = new ArrayList<>();
        queue.drainTo(rest);
        if (!rest.isEmpty()) {
            writeBatch(rest);
            pending.addAndGet(-rest.size());
        }
    }

    private void drainLoop() {
        List<AuditStore.AuditRow> batch = new ArrayList<>(MAX_BATCH);
        while (running || !queue.isEmpty()) {
            try {
                AuditStore.AuditRow first = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, MAX_BATCH - 1);
                writeBatch(batch);
                pending.addAndGet(-batch.size());
                batch.clear();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void writeBatch(List<AuditStore.AuditRow> batch) {
        try {
            written.addAndGet(store.insertBatch(batch));
        } catch (RuntimeException e) {
            failed.addAndGet(batch.size());
            log.warn("Failed to write {} audit entries: {}", batch.size(), e.getMessage());
        }
    }

    private void drop(AuditStore.AuditRow row, String cause) {
        long total = dropped.incrementAndGet();
        log.warn("Dropped audit entry operation={} agent={} cause={} dropped_total={}",
                row.operation(), row.agentId(), cause, total);
    }

    private AuditStore.AuditRow toRow(AuditEntry entry) {
        return new AuditStore.AuditRow(
                "aud_" + UUID.randomUUID(),
                entry.agentId(),
                entry.agentType(),
                entry.operation(),
                Jsons.toCompactJson(SensitiveDataMasker.maskedMap(entry.parameters())),
                Jsons.toCompactJson(SensitiveDataMasker.maskedMap(entry.result())),
                entry.durationMs(),
                entry.success(),
                entry.errorMessage(),
                clock.millis()
        );
    }

    private static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse stored audit JSON", e);
        }
    }

    public record Stats(
            boolean async,
            int queued,
            int remainingCapacity,
            long accepted,
            long written,
            long dropped,
            long failed
    ) {
    }

    public record RetentionOutcome(int days, long cutoffMs, int deleted) {
    }
}
