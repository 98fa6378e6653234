package io.cronhook.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhook.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers execution records in memory and writes them to the {@link ObjectStore} in batches.
 *
 * <p>A flush happens when the buffer reaches {@code bufferSize} records or every {@code flushInterval},
 * whichever comes first. Each flush writes one JSON array per workspace, partitioned by the flush time
 * (not by each record's own timestamp). Records of a workspace whose write failed go back to the front of
 * the buffer and are retried on the next flush, so the same record may be persisted twice.
 *
 * <p>The buffer is swapped out under {@code bufferLock}; the object store write never runs while holding it.
 * {@link #close()} flushes whatever is left.
 */
public class MetricsRecorder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsRecorder.class);

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final int bufferSize;
    private final Duration flushInterval;
    private final Clock clock;
    // distinguishes objects of recorders in other processes flushing in the same millisecond
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);
    private final AtomicLong objectSeq = new AtomicLong();

    private final ReentrantLock bufferLock = new ReentrantLock();
    private final ReentrantLock flushLock = new ReentrantLock();
    private List<ExecutionRecord> buffer = new ArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ScheduledExecutorService flusher;

    public MetricsRecorder(ObjectStore objectStore, ObjectMapper objectMapper, int bufferSize, Duration flushInterval) {
        this(objectStore, objectMapper, bufferSize, flushInterval, Clock.systemUTC());
    }

    public MetricsRecorder(ObjectStore objectStore, ObjectMapper objectMapper, int bufferSize, Duration flushInterval,
                           Clock clock) {
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore must not be null");
        this.objectMapper = MetricsJson.configure(Objects.requireNonNull(objectMapper, "objectMapper must not be null"));
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must be a positive duration");
        }
        this.bufferSize = bufferSize;
        this.flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("cronhook.metricsFlusher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the periodic flush timer. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long periodMs = flushInterval.toMillis();
        flusher.scheduleWithFixedDelay(this::flushQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Metrics recorder started with bufferSize={}, flushInterval={}", bufferSize, flushInterval);
    }

    public void record(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        int size;
        bufferLock.lock();
        try {
            buffer.add(record);
            size = buffer.size();
        } finally {
            bufferLock.unlock();
        }
        log.debug("Buffered metric workspace={} job={} status={} buffered={}",
                record.workspaceId(), record.jobName(), record.status().value(), size);

        if (size >= bufferSize) {
            requestFlush();
        }
    }

    public int pendingCount() {
        bufferLock.lock();
        try {
            return buffer.size();
        } finally {
            bufferLock.unlock();
        }
    }

    /**
     * Write all buffered records now.
     *
     * @return number of records persisted by this flush
     */
    public int flush() {
        flushLock.lock();
        try {
            List<ExecutionRecord> batch;
            bufferLock.lock();
            try {
                if (buffer.isEmpty()) {
                    return 0;
                }
                batch = buffer;
                buffer = new ArrayList<>();
            } finally {
                bufferLock.unlock();
            }

            Instant flushTime = clock.instant();
            Map<String, List<ExecutionRecord>> byWorkspace = new LinkedHashMap<>();
            for (ExecutionRecord r : batch) {
                byWorkspace.computeIfAbsent(r.workspaceId(), ws -> new ArrayList<>()).add(r);
            }

            int written = 0;
            List<ExecutionRecord> failed = new ArrayList<>();
            for (Map.Entry<String, List<ExecutionRecord>> e : byWorkspace.entrySet()) {
                try {
                    write(e.getKey(), e.getValue(), flushTime);
                    written += e.getValue().size();
                } catch (IOException | RuntimeException ex) {
                    log.error("Failed to write {} metrics for workspace={} msg={}",
                            e.getValue().size(), e.getKey(), ex.getMessage(), ex);
                    failed.addAll(e.getValue());
                }
            }

            if (!failed.isEmpty()) {
                requeue(failed);
                log.warn("Returned {} metrics to the buffer for the next flush", failed.size());
            }
            if (written > 0) {
                log.info("Flushed {} metrics for {} workspaces", written, byWorkspace.size());
            }
            return written;
        } finally {
            flushLock.unlock();
        }
    }

    private void write(String workspaceId, List<ExecutionRecord> records, Instant flushTime) throws IOException {
        String key = MetricsPaths.objectKey(workspaceId, flushTime, instanceId + "-" + objectSeq.incrementAndGet());
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("record-count", String.valueOf(records.size()));
        metadata.put("workspace-id", workspaceId);
        metadata.put("created-at", flushTime.toString());

        objectStore.put(key, json, "application/json", metadata);
        log.debug("Wrote {} metrics for workspace={} to {}", records.size(), workspaceId, key);
    }

    private void requeue(List<ExecutionRecord> failed) {
        bufferLock.lock();
        try {
            List<ExecutionRecord> merged = new ArrayList<>(failed.size() + buffer.size());
            merged.addAll(failed);
            merged.addAll(buffer);
            buffer = merged;
        } finally {
            bufferLock.unlock();
        }
    }

    private void requestFlush() {
        if (closed.get()) {
            flushQuietly();
            return;
        }
        try {
            flusher.execute(this::flushQuietly);
        } catch (RejectedExecutionException e) {
            flushQuietly();
        }
    }

    private void flushQuietly() {
        try {
            flush();
        } catch (Exception e) {
            log.error("Metrics flush failed msg={}", e.getMessage(), e);
        }
    }

    /**
     * Stop the timer and flush remaining records. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Flushing remaining metrics before shutdown...");
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(flushInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flusher.shutdownNow();
        }

        flush();
        int left = pendingCount();
        if (left > 0) {
            log.warn("Metrics recorder closed with {} unwritten metrics", left);
        }
    }
}
