package io.cronhook.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhook.ObjectStore;
import io.cronhook.core.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Rebuilds a workspace's recent execution history from the partitioned metrics objects.
 *
 * <p>Hour partitions are scanned newest first, {@code batchHours} at a time, on a fixed pool of
 * {@code parallelism} threads. Scanning stops once {@code limit} records were collected or the
 * look-back window is exhausted. Legacy partitions (no workspace in the path) are scanned for the
 * most recent {@code legacyLookbackHours} hours and filtered by workspace id.
 *
 * <p>Records are de-duplicated on {@code (timestamp, job_id)} since the recorder may persist a record twice.
 * Unreadable objects and partitions are skipped.
 */
public class MetricsReader implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsReader.class);

    public static final int DEFAULT_LIMIT = 100;

    /**
     * Scan bounds.
     * <ul>
     *   <li>lookbackHours: hour partitions scanned under the workspace prefix</li>
     *   <li>legacyLookbackHours: hour partitions scanned under the legacy prefix</li>
     *   <li>batchHours: hours fetched concurrently per batch</li>
     *   <li>maxObjectsPerPartition / legacyMaxObjectsPerPartition: objects read per hour partition</li>
     * </ul>
     */
    public record ScanOptions(int lookbackHours,
                              int legacyLookbackHours,
                              int batchHours,
                              int maxObjectsPerPartition,
                              int legacyMaxObjectsPerPartition) {
        public static ScanOptions defaults() {
            return new ScanOptions(168, 24, 24, 100, 5);
        }
    }

    private record DedupKey(Instant timestamp, String jobId) {
    }

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final ScanOptions options;
    private final Clock clock;
    private final ExecutorService readers;

    public MetricsReader(ObjectStore objectStore, ObjectMapper objectMapper, ScanOptions options, int parallelism) {
        this(objectStore, objectMapper, options, parallelism, Clock.systemUTC());
    }

    public MetricsReader(ObjectStore objectStore, ObjectMapper objectMapper, ScanOptions options, int parallelism,
                         Clock clock) {
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore must not be null");
        this.objectMapper = MetricsJson.configure(Objects.requireNonNull(objectMapper, "objectMapper must not be null"));
        this.options = options == null ? ScanOptions.defaults() : options;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (this.options.batchHours() <= 0) {
            throw new IllegalArgumentException("batchHours must be positive");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }

        AtomicInteger seq = new AtomicInteger();
        this.readers = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r);
            t.setName("cronhook.metricsReader-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public WorkspaceMetrics getWorkspaceMetrics(String workspaceId) {
        return getWorkspaceMetrics(workspaceId, DEFAULT_LIMIT);
    }

    public WorkspaceMetrics getWorkspaceMetrics(String workspaceId, int limit) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new InvalidRequestException("workspace_id is required");
        }
        if (limit <= 0) {
            throw new InvalidRequestException("limit must be a positive number");
        }

        Instant currentHour = clock.instant().truncatedTo(ChronoUnit.HOURS);
        List<ExecutionRecord> collected = new ArrayList<>();

        for (int batchStart = 0;
             batchStart < options.lookbackHours() && collected.size() < limit;
             batchStart += options.batchHours()) {

            int batchEnd = Math.min(batchStart + options.batchHours(), options.lookbackHours());
            List<CompletableFuture<List<ExecutionRecord>>> futures = new ArrayList<>();

            for (int h = batchStart; h < batchEnd; h++) {
                Instant hour = currentHour.minus(h, ChronoUnit.HOURS);
                String prefix = MetricsPaths.workspacePrefix(workspaceId, hour);
                futures.add(CompletableFuture.supplyAsync(
                        () -> readPartition(prefix, options.maxObjectsPerPartition(), r -> true), readers));

                if (h < options.legacyLookbackHours()) {
                    String legacyPrefix = MetricsPaths.legacyPrefix(hour);
                    futures.add(CompletableFuture.supplyAsync(
                            () -> readPartition(legacyPrefix, options.legacyMaxObjectsPerPartition(),
                                    r -> workspaceId.equals(r.workspaceId())),
                            readers));
                }
            }

            for (CompletableFuture<List<ExecutionRecord>> f : futures) {
                collected.addAll(f.join());
            }
        }

        Map<DedupKey, ExecutionRecord> unique = new LinkedHashMap<>();
        for (ExecutionRecord r : collected) {
            unique.putIfAbsent(new DedupKey(r.timestamp(), r.jobId()), r);
        }

        List<ExecutionRecord> executions = unique.values().stream()
                .sorted(Comparator.comparing(ExecutionRecord::timestamp,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .limit(limit)
                .toList();

        log.debug("Loaded {} executions for workspace={} (scanned {} records)",
                executions.size(), workspaceId, collected.size());

        return new WorkspaceMetrics(workspaceId, executions.size(), MetricsStats.of(executions), executions);
    }

    private List<ExecutionRecord> readPartition(String prefix, int maxObjects, Predicate<ExecutionRecord> filter) {
        List<String> keys;
        try {
            keys = objectStore.list(prefix, maxObjects);
        } catch (IOException | RuntimeException e) {
            log.debug("Skipping unreadable partition {} msg={}", prefix, e.getMessage());
            return List.of();
        }

        List<ExecutionRecord> records = new ArrayList<>();
        for (String key : keys) {
            try {
                JsonNode root = objectMapper.readTree(objectStore.get(key));
                if (root.isArray()) {
                    for (JsonNode node : root) {
                        addIfMatching(records, objectMapper.treeToValue(node, ExecutionRecord.class), filter);
                    }
                } else if (root.isObject()) {
                    addIfMatching(records, objectMapper.treeToValue(root, ExecutionRecord.class), filter);
                }
            } catch (IOException | RuntimeException e) {
                log.debug("Skipping unreadable metrics object {} msg={}", key, e.getMessage());
            }
        }
        return records;
    }

    private static void addIfMatching(List<ExecutionRecord> out, ExecutionRecord r, Predicate<ExecutionRecord> filter) {
        if (r != null && filter.test(r)) {
            out.add(r);
        }
    }

    @Override
    public void close() {
        readers.shutdown();
        try {
            if (!readers.awaitTermination(5, TimeUnit.SECONDS)) {
                readers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            readers.shutdownNow();
        }
    }
}
