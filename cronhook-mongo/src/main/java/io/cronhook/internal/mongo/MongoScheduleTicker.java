package io.cronhook.internal.mongo;

import io.cronhook.DispatchQueue;
import io.cronhook.core.FireEvent;
import io.cronhook.core.ScheduleEntry;
import io.cronhook.utils.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns due schedule entries into fire events.
 *
 * <p>Each poll claims due entries, enqueues one event per elapsed tick and advances {@code nextRunAt} past
 * now. Event ids are derived from the entry key and tick time, so a tick re-emitted after a crash (the
 * entry lease expired before the advance) is deduplicated by the queue. Ticks older than
 * {@code catchUpWindow} are dropped, so the lease must be shorter than the window for that recovery to
 * replay the tick. An entry whose emission fails is released untouched and retried on the next poll.
 */
public class MongoScheduleTicker {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleTicker.class);

    private static final int MAX_TICKS_PER_ENTRY = 1000;

    private final MongoScheduleStore scheduleStore;
    private final DispatchQueue dispatchQueue;
    private final int batchSize;
    private final Duration processEvery;
    private final Duration lockLifetime;
    private final Duration catchUpWindow;
    private final String workerId;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public MongoScheduleTicker(MongoScheduleStore scheduleStore,
                               DispatchQueue dispatchQueue,
                               int batchSize,
                               Duration processEvery,
                               Duration lockLifetime,
                               Duration catchUpWindow,
                               String workerId) {
        this(scheduleStore, dispatchQueue, batchSize, processEvery, lockLifetime, catchUpWindow, workerId,
                Clock.systemUTC());
    }

    public MongoScheduleTicker(MongoScheduleStore scheduleStore,
                               DispatchQueue dispatchQueue,
                               int batchSize,
                               Duration processEvery,
                               Duration lockLifetime,
                               Duration catchUpWindow,
                               String workerId,
                               Clock clock) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue must not be null");
        this.processEvery = Objects.requireNonNull(processEvery, "processEvery must not be null");
        this.lockLifetime = Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        this.catchUpWindow = Objects.requireNonNull(catchUpWindow, "catchUpWindow must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.batchSize = Math.max(1, batchSize);
        if (lockLifetime.compareTo(catchUpWindow) >= 0) {
            throw new IllegalArgumentException("lockLifetime " + lockLifetime
                    + " must be shorter than catchUpWindow " + catchUpWindow);
        }
    }

    /**
     * Start polling. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Schedule ticker starting with processEvery={}, lockLifetime={}, catchUpWindow={}, workerId={}, batchSize={}",
                processEvery, lockLifetime, catchUpWindow, workerId, batchSize);

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("cronhook.ticker");
        pollerThread.setDaemon(true);
        pollerThread.start();
    }

    /**
     * Stop polling. Entries claimed but not yet advanced are picked up again once their lease expires.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Schedule ticker stopping...");
        if (pollerThread != null) {
            pollerThread.interrupt();
            try {
                pollerThread.join(processEvery.toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            pollerThread = null;
        }
        log.info("Schedule ticker stopped successfully.");
    }

    public boolean isRunning() {
        return started.get();
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = tickOnce() >= batchSize;
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("ticker tickOnce failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get() || backlog) {
                continue;
            }

            try {
                Thread.sleep(processEvery.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * One poll: claim due entries, emit their ticks and advance them.
     *
     * @return number of entries claimed
     */
    public int tickOnce() {
        Instant now = clock.instant();
        List<ScheduleEntryDocument> due = scheduleStore.claimDueEntries(now, batchSize, lockLifetime, workerId);
        log.debug("Ticker claimed entries count={} now={}", due.size(), now);

        for (ScheduleEntryDocument doc : due) {
            try {
                emit(doc, now);
            } catch (RuntimeException e) {
                log.error("Failed to emit ticks job={} msg={}", doc.getId(), e.getMessage(), e);
                release(doc);
            }
        }
        return due.size();
    }

    private void release(ScheduleEntryDocument doc) {
        try {
            scheduleStore.release(doc.getId(), workerId);
        } catch (RuntimeException e) {
            log.warn("Failed to release entry job={}, it is retried when the lease expires msg={}",
                    doc.getId(), e.getMessage());
        }
    }

    private void emit(ScheduleEntryDocument doc, Instant now) {
        ScheduleEntry entry = scheduleStore.toEntry(doc);
        ZoneId zone = scheduleStore.zoneOf(doc);
        Instant oldest = now.minus(catchUpWindow);

        Instant tick = doc.getNextRunAt();
        Instant lastEmitted = null;
        int emitted = 0;
        int dropped = 0;

        for (int i = 0; tick != null && !tick.isAfter(now) && i < MAX_TICKS_PER_ENTRY; i++) {
            if (tick.isBefore(oldest)) {
                dropped++;
            } else {
                dispatchQueue.enqueue(FireEvent.firstAttempt(entry, tick));
                lastEmitted = tick;
                emitted++;
            }
            tick = CronExpressions.nextFireTime(doc.getCron(), zone, tick);
        }
        if (tick != null && !tick.isAfter(now)) {
            tick = CronExpressions.computeNextRunAt(doc.getCron(), zone, tick, now);
        }

        if (dropped > 0) {
            log.warn("[{}] Dropped {} missed ticks older than {} job={}", entry.key().workspaceId(), dropped,
                    catchUpWindow, doc.getId());
        }

        if (!scheduleStore.advance(doc.getId(), workerId, lastEmitted, tick)) {
            log.debug("Entry replaced or re-claimed before advance job={}", doc.getId());
        }
        log.debug("[{}] Emitted {} ticks job={} nextRunAt={}", entry.key().workspaceId(), emitted, doc.getId(), tick);
    }
}
