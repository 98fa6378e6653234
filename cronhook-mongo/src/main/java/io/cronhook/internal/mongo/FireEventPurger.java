package io.cronhook.internal.mongo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically removes finished fire events once their retention has elapsed.
 */
public class FireEventPurger {
    private static final Logger log = LoggerFactory.getLogger(FireEventPurger.class);

    private final MongoDispatchQueue dispatchQueue;
    private final Duration completedRetention;
    private final Duration failedRetention;
    private final Duration interval;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public FireEventPurger(MongoDispatchQueue dispatchQueue,
                           Duration completedRetention,
                           Duration failedRetention,
                           Duration interval) {
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue must not be null");
        this.completedRetention = Objects.requireNonNull(completedRetention, "completedRetention must not be null");
        this.failedRetention = Objects.requireNonNull(failedRetention, "failedRetention must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("cronhook.purger");
            t.setDaemon(true);
            return t;
        });
        long periodMs = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::purgeQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Fire event purger started with completedRetention={}, failedRetention={}, interval={}",
                completedRetention, failedRetention, interval);
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
    }

    /**
     * @return number of fire events removed
     */
    public long purgeOnce() {
        long removed = dispatchQueue.purgeFinished(completedRetention, failedRetention);
        if (removed > 0) {
            log.info("Purged {} finished fire events", removed);
        }
        return removed;
    }

    private void purgeQuietly() {
        try {
            purgeOnce();
        } catch (RuntimeException e) {
            log.error("fire event purge failed msg={}", e.getMessage(), e);
        }
    }
}
