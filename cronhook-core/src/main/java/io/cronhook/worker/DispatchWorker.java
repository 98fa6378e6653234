package io.cronhook.worker;

import com.google.common.util.concurrent.RateLimiter;
import io.cronhook.DispatchQueue;
import io.cronhook.core.FireEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pulls fire events from the {@link DispatchQueue} and runs them on a bounded pool.
 *
 * <p>At most {@code maxConcurrency} events are in flight per process, and events are admitted at no more
 * than {@code ratePerSecond}. Each event runs in isolation: an exception in one never affects another.
 *
 * <p>{@link #stop()} stops claiming, then waits up to {@code shutdownGracePeriod} for in-flight calls.
 */
public class DispatchWorker {
    private static final Logger log = LoggerFactory.getLogger(DispatchWorker.class);

    private final DispatchQueue dispatchQueue;
    private final ExecutionWorker executionWorker;
    private final int maxConcurrency;
    private final Duration processEvery;
    private final Duration leaseDuration;
    private final Duration shutdownGracePeriod;
    private final RateLimiter admissionLimiter;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore slots;
    private final Semaphore refillSignal = new Semaphore(0);

    private ExecutorService workerPool;
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public DispatchWorker(DispatchQueue dispatchQueue,
                          ExecutionWorker executionWorker,
                          int maxConcurrency,
                          double ratePerSecond,
                          Duration processEvery,
                          Duration leaseDuration,
                          Duration shutdownGracePeriod) {
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue must not be null");
        this.executionWorker = Objects.requireNonNull(executionWorker, "executionWorker must not be null");
        this.processEvery = requirePositive(processEvery, "processEvery");
        this.leaseDuration = requirePositive(leaseDuration, "leaseDuration");
        this.shutdownGracePeriod = requirePositive(shutdownGracePeriod, "shutdownGracePeriod");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be positive");
        }
        this.maxConcurrency = maxConcurrency;
        this.slots = new Semaphore(maxConcurrency);
        this.admissionLimiter = RateLimiter.create(ratePerSecond);
    }

    /**
     * Start polling and executing. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Dispatch worker starting with workerId={}, maxConcurrency={}, rate={}/s, processEvery={}, lease={}",
                executionWorker.workerId(), maxConcurrency, admissionLimiter.getRate(), processEvery, leaseDuration);

        AtomicInteger seq = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("cronhook.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("cronhook.dispatcher");
        pollerThread.setDaemon(true);
        pollerThread.start();
        log.info("Dispatch worker started successfully.");
    }

    /**
     * Stop claiming new events and drain in-flight ones. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Dispatch worker stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            try {
                pollerThread.join(processEvery.toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("In-flight executions did not finish within {}; interrupting", shutdownGracePeriod);
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        refillSignal.drainPermits();
        log.info("Dispatch worker stopped successfully.");
    }

    public boolean isRunning() {
        return started.get();
    }

    public int inFlight() {
        return maxConcurrency - slots.availablePermits();
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("dispatch pollOnce failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    refillSignal.tryAcquire(processEvery.toMillis(), TimeUnit.MILLISECONDS);
                }
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
     * @return true when every free slot was filled, meaning more work is probably waiting
     */
    private boolean pollOnce() throws InterruptedException {
        int free = slots.availablePermits();
        if (free == 0) {
            return true;
        }

        List<FireEvent> events = dispatchQueue.claimDue(free, leaseDuration, executionWorker.workerId());
        log.debug("Dispatch polled events count={} free={}", events.size(), free);

        for (FireEvent event : events) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            admissionLimiter.acquire();
            slots.acquire();
            submit(event);
        }
        return events.size() >= free;
    }

    private void submit(FireEvent event) {
        try {
            workerPool.submit(() -> {
                try {
                    executionWorker.execute(event);
                } catch (Exception e) {
                    log.error("execution failed job={} attempt={} msg={}", event.id(), event.attempt(), e.getMessage(), e);
                } finally {
                    slots.release();
                    refillSignal.release();
                }
            });
        } catch (RejectedExecutionException e) {
            // Shutting down; the lease expires and another worker picks the event up.
            slots.release();
            log.debug("Dropped claimed event during shutdown job={}", event.id());
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }
}
