package io.cronhook.worker;

import io.cronhook.DispatchQueue;
import io.cronhook.core.EntryKey;
import io.cronhook.core.FireEvent;
import io.cronhook.core.FireEventState;
import io.cronhook.core.FirePayload;
import io.cronhook.core.ScheduleEntry;
import io.cronhook.core.Trigger;
import io.cronhook.testing.InMemoryDispatchQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchWorkerTest {

    private static final String WORKER = "worker-A";

    @Mock
    private ExecutionWorker executionWorker;

    private final InMemoryDispatchQueue queue = new InMemoryDispatchQueue();
    private DispatchWorker dispatchWorker;

    @AfterEach
    void tearDown() {
        if (dispatchWorker != null) {
            dispatchWorker.stop();
        }
    }

    @Test
    void shouldNeverExceedMaxConcurrency() throws Exception {
        int maxConcurrency = 3;
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(12);

        when(executionWorker.workerId()).thenReturn(WORKER);
        when(executionWorker.execute(any())).thenAnswer(inv -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            FireEvent event = inv.getArgument(0);
            queue.markSucceeded(event, WORKER);
            done.countDown();
            return FireEventState.SUCCEEDED;
        });

        for (int i = 0; i < 12; i++) {
            enqueue("acme", i);
        }

        dispatchWorker = new DispatchWorker(queue, executionWorker, maxConcurrency, 1000,
                Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofSeconds(5));
        dispatchWorker.start();

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertTrue(peak.get() <= maxConcurrency, "peak concurrency was " + peak.get());
        assertEquals(12, queue.countInState(FireEventState.SUCCEEDED));
    }

    @Test
    void failingExecutionShouldNotStopOtherEvents() throws Exception {
        CountDownLatch done = new CountDownLatch(3);
        when(executionWorker.workerId()).thenReturn(WORKER);
        when(executionWorker.execute(any())).thenAnswer(inv -> {
            FireEvent event = inv.getArgument(0);
            done.countDown();
            if (event.key().index() == 1) {
                throw new IllegalStateException("boom");
            }
            queue.markSucceeded(event, WORKER);
            return FireEventState.SUCCEEDED;
        });

        for (int i = 0; i < 3; i++) {
            enqueue("acme", i);
        }

        dispatchWorker = new DispatchWorker(queue, executionWorker, 2, 100,
                Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofSeconds(5));
        dispatchWorker.start();

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(waitUntil(() -> queue.countInState(FireEventState.SUCCEEDED) == 2, 5000));
        assertEquals(FireEventState.IN_FLIGHT, queue.get(FireEvent.idFor(new EntryKey("acme", 1), tick())).state());
    }

    @Test
    void stopShouldWaitForInFlightExecutions() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        when(executionWorker.workerId()).thenReturn(WORKER);
        when(executionWorker.execute(any())).thenAnswer(inv -> {
            started.countDown();
            Thread.sleep(300);
            finished.incrementAndGet();
            return FireEventState.SUCCEEDED;
        });
        enqueue("acme", 0);

        dispatchWorker = new DispatchWorker(queue, executionWorker, 1, 100,
                Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofSeconds(5));
        dispatchWorker.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        dispatchWorker.stop();

        assertEquals(1, finished.get());
        assertFalse(dispatchWorker.isRunning());
        assertEquals(0, dispatchWorker.inFlight());
    }

    @Test
    void invalidSettingsShouldBeRejected() {
        DispatchQueue dq = queue;
        assertThrows(IllegalArgumentException.class, () -> new DispatchWorker(dq, executionWorker, 0, 10,
                Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(5)));
        assertThrows(IllegalArgumentException.class, () -> new DispatchWorker(dq, executionWorker, 1, 0,
                Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(5)));
        assertThrows(IllegalArgumentException.class, () -> new DispatchWorker(dq, executionWorker, 1, 10,
                Duration.ZERO, Duration.ofSeconds(30), Duration.ofSeconds(5)));
    }

    private static Instant tick() {
        return Instant.parse("2026-01-01T00:00:00Z");
    }

    private void enqueue(String workspaceId, int index) {
        EntryKey key = new EntryKey(workspaceId, index);
        Trigger trigger = Trigger.of("* * * * *", "https://example.com/" + index, "GET");
        ScheduleEntry entry = new ScheduleEntry(key, trigger.cron(), "UTC", new FirePayload(workspaceId, trigger), null);
        queue.enqueue(FireEvent.firstAttempt(entry, tick()));
    }

    private static boolean waitUntil(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
