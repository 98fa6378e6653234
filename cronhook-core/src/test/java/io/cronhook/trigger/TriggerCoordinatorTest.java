package io.cronhook.trigger;

import io.cronhook.core.InvalidRequestException;
import io.cronhook.core.InvalidTriggerException;
import io.cronhook.core.ReplaceResult;
import io.cronhook.core.StoreUnavailableException;
import io.cronhook.core.Trigger;
import io.cronhook.core.TriggerJob;
import io.cronhook.testing.InMemoryScheduleStore;
import io.cronhook.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggerCoordinatorTest {

    private MutableClock clock;
    private InMemoryScheduleStore store;
    private TriggerCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:01:00Z"));
        store = new InMemoryScheduleStore(clock);
        coordinator = new TriggerCoordinator(store);
    }

    @Test
    void replaceShouldRegisterTriggersByIndex() {
        ReplaceResult result = coordinator.replaceTriggers("acme", List.of(
                Trigger.of("*/5 * * * *", "https://a.example/x", "POST"),
                Trigger.of("0 9 * * 1-5", "https://b.example/y", "get")
        ));

        assertEquals("acme", result.workspaceId());
        assertEquals(0, result.removed());
        assertEquals(2, result.added());

        TriggerJob first = result.jobs().get(0);
        assertEquals("acme:0", first.jobId());
        assertEquals("acme-trigger-0", first.jobName());
        assertEquals("*/5 * * * *", first.cron());
        assertEquals("https://a.example/x", first.url());
        assertEquals("POST", first.method());
        assertNull(first.nextRunAt());

        TriggerJob second = result.jobs().get(1);
        assertEquals("acme:1", second.jobId());
        assertEquals("GET", second.method());
    }

    @Test
    void replaceShouldBeIdempotent() {
        List<Trigger> triggers = List.of(
                Trigger.of("*/5 * * * *", "https://a.example/x", "POST"),
                Trigger.of("0 * * * *", "https://b.example/y", "GET")
        );

        coordinator.replaceTriggers("acme", triggers);
        ReplaceResult second = coordinator.replaceTriggers("acme", triggers);

        assertEquals(2, second.removed());
        assertEquals(2, second.added());
        assertEquals(2, store.size());
        assertEquals(List.of("acme:0", "acme:1"),
                coordinator.getTriggers("acme").stream().map(TriggerJob::jobId).toList());
    }

    @Test
    void replaceWithFewerTriggersShouldReindexDensely() {
        coordinator.replaceTriggers("acme", List.of(
                Trigger.of("* * * * *", "https://a.example/0", "GET"),
                Trigger.of("* * * * *", "https://a.example/1", "GET"),
                Trigger.of("* * * * *", "https://a.example/2", "GET")
        ));

        coordinator.replaceTriggers("acme", List.of(Trigger.of("* * * * *", "https://a.example/new", "GET")));

        List<TriggerJob> jobs = coordinator.getTriggers("acme");
        assertEquals(1, jobs.size());
        assertEquals("acme:0", jobs.get(0).jobId());
        assertEquals("https://a.example/new", jobs.get(0).url());
    }

    @Test
    void invalidTriggerShouldLeaveExistingEntriesUntouched() {
        coordinator.replaceTriggers("acme", List.of(Trigger.of("* * * * *", "https://a.example/keep", "GET")));

        InvalidTriggerException e = assertThrows(InvalidTriggerException.class, () -> coordinator.replaceTriggers("acme",
                List.of(
                        Trigger.of("* * * * *", "https://a.example/ok", "GET"),
                        Trigger.of("* * * * *", "https://a.example/ok", "GET"),
                        Trigger.of("* * * * *", "https://a.example/bad", "TRACE")
                )));

        assertEquals(2, e.index());
        assertEquals("method", e.field());
        assertTrue(e.getMessage().startsWith("Invalid trigger at index 2"));

        List<TriggerJob> jobs = coordinator.getTriggers("acme");
        assertEquals(1, jobs.size());
        assertEquals("https://a.example/keep", jobs.get(0).url());
    }

    @Test
    void emptyListShouldRemoveEverything() {
        coordinator.replaceTriggers("acme", List.of(Trigger.of("* * * * *", "https://a.example", "GET")));

        ReplaceResult result = coordinator.replaceTriggers("acme", List.of());

        assertEquals(1, result.removed());
        assertEquals(0, result.added());
        assertTrue(coordinator.getTriggers("acme").isEmpty());
    }

    @Test
    void workspacesWithSharedPrefixShouldStayIsolated() {
        coordinator.replaceTriggers("ws1", List.of(Trigger.of("* * * * *", "https://one.example", "GET")));
        coordinator.replaceTriggers("ws10", List.of(
                Trigger.of("* * * * *", "https://ten.example/a", "GET"),
                Trigger.of("* * * * *", "https://ten.example/b", "GET")
        ));

        assertEquals(1, coordinator.getTriggers("ws1").size());
        assertEquals(1, coordinator.removeTriggers("ws1"));
        assertEquals(2, coordinator.getTriggers("ws10").size());
        assertEquals(2, store.size());
    }

    @Test
    void removeShouldReturnZeroWhenNothingRegistered() {
        assertEquals(0, coordinator.removeTriggers("ghost"));
        assertEquals(0, coordinator.removeTriggers("ghost"));
    }

    @Test
    void getTriggersShouldExposeNextRunAt() {
        coordinator.replaceTriggers("acme", List.of(Trigger.of("*/5 * * * *", "https://a.example", "GET")));

        List<TriggerJob> jobs = coordinator.getTriggers("acme");
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), jobs.get(0).nextRunAt());
    }

    @Test
    void nextExecutionShouldBeEarliestAcrossEntries() {
        coordinator.replaceTriggers("acme", List.of(
                Trigger.of("0 * * * *", "https://a.example/hourly", "GET"),
                Trigger.of("*/5 * * * *", "https://a.example/five", "GET")
        ));

        assertEquals(Optional.of(Instant.parse("2026-01-01T00:05:00Z")), coordinator.nextExecution("acme"));
        assertEquals(Optional.empty(), coordinator.nextExecution("ghost"));
    }

    @Test
    void blankWorkspaceOrMissingListShouldBeRejected() {
        assertThrows(InvalidRequestException.class, () -> coordinator.replaceTriggers(" ", List.of()));
        assertThrows(InvalidRequestException.class, () -> coordinator.replaceTriggers("acme", null));
        assertThrows(InvalidRequestException.class, () -> coordinator.getTriggers(null));
        assertThrows(InvalidRequestException.class, () -> coordinator.removeTriggers(""));
    }

    @Test
    void storeFailureShouldPropagate() {
        store.setUnavailable(true);
        assertThrows(StoreUnavailableException.class, () -> coordinator.getTriggers("acme"));
        assertThrows(StoreUnavailableException.class,
                () -> coordinator.replaceTriggers("acme", List.of(Trigger.of("* * * * *", "https://a.example", "GET"))));
    }

    @Test
    void failureMidInsertShouldLeavePartialStateUntilNextReplace() {
        coordinator.replaceTriggers("acme", List.of(Trigger.of("* * * * *", "https://a.example/old", "GET")));
        store.failAfterUpserts(1);

        List<Trigger> triggers = List.of(
                Trigger.of("* * * * *", "https://a.example/0", "GET"),
                Trigger.of("* * * * *", "https://a.example/1", "GET")
        );
        assertThrows(StoreUnavailableException.class, () -> coordinator.replaceTriggers("acme", triggers));
        assertEquals(1, coordinator.getTriggers("acme").size());

        store.failAfterUpserts(-1);
        coordinator.replaceTriggers("acme", triggers);
        assertEquals(2, coordinator.getTriggers("acme").size());
    }

    @Test
    void concurrentReplacesOfDifferentWorkspacesShouldNotInterfere() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ReplaceResult>> calls = new ArrayList<>();
            for (int w = 0; w < 16; w++) {
                String ws = "ws" + w;
                List<Trigger> triggers = new ArrayList<>();
                for (int i = 0; i <= w % 4; i++) {
                    triggers.add(Trigger.of("* * * * *", "https://" + ws + ".example/" + i, "GET"));
                }
                calls.add(() -> coordinator.replaceTriggers(ws, triggers));
            }
            for (Future<ReplaceResult> f : pool.invokeAll(calls)) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        for (int w = 0; w < 16; w++) {
            String prefix = "https://ws" + w + ".example/";
            List<TriggerJob> jobs = coordinator.getTriggers("ws" + w);
            assertEquals(w % 4 + 1, jobs.size());
            assertTrue(jobs.stream().allMatch(j -> j.url().startsWith(prefix)));
        }
        assertEquals(40, store.size());
    }
}
