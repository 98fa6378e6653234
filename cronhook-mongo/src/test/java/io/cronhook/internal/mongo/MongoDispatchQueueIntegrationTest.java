package io.cronhook.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.cronhook.core.EntryKey;
import io.cronhook.core.FireEvent;
import io.cronhook.core.FireEventState;
import io.cronhook.core.FirePayload;
import io.cronhook.core.ScheduleEntry;
import io.cronhook.core.Trigger;
import io.cronhook.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoDispatchQueueIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant TICK = Instant.parse("2026-01-01T00:05:00Z");

    private final MutableClock clock = new MutableClock(TICK.plusSeconds(1));
    private MongoTemplate mongoTemplate;
    private MongoDispatchQueue queue;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "cronhook_test");
        mongoTemplate.dropCollection(FireEventDocument.class);
        queue = new MongoDispatchQueue(mongoTemplate, new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(FireEventDocument.class);
    }

    @Test
    void enqueueShouldBeInsertIfAbsent() {
        FireEvent event = event("acme", 0, TICK);

        assertTrue(queue.enqueue(event));
        assertFalse(queue.enqueue(event));
        assertEquals(1, mongoTemplate.count(new Query(), FireEventDocument.class));

        FireEventDocument doc = mongoTemplate.findById(event.id(), FireEventDocument.class);
        assertNotNull(doc);
        assertEquals("acme:0@" + TICK.toEpochMilli(), doc.getId());
        assertEquals(FireEventState.PENDING, doc.getState());
        assertEquals("acme-trigger-0", doc.getJobName());
    }

    @Test
    void claimShouldRoundTripEventAndPreventDoubleClaim() {
        FireEvent event = event("acme", 0, TICK);
        queue.enqueue(event);

        List<FireEvent> first = queue.claimDue(10, Duration.ofSeconds(30), "worker-A");
        List<FireEvent> second = queue.claimDue(10, Duration.ofSeconds(30), "worker-B");

        assertEquals(1, first.size());
        assertTrue(second.isEmpty());

        FireEvent claimed = first.get(0);
        assertEquals(event.id(), claimed.id());
        assertEquals(new EntryKey("acme", 0), claimed.key());
        assertEquals(0, claimed.attempt());
        assertEquals("https://a.example/hook", claimed.trigger().url());
        assertEquals(Map.of("x", 1), claimed.trigger().payload());
        assertEquals(Map.of("X-Key", "k"), claimed.trigger().headers());
    }

    @Test
    void futureEventsShouldNotBeClaimed() {
        queue.enqueue(event("acme", 0, TICK.plusSeconds(60)));

        assertTrue(queue.claimDue(10, Duration.ofSeconds(30), "worker-A").isEmpty());

        clock.advance(Duration.ofSeconds(60));
        assertEquals(1, queue.claimDue(10, Duration.ofSeconds(30), "worker-A").size());
    }

    @Test
    void expiredLeaseShouldMakeEventClaimableAgain() {
        queue.enqueue(event("acme", 0, TICK));
        FireEvent claimed = queue.claimDue(1, Duration.ofSeconds(30), "worker-A").get(0);

        clock.advance(Duration.ofSeconds(31));
        List<FireEvent> reclaimed = queue.claimDue(1, Duration.ofSeconds(30), "worker-B");
        assertEquals(1, reclaimed.size());

        // the original holder reporting late is ignored
        queue.markSucceeded(claimed, "worker-A");
        assertEquals(FireEventState.IN_FLIGHT, stateOf(claimed));

        queue.markSucceeded(reclaimed.get(0), "worker-B");
        assertEquals(FireEventState.SUCCEEDED, stateOf(claimed));
    }

    @Test
    void retryShouldIncrementAttemptAndDelay() {
        queue.enqueue(event("acme", 0, TICK));
        FireEvent claimed = queue.claimDue(1, Duration.ofSeconds(30), "worker-A").get(0);

        queue.scheduleRetry(claimed, "worker-A", clock.instant().plusSeconds(2), "timeout of 30000ms exceeded");

        FireEventDocument doc = mongoTemplate.findById(claimed.id(), FireEventDocument.class);
        assertNotNull(doc);
        assertEquals(FireEventState.RETRY_SCHEDULED, doc.getState());
        assertEquals(1, doc.getAttempt());
        assertEquals("timeout of 30000ms exceeded", doc.getLastError());
        assertNull(doc.getLockedBy());

        assertTrue(queue.claimDue(1, Duration.ofSeconds(30), "worker-A").isEmpty());
        clock.advance(Duration.ofSeconds(2));
        FireEvent retry = queue.claimDue(1, Duration.ofSeconds(30), "worker-A").get(0);
        assertEquals(1, retry.attempt());

        queue.markPermanentlyFailed(retry, "worker-A", "gave up");
        assertEquals(FireEventState.PERMANENTLY_FAILED, stateOf(retry));
        assertTrue(queue.claimDue(1, Duration.ofSeconds(30), "worker-A").isEmpty());
    }

    @Test
    void purgeShouldHonourRetentionPerState() {
        FireEvent ok = event("acme", 0, TICK);
        FireEvent bad = event("acme", 1, TICK);
        queue.enqueue(ok);
        queue.enqueue(bad);
        List<FireEvent> claimed = queue.claimDue(2, Duration.ofSeconds(30), "worker-A");
        queue.markSucceeded(claimed.get(0), "worker-A");
        queue.markPermanentlyFailed(claimed.get(1), "worker-A", "boom");

        clock.advance(Duration.ofHours(25));
        assertEquals(1, queue.purgeFinished(Duration.ofHours(24), Duration.ofDays(7)));

        Map<FireEventState, Long> counts = queue.countByState();
        assertEquals(0L, counts.get(FireEventState.SUCCEEDED));
        assertEquals(1L, counts.get(FireEventState.PERMANENTLY_FAILED));

        clock.advance(Duration.ofDays(7));
        assertEquals(1, queue.purgeFinished(Duration.ofHours(24), Duration.ofDays(7)));
    }

    @Test
    void purgerShouldOnlyRemoveExpiredFinishedEvents() {
        FireEvent done = event("acme", 0, TICK);
        queue.enqueue(done);
        queue.enqueue(event("acme", 1, TICK.plusSeconds(3600)));
        queue.markSucceeded(queue.claimDue(1, Duration.ofSeconds(30), "worker-A").get(0), "worker-A");

        FireEventPurger purger = new FireEventPurger(queue, Duration.ofHours(1), Duration.ofDays(1), Duration.ofMinutes(10));
        assertEquals(0, purger.purgeOnce());

        clock.advance(Duration.ofHours(2));
        assertEquals(1, purger.purgeOnce());
        assertNull(mongoTemplate.findById(done.id(), FireEventDocument.class));
        assertEquals(1L, queue.countByState().get(FireEventState.PENDING));
    }

    private FireEventState stateOf(FireEvent event) {
        FireEventDocument doc = mongoTemplate.findById(event.id(), FireEventDocument.class);
        assertNotNull(doc);
        return doc.getState();
    }

    private static FireEvent event(String workspaceId, int index, Instant tick) {
        EntryKey key = new EntryKey(workspaceId, index);
        Trigger trigger = new Trigger("* * * * *", "https://a.example/hook", "POST", Map.of("x", 1), Map.of("X-Key", "k"));
        ScheduleEntry entry = new ScheduleEntry(key, trigger.cron(), "UTC", new FirePayload(workspaceId, trigger), tick);
        return FireEvent.firstAttempt(entry, tick);
    }
}
