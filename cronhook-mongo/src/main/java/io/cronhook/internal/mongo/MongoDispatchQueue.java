package io.cronhook.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.cronhook.DispatchQueue;
import io.cronhook.core.EntryKey;
import io.cronhook.core.FireEvent;
import io.cronhook.core.FireEventState;
import io.cronhook.core.FirePayload;
import io.cronhook.core.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * MongoDB-backed {@link DispatchQueue}.
 *
 * <p>An event is claimable when its {@code runAt} has arrived and it is either waiting
 * ({@code PENDING}, {@code RETRY_SCHEDULED}) or {@code IN_FLIGHT} with an expired lease. The latter is how an
 * event whose worker crashed gets delivered again. Outcome reports match on {@code lockedBy}, so a worker
 * that lost its lease cannot overwrite the new owner's state.
 */
public class MongoDispatchQueue implements DispatchQueue {
    private static final Logger log = LoggerFactory.getLogger(MongoDispatchQueue.class);

    private static final List<FireEventState> WAITING = List.of(FireEventState.PENDING, FireEventState.RETRY_SCHEDULED);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoDispatchQueue(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, Clock.systemUTC());
    }

    public MongoDispatchQueue(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Insert-if-absent by event id; an existing event is left untouched.
     */
    @Override
    public boolean enqueue(FireEvent event) {
        Objects.requireNonNull(event, "event must not be null");

        Query q = new Query(Criteria.where("_id").is(event.id()));
        Update u = new Update()
                .setOnInsert("entryKey", event.key().id())
                .setOnInsert("workspaceId", event.workspaceId())
                .setOnInsert("jobName", event.jobName())
                .setOnInsert("payload", toMap(event.payload()))
                .setOnInsert("attempt", event.attempt())
                .setOnInsert("state", FireEventState.PENDING)
                .setOnInsert("runAt", event.runAt())
                .setOnInsert("createdAt", clock.instant());

        try {
            UpdateResult result = mongoTemplate.upsert(q, u, FireEventDocument.class);
            return result.getUpsertedId() != null;
        } catch (DuplicateKeyException e) {
            // lost the insert race against another ticker
            return false;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Dispatch queue failed to enqueue " + event.id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Atomically claims at most {@code max} due events, oldest {@code runAt} first.
     */
    @Override
    public List<FireEvent> claimDue(int max, Duration lease, String workerId) {
        Objects.requireNonNull(lease, "lease must not be null");
        if (max <= 0) {
            return List.of();
        }
        if (lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Instant now = clock.instant();
        Query baseQuery = new Query(
                Criteria.where("runAt").lte(now)
                        .orOperator(
                                Criteria.where("state").in(WAITING),
                                Criteria.where("state").is(FireEventState.IN_FLIGHT).and("lockUntil").lte(now)
                        )
        );
        baseQuery.with(Sort.by(Sort.Order.asc("runAt")));

        Update lockUpdate = new Update()
                .set("state", FireEventState.IN_FLIGHT)
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lease))
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        return guarded("claim due fire events", () -> {
            List<FireEvent> claimed = new ArrayList<>(Math.min(max, 64));
            for (int i = 0; i < max; i++) {
                FireEventDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, FireEventDocument.class);
                if (doc == null) {
                    break;
                }
                claimed.add(toEvent(doc));
            }
            return claimed;
        });
    }

    @Override
    public void markSucceeded(FireEvent event, String workerId) {
        Update u = releaseLock(new Update())
                .set("state", FireEventState.SUCCEEDED)
                .set("finishedAt", clock.instant())
                .unset("lastError");
        transition(event, workerId, u, FireEventState.SUCCEEDED);
    }

    @Override
    public void scheduleRetry(FireEvent event, String workerId, Instant runAt, String error) {
        Objects.requireNonNull(runAt, "runAt must not be null");
        Update u = releaseLock(new Update())
                .set("state", FireEventState.RETRY_SCHEDULED)
                .set("attempt", event.attempt() + 1)
                .set("runAt", runAt)
                .set("lastError", error);
        transition(event, workerId, u, FireEventState.RETRY_SCHEDULED);
    }

    @Override
    public void markPermanentlyFailed(FireEvent event, String workerId, String error) {
        Update u = releaseLock(new Update())
                .set("state", FireEventState.PERMANENTLY_FAILED)
                .set("finishedAt", clock.instant())
                .set("lastError", error);
        transition(event, workerId, u, FireEventState.PERMANENTLY_FAILED);
    }

    /**
     * Delete finished events older than their retention.
     *
     * @return number of documents removed
     */
    public long purgeFinished(Duration completedRetention, Duration failedRetention) {
        Objects.requireNonNull(completedRetention, "completedRetention must not be null");
        Objects.requireNonNull(failedRetention, "failedRetention must not be null");

        Instant now = clock.instant();
        Query completed = new Query(Criteria.where("state").is(FireEventState.SUCCEEDED)
                .and("finishedAt").lt(now.minus(completedRetention)));
        Query failed = new Query(Criteria.where("state").is(FireEventState.PERMANENTLY_FAILED)
                .and("finishedAt").lt(now.minus(failedRetention)));

        return guarded("purge finished fire events", () ->
                mongoTemplate.remove(completed, FireEventDocument.class).getDeletedCount()
                        + mongoTemplate.remove(failed, FireEventDocument.class).getDeletedCount());
    }

    public Map<FireEventState, Long> countByState() {
        return guarded("count fire events", () -> {
            Map<FireEventState, Long> counts = new EnumMap<>(FireEventState.class);
            for (FireEventState state : FireEventState.values()) {
                counts.put(state, mongoTemplate.count(new Query(Criteria.where("state").is(state)), FireEventDocument.class));
            }
            return counts;
        });
    }

    private void transition(FireEvent event, String workerId, Update update, FireEventState target) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(event.id())
                        // Prevent stale write-back if another worker already re-claimed this event.
                        .and("lockedBy").is(workerId)
                        .and("state").is(FireEventState.IN_FLIGHT)
        );

        long modified = guarded("move " + event.id() + " to " + target,
                () -> mongoTemplate.updateFirst(q, update, FireEventDocument.class).getModifiedCount());
        if (modified == 0) {
            log.warn("Lease lost before reporting outcome job={} state={} worker={}", event.id(), target, workerId);
        }
    }

    private static Update releaseLock(Update u) {
        return u.unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
    }

    FireEvent toEvent(FireEventDocument doc) {
        FirePayload payload = objectMapper.convertValue(doc.getPayload(), FirePayload.class);
        return new FireEvent(doc.getId(), EntryKey.parse(doc.getEntryKey()), payload, doc.getAttempt(), doc.getRunAt());
    }

    private Map<String, Object> toMap(FirePayload payload) {
        return objectMapper.convertValue(payload, new TypeReference<>() {
        });
    }

    private static <T> T guarded(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Dispatch queue failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
