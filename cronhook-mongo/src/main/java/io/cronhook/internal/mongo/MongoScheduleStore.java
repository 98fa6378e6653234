package io.cronhook.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhook.ScheduleStore;
import io.cronhook.core.EntryKey;
import io.cronhook.core.FirePayload;
import io.cronhook.core.ScheduleEntry;
import io.cronhook.core.StoreUnavailableException;
import io.cronhook.utils.CronExpressions;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for repeating schedule entries.
 *
 * <p>Entries are keyed by {@code {workspaceId}:{index}}, so an upsert of the same key always replaces the
 * existing document. Workspace lookups match the {@code workspaceId} field exactly.
 *
 * <p>Tick emission claims entries with the same {@code findAndModify} lease lock used for fire events, which
 * keeps it safe with any number of processes polling the collection.
 */
public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;
    private final Clock clock;

    public MongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, ZoneId zone) {
        this(mongoTemplate, objectMapper, zone, Clock.systemUTC());
    }

    public MongoScheduleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, ZoneId zone, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<ScheduleEntry> listRepeating() {
        return guarded("list schedule entries", () -> {
            Query q = new Query().with(Sort.by(Sort.Order.asc("workspaceId"), Sort.Order.asc("index")));
            return mongoTemplate.find(q, ScheduleEntryDocument.class).stream().map(this::toEntry).toList();
        });
    }

    @Override
    public List<ScheduleEntry> listRepeating(String workspaceId) {
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        return guarded("list schedule entries of " + workspaceId, () -> {
            Query q = new Query(Criteria.where("workspaceId").is(workspaceId))
                    .with(Sort.by(Sort.Order.asc("index")));
            return mongoTemplate.find(q, ScheduleEntryDocument.class).stream().map(this::toEntry).toList();
        });
    }

    /**
     * Insert or replace the entry. Replacing recomputes {@code nextRunAt} from now and releases any tick lease.
     */
    @Override
    public ScheduleEntry upsertRepeating(EntryKey key, String cronPattern, FirePayload payload) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(cronPattern, "cronPattern must not be null");
        Objects.requireNonNull(payload, "payload must not be null");

        Instant now = clock.instant();
        Instant nextRunAt = CronExpressions.nextFireTime(cronPattern, zone, now);

        Query q = new Query(Criteria.where("_id").is(key.id()));
        Update u = new Update()
                .set("workspaceId", key.workspaceId())
                .set("index", key.index())
                .set("jobName", key.jobName())
                .set("cron", cronPattern)
                .set("timezone", zone.getId())
                .set("payload", toMap(payload))
                .set("nextRunAt", nextRunAt)
                .set("updatedAt", now)
                .setOnInsert("createdAt", now)
                .unset("lastTickAt")
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");

        guarded("upsert schedule entry " + key, () -> mongoTemplate.upsert(q, u, ScheduleEntryDocument.class));
        return new ScheduleEntry(key, cronPattern, zone.getId(), payload, nextRunAt);
    }

    @Override
    public boolean removeRepeatingByKey(EntryKey key) {
        Objects.requireNonNull(key, "key must not be null");
        Query q = new Query(Criteria.where("_id").is(key.id()));
        return guarded("remove schedule entry " + key,
                () -> mongoTemplate.remove(q, ScheduleEntryDocument.class).getDeletedCount() > 0);
    }

    /**
     * Atomically claims (locks) at most {@code batchSize} entries whose tick is due at {@code now}.
     *
     * <p>An entry is due when {@code nextRunAt <= now} and it is not locked, or its lock has expired.
     */
    public List<ScheduleEntryDocument> claimDueEntries(Instant now, int batchSize, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query baseQuery = new Query(
                Criteria.where("nextRunAt").ne(null).lte(now)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now)
                        )
        );
        baseQuery.with(Sort.by(Sort.Order.asc("nextRunAt")));

        Update lockUpdate = new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        return guarded("claim due schedule entries", () -> {
            List<ScheduleEntryDocument> claimed = new ArrayList<>(Math.min(batchSize, 64));
            for (int i = 0; i < batchSize; i++) {
                ScheduleEntryDocument doc =
                        mongoTemplate.findAndModify(baseQuery, lockUpdate, options, ScheduleEntryDocument.class);
                if (doc == null) {
                    break;
                }
                claimed.add(doc);
            }
            return claimed;
        });
    }

    /**
     * Move a claimed entry to its next tick and release the lease. Ignored when the caller no longer holds
     * the lease, or the entry was replaced in the meantime.
     *
     * @return true if the entry was advanced
     */
    public boolean advance(String id, String workerId, Instant lastTickAt, Instant nextRunAtOrNull) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        // Prevent stale write-back if the entry was re-claimed or replaced.
                        .and("lockedBy").is(workerId)
        );

        Update u = new Update()
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
        if (lastTickAt != null) {
            u.set("lastTickAt", lastTickAt);
        }
        if (nextRunAtOrNull != null) {
            u.set("nextRunAt", nextRunAtOrNull);
        } else {
            u.unset("nextRunAt");
        }

        return guarded("advance schedule entry " + id,
                () -> mongoTemplate.updateFirst(q, u, ScheduleEntryDocument.class).getModifiedCount() > 0);
    }

    /**
     * Drop the lease on a claimed entry without moving {@code nextRunAt}, so the next poll claims it again.
     */
    public boolean release(String id, String workerId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(Criteria.where("_id").is(id).and("lockedBy").is(workerId));
        Update u = new Update()
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");

        return guarded("release schedule entry " + id,
                () -> mongoTemplate.updateFirst(q, u, ScheduleEntryDocument.class).getModifiedCount() > 0);
    }

    public ScheduleEntry toEntry(ScheduleEntryDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        FirePayload payload = doc.getPayload() == null ? null : objectMapper.convertValue(doc.getPayload(), FirePayload.class);
        return new ScheduleEntry(
                new EntryKey(doc.getWorkspaceId(), doc.getIndex()),
                doc.getCron(),
                doc.getTimezone(),
                payload,
                doc.getNextRunAt()
        );
    }

    /**
     * Zone an entry's cron is evaluated in; falls back to the store zone for unknown ids.
     */
    public ZoneId zoneOf(ScheduleEntryDocument doc) {
        String tz = doc.getTimezone();
        if (tz == null || tz.isBlank()) {
            return zone;
        }
        try {
            return ZoneId.of(tz);
        } catch (RuntimeException e) {
            return zone;
        }
    }

    private Map<String, Object> toMap(FirePayload payload) {
        return objectMapper.convertValue(payload, new TypeReference<>() {
        });
    }

    private static <T> T guarded(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Schedule store failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
