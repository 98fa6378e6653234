package io.cronhook.core;

import java.time.Instant;

/**
 * One due occurrence of a schedule entry.
 *
 * @param id      stable id of the occurrence, {@code {entryKey}@{tickEpochMillis}}
 * @param key     the entry that produced it
 * @param payload workspace and trigger definition captured at tick time
 * @param attempt zero-based attempt number
 * @param runAt   earliest time the attempt may run
 */
public record FireEvent(
        String id,
        EntryKey key,
        FirePayload payload,
        int attempt,
        Instant runAt
) {

    public static FireEvent firstAttempt(ScheduleEntry entry, Instant tickAt) {
        return new FireEvent(idFor(entry.key(), tickAt), entry.key(), entry.payload(), 0, tickAt);
    }

    public static String idFor(EntryKey key, Instant tickAt) {
        return key.id() + "@" + tickAt.toEpochMilli();
    }

    public String workspaceId() {
        return payload.workspaceId();
    }

    public String jobName() {
        return key.jobName();
    }

    public Trigger trigger() {
        return payload.trigger();
    }

    public FireEvent nextAttempt(Instant retryAt) {
        return new FireEvent(id, key, payload, attempt + 1, retryAt);
    }
}
