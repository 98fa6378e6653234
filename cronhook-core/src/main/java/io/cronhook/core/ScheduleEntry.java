package io.cronhook.core;

import java.time.Instant;

/**
 * Durable repeating registration of one trigger, as held by a {@link io.cronhook.ScheduleStore}.
 */
public record ScheduleEntry(
        EntryKey key,
        String cron,
        String timezone,
        FirePayload payload,
        Instant nextRunAt
) {

    public String jobId() {
        return key.id();
    }

    public String jobName() {
        return key.jobName();
    }

    public Trigger trigger() {
        return payload == null ? null : payload.trigger();
    }
}
