package io.cronhook.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Client-facing view of a registered trigger.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerJob(
        String jobId,
        String jobName,
        String cron,
        String url,
        String method,
        Instant nextRunAt
) {

    public static TriggerJob accepted(EntryKey key, Trigger trigger) {
        return new TriggerJob(key.id(), key.jobName(), trigger.cron(), trigger.url(), trigger.method(), null);
    }

    public static TriggerJob from(ScheduleEntry entry) {
        Trigger trigger = entry.trigger();
        return new TriggerJob(
                entry.jobId(),
                entry.jobName(),
                entry.cron(),
                trigger == null ? null : trigger.url(),
                trigger == null ? null : trigger.method(),
                entry.nextRunAt()
        );
    }
}
