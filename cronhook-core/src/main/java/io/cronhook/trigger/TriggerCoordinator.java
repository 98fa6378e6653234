package io.cronhook.trigger;

import io.cronhook.ScheduleStore;
import io.cronhook.core.EntryKey;
import io.cronhook.core.FirePayload;
import io.cronhook.core.InvalidRequestException;
import io.cronhook.core.InvalidTriggerException;
import io.cronhook.core.ReplaceResult;
import io.cronhook.core.ScheduleEntry;
import io.cronhook.core.Trigger;
import io.cronhook.core.TriggerJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the schedule entries of every workspace and replaces them as a whole.
 *
 * <p>Replacing is validate-all, then remove-all, then insert-all. Validation happens before any store
 * mutation, but removal and insertion are separate store calls: a crash between them leaves the workspace
 * with no active triggers until the next successful replace. Two concurrent replaces of the same workspace
 * are not serialized either; their individual upserts interleave and the last write of each key wins.
 * A tick already emitted for an entry being replaced is still executed with the old definition.
 *
 * <p>Calls for different workspaces touch disjoint keys and never wait on each other.
 */
public class TriggerCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TriggerCoordinator.class);

    private final ScheduleStore scheduleStore;

    public TriggerCoordinator(ScheduleStore scheduleStore) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
    }

    /**
     * Replace all triggers of a workspace. Trigger {@code i} becomes entry {@code {workspaceId}:{i}}.
     *
     * @throws InvalidRequestException  if the workspace id is blank or {@code triggers} is null
     * @throws InvalidTriggerException  for the first invalid trigger; nothing is changed in that case
     * @throws io.cronhook.core.StoreUnavailableException if the store fails midway
     */
    public ReplaceResult replaceTriggers(String workspaceId, List<Trigger> triggers) {
        requireWorkspace(workspaceId);
        if (triggers == null) {
            throw new InvalidRequestException("triggers must be an array");
        }

        List<Trigger> accepted = new ArrayList<>(triggers.size());
        for (int i = 0; i < triggers.size(); i++) {
            Trigger trigger = triggers.get(i);
            try {
                TriggerValidator.validate(trigger);
            } catch (InvalidTriggerException e) {
                throw e.atIndex(i);
            }
            accepted.add(trigger.normalized());
        }

        int removed = removeTriggers(workspaceId);
        log.info("Removed {} existing entries for workspace={}", removed, workspaceId);

        List<TriggerJob> jobs = new ArrayList<>(accepted.size());
        for (int i = 0; i < accepted.size(); i++) {
            Trigger trigger = accepted.get(i);
            EntryKey key = new EntryKey(workspaceId, i);
            scheduleStore.upsertRepeating(key, trigger.cron(), new FirePayload(workspaceId, trigger));
            jobs.add(TriggerJob.accepted(key, trigger));
        }

        log.info("Registered {} triggers for workspace={}", jobs.size(), workspaceId);
        return new ReplaceResult(workspaceId, removed, jobs.size(), List.copyOf(jobs));
    }

    /**
     * Current entries of a workspace, by index. No side effects.
     */
    public List<TriggerJob> getTriggers(String workspaceId) {
        requireWorkspace(workspaceId);
        return scheduleStore.listRepeating(workspaceId).stream()
                .map(TriggerJob::from)
                .toList();
    }

    /**
     * Remove every entry of a workspace.
     *
     * @return number of entries removed
     */
    public int removeTriggers(String workspaceId) {
        requireWorkspace(workspaceId);

        int removed = 0;
        for (ScheduleEntry entry : scheduleStore.listRepeating(workspaceId)) {
            if (scheduleStore.removeRepeatingByKey(entry.key())) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Earliest upcoming tick across the workspace's entries.
     */
    public Optional<Instant> nextExecution(String workspaceId) {
        requireWorkspace(workspaceId);
        return scheduleStore.listRepeating(workspaceId).stream()
                .map(ScheduleEntry::nextRunAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
    }

    /**
     * Every entry in the store, across workspaces.
     */
    public List<TriggerJob> listAll() {
        return scheduleStore.listRepeating().stream()
                .map(TriggerJob::from)
                .toList();
    }

    private static void requireWorkspace(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new InvalidRequestException("workspace_id is required");
        }
    }
}
