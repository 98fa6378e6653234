package io.cronhook;

import io.cronhook.core.EntryKey;
import io.cronhook.core.FirePayload;
import io.cronhook.core.ScheduleEntry;

import java.util.List;

/**
 * Durable store of repeating schedule entries shared by all workspaces.
 *
 * <p>Implementations emit a fire event onto the associated {@link DispatchQueue} whenever an entry's
 * cron tick is due. Ticks missed while the store is unavailable may be dropped.
 *
 * <p>Failures surface as {@link io.cronhook.core.StoreUnavailableException}.
 */
public interface ScheduleStore {

    /**
     * Every repeating entry, across all workspaces.
     */
    List<ScheduleEntry> listRepeating();

    /**
     * Entries owned by exactly this workspace, ordered by index.
     */
    List<ScheduleEntry> listRepeating(String workspaceId);

    /**
     * Insert or replace the entry with this key. Calling it twice with the same key never yields two entries.
     */
    ScheduleEntry upsertRepeating(EntryKey key, String cronPattern, FirePayload payload);

    /**
     * @return true if an entry was removed
     */
    boolean removeRepeatingByKey(EntryKey key);
}
