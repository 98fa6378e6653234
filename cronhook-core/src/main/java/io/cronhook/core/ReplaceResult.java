package io.cronhook.core;

import java.util.List;

/**
 * Outcome of replacing a workspace's triggers.
 *
 * removed : entries deleted before insertion
 * added   : entries inserted
 * jobs    : inserted entries, in trigger order
 */
public record ReplaceResult(
        String workspaceId,
        int removed,
        int added,
        List<TriggerJob> jobs
) {
}
