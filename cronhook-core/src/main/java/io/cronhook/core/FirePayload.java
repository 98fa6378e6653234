package io.cronhook.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body carried by every fire event of a schedule entry.
 */
public record FirePayload(
        @JsonProperty("workspace_id") String workspaceId,
        Trigger trigger
) {
}
