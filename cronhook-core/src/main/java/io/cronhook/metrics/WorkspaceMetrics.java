package io.cronhook.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Recent execution history of one workspace, newest first.
 */
public record WorkspaceMetrics(
        @JsonProperty("workspace_id") String workspaceId,
        int total,
        MetricsStats stats,
        List<ExecutionRecord> executions
) {
}
