package io.cronhook.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable outcome of one fire event attempt. Serialized field names match the persisted layout.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionRecord(
        Instant timestamp,
        @JsonProperty("workspace_id") String workspaceId,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("job_name") String jobName,
        @JsonProperty("trigger_url") String triggerUrl,
        @JsonProperty("trigger_method") String triggerMethod,
        ExecutionStatus status,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("http_status") Integer httpStatus,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("retry_count") int retryCount
) {

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }
}
