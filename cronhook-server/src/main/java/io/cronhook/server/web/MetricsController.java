package io.cronhook.server.web;

import io.cronhook.core.StoreUnavailableException;
import io.cronhook.metrics.MetricsReader;
import io.cronhook.metrics.WorkspaceMetrics;
import io.cronhook.trigger.TriggerCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class MetricsController {
    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private final MetricsReader metricsReader;
    private final TriggerCoordinator coordinator;

    public MetricsController(MetricsReader metricsReader, TriggerCoordinator coordinator) {
        this.metricsReader = metricsReader;
        this.coordinator = coordinator;
    }

    /**
     * Recent executions and aggregate stats of a workspace, plus its next scheduled run.
     * A missing, unparsable or non-positive {@code limit} falls back to the default.
     */
    @GetMapping("/metrics/api/{workspaceId}")
    public Map<String, Object> workspaceMetrics(@PathVariable String workspaceId,
                                                @RequestParam(name = "limit", required = false) String limit) {
        WorkspaceMetrics metrics = metricsReader.getWorkspaceMetrics(workspaceId, parseLimit(limit));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workspace_id", metrics.workspaceId());
        body.put("total", metrics.total());
        body.put("stats", metrics.stats());
        body.put("executions", metrics.executions());
        body.put("next_execution", nextExecution(workspaceId));
        return body;
    }

    private String nextExecution(String workspaceId) {
        try {
            return coordinator.nextExecution(workspaceId).map(Instant::toString).orElse(null);
        } catch (StoreUnavailableException e) {
            log.warn("[{}] Could not look up next execution msg={}", workspaceId, e.getMessage());
            return null;
        }
    }

    static int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return MetricsReader.DEFAULT_LIMIT;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : MetricsReader.DEFAULT_LIMIT;
        } catch (NumberFormatException e) {
            return MetricsReader.DEFAULT_LIMIT;
        }
    }
}
