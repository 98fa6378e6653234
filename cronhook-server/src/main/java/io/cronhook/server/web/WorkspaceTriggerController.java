package io.cronhook.server.web;

import io.cronhook.core.InvalidRequestException;
import io.cronhook.core.ReplaceResult;
import io.cronhook.core.TriggerJob;
import io.cronhook.trigger.TriggerCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replace, list and remove the triggers of one workspace.
 */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}/triggers")
public class WorkspaceTriggerController {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceTriggerController.class);

    private final TriggerCoordinator coordinator;

    public WorkspaceTriggerController(TriggerCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    public Map<String, Object> replace(@PathVariable String workspaceId,
                                       @RequestBody(required = false) TriggersRequest request) {
        if (request == null || request.triggers() == null) {
            throw new InvalidRequestException("triggers array is required in request body");
        }

        ReplaceResult result = coordinator.replaceTriggers(workspaceId, request.triggers());
        log.info("[{}] Triggers replaced removed={} added={}", workspaceId, result.removed(), result.added());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("workspace_id", result.workspaceId());
        body.put("removed", result.removed());
        body.put("added", result.added());
        body.put("jobs", result.jobs());
        return body;
    }

    @GetMapping
    public Map<String, Object> list(@PathVariable String workspaceId) {
        List<TriggerJob> jobs = coordinator.getTriggers(workspaceId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("workspace_id", workspaceId);
        body.put("count", jobs.size());
        body.put("jobs", jobs);
        return body;
    }

    @DeleteMapping
    public Map<String, Object> remove(@PathVariable String workspaceId) {
        int removed = coordinator.removeTriggers(workspaceId);
        log.info("[{}] Triggers removed count={}", workspaceId, removed);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("workspace_id", workspaceId);
        body.put("removed", removed);
        return body;
    }
}
