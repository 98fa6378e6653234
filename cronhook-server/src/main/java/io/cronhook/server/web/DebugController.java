package io.cronhook.server.web;

import io.cronhook.core.TriggerJob;
import io.cronhook.trigger.TriggerCoordinator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists every repeating entry across all workspaces.
 */
@RestController
public class DebugController {

    private final TriggerCoordinator coordinator;

    public DebugController(TriggerCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/debug/jobs")
    public Map<String, Object> jobs() {
        List<TriggerJob> jobs = coordinator.listAll();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", jobs.size());
        body.put("jobs", jobs);
        return body;
    }
}
