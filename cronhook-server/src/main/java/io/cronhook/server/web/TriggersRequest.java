package io.cronhook.server.web;

import io.cronhook.core.Trigger;

import java.util.List;

/**
 * Body of {@code POST /api/workspaces/{id}/triggers}.
 */
public record TriggersRequest(List<Trigger> triggers) {
}
