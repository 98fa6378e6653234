package io.cronhook.core;

import java.util.Objects;

/**
 * Structured identity of a schedule entry: the owning workspace plus the trigger's position.
 *
 * <p>The string form {@code {workspaceId}:{index}} is what the store persists and what clients see
 * as {@code jobId}. Lookups by workspace always compare {@link #workspaceId()} for equality so that
 * {@code ws1} never matches entries of {@code ws10}.
 */
public record EntryKey(String workspaceId, int index) {

    public static final char SEPARATOR = ':';

    public EntryKey {
        Objects.requireNonNull(workspaceId, "workspaceId must not be null");
        if (workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId must not be blank");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
    }

    public String id() {
        return workspaceId + SEPARATOR + index;
    }

    public String jobName() {
        return workspaceId + "-trigger-" + index;
    }

    /**
     * Parses {@code {workspaceId}:{index}}. The index is taken after the last separator, so
     * workspace ids may themselves contain {@code ':'}.
     */
    public static EntryKey parse(String id) {
        Objects.requireNonNull(id, "id must not be null");
        int sep = id.lastIndexOf(SEPARATOR);
        if (sep <= 0 || sep == id.length() - 1) {
            throw new IllegalArgumentException("Malformed entry key: " + id);
        }
        try {
            return new EntryKey(id.substring(0, sep), Integer.parseInt(id.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed entry key: " + id, e);
        }
    }

    @Override
    public String toString() {
        return id();
    }
}
