package io.opgraph.core.workflow.node;

import java.util.Locale;

/// Execution outcome of a node, written by the executor and read by the graph engine.
public enum NodeStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    SKIPPED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Lenient parse; unknown or missing values map to {@link #PENDING}.
    public static NodeStatus fromWireName(String name) {
        if (name == null) {
            return PENDING;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("COMPLETED".equals(normalized) || "COMPLETE".equals(normalized)) {
            return SUCCESS;
        }
        for (NodeStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return PENDING;
    }
}
