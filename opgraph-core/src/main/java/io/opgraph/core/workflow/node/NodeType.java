package io.opgraph.core.workflow.node;

import io.opgraph.core.exception.ValidationException;
import java.util.Locale;

/// Node kinds understood by the engine.
///
/// Only {@link #ROUTE}, {@link #ITERATE} and {@link #HANDLE} carry control-flow links to
/// other nodes; {@link #GROUP} is a visual container that never takes a parent tag.
public enum NodeType {
    ACTION("action"),
    QUERY("query"),
    COGNITION("cognition"),
    TRANSFORM("transform"),
    ITERATE("iterate"),
    ROUTE("route"),
    HANDLE("handle"),
    CONTEXT("context"),
    CHECKPOINT("checkpoint"),
    GROUP("group"),
    LEAF("leaf");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the lowercase name used in stored params and JSON payloads.
    public String wireName() {
        return wireName;
    }

    public boolean isContainer() {
        return this == GROUP;
    }

    public boolean isControlFlow() {
        return this == ROUTE || this == ITERATE || this == HANDLE;
    }

    /// Parses a wire name, accepting the legacy browser/memory spellings.
    ///
    /// @param name type name, not null
    /// @return the matching type, never null
    /// @throws ValidationException if the name is unknown
    public static NodeType fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("type", "node type is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "browser_action":
                return ACTION;
            case "browser_query":
                return QUERY;
            case "memory":
                return CONTEXT;
            default:
                break;
        }
        for (NodeType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("type", "unknown node type '" + name + "'");
    }
}
