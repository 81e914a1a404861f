package io.opgraph.core.edit;

import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.NodeType;
import java.util.Map;
import java.util.Objects;

/// Caller-supplied description of a node to create.
///
/// @param type node type, not null
/// @param alias snake_case alias, unique per workflow, not null
/// @param description free text, may be null
/// @param params params payload (map, or list for array-form routes), may be null
/// @param position requested position, null to append at the end
public record NodeDraft(
        NodeType type, String alias, String description, Object params, Integer position) {

    public NodeDraft {
        Objects.requireNonNull(type, "type must not be null");
        params = Values.deepCopy(params != null ? params : Map.of());
    }

    public NodeDraft withParams(Object newParams) {
        return new NodeDraft(type, alias, description, newParams, position);
    }

    public NodeDraft withPosition(Integer newPosition) {
        return new NodeDraft(type, alias, description, params, newPosition);
    }

    /// Reads a draft from a loosely typed map (`type`, `alias`, `description`, `params`,
    /// `position`), as received in requests and inline selector specs.
    public static NodeDraft fromMap(Map<String, Object> raw) {
        Object type = raw.get("type");
        Object alias = raw.get("alias");
        Object description = raw.get("description");
        Object params = raw.containsKey("params") ? raw.get("params") : raw.get("config");
        return new NodeDraft(
                NodeType.fromWireName(type != null ? String.valueOf(type) : null),
                alias != null ? String.valueOf(alias) : null,
                description != null ? String.valueOf(description) : null,
                params,
                Values.toInteger(raw.get("position")));
    }
}
