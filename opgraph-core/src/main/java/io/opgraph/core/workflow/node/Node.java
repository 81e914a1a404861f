package io.opgraph.core.workflow.node;

import io.opgraph.core.util.Values;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A single unit of a workflow graph: an action, a query, or a control construct.
///
/// A node is addressed three ways. Its `position` is the canonical ordinal and changes on
/// renumbering; its `uuid` is assigned at creation and never changes; its `alias` is a
/// human-chosen name, unique per workflow.
///
/// `params` is kept in its stored JSON-like form (maps, lists and scalars) because route and
/// iterate nodes have several historical shapes; typed views are obtained through
/// {@link io.opgraph.core.workflow.params.RouteParams} and
/// {@link io.opgraph.core.workflow.params.IterateParams}.
///
/// @implNote Immutable. `params` and `result` are deep-frozen copies. Use
/// {@link #toBuilder()} to derive a modified node.
public final class Node {

    private final String workflowId;
    private final String uuid;
    private final int position;
    private final String alias;
    private final NodeType type;
    private final Object params;
    private final String description;
    private final NodeStatus status;
    private final Object result;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Node(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId must not be null");
        this.uuid = Objects.requireNonNull(builder.uuid, "uuid must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.position = builder.position;
        this.alias = builder.alias;
        this.params = Values.freeze(builder.params != null ? builder.params : Map.of());
        this.description = builder.description;
        this.status = builder.status != null ? builder.status : NodeStatus.PENDING;
        this.result = Values.freeze(builder.result);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getUuid() {
        return uuid;
    }

    public int getPosition() {
        return position;
    }

    public String getAlias() {
        return alias;
    }

    public NodeType getType() {
        return type;
    }

    /// Returns the raw params payload: an unmodifiable map, or for array-form routes an
    /// unmodifiable list.
    public Object getParams() {
        return params;
    }

    /// Returns params as a map, or an empty map when params are stored as a list.
    public Map<String, Object> getParamsMap() {
        Map<String, Object> map = Values.asMap(params);
        return map != null ? map : Map.of();
    }

    /// Returns the explicit parent declared through `_parent_position`, if any.
    public Optional<Integer> getParentPosition() {
        return Optional.ofNullable(Values.toInteger(getParamsMap().get(NodeParams.PARENT_POSITION)));
    }

    public String getDescription() {
        return description;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public Object getResult() {
        return result;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /// Returns a builder pre-populated with this node's state.
    public Builder toBuilder() {
        return new Builder()
                .workflowId(workflowId)
                .uuid(uuid)
                .position(position)
                .alias(alias)
                .type(type)
                .params(params)
                .description(description)
                .status(status)
                .result(result)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return position == other.position
                && workflowId.equals(other.workflowId)
                && uuid.equals(other.uuid)
                && Objects.equals(alias, other.alias)
                && type == other.type
                && params.equals(other.params)
                && Objects.equals(description, other.description)
                && status == other.status
                && Objects.equals(result, other.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, uuid, position, alias, type, params);
    }

    @Override
    public String toString() {
        return "Node{"
                + "position="
                + position
                + ", alias='"
                + alias
                + '\''
                + ", type="
                + type.wireName()
                + ", uuid="
                + uuid
                + '}';
    }

    public static final class Builder {
        private String workflowId;
        private String uuid;
        private int position;
        private String alias;
        private NodeType type = NodeType.LEAF;
        private Object params;
        private String description;
        private NodeStatus status;
        private Object result;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {}

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder uuid(String uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder position(int position) {
            this.position = position;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder params(Object params) {
            this.params = params;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(NodeStatus status) {
            this.status = status;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
