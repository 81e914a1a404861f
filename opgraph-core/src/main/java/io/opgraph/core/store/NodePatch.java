package io.opgraph.core.store;

import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeStatus;
import io.opgraph.core.workflow.node.NodeType;
import java.time.Instant;

/// Partial update of a node. Only fields explicitly set on the builder are applied.
///
/// `params` and `result` track presence separately so that they can be cleared to null.
public final class NodePatch {

    private final Integer position;
    private final String alias;
    private final NodeType type;
    private final Object params;
    private final boolean paramsSet;
    private final String description;
    private final boolean descriptionSet;
    private final NodeStatus status;
    private final Object result;
    private final boolean resultSet;

    private NodePatch(Builder builder) {
        this.position = builder.position;
        this.alias = builder.alias;
        this.type = builder.type;
        this.params = builder.params;
        this.paramsSet = builder.paramsSet;
        this.description = builder.description;
        this.descriptionSet = builder.descriptionSet;
        this.status = builder.status;
        this.result = builder.result;
        this.resultSet = builder.resultSet;
    }

    public static NodePatch position(int position) {
        return builder().position(position).build();
    }

    public static NodePatch params(Object params) {
        return builder().params(params).build();
    }

    public Integer getPosition() {
        return position;
    }

    public String getAlias() {
        return alias;
    }

    public boolean isPositionChange() {
        return position != null;
    }

    public boolean isEmpty() {
        return position == null
                && alias == null
                && type == null
                && !paramsSet
                && !descriptionSet
                && status == null
                && !resultSet;
    }

    /// Applies the patch, stamping `updatedAt`.
    ///
    /// @param node current node, not null
    /// @param now update timestamp, not null
    /// @return patched node, never null
    public Node applyTo(Node node, Instant now) {
        Node.Builder builder = node.toBuilder().updatedAt(now);
        if (position != null) {
            builder.position(position);
        }
        if (alias != null) {
            builder.alias(alias);
        }
        if (type != null) {
            builder.type(type);
        }
        if (paramsSet) {
            builder.params(params);
        }
        if (descriptionSet) {
            builder.description(description);
        }
        if (status != null) {
            builder.status(status);
        }
        if (resultSet) {
            builder.result(result);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer position;
        private String alias;
        private NodeType type;
        private Object params;
        private boolean paramsSet;
        private String description;
        private boolean descriptionSet;
        private NodeStatus status;
        private Object result;
        private boolean resultSet;

        private Builder() {}

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
            this.paramsSet = true;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            this.descriptionSet = true;
            return this;
        }

        public Builder status(NodeStatus status) {
            this.status = status;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            this.resultSet = true;
            return this;
        }

        public NodePatch build() {
            return new NodePatch(this);
        }
    }
}
