package io.opgraph.core.store;

import io.opgraph.core.exception.NodeNotFoundException;
import io.opgraph.core.exception.ValidationError;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Indexed, read-only view of a workflow's nodes taken at one instant.
///
/// Built fresh for every builder, resolver or renumbering call and discarded afterwards.
/// Construction re-checks that positions, aliases and uuids are unique.
public final class NodeSnapshot {

    private final String workflowId;
    private final List<Node> nodes;
    private final Map<Integer, Node> byPosition;
    private final Map<String, Node> byAlias;
    private final Map<String, Node> byUuid;

    private NodeSnapshot(String workflowId, List<Node> nodes) {
        this.workflowId = workflowId;
        this.nodes = List.copyOf(nodes);
        this.byPosition = new LinkedHashMap<>();
        this.byAlias = new HashMap<>();
        this.byUuid = new HashMap<>();

        List<ValidationError> errors = new ArrayList<>();
        for (Node node : this.nodes) {
            Node previous = byPosition.putIfAbsent(node.getPosition(), node);
            if (previous != null) {
                errors.add(
                        new ValidationError(
                                "position",
                                "position " + node.getPosition() + " is shared by "
                                        + previous.getUuid() + " and " + node.getUuid()));
            }
            if (node.getAlias() != null && byAlias.putIfAbsent(node.getAlias(), node) != null) {
                errors.add(new ValidationError("alias", "duplicate alias '" + node.getAlias() + "'"));
            }
            if (byUuid.putIfAbsent(node.getUuid(), node) != null) {
                errors.add(new ValidationError("uuid", "duplicate uuid " + node.getUuid()));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /// Reads and indexes the current nodes of a workflow.
    ///
    /// @throws ValidationException if positions, aliases or uuids collide
    public static NodeSnapshot of(NodeStore store, String workflowId) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return new NodeSnapshot(workflowId, store.list(workflowId));
    }

    /// Indexes an explicit node list, ordering it by position.
    public static NodeSnapshot of(String workflowId, List<Node> nodes) {
        List<Node> sorted = new ArrayList<>(nodes);
        sorted.sort(InMemoryNodeStore.BY_POSITION);
        return new NodeSnapshot(workflowId, sorted);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /// Returns nodes ordered by position.
    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<Node> atPosition(int position) {
        return Optional.ofNullable(byPosition.get(position));
    }

    /// Positions in use, in ascending order.
    public Set<Integer> positions() {
        return Collections.unmodifiableSet(byPosition.keySet());
    }

    public boolean hasPosition(int position) {
        return byPosition.containsKey(position);
    }

    public Optional<Node> byAlias(String alias) {
        return Optional.ofNullable(byAlias.get(alias));
    }

    public Optional<Node> byUuid(String uuid) {
        return Optional.ofNullable(byUuid.get(uuid));
    }

    public Optional<Node> find(NodeRef ref) {
        if (ref instanceof NodeRef.ByPosition p) {
            return atPosition(p.position());
        }
        if (ref instanceof NodeRef.ByAlias a) {
            return byAlias(a.alias());
        }
        return byUuid(((NodeRef.ByUuid) ref).uuid());
    }

    /// @throws NodeNotFoundException if the reference does not resolve
    public Node get(NodeRef ref) {
        return find(ref).orElseThrow(() -> new NodeNotFoundException(workflowId, ref.describe()));
    }

    /// Highest position in use, or 0 for an empty workflow.
    public int maxPosition() {
        return nodes.isEmpty() ? 0 : nodes.get(nodes.size() - 1).getPosition();
    }
}
