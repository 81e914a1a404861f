package io.opgraph.core.store;

import io.opgraph.core.exception.NodeNotFoundException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory node store (default implementation).
///
/// Thread-safe, no external dependencies.
///
/// ### Storage Structure
/// Uses nested maps: workflowId -> uuid -> node. Writes to one workflow synchronize on
/// that workflow's map so that alias checks and the write happen together.
///
/// @see NodeStore for contract
public final class InMemoryNodeStore implements NodeStore {

    static final Comparator<Node> BY_POSITION =
            Comparator.comparingInt(Node::getPosition).thenComparing(Node::getUuid);

    private final Map<String, Map<String, Node>> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryNodeStore() {
        this(Clock.systemUTC());
    }

    public InMemoryNodeStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<Node> find(String workflowId, NodeRef ref) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(ref, "ref must not be null");

        Map<String, Node> nodes = storage.get(workflowId);
        if (nodes == null) {
            return Optional.empty();
        }
        if (ref instanceof NodeRef.ByUuid byUuid) {
            return Optional.ofNullable(nodes.get(byUuid.uuid()));
        }
        return nodes.values().stream().filter(n -> matches(n, ref)).min(BY_POSITION);
    }

    private static boolean matches(Node node, NodeRef ref) {
        if (ref instanceof NodeRef.ByPosition byPosition) {
            return node.getPosition() == byPosition.position();
        }
        if (ref instanceof NodeRef.ByAlias byAlias) {
            return byAlias.alias().equals(node.getAlias());
        }
        return ((NodeRef.ByUuid) ref).uuid().equals(node.getUuid());
    }

    @Override
    public List<Node> list(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        Map<String, Node> nodes = storage.get(workflowId);
        if (nodes == null) {
            return List.of();
        }
        return nodes.values().stream().sorted(BY_POSITION).toList();
    }

    @Override
    public Node create(Node node) {
        Objects.requireNonNull(node, "node must not be null");

        Map<String, Node> nodes =
                storage.computeIfAbsent(node.getWorkflowId(), k -> new ConcurrentHashMap<>());
        synchronized (nodes) {
            if (nodes.containsKey(node.getUuid())) {
                throw new ValidationException("uuid", "uuid already exists: " + node.getUuid());
            }
            requireAliasFree(nodes, node.getAlias(), node.getUuid());
            nodes.put(node.getUuid(), node);
        }
        return node;
    }

    @Override
    public Node update(String workflowId, String uuid, NodePatch patch) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(uuid, "uuid must not be null");
        Objects.requireNonNull(patch, "patch must not be null");

        Map<String, Node> nodes = storage.get(workflowId);
        if (nodes == null) {
            throw new NodeNotFoundException(workflowId, "uuid " + uuid);
        }
        synchronized (nodes) {
            Node current = nodes.get(uuid);
            if (current == null) {
                throw new NodeNotFoundException(workflowId, "uuid " + uuid);
            }
            if (patch.getAlias() != null) {
                requireAliasFree(nodes, patch.getAlias(), uuid);
            }
            Node updated = patch.applyTo(current, clock.instant());
            nodes.put(uuid, updated);
            return updated;
        }
    }

    private static void requireAliasFree(Map<String, Node> nodes, String alias, String uuid) {
        if (alias == null) {
            return;
        }
        for (Node other : nodes.values()) {
            if (alias.equals(other.getAlias()) && !other.getUuid().equals(uuid)) {
                throw new ValidationException(
                        "alias",
                        "alias '" + alias + "' already used by node at position "
                                + other.getPosition());
            }
        }
    }

    @Override
    public boolean delete(String workflowId, String uuid) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(uuid, "uuid must not be null");

        Map<String, Node> nodes = storage.get(workflowId);
        if (nodes == null) {
            return false;
        }
        synchronized (nodes) {
            return nodes.remove(uuid) != null;
        }
    }

    @Override
    public List<String> workflowIds() {
        return storage.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
