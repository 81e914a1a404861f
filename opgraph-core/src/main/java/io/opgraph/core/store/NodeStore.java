package io.opgraph.core.store;

import io.opgraph.core.exception.NodeNotFoundException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import java.util.List;
import java.util.Optional;

/// Flat, position-indexed persistence of workflow nodes.
///
/// The store is the single source of truth for node state. Callers take a fresh
/// {@link #list(String)} per operation and never hold on to nodes across calls.
///
/// ### Contracts
/// - `uuid` and `alias` are unique per workflow; {@link #create} and {@link #update} reject
///   collisions with a {@link ValidationException}
/// - positions are not checked on update: renumbering moves nodes one at a time and passes
///   through states where two nodes briefly share a position
/// - every single call is atomic; sequences of calls are not
///
/// @implNote Implementations must be thread-safe.
/// @see InMemoryNodeStore
public interface NodeStore {

    /// Looks up a node by position, alias or uuid.
    ///
    /// @param workflowId workflow identifier, not null
    /// @param ref node reference, not null
    /// @return the node, or empty if nothing matches
    Optional<Node> find(String workflowId, NodeRef ref);

    /// Looks up a node and fails when it does not exist.
    ///
    /// @throws NodeNotFoundException if the reference does not resolve
    default Node get(String workflowId, NodeRef ref) {
        return find(workflowId, ref)
                .orElseThrow(() -> new NodeNotFoundException(workflowId, ref.describe()));
    }

    /// Returns all nodes of a workflow ordered by position (ties by uuid).
    ///
    /// @param workflowId workflow identifier, not null
    /// @return snapshot list, never null, empty for unknown workflows
    List<Node> list(String workflowId);

    /// Persists a new node.
    ///
    /// @param node node with workflow id, uuid and position set, not null
    /// @return the stored node, never null
    /// @throws ValidationException if the uuid or alias is already taken
    Node create(Node node);

    /// Applies a partial update to the node with the given uuid.
    ///
    /// @param workflowId workflow identifier, not null
    /// @param uuid node uuid, not null
    /// @param patch changes to apply, not null
    /// @return the updated node, never null
    /// @throws NodeNotFoundException if no node has that uuid
    /// @throws ValidationException if the patch renames the node onto a taken alias
    Node update(String workflowId, String uuid, NodePatch patch);

    /// Removes a node.
    ///
    /// @return true if a node was removed
    boolean delete(String workflowId, String uuid);

    /// Lists workflow identifiers that currently hold nodes.
    List<String> workflowIds();
}
