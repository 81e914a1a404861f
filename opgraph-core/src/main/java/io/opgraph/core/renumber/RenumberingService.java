package io.opgraph.core.renumber;

import io.opgraph.core.exception.PartialRenumberException;
import io.opgraph.core.execution.RetryPolicy;
import io.opgraph.core.store.NodePatch;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.tree.TreeBuilder;
import io.opgraph.core.tree.WorkflowTree;
import io.opgraph.core.workflow.node.Node;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Assigns contiguous preorder positions `1..N` and rewrites every control-flow reference.
///
/// ### Steps
/// 1. build the forest from a fresh snapshot
/// 2. walk it depth-first in preorder (see {@link WorkflowTree#preorder()})
/// 3. map each node to its visitation index, keeping only nodes that move
/// 4. move nodes one at a time, each move retried on its own
/// 5. rewrite branch, body, handle and parent references through the old-to-new map
///
/// Moves are ordered so that no two nodes ever share a position: a node moves only once its
/// target is free, and a cycle of moves is broken by parking one node above the highest
/// position in use.
///
/// ### Contracts
/// - running twice without intervening edits makes no writes the second time
/// - uuids never change
/// - the operation as a whole is not atomic; see {@link PartialRenumberException}
///
/// @implNote Stateless. Callers serialize structural edits per workflow.
public class RenumberingService {

    private static final Logger logger = Logger.getLogger(RenumberingService.class.getName());

    private final NodeStore store;
    private final TreeBuilder treeBuilder;
    private final RetryPolicy updateRetry;
    private final Clock clock;

    public RenumberingService(NodeStore store, TreeBuilder treeBuilder) {
        this(store, treeBuilder, RetryPolicy.none(), Clock.systemUTC());
    }

    /// @param store node persistence, not null
    /// @param treeBuilder forest builder, not null
    /// @param updateRetry retry policy for each individual store update, not null
    /// @param clock completion timestamps, not null
    public RenumberingService(
            NodeStore store, TreeBuilder treeBuilder, RetryPolicy updateRetry, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder must not be null");
        this.updateRetry = Objects.requireNonNull(updateRetry, "updateRetry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Computes the moves a renumbering would make, without writing anything.
    public List<PositionChange> plan(String workflowId) {
        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        return plan(treeBuilder.build(snapshot));
    }

    private static List<PositionChange> plan(WorkflowTree tree) {
        List<PositionChange> changes = new ArrayList<>();
        int next = 1;
        for (Node node : tree.preorder()) {
            if (node.getPosition() != next) {
                changes.add(new PositionChange(node.getUuid(), node.getPosition(), next));
            }
            next++;
        }
        return changes;
    }

    /// Renumbers a workflow in preorder.
    ///
    /// @param workflowId workflow to renumber, not null
    /// @return applied changes, never null
    /// @throws io.opgraph.core.exception.ConflictingParentException if the forest cannot be
    ///     built
    /// @throws PartialRenumberException if a store update fails after its retries
    public RenumberResult renumber(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");

        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        WorkflowTree tree = treeBuilder.build(snapshot);
        List<PositionChange> changes = plan(tree);
        if (changes.isEmpty()) {
            return new RenumberResult(workflowId, List.of(), List.of(), clock.instant());
        }

        applyMoves(workflowId, snapshot, changes);
        List<String> rewritten = rewriteReferences(workflowId, snapshot, changes);

        logger.info(
                "Renumbered workflow "
                        + workflowId
                        + ": "
                        + changes.size()
                        + " position changes, "
                        + rewritten.size()
                        + " nodes with rewritten references");
        return new RenumberResult(workflowId, changes, rewritten, clock.instant());
    }

    private void applyMoves(String workflowId, NodeSnapshot snapshot, List<PositionChange> changes) {
        Set<Integer> occupied = new HashSet<>();
        snapshot.nodes().forEach(n -> occupied.add(n.getPosition()));

        List<Move> remaining = new ArrayList<>();
        changes.forEach(c -> remaining.add(new Move(c)));
        List<PositionChange> applied = new ArrayList<>();

        while (!remaining.isEmpty()) {
            Move ready = null;
            for (Move move : remaining) {
                if (!occupied.contains(move.change.newPosition())) {
                    ready = move;
                    break;
                }
            }
            Move move = ready != null ? ready : remaining.get(0);
            int target =
                    ready != null
                            ? move.change.newPosition()
                            : occupied.stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
            try {
                moveNode(workflowId, move.change.id(), target);
            } catch (RuntimeException e) {
                List<PositionChange> pending = new ArrayList<>();
                remaining.forEach(m -> pending.add(m.change));
                throw new PartialRenumberException(workflowId, applied, pending, false, e);
            }
            occupied.remove(move.current);
            occupied.add(target);
            move.current = target;
            if (ready != null) {
                remaining.remove(move);
                applied.add(move.change);
            }
        }
    }

    private void moveNode(String workflowId, String uuid, int position) {
        updateRetry.callUnchecked(
                "Moving node " + uuid + " to position " + position,
                () -> store.update(workflowId, uuid, NodePatch.position(position)));
    }

    private List<String> rewriteReferences(
            String workflowId, NodeSnapshot snapshot, List<PositionChange> changes) {
        Map<Integer, Integer> mapping = new HashMap<>();
        changes.forEach(c -> mapping.put(c.oldPosition(), c.newPosition()));

        List<String> rewritten = new ArrayList<>();
        for (Node node : snapshot.nodes()) {
            Optional<Object> params =
                    ReferenceRewriter.rewrite(
                            node, old -> mapping.getOrDefault(old, old), snapshot.positions());
            if (params.isEmpty()) {
                continue;
            }
            try {
                updateRetry.callUnchecked(
                        "Rewriting references of node " + node.getUuid(),
                        () -> store.update(workflowId, node.getUuid(), NodePatch.params(params.get())));
            } catch (RuntimeException e) {
                throw new PartialRenumberException(workflowId, changes, List.of(), true, e);
            }
            rewritten.add(node.getUuid());
        }
        return rewritten;
    }

    private static final class Move {
        private final PositionChange change;
        private int current;

        private Move(PositionChange change) {
            this.change = change;
            this.current = change.oldPosition();
        }
    }
}
