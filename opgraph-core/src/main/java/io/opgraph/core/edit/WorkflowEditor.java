package io.opgraph.core.edit;

import io.opgraph.core.exception.ValidationError;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.renumber.PositionChange;
import io.opgraph.core.renumber.ReferenceRewriter;
import io.opgraph.core.store.NodePatch;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.tree.TreeBuilder;
import io.opgraph.core.tree.TreeNode;
import io.opgraph.core.tree.WorkflowTree;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import io.opgraph.core.workflow.node.NodeType;
import io.opgraph.core.workflow.params.IterateParams;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Structural edits on a workflow: create, insert, update, delete and sequence import.
///
/// Edits that move nodes keep positions unique at every step and rewrite the control-flow
/// references of the other nodes, so the workflow stays linkable after each call.
///
/// @implNote Stateless; callers serialize structural edits per workflow.
public class WorkflowEditor {

    private static final Logger logger = Logger.getLogger(WorkflowEditor.class.getName());

    private final NodeStore store;
    private final TreeBuilder treeBuilder;
    private final Supplier<String> uuidGenerator;
    private final Clock clock;

    public WorkflowEditor(NodeStore store, TreeBuilder treeBuilder) {
        this(store, treeBuilder, () -> UUID.randomUUID().toString(), Clock.systemUTC());
    }

    /// @param store node persistence, not null
    /// @param treeBuilder used to find descendants on cascading deletes, not null
    /// @param uuidGenerator source of node uuids, not null
    /// @param clock creation timestamps, not null
    public WorkflowEditor(
            NodeStore store, TreeBuilder treeBuilder, Supplier<String> uuidGenerator, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder must not be null");
        this.uuidGenerator = Objects.requireNonNull(uuidGenerator, "uuidGenerator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Creates a node. Without a requested position it is appended; a requested position that
    /// is taken behaves like {@link #insertNodeAt}.
    ///
    /// @throws ValidationException if the draft is invalid or its alias is taken
    public Node createNode(String workflowId, NodeDraft draft) {
        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        NodeDraftValidator.validate(draft, snapshot);
        Integer requested = draft.position();
        if (requested != null && snapshot.hasPosition(requested)) {
            return insertNodeAt(workflowId, requested, draft);
        }
        int position = requested != null ? requested : snapshot.maxPosition() + 1;
        return store.create(toNode(workflowId, draft, position));
    }

    /// Appends a node after the current last position.
    public Node appendNode(String workflowId, NodeDraft draft) {
        return createNode(workflowId, draft.withPosition(null));
    }

    /// Inserts a node, shifting nodes at or after the position up by one and rewriting
    /// references to them.
    ///
    /// @param position target position, at least 1
    public Node insertNodeAt(String workflowId, int position, NodeDraft draft) {
        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        NodeDraftValidator.validate(draft.withPosition(position), snapshot);

        List<Node> shifted =
                snapshot.nodes().stream()
                        .filter(n -> n.getPosition() >= position)
                        .sorted(Comparator.comparingInt(Node::getPosition).reversed())
                        .toList();
        for (Node node : shifted) {
            store.update(workflowId, node.getUuid(), NodePatch.position(node.getPosition() + 1));
        }
        rewriteAll(workflowId, snapshot, p -> p >= position ? p + 1 : p);

        Node created = store.create(toNode(workflowId, draft, position));
        logger.info(
                "Inserted node '"
                        + draft.alias()
                        + "' at position "
                        + position
                        + " in workflow "
                        + workflowId
                        + ", shifted "
                        + shifted.size()
                        + " nodes");
        return created;
    }

    /// Applies a partial update. Positions are owned by renumbering and cannot be patched here.
    ///
    /// @throws ValidationException if the patch moves the node, renames it to an invalid or
    ///     taken alias, or gives an iterate node invalid settings
    public Node updateNode(String workflowId, NodeRef ref, NodePatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        if (patch.isPositionChange()) {
            throw new ValidationException(
                    "position", "positions change only through renumbering, insert or delete");
        }
        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        Node node = snapshot.get(ref);
        if (patch.getAlias() != null && !patch.getAlias().equals(node.getAlias())) {
            List<ValidationError> errors = new ArrayList<>();
            NodeDraftValidator.validateAlias(patch.getAlias(), snapshot, errors);
            if (!errors.isEmpty()) {
                throw new ValidationException(errors);
            }
        }
        Node preview = patch.applyTo(node, clock.instant());
        if (preview.getType() == NodeType.ITERATE) {
            IterateParams.of(preview.getParams()).requireValid();
        }
        return store.update(workflowId, node.getUuid(), patch);
    }

    /// Deletes nodes, optionally with their descendants, then closes the position gaps.
    ///
    /// @param refs nodes to delete, not null
    /// @param options cascade, dependency and dry-run behavior, not null
    /// @return what was (or, for a dry run, would be) deleted and moved
    /// @throws ValidationException if dependencies are not handled and a surviving node
    ///     references a deleted one
    public DeletionResult deleteNodes(String workflowId, List<NodeRef> refs, DeleteOptions options) {
        Objects.requireNonNull(refs, "refs must not be null");
        Objects.requireNonNull(options, "options must not be null");

        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        Set<Integer> doomed = new LinkedHashSet<>();
        for (NodeRef ref : refs) {
            doomed.add(snapshot.get(ref).getPosition());
        }
        if (options.deleteChildren()) {
            WorkflowTree tree = treeBuilder.build(snapshot);
            for (Integer position : List.copyOf(doomed)) {
                tree.find(position).ifPresent(t -> collectDescendants(t, doomed));
            }
        }

        Map<Integer, Integer> compacted = new HashMap<>();
        List<PositionChange> compaction = new ArrayList<>();
        List<Node> survivors = new ArrayList<>();
        int next = 1;
        for (Node node : snapshot.nodes()) {
            if (doomed.contains(node.getPosition())) {
                continue;
            }
            survivors.add(node);
            compacted.put(node.getPosition(), next);
            if (node.getPosition() != next) {
                compaction.add(new PositionChange(node.getUuid(), node.getPosition(), next));
            }
            next++;
        }
        IntFunction<Integer> mapper = p -> doomed.contains(p) ? null : compacted.getOrDefault(p, p);

        List<String> dependents = new ArrayList<>();
        for (Node survivor : survivors) {
            Optional<Object> stripped = ReferenceRewriter.rewrite(
                            survivor, p -> doomed.contains(p) ? null : p, snapshot.positions());
            if (stripped.isPresent()) {
                dependents.add(survivor.getUuid());
            }
        }
        if (!options.handleDependencies() && !dependents.isEmpty()) {
            throw new ValidationException(
                    "nodes",
                    "deleted nodes are still referenced by " + dependents.size()
                            + " other node(s); delete with dependency handling or detach them first");
        }

        List<Integer> deletedPositions = new ArrayList<>(new TreeSet<>(doomed));
        List<String> deletedUuids = new ArrayList<>();
        for (Integer position : deletedPositions) {
            snapshot.atPosition(position).ifPresent(n -> deletedUuids.add(n.getUuid()));
        }

        List<String> updated = new ArrayList<>();
        if (!options.dryRun()) {
            deletedUuids.forEach(uuid -> store.delete(workflowId, uuid));
            for (PositionChange change : compaction) {
                store.update(workflowId, change.id(), NodePatch.position(change.newPosition()));
            }
            updated.addAll(rewriteNodes(workflowId, survivors, mapper, snapshot.positions()));
            logger.info(
                    "Deleted "
                            + deletedUuids.size()
                            + " node(s) from workflow "
                            + workflowId
                            + ", compacted "
                            + compaction.size()
                            + ", rewrote "
                            + updated.size());
        } else {
            for (Node survivor : survivors) {
                if (ReferenceRewriter.rewrite(survivor, mapper, snapshot.positions()).isPresent()) {
                    updated.add(survivor.getUuid());
                }
            }
        }
        return new DeletionResult(deletedPositions, deletedUuids, compaction, updated, options.dryRun());
    }

    /// Creates a nested definition after the current last node.
    ///
    /// @param definition nested entries (see {@link SequenceFlattener}), not null
    /// @return created nodes in position order
    /// @throws ValidationException if any entry is invalid; nothing is created in that case
    public List<Node> importSequence(String workflowId, List<Map<String, Object>> definition) {
        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        List<NodeDraft> drafts = SequenceFlattener.flatten(definition, snapshot.maxPosition() + 1);

        List<ValidationError> errors = new ArrayList<>();
        Set<String> aliases = new HashSet<>();
        for (NodeDraft draft : drafts) {
            try {
                NodeDraftValidator.validate(draft, snapshot);
            } catch (ValidationException e) {
                e.getErrors().forEach(err ->
                        errors.add(new ValidationError("position " + draft.position() + "." + err.field(), err.message())));
            }
            if (draft.alias() != null && !aliases.add(draft.alias())) {
                errors.add(new ValidationError("alias", "duplicate alias '" + draft.alias() + "' in sequence"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        List<Node> created = new ArrayList<>(drafts.size());
        for (NodeDraft draft : drafts) {
            created.add(store.create(toNode(workflowId, draft, draft.position())));
        }
        return created;
    }

    private static void collectDescendants(TreeNode node, Set<Integer> into) {
        for (TreeNode child : node.getChildren()) {
            if (into.add(child.getPosition())) {
                collectDescendants(child, into);
            }
        }
    }

    private void rewriteAll(String workflowId, NodeSnapshot snapshot, IntFunction<Integer> mapper) {
        rewriteNodes(workflowId, snapshot.nodes(), mapper, snapshot.positions());
    }

    private List<String> rewriteNodes(
            String workflowId,
            List<Node> nodes,
            IntFunction<Integer> mapper,
            Collection<Integer> existing) {
        List<String> rewritten = new ArrayList<>();
        for (Node node : nodes) {
            Optional<Object> params = ReferenceRewriter.rewrite(node, mapper, existing);
            if (params.isPresent()) {
                store.update(workflowId, node.getUuid(), NodePatch.params(params.get()));
                rewritten.add(node.getUuid());
            }
        }
        return rewritten;
    }

    private Node toNode(String workflowId, NodeDraft draft, int position) {
        return Node.builder()
                .workflowId(workflowId)
                .uuid(uuidGenerator.get())
                .position(position)
                .alias(draft.alias())
                .type(draft.type())
                .params(draft.params())
                .description(draft.description())
                .createdAt(clock.instant())
                .build();
    }
}
