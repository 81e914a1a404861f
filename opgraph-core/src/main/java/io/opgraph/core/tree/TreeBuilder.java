package io.opgraph.core.tree;

import io.opgraph.core.exception.ConflictingParentException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeType;
import io.opgraph.core.workflow.params.Branch;
import io.opgraph.core.workflow.params.HandleParams;
import io.opgraph.core.workflow.params.IterateParams;
import io.opgraph.core.workflow.params.RouteParams;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Reconstructs the control-flow forest from a flat node list.
///
/// ### Linkage rules
/// 1. route branches (array or legacy `paths` form) claim their listed positions
/// 2. iterate bodies claim `body_positions`, an explicit `body` list, or an expanded
///    `{start,end}` range
/// 3. handle nodes claim their `try`, `catch` and `finally` positions
/// 4. `_parent_position` claims the declaring node for the named parent; ignored on `group`
///    nodes
///
/// A node claimed by one parent becomes that parent's child, once. Roots are the unclaimed
/// nodes, by position. When every node is claimed, all nodes are returned flat at the top
/// level so the builder stays total.
///
/// ### Contracts
/// - **Pure**: never writes to the node store
/// - references to missing positions are reported as {@link DanglingReference}s and skipped
/// - an explicit parent that does not exist leaves the node at the root level
///
/// @implNote Stateless and thread-safe. The parent table is rebuilt on every call.
public class TreeBuilder {

    private static final Logger logger = Logger.getLogger(TreeBuilder.class.getName());

    /// Builds the forest from the store's current state.
    public WorkflowTree build(NodeStore store, String workflowId) {
        return build(NodeSnapshot.of(store, workflowId));
    }

    /// Builds the forest from a snapshot.
    ///
    /// @param snapshot nodes to link, not null
    /// @return the forest, never null
    /// @throws ConflictingParentException if two parents claim one node, a node claims itself,
    ///     or parent links form a cycle
    public WorkflowTree build(NodeSnapshot snapshot) {
        Map<Integer, TreeNode> arena = new LinkedHashMap<>();
        for (Node node : snapshot.nodes()) {
            arena.put(node.getPosition(), new TreeNode(node));
        }

        Map<Integer, Set<Integer>> claims = new LinkedHashMap<>();
        List<DanglingReference> dangling = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Node node : snapshot.nodes()) {
            TreeNode owner = arena.get(node.getPosition());
            switch (node.getType()) {
                case ROUTE -> linkRoute(owner, arena, claims, dangling, warnings);
                case ITERATE -> linkMembers(
                        owner,
                        null,
                        LinkKind.ITERATE_BODY,
                        IterateParams.of(node.getParams()).bodyPositions(arena.keySet()),
                        arena,
                        claims,
                        dangling);
                case HANDLE -> HandleParams.sections(node.getParams())
                        .forEach(
                                (section, positions) ->
                                        linkMembers(
                                                owner,
                                                section,
                                                LinkKind.HANDLE_SECTION,
                                                positions,
                                                arena,
                                                claims,
                                                dangling));
                default -> {
                    // leaf types declare no members
                }
            }
        }

        for (Node node : snapshot.nodes()) {
            if (node.getType() == NodeType.GROUP) {
                continue;
            }
            node.getParentPosition()
                    .ifPresent(
                            parent -> {
                                if (!arena.containsKey(parent)) {
                                    dangling.add(
                                            new DanglingReference(
                                                    node.getPosition(),
                                                    node.getAlias(),
                                                    LinkKind.EXPLICIT_PARENT,
                                                    null,
                                                    parent));
                                    return;
                                }
                                claim(claims, node.getPosition(), parent);
                            });
        }

        Map<Integer, Integer> parentOf = new LinkedHashMap<>();
        for (Map.Entry<Integer, Set<Integer>> entry : claims.entrySet()) {
            int child = entry.getKey();
            Set<Integer> parents = entry.getValue();
            if (parents.size() > 1) {
                throw new ConflictingParentException(child, new ArrayList<>(parents));
            }
            int parent = parents.iterator().next();
            if (parent == child) {
                throw new ConflictingParentException(
                        child, "Node at position " + child + " declares itself as its parent");
            }
            parentOf.put(child, parent);
            arena.get(parent).addChild(arena.get(child));
        }
        arena.values().forEach(TreeNode::sortChildren);

        for (DanglingReference reference : dangling) {
            logger.warning(
                    "Dangling reference in workflow "
                            + snapshot.getWorkflowId()
                            + ": "
                            + reference.describe());
        }

        List<TreeNode> roots = new ArrayList<>();
        for (TreeNode treeNode : arena.values()) {
            if (!parentOf.containsKey(treeNode.getPosition())) {
                roots.add(treeNode);
            }
        }

        boolean flatFallback = false;
        if (roots.isEmpty() && !arena.isEmpty()) {
            warnings.add("every node is claimed by a parent; listing all nodes at top level");
            logger.warning(
                    "No root nodes in workflow "
                            + snapshot.getWorkflowId()
                            + ", falling back to a flat list");
            roots.addAll(arena.values());
            flatFallback = true;
        } else {
            requireAllReachable(roots, arena);
        }

        return new WorkflowTree(
                snapshot.getWorkflowId(),
                roots,
                arena,
                parentOf,
                dangling,
                warnings,
                flatFallback);
    }

    private void linkRoute(
            TreeNode owner,
            Map<Integer, TreeNode> arena,
            Map<Integer, Set<Integer>> claims,
            List<DanglingReference> dangling,
            List<String> warnings) {
        RouteParams params;
        try {
            params = RouteParams.of(owner.getNode().getParams());
        } catch (ValidationException e) {
            warnings.add("route at position " + owner.getPosition() + ": " + e.getMessage());
            return;
        }
        for (Branch branch : params.branches()) {
            linkMembers(
                    owner,
                    branch.name(),
                    LinkKind.ROUTE_BRANCH,
                    branch.positions(),
                    arena,
                    claims,
                    dangling);
        }
    }

    private void linkMembers(
            TreeNode owner,
            String pathName,
            LinkKind kind,
            List<Integer> positions,
            Map<Integer, TreeNode> arena,
            Map<Integer, Set<Integer>> claims,
            List<DanglingReference> dangling) {
        Node node = owner.getNode();
        for (Integer position : positions) {
            TreeNode member = arena.get(position);
            if (member == null) {
                dangling.add(
                        new DanglingReference(
                                node.getPosition(), node.getAlias(), kind, pathName, position));
                continue;
            }
            claim(claims, position, node.getPosition());
            if (pathName != null) {
                owner.addToPath(pathName, member);
            }
        }
    }

    private static void claim(Map<Integer, Set<Integer>> claims, int child, int parent) {
        claims.computeIfAbsent(child, k -> new LinkedHashSet<>()).add(parent);
    }

    /// With single parents and no self-claims, a node unreachable from the roots sits on a
    /// parent cycle.
    private static void requireAllReachable(List<TreeNode> roots, Map<Integer, TreeNode> arena) {
        Set<Integer> visited = new HashSet<>();
        Deque<TreeNode> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            TreeNode current = stack.pop();
            if (!visited.add(current.getPosition())) {
                throw new ConflictingParentException(
                        current.getPosition(),
                        "Node at position " + current.getPosition() + " is reached twice");
            }
            current.getChildren().forEach(stack::push);
        }
        for (Integer position : arena.keySet()) {
            if (!visited.contains(position)) {
                throw new ConflictingParentException(
                        position, "Node at position " + position + " is part of a parent cycle");
            }
        }
    }
}
