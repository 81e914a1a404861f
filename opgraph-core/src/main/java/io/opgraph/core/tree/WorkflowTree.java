package io.opgraph.core.tree;

import io.opgraph.core.workflow.node.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A forest reconstructed from a workflow's flat node list.
///
/// Holds the explicit parent-pointer table built for this call only. Nothing here is
/// written back to the store.
public final class WorkflowTree {

    private final String workflowId;
    private final List<TreeNode> roots;
    private final Map<Integer, TreeNode> arena;
    private final Map<Integer, Integer> parentOf;
    private final List<DanglingReference> danglingReferences;
    private final List<String> warnings;
    private final boolean flatFallback;

    WorkflowTree(
            String workflowId,
            List<TreeNode> roots,
            Map<Integer, TreeNode> arena,
            Map<Integer, Integer> parentOf,
            List<DanglingReference> danglingReferences,
            List<String> warnings,
            boolean flatFallback) {
        this.workflowId = workflowId;
        this.roots = List.copyOf(roots);
        this.arena = Collections.unmodifiableMap(arena);
        this.parentOf = Collections.unmodifiableMap(parentOf);
        this.danglingReferences = List.copyOf(danglingReferences);
        this.warnings = List.copyOf(warnings);
        this.flatFallback = flatFallback;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /// Top-level nodes ordered by position.
    public List<TreeNode> getRoots() {
        return roots;
    }

    public Optional<TreeNode> find(int position) {
        return Optional.ofNullable(arena.get(position));
    }

    /// Returns the parent position of a node, if it has one.
    public Optional<Integer> parentOf(int position) {
        return Optional.ofNullable(parentOf.get(position));
    }

    /// Child position to parent position, for every attached node.
    public Map<Integer, Integer> getParentTable() {
        return parentOf;
    }

    public List<DanglingReference> getDanglingReferences() {
        return danglingReferences;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /// Whether no roots were found and every node was promoted to the top level.
    public boolean isFlatFallback() {
        return flatFallback;
    }

    public int size() {
        return arena.size();
    }

    /// Depth-first preorder over the forest, visiting each node once.
    ///
    /// Roots are taken by position; children follow {@link TreeNode#traversalOrder()}.
    ///
    /// @return nodes in visitation order, never null
    public List<Node> preorder() {
        List<Node> order = new ArrayList<>(arena.size());
        Set<Integer> visited = new HashSet<>();
        for (TreeNode root : roots) {
            visit(root, visited, order);
        }
        return order;
    }

    private static void visit(TreeNode current, Set<Integer> visited, List<Node> order) {
        if (!visited.add(current.getPosition())) {
            return;
        }
        order.add(current.getNode());
        for (TreeNode child : current.traversalOrder()) {
            visit(child, visited, order);
        }
    }
}
