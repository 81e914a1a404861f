package io.opgraph.core.tree;

import io.opgraph.core.workflow.node.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A node placed in the reconstructed control-flow forest.
///
/// `children` holds every child ordered by position. Route branches and handle sections are
/// additionally exposed as named `paths`, each list in declared order.
public final class TreeNode {

    private final Node node;
    private final List<TreeNode> children = new ArrayList<>();
    private final Map<String, List<TreeNode>> paths = new LinkedHashMap<>();

    TreeNode(Node node) {
        this.node = node;
    }

    public Node getNode() {
        return node;
    }

    public int getPosition() {
        return node.getPosition();
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /// Returns branch (route) or section (handle) members by name, in declared order.
    public Map<String, List<TreeNode>> getPaths() {
        Map<String, List<TreeNode>> view = new LinkedHashMap<>();
        paths.forEach((name, members) -> view.put(name, Collections.unmodifiableList(members)));
        return Collections.unmodifiableMap(view);
    }

    /// Returns branch positions by name.
    public Map<String, List<Integer>> getPathPositions() {
        Map<String, List<Integer>> view = new LinkedHashMap<>();
        paths.forEach(
                (name, members) ->
                        view.put(name, members.stream().map(TreeNode::getPosition).toList()));
        return view;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /// Children in the order a depth-first walk must visit them.
    ///
    /// Named paths come first in declared order, so a route's branch `a` is visited before
    /// branch `b` even when `b`'s children have lower positions. Remaining children follow
    /// by position.
    public List<TreeNode> traversalOrder() {
        if (paths.isEmpty()) {
            return getChildren();
        }
        Set<TreeNode> ordered = new LinkedHashSet<>();
        paths.values().forEach(ordered::addAll);
        ordered.addAll(children);
        return new ArrayList<>(ordered);
    }

    void addChild(TreeNode child) {
        if (!children.contains(child)) {
            children.add(child);
        }
    }

    void addToPath(String name, TreeNode member) {
        List<TreeNode> members = paths.computeIfAbsent(name, k -> new ArrayList<>());
        if (!members.contains(member)) {
            members.add(member);
        }
    }

    void sortChildren() {
        children.sort((a, b) -> Integer.compare(a.getPosition(), b.getPosition()));
    }

    @Override
    public String toString() {
        return "TreeNode{" + node.getPosition() + ", children=" + children.size() + '}';
    }
}
