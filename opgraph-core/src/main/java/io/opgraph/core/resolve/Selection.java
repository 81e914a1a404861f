package io.opgraph.core.resolve;

import io.opgraph.core.workflow.node.Node;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/// Accumulates the outcome of evaluating references and selectors for one branch or body.
final class Selection {

    private final Set<Integer> positions = new TreeSet<>();
    private final Set<String> missingAliases = new LinkedHashSet<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<Node> createdNodes = new ArrayList<>();

    void add(int position) {
        positions.add(position);
    }

    void addAll(Iterable<Integer> more) {
        more.forEach(positions::add);
    }

    void missingAlias(String alias) {
        missingAliases.add(alias);
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    void created(Node node) {
        createdNodes.add(node);
        positions.add(node.getPosition());
    }

    /// De-duplicated positions in ascending order.
    List<Integer> positions() {
        return new ArrayList<>(positions);
    }

    List<String> missingAliases() {
        return new ArrayList<>(missingAliases);
    }

    List<String> warnings() {
        return warnings;
    }

    List<Node> createdNodes() {
        return createdNodes;
    }
}
