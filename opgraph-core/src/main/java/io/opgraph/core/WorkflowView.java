package io.opgraph.core;

import io.opgraph.core.tree.WorkflowTree;
import io.opgraph.core.workflow.node.Node;
import java.util.List;

/// Nodes of a workflow in position order together with the tree built from them.
///
/// @param workflowId workflow identifier
/// @param nodes every node, ordered by position
/// @param tree the linked forest with its diagnostics
public record WorkflowView(String workflowId, List<Node> nodes, WorkflowTree tree) {

    public WorkflowView {
        nodes = List.copyOf(nodes);
    }
}
