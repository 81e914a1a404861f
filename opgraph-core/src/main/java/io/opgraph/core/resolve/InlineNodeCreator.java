package io.opgraph.core.resolve;

import io.opgraph.core.edit.NodeDraft;
import io.opgraph.core.workflow.node.Node;

/// Creates nodes declared inline in a selector spec (`inline_nodes`).
@FunctionalInterface
public interface InlineNodeCreator {

    /// Validates and persists a draft at the end of the workflow.
    ///
    /// @return the stored node, never null
    Node create(String workflowId, NodeDraft draft);
}
