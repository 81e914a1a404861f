package io.opgraph.core.execution;

import io.opgraph.core.workflow.node.Node;

/// Driver that performs the actual work of an action or query node.
///
/// The engine calls it once per resolved body child and iteration, after templates in the
/// node's params have been resolved against the active scope. Implementations either return a
/// {@link NodeResult} or throw; both a thrown exception and a failure result count as a failed
/// attempt and are subject to the retry policy.
@FunctionalInterface
public interface NodeActionExecutor {

    /// @param executionId identifier of the running execution, not null
    /// @param node node with params already resolved, not null
    /// @return the outcome, not null
    /// @throws Exception if the node cannot be executed
    NodeResult executeNode(String executionId, Node node) throws Exception;
}
