package io.opgraph.core.execution;

/// Outcome of executing a single node.
public enum ResultStatus {
    SUCCESS,
    FAILURE,
    /// The node was not executed, for example a control node handled by the engine itself.
    SKIPPED
}
