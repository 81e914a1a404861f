package io.opgraph.core.exception;

import java.io.Serial;

/// Thrown when an iteration body fails and the loop does not continue on error.
public class IterationFailedException extends OpgraphException {

    @Serial private static final long serialVersionUID = 2955271804414395130L;

    private final int iterateNodePosition;
    private final int iterationIndex;
    private final Integer failedNodePosition;

    public IterationFailedException(
            int iterateNodePosition,
            int iterationIndex,
            Integer failedNodePosition,
            Throwable cause) {
        super(
                "Iteration "
                        + iterationIndex
                        + " of iterate node "
                        + iterateNodePosition
                        + " failed"
                        + (failedNodePosition != null ? " at node " + failedNodePosition : "")
                        + ": "
                        + cause.getMessage(),
                cause);
        this.iterateNodePosition = iterateNodePosition;
        this.iterationIndex = iterationIndex;
        this.failedNodePosition = failedNodePosition;
    }

    public int getIterateNodePosition() {
        return iterateNodePosition;
    }

    public int getIterationIndex() {
        return iterationIndex;
    }

    public Integer getFailedNodePosition() {
        return failedNodePosition;
    }
}
