package io.opgraph.core.exception;

import java.io.Serial;

/// Thrown when the driver reports a failed node or an attempt to run it throws.
public class NodeExecutionException extends OpgraphException {

    @Serial private static final long serialVersionUID = -6028143650517293734L;

    private final int nodePosition;

    public NodeExecutionException(int nodePosition, String message, Throwable cause) {
        super("Node " + nodePosition + " failed: " + message, cause);
        this.nodePosition = nodePosition;
    }

    public int getNodePosition() {
        return nodePosition;
    }
}
