package io.opgraph.core.exception;

import java.io.Serial;

/// Thrown when a node reference (position, alias or uuid) does not resolve in a workflow.
public class NodeNotFoundException extends OpgraphException {

    @Serial private static final long serialVersionUID = -2360126466390127855L;

    private final String workflowId;
    private final String reference;

    public NodeNotFoundException(String workflowId, String reference) {
        super("Node not found in workflow " + workflowId + ": " + reference);
        this.workflowId = workflowId;
        this.reference = reference;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getReference() {
        return reference;
    }
}
