package io.opgraph.core.exception;

import io.opgraph.core.renumber.PositionChange;
import java.io.Serial;
import java.util.List;

/// Thrown when renumbering aborts part way through.
///
/// The workflow may hold a mix of old and new positions. Callers must re-read the node
/// list before issuing further structural edits.
public class PartialRenumberException extends OpgraphException {

    @Serial private static final long serialVersionUID = -812705119264513349L;

    private final String workflowId;
    private final transient List<PositionChange> applied;
    private final transient List<PositionChange> pending;
    private final boolean referencesRewritten;

    public PartialRenumberException(
            String workflowId,
            List<PositionChange> applied,
            List<PositionChange> pending,
            boolean referencesRewritten,
            Throwable cause) {
        super(
                "Renumbering of workflow "
                        + workflowId
                        + " aborted after "
                        + applied.size()
                        + " of "
                        + (applied.size() + pending.size())
                        + " position updates"
                        + (referencesRewritten ? " (reference rewrite incomplete)" : "")
                        + ": "
                        + cause.getMessage(),
                cause);
        this.workflowId = workflowId;
        this.applied = List.copyOf(applied);
        this.pending = List.copyOf(pending);
        this.referencesRewritten = referencesRewritten;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<PositionChange> getApplied() {
        return applied;
    }

    public List<PositionChange> getPending() {
        return pending;
    }

    /// Whether the failure happened while rewriting control-flow references, after all
    /// position updates were applied.
    public boolean isReferenceRewriteFailure() {
        return referencesRewritten;
    }
}
