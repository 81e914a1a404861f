package io.opgraph.core.renumber;

import java.time.Instant;
import java.util.List;

/// Outcome of a preorder renumbering.
///
/// @param workflowId renumbered workflow, not null
/// @param changes position moves in preorder, only for nodes that moved, never null
/// @param rewrittenNodes uuids of nodes whose references were rewritten, never null
/// @param completedAt completion time, not null
public record RenumberResult(
        String workflowId,
        List<PositionChange> changes,
        List<String> rewrittenNodes,
        Instant completedAt) {

    public RenumberResult {
        changes = List.copyOf(changes);
        rewrittenNodes = List.copyOf(rewrittenNodes);
    }

    public boolean isNoop() {
        return changes.isEmpty();
    }
}
