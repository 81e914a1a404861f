package io.opgraph.core.edit;

import io.opgraph.core.renumber.PositionChange;
import java.util.List;

/// Outcome of a node deletion.
///
/// @param deletedPositions positions removed, ascending
/// @param deletedUuids uuids removed
/// @param compaction moves that closed the gaps left behind
/// @param updatedNodes uuids of surviving nodes whose references were rewritten
/// @param dryRun whether nothing was actually written
public record DeletionResult(
        List<Integer> deletedPositions,
        List<String> deletedUuids,
        List<PositionChange> compaction,
        List<String> updatedNodes,
        boolean dryRun) {

    public DeletionResult {
        deletedPositions = List.copyOf(deletedPositions);
        deletedUuids = List.copyOf(deletedUuids);
        compaction = List.copyOf(compaction);
        updatedNodes = List.copyOf(updatedNodes);
    }
}
