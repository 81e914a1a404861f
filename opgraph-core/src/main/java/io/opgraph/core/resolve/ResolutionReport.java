package io.opgraph.core.resolve;

import io.opgraph.core.tree.DanglingReference;
import java.time.Instant;
import java.util.List;

/// What a route or iterate resolution did.
///
/// @param workflowId workflow of the resolved node
/// @param nodePosition position of the route or iterate node
/// @param nodeAlias alias of that node, may be null
/// @param branches per-branch outcome in declaration order (a single `body` entry for
///     iterate nodes)
/// @param danglingReferences resolved positions with no node behind them; dropped
/// @param missingAliases aliases that matched no node
/// @param createdNodes positions of nodes created by `inline_nodes`
/// @param taggedChildren positions whose `_parent_position` was written in this call
/// @param conflicts children left untagged because another container claims them
/// @param warnings other non-fatal findings
/// @param paramsChanged whether the node's params were written back
/// @param resolvedAt completion time
public record ResolutionReport(
        String workflowId,
        int nodePosition,
        String nodeAlias,
        List<BranchResolution> branches,
        List<DanglingReference> danglingReferences,
        List<String> missingAliases,
        List<Integer> createdNodes,
        List<Integer> taggedChildren,
        List<String> conflicts,
        List<String> warnings,
        boolean paramsChanged,
        Instant resolvedAt) {

    public ResolutionReport {
        branches = List.copyOf(branches);
        danglingReferences = List.copyOf(danglingReferences);
        missingAliases = List.copyOf(missingAliases);
        createdNodes = List.copyOf(createdNodes);
        taggedChildren = List.copyOf(taggedChildren);
        conflicts = List.copyOf(conflicts);
        warnings = List.copyOf(warnings);
    }

    /// Positions of the first (for iterate: only) branch.
    public List<Integer> bodyPositions() {
        return branches.isEmpty() ? List.of() : branches.get(0).positions();
    }

    public boolean hasErrors() {
        return branches.stream().anyMatch(BranchResolution::failed);
    }
}
