package io.opgraph.core.tree;

/// A control-flow reference pointing at a position that holds no node.
///
/// Non-fatal: the reference is skipped and reported.
///
/// @param sourcePosition position of the node declaring the reference
/// @param sourceAlias alias of that node, may be null
/// @param kind how the reference was declared
/// @param branch branch or section name, null for iterate bodies and explicit parents
/// @param missingPosition the position that does not exist
public record DanglingReference(
        int sourcePosition,
        String sourceAlias,
        LinkKind kind,
        String branch,
        int missingPosition) {

    public String describe() {
        return "node "
                + sourcePosition
                + (sourceAlias != null ? " (" + sourceAlias + ")" : "")
                + (branch != null ? " branch '" + branch + "'" : "")
                + " references missing position "
                + missingPosition;
    }
}
